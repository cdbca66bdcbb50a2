package com.gentoro.gscmcp;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvFileLookupTest {

  @TempDir Path dir;

  @Test
  void parsesDotenvLines() {
    Map<String, String> values =
        EnvFileLookup.parse(
            List.of(
                "# Google OAuth",
                "GOOGLE_CLIENT_ID=abc.apps.googleusercontent.com",
                "export GOOGLE_CLIENT_SECRET=\"s3cr=t\"",
                "GSC_EMAIL='me@work.com'",
                "not a pair",
                "=orphan",
                ""));

    assertEquals(
        Map.of(
            "GOOGLE_CLIENT_ID", "abc.apps.googleusercontent.com",
            "GOOGLE_CLIENT_SECRET", "s3cr=t",
            "GSC_EMAIL", "me@work.com"),
        values);
  }

  @Test
  void environmentWinsOverFile() throws Exception {
    Path env = dir.resolve(".env.local");
    Files.writeString(env, "GSC_EMAIL=file@example.com\nGSC_REFRESH_TOKEN=1//file\n");
    Map<String, String> process = Map.of("GSC_EMAIL", "env@example.com", "GSC_REFRESH_TOKEN", "");

    EnvFileLookup lookup = new EnvFileLookup(process::get, List.of(dir.resolve("missing"), env));

    assertEquals("env@example.com", lookup.lookup("GSC_EMAIL"));
    assertEquals("1//file", lookup.lookup("GSC_REFRESH_TOKEN"));
    assertNull(lookup.lookup("SUPABASE_URL"));
  }

  @Test
  void placeholdersInYamlUseTheLookup() throws Exception {
    Path yaml = dir.resolve("gsc.yaml");
    Files.writeString(yaml, "gsc:\n  oauth:\n    client-id: ${env:GOOGLE_CLIENT_ID}\n");
    EnvFileLookup lookup =
        new EnvFileLookup(Map.of("GOOGLE_CLIENT_ID", "from-env")::get, List.of());

    ConfigurationProvider provider = new ConfigurationProvider(yaml.toString(), lookup);

    assertEquals("from-env", provider.config().getString("gsc.oauth.client-id"));
  }
}
