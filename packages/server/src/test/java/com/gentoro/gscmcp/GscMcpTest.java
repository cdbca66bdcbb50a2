package com.gentoro.gscmcp;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.auth.TokenRefresher;
import com.gentoro.gscmcp.exception.ConfigException;
import com.gentoro.gscmcp.exception.StateException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class GscMcpTest {

  private GscMcp app;

  @AfterEach
  void tearDown() {
    if (app != null) {
      app.shutdown();
    }
  }

  private GscMcp load(String... args) {
    app = new GscMcp(args);
    app.loadConfiguration();
    return app;
  }

  @Test
  void loadsAccountsFromEveryConfiguredSource() {
    load("--config-file", "classpath:gsc-mcp-test.yaml");
    app.initializeServices(Mockito.mock(TokenRefresher.class));

    List<Account> accounts = app.accountRegistry().list();
    assertEquals(List.of("agency", "default", "work"), accounts.stream().map(Account::id).toList());
    assertEquals("ya29.cached", app.accountRegistry().lookup("agency").orElseThrow().credentials().accessToken());
    assertEquals("solo@example.com", app.accountResolver().resolve("default").email());
    assertEquals("seo@agency.com", app.accountResolver().resolve(null).email());
    assertEquals(10, app.toolRegistry().tools().size());
  }

  @Test
  void commandLineTransportWinsOverConfiguration() {
    assertEquals("stdio", load("--config-file", "classpath:gsc-mcp-test.yaml").transport());
    app.shutdown();
    assertEquals(
        "http",
        load("--config-file", "classpath:gsc-mcp-test.yaml", "--transport", "http").transport());
  }

  @Test
  void missingOAuthClientFailsStartup() {
    load("--config-file", "classpath:gsc-mcp-no-client.yaml");
    ConfigException ex =
        assertThrows(
            ConfigException.class,
            () -> app.initializeServices(Mockito.mock(TokenRefresher.class)));
    assertTrue(ex.getMessage().contains("GOOGLE_CLIENT_ID"));
  }

  @Test
  void configurationRequiresLoading() {
    app = new GscMcp(new String[0]);
    assertThrows(StateException.class, app::configuration);
  }
}
