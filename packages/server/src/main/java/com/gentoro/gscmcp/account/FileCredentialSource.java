package com.gentoro.gscmcp.account;

import com.gentoro.gscmcp.exception.GscMcpErrorCode;
import com.gentoro.gscmcp.exception.GscMcpException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Accounts document read from a file, typically named by {@code GSC_ACCOUNTS_FILE}. */
public class FileCredentialSource implements CredentialSource {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(FileCredentialSource.class);

  private final Path path;

  public FileCredentialSource(Path path) {
    this.path = path;
  }

  @Override
  public String name() {
    return "GSC_ACCOUNTS_FILE(" + path + ")";
  }

  @Override
  public List<AccountEntry> load() {
    if (!Files.isRegularFile(path)) {
      log.warn("Accounts file {} does not exist, skipping", path.toAbsolutePath());
      return List.of();
    }
    log.info("Reading accounts file {}", path.toAbsolutePath());
    try {
      return AccountsDocumentParser.parse(Files.readString(path, StandardCharsets.UTF_8), name());
    } catch (IOException e) {
      throw new GscMcpException(
          GscMcpErrorCode.IO_ERROR, "Failed to read accounts file " + path, e);
    }
  }
}
