package com.gentoro.gscmcp;

public class GscMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(GscMcpApp.class);

  public static void main(String[] args) {
    GscMcp app = null;
    try {
      app = new GscMcp(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      if (app != null) {
        app.shutdown();
      }
      System.exit(1);
    }
    app.waitShutdownSignal();
  }
}
