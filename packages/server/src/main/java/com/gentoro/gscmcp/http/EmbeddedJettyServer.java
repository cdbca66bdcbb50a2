package com.gentoro.gscmcp.http;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.exception.ConfigException;
import com.gentoro.gscmcp.exception.ExceptionUtil;
import com.gentoro.gscmcp.exception.NetworkException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}, used by the HTTP transport.
 *
 * <p>Other components register their servlets on {@link #getContextHandler()} between {@link
 * #prepare()} and {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String ANY_HOST = "0.0.0.0";

  private final GscMcp context;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(GscMcp context) {
    this.context = context;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        return;
      }

      int port;
      String hostname;
      try {
        port = context.configuration().getInt("http.port", 8080);
        hostname = context.configuration().getString("http.hostname", ANY_HOST);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port / http.hostname configuration", e);
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();

      try {
        Server created = new Server();
        ServerConnector connector = new ServerConnector(created);
        connector.setPort(port);
        if (!ANY_HOST.equals(hostname)) {
          connector.setHost(hostname);
        }
        created.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        created.setHandler(contextHandler);
        server = created;
        log.debug("Jetty prepared for {}:{}", hostname, port);
      } catch (Exception e) {
        throw new NetworkException(
            "Failed to initialize Jetty on " + hostname + ":" + port, e);
      }
    }
  }

  public void start() throws Exception {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return;
      }
      if (server == null) {
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start Jetty; check that the configured port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          log.error("Error stopping Jetty server", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started (useful with {@code http.port: 0}), configured port before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return context.configuration().getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
