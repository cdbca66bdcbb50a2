package com.gentoro.gscmcp;

import com.gentoro.gscmcp.account.Account;
import com.gentoro.gscmcp.account.AccountLoader;
import com.gentoro.gscmcp.account.AccountRegistry;
import com.gentoro.gscmcp.account.AccountResolver;
import com.gentoro.gscmcp.account.CredentialSource;
import com.gentoro.gscmcp.account.CredentialSources;
import com.gentoro.gscmcp.actuator.ActuatorService;
import com.gentoro.gscmcp.auth.AuthenticatedClientCache;
import com.gentoro.gscmcp.auth.GoogleTokenRefresher;
import com.gentoro.gscmcp.auth.OAuthClientConfig;
import com.gentoro.gscmcp.auth.TokenListener;
import com.gentoro.gscmcp.auth.TokenRefresher;
import com.gentoro.gscmcp.exception.ConfigException;
import com.gentoro.gscmcp.exception.NetworkException;
import com.gentoro.gscmcp.exception.StateException;
import com.gentoro.gscmcp.http.EmbeddedJettyServer;
import com.gentoro.gscmcp.http.OkHttpFactory;
import com.gentoro.gscmcp.mcp.McpServer;
import com.gentoro.gscmcp.searchconsole.OkHttpSearchConsoleClient;
import com.gentoro.gscmcp.searchconsole.SearchConsoleEndpoints;
import com.gentoro.gscmcp.searchconsole.SearchConsoleService;
import com.gentoro.gscmcp.tools.ToolRegistry;
import com.gentoro.gscmcp.utility.ConfigValues;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context. Owns the configuration, the account registry, the authenticated client
 * cache, the shared executor and the MCP transport, and hands them to the tools.
 */
public class GscMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.gscmcp.logging.LoggingService.getLogger(GscMcp.class);

  static final int EXECUTOR_THREADS = 4;

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private OkHttpClient baseHttpClient;
  private SearchConsoleEndpoints endpoints;
  private AccountRegistry accountRegistry;
  private AccountResolver accountResolver;
  private AuthenticatedClientCache clientCache;
  private ExecutorService executor;
  private ToolRegistry toolRegistry;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public GscMcp(String[] applicationArgs) {
    this(applicationArgs, Clock.systemUTC());
  }

  GscMcp(String[] applicationArgs, Clock clock) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.clock = clock;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    loadConfiguration();
    com.gentoro.gscmcp.logging.LoggingService.applyConfiguration(configuration());

    initializeServices(null);

    String transport = transport();
    this.mcpServer = new McpServer(this);
    try {
      if ("http".equals(transport)) {
        this.httpServer = new EmbeddedJettyServer(this);
        httpServer.prepare();
        new ActuatorService(this).register();
        mcpServer.registerServlet();
        httpServer.start();
      } else {
        mcpServer.startStdio();
      }
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start MCP transport '" + transport + "'", e);
    }
    log.info(
        "Search Console MCP server ready: transport={}, accounts={}",
        transport,
        accountRegistry.count());
  }

  /**
   * Wires accounts, tokens and tools from the loaded configuration. {@code refresher} replaces the
   * Google token endpoint client when not null.
   */
  void initializeServices(TokenRefresher refresher) {
    Configuration cfg = configuration();
    OAuthClientConfig oauth = OAuthClientConfig.fromConfiguration(cfg);

    this.baseHttpClient = OkHttpFactory.create(cfg);
    this.endpoints = SearchConsoleEndpoints.fromConfiguration(cfg);
    this.executor = Executors.newFixedThreadPool(EXECUTOR_THREADS, daemonThreads());

    this.accountRegistry = new AccountRegistry();
    this.accountResolver = new AccountResolver(accountRegistry);
    this.clientCache =
        new AuthenticatedClientCache(
            refresher != null ? refresher : new GoogleTokenRefresher(baseHttpClient, oauth, clock),
            baseHttpClient,
            clock);
    accountRegistry.addListener(clientCache);

    List<CredentialSource> sources =
        CredentialSources.fromConfiguration(cfg, baseHttpClient, clock);
    for (CredentialSource source : sources) {
      if (source instanceof TokenListener listener) {
        clientCache.addTokenListener(listener);
      }
    }
    new AccountLoader(accountRegistry).load(sources);

    this.toolRegistry = ToolRegistry.standard(this);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "gsc-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        if (executor != null) {
          executor.shutdownNow();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Search Console facade bound to the live authenticated client of {@code account}. */
  public SearchConsoleService searchConsoleFor(Account account) {
    return new SearchConsoleService(
        new OkHttpSearchConsoleClient(clientCache().getLiveClient(account).httpClient(), endpoints),
        executor);
  }

  /** {@code stdio} or {@code http}; the command line wins over configuration. */
  public String transport() {
    String transport =
        startupParameters
            .transport()
            .orElseGet(() -> ConfigValues.stringOrDefault(configuration(), "transport", "stdio"));
    if (!"stdio".equals(transport) && !"http".equals(transport)) {
      throw new ConfigException("Invalid transport: " + transport);
    }
    return transport;
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("GscMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  void loadConfiguration() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public AccountRegistry accountRegistry() {
    return accountRegistry;
  }

  public AccountResolver accountResolver() {
    return accountResolver;
  }

  public AuthenticatedClientCache clientCache() {
    return clientCache;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "gsc-mcp-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
