package com.gentoro.aistack;

import com.gentoro.aistack.actuator.ActuatorService;
import com.gentoro.aistack.client.CapabilityClients;
import com.gentoro.aistack.client.DeferredTransport;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.IoException;
import com.gentoro.aistack.exception.StateException;
import com.gentoro.aistack.http.CapabilityServlet;
import com.gentoro.aistack.http.EmbeddedJettyServer;
import com.gentoro.aistack.manifest.Manifest;
import com.gentoro.aistack.manifest.ManifestLoader;
import com.gentoro.aistack.manifest.ManifestResolver;
import com.gentoro.aistack.provider.Api;
import com.gentoro.aistack.provider.ProviderRegistry;
import com.gentoro.aistack.provider.RegisteredProvider;
import com.gentoro.aistack.router.RequestRouter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * One assembled stack: configuration, resolved manifest, provider registry and router, plus the
 * optional HTTP endpoint. Each instance owns its own registry; nothing is global.
 */
public class AiStack implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(AiStack.class);

  public static final String DEFAULT_MANIFEST = "classpath:run.yaml";
  public static final int DEFAULT_WORKER_THREADS = 16;

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private Manifest manifest;
  private ProviderRegistry registry;
  private RequestRouter router;
  private final DeferredTransport stackTransport = new DeferredTransport();
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public AiStack(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  public AiStack(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  /** Load configuration and manifest, then build every adapter. Fails without side effects. */
  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.aistack.logging.LoggingService.applyConfiguration(configuration());

    String manifestLocation = configuration().getString("stack.manifest", DEFAULT_MANIFEST);
    this.manifest = ManifestLoader.load(manifestLocation);

    this.registry = ManifestResolver.withInstalledFactories().resolve(manifest, stackTransport);
    this.router =
        new RequestRouter(
            registry,
            configuration().getInt("router.worker-threads", DEFAULT_WORKER_THREADS),
            configuration().getLong("router.call-timeout-ms", 0L));
    stackTransport.bind(router);
    log.info(
        "Stack '{}' ready: {} providers across {}",
        manifest.imageName(),
        registry.allProviders().size(),
        registry.apis());
  }

  /** Serve the capability endpoint and the actuator over HTTP. Non-blocking. */
  public void startServer() {
    requireInitialized();
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      CapabilityServlet.register(httpServer.getContextHandler(), router);
      new ActuatorService(this).register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new IoException("Could not start http server", ex));
    }
  }

  /** Typed client that routes through this stack, e.g. {@code client(Inference.class)}. */
  public <T> T client(Class<T> contract) {
    requireInitialized();
    return CapabilityClients.create(contract, stackTransport);
  }

  /** One entry per bound provider, in manifest order. */
  public List<Map<String, Object>> describeProviders() {
    requireInitialized();
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Api api : registry.apis()) {
      for (RegisteredProvider p : registry.providers(api)) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("api", api.wireName());
        row.put("provider_id", p.providerId());
        row.put("provider_type", p.providerType());
        row.put("kind", p.kind().name().toLowerCase(Locale.ROOT));
        row.put("active", registry.active(api) == p);
        row.put("resources", p.servedResources());
        rows.add(row);
      }
    }
    return rows;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "aistack-shutdown-hook");
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
      try {
        closeLogged("http server", httpServer);
        closeLogged("router", router);
        closeLogged("provider registry", registry);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private void closeLogged(String what, AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", what, e);
      }
    }
  }

  private void requireInitialized() {
    if (registry == null) {
      throw new StateException("AiStack not initialized. Call initialize() first.");
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AiStack not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Manifest manifest() {
    return manifest;
  }

  public ProviderRegistry registry() {
    return registry;
  }

  public RequestRouter router() {
    return router;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
