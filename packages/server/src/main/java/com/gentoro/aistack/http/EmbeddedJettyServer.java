package com.gentoro.aistack.http;

import com.gentoro.aistack.exception.ConfigException;
import com.gentoro.aistack.exception.ExceptionUtil;
import com.gentoro.aistack.exception.IoException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop/join) and exposes the {@link
 * ServletContextHandler} so the capability endpoint and the actuator can register their servlets.
 * Port {@code 0} binds an ephemeral port; {@link #getPort()} reports the bound one once started.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.aistack.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 5000;

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    log.trace("Initializing Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", DEFAULT_PORT);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname = configuration.getString("http.hostname", "0.0.0.0");
      if (Objects.isNull(hostname) || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();
      log.trace("Resolved http endpoint {}:{}", hostname, port);

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        server = null;
        contextHandler = null;
        throw new IoException(
            "Failed to initialize the Jetty server on %s:%d".formatted(hostname, port), e);
      }
    }
  }

  /** Start Jetty if not already started. */
  public void start() throws Exception {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new IoException(
                    "Failed to start the Jetty server. Check that the port and hostname are"
                        + " available to this process",
                    ex));
      }
    }
  }

  public void stop() {
    log.trace("Stopping Jetty server");
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarted() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          log.error("Error stopping Jetty server, continuing shutdown", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
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
