package com.gentoro.autotag.http;

import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.exception.ExceptionUtil;
import com.gentoro.autotag.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a single root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler so that API
 * components can register their servlets before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  static final int DEFAULT_PORT = 8000;
  static final String ANY_HOST = "0.0.0.0";

  private final Configuration config;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration config) {
    this.config = config;
  }

  /** Build the server and root context without binding the port. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = config.getInt("http.port", DEFAULT_PORT);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port out of range: " + port);
      }

      String hostname;
      try {
        hostname = StringUtils.trimToNull(config.getString("http.hostname", ANY_HOST));
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.hostname configuration", e);
      }
      if (hostname == null) {
        throw new ConfigException("http.hostname must not be blank");
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("autotag-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals(ANY_HOST)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
        log.debug("Jetty prepared for {}:{}", hostname, port);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the HTTP server on port " + port, e);
      }
    }
  }

  public void start() {
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
                new NetworkException(
                    "Failed to start the HTTP server. Check that port "
                        + config.getInt("http.port", DEFAULT_PORT)
                        + " is free and this process may listen on it",
                    ex));
      }
    }
  }

  /** Stop the server. Errors are logged and not rethrown, so other services can still stop. */
  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      Server s = server;
      try {
        if (s.isStarted() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, otherwise the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return config.getInt("http.port", DEFAULT_PORT);
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
