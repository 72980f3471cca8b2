package com.gentoro.autotag;

import com.gentoro.autotag.api.ProcessingServer;
import com.gentoro.autotag.batch.BatchOrchestrator;
import com.gentoro.autotag.batch.JobStatus;
import com.gentoro.autotag.classifier.Classifier;
import com.gentoro.autotag.classifier.ClassifierFactory;
import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.exception.NetworkException;
import com.gentoro.autotag.exception.StateException;
import com.gentoro.autotag.http.EmbeddedJettyServer;
import com.gentoro.autotag.image.FolderScanner;
import com.gentoro.autotag.logging.LoggingService;
import com.gentoro.autotag.tagging.TaggingPipeline;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root. Builds every component once, in dependency order, and passes them by
 * reference: classifier, pipeline, batch orchestrator, then the HTTP server.
 */
public class AutoTag {
  private static final org.slf4j.Logger log = LoggingService.getLogger(AutoTag.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private Classifier classifier;
  private TaggingPipeline pipeline;
  private BatchOrchestrator orchestrator;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public AutoTag(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Route everything through SLF4J; java.util.logging stays silent.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    this.classifier = ClassifierFactory.create(configuration());
    log.info("Using classifier: {}", classifier.name());
    this.pipeline = TaggingPipeline.from(configuration(), classifier);

    int recentCapacity =
        configuration().getInt("batch.recent-status-capacity", JobStatus.DEFAULT_RECENT_CAPACITY);
    if (recentCapacity <= 0) {
      throw new ConfigException("batch.recent-status-capacity must be positive");
    }
    this.orchestrator =
        new BatchOrchestrator(
            new FolderScanner(), pipeline, new JobStatus(recentCapacity, Clock.systemUTC()));

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      long maxFileSize = configuration().getLong("http.upload.max-file-size", 50L * 1024 * 1024);
      new ProcessingServer(httpServer, pipeline, orchestrator, maxFileSize).register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info(
        "AUTO-TAG ready (tag_mode: {}, save_mode: {})",
        pipeline.defaultTagMode().value(),
        pipeline.defaultSaveMode().value());
  }

  /** Block until the JVM receives a shutdown signal, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "autotag-shutdown-hook");
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
        closeLogged(httpServer, "HTTP server");
        closeLogged(orchestrator, "batch worker");
        closeLogged(classifier, "classifier");
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeLogged(AutoCloseable closeable, String what) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error closing {}: {}", what, e.getMessage());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AutoTag not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TaggingPipeline pipeline() {
    return pipeline;
  }

  public BatchOrchestrator orchestrator() {
    return orchestrator;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
