package com.gentoro.autotag.api;

import com.gentoro.autotag.batch.BatchOrchestrator;
import com.gentoro.autotag.http.EmbeddedJettyServer;
import com.gentoro.autotag.tagging.TaggingPipeline;
import jakarta.servlet.MultipartConfigElement;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Mounts the processing API on the shared Jetty context: single-image upload, folder batches, batch
 * status and a health probe.
 */
public final class ProcessingServer {

  private final EmbeddedJettyServer httpServer;
  private final TaggingPipeline pipeline;
  private final BatchOrchestrator orchestrator;
  private final long maxFileSize;

  public ProcessingServer(
      EmbeddedJettyServer httpServer,
      TaggingPipeline pipeline,
      BatchOrchestrator orchestrator,
      long maxFileSize) {
    this.httpServer = httpServer;
    this.pipeline = pipeline;
    this.orchestrator = orchestrator;
    this.maxFileSize = maxFileSize;
  }

  /** Register all processing servlets with the Jetty context handler. */
  public void register() {
    ServletContextHandler ctx = httpServer.getContextHandler();

    ServletHolder upload = new ServletHolder(new ProcessImageServlet(pipeline));
    upload.getRegistration().setMultipartConfig(multipartConfig(maxFileSize));
    ctx.addServlet(upload, "/process/image");

    ctx.addServlet(
        new ServletHolder(
            new ProcessFolderServlet(
                orchestrator, pipeline.defaultTagMode(), pipeline.defaultSaveMode())),
        "/process/folder");

    ctx.addServlet(new ServletHolder(new StatusServlet(orchestrator.status())), "/status");
    ctx.addServlet(new ServletHolder(new HealthServlet()), "/health");
  }

  /** Multipart settings for uploads; parts are buffered in memory up to 1 MiB. */
  public static MultipartConfigElement multipartConfig(long maxFileSize) {
    return new MultipartConfigElement(
        System.getProperty("java.io.tmpdir"), maxFileSize, maxFileSize * 2, 1024 * 1024);
  }
}
