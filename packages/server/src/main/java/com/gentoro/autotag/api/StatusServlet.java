package com.gentoro.autotag.api;

import com.gentoro.autotag.batch.JobStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * GET /status
 *
 * <p>Returns a snapshot of the current or most recent batch job with snake_case field names.
 */
public final class StatusServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(StatusServlet.class);

  private final JobStatus status;

  public StatusServlet(JobStatus status) {
    this.status = status;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      ApiResponses.write(resp, 200, status.snapshot());
    } catch (Exception e) {
      log.error("Failed to render status", e);
      ApiResponses.error(resp, 500, "Failed to render status: " + e.getMessage());
    }
  }
}
