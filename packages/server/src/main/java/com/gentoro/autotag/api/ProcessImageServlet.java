package com.gentoro.autotag.api;

import com.gentoro.autotag.exception.ValidationException;
import com.gentoro.autotag.image.ValidationResult;
import com.gentoro.autotag.tagging.ProcessingOutcome;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import com.gentoro.autotag.tagging.TaggingPipeline;
import com.gentoro.autotag.utility.FileUtility;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.Part;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * POST /process/image
 *
 * <p>Multipart upload with a {@code file} part. {@code tag_mode} and {@code save_mode} may be
 * given as query parameters or form fields. The upload is staged in a temporary file that is
 * always removed before the response completes.
 *
 * <pre>
 * {
 *   "success": true,
 *   "filename": "kitchen.jpg",
 *   "output_path": "/tmp/autotag_123.jpg",
 *   "tags": ["scene/indoor", "roomtype/kitchen", "people/none"],
 *   "save_mode": "replace",
 *   "processing_time": 1.27
 * }
 * </pre>
 */
public final class ProcessImageServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(ProcessImageServlet.class);

  static final String TEMP_PREFIX = "autotag_";

  private final TaggingPipeline pipeline;

  public ProcessImageServlet(TaggingPipeline pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp)
      throws IOException, ServletException {
    Part file;
    TagMode tagMode;
    SaveMode saveMode;
    try {
      file = req.getPart("file");
      String tagParam = field(req, "tag_mode");
      String saveParam = field(req, "save_mode");
      tagMode = tagParam == null ? pipeline.defaultTagMode() : TagMode.parse(tagParam);
      saveMode = saveParam == null ? pipeline.defaultSaveMode() : SaveMode.parse(saveParam);
    } catch (ValidationException e) {
      ApiResponses.error(resp, 400, e.getMessage());
      return;
    } catch (IllegalStateException | ServletException e) {
      // not multipart, or the part exceeds the configured size
      ApiResponses.error(resp, 400, "Invalid upload: " + e.getMessage());
      return;
    }
    if (file == null) {
      ApiResponses.error(resp, 400, "Missing 'file' part");
      return;
    }

    String filename = file.getSubmittedFileName();
    String extension = FileUtility.extension(filename);
    Path temp = null;
    try {
      temp = Files.createTempFile(TEMP_PREFIX, extension.isEmpty() ? null : "." + extension);
      try (InputStream in = file.getInputStream()) {
        FileUtility.copyStream(in, temp);
      }

      ValidationResult validation = pipeline.validate(Files.readAllBytes(temp), filename);
      if (!validation.valid()) {
        log.warn("Rejected upload {}: {}", filename, validation.reason());
        ApiResponses.error(resp, 400, validation.reason());
        return;
      }

      ProcessingOutcome outcome = pipeline.process(temp, tagMode, saveMode);
      if (!outcome.success()) {
        ApiResponses.error(resp, 400, outcome.error());
        return;
      }
      double seconds = Math.round(outcome.elapsedSeconds() * 100) / 100.0;
      ApiResponses.write(
          resp,
          200,
          new ApiResponses.ImageProcessed(
              true,
              filename,
              outcome.outputPath().toString(),
              outcome.tags(),
              saveMode,
              seconds));
    } catch (Exception e) {
      log.error("Error processing upload {}", filename, e);
      ApiResponses.error(resp, 500, "Error processing image: " + e.getMessage());
    } finally {
      FileUtility.deleteQuietly(temp);
    }
  }

  private static String field(HttpServletRequest req, String name)
      throws IOException, ServletException {
    String value = req.getParameter(name);
    if (value == null && isMultipart(req)) {
      Part part = req.getPart(name);
      if (part != null && part.getSubmittedFileName() == null) {
        try (InputStream in = part.getInputStream()) {
          value = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
      }
    }
    return StringUtils.trimToNull(value);
  }

  private static boolean isMultipart(HttpServletRequest req) {
    String type = req.getContentType();
    return type != null && type.toLowerCase(Locale.ROOT).startsWith("multipart/");
  }
}
