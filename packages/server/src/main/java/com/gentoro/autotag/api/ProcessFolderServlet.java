package com.gentoro.autotag.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.autotag.batch.BatchOrchestrator;
import com.gentoro.autotag.batch.BatchRequest;
import com.gentoro.autotag.exception.ValidationException;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * POST /process/folder
 *
 * <p>Starts a background batch over a folder. Body:
 *
 * <pre>
 * {"path": "/photos", "recursive": false, "save_mode": "replace", "tag_mode": "append"}
 * </pre>
 *
 * Only {@code path} is required. The response acknowledges the start; progress is read from
 * {@code /status}.
 */
public final class ProcessFolderServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(ProcessFolderServlet.class);

  static final String STATUS_ENDPOINT = "/status";

  private final BatchOrchestrator orchestrator;
  private final TagMode defaultTagMode;
  private final SaveMode defaultSaveMode;

  public ProcessFolderServlet(
      BatchOrchestrator orchestrator, TagMode defaultTagMode, SaveMode defaultSaveMode) {
    this.orchestrator = orchestrator;
    this.defaultTagMode = defaultTagMode;
    this.defaultSaveMode = defaultSaveMode;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    BatchRequest request;
    try {
      request = parse(req);
    } catch (ValidationException e) {
      ApiResponses.error(resp, 400, e.getMessage());
      return;
    }

    try {
      if (!orchestrator.start(request)) {
        ApiResponses.error(resp, 500, "Batch worker is not accepting jobs");
        return;
      }
      String message =
          "Started processing folder: %s (recursive: %s, save_mode: %s)"
              .formatted(request.folder(), request.recursive(), request.saveMode().value());
      ApiResponses.write(
          resp, 200, new ApiResponses.FolderAccepted(true, message, STATUS_ENDPOINT));
    } catch (Exception e) {
      log.error("Failed to start batch for {}", request.folder(), e);
      ApiResponses.error(resp, 500, "Failed to start processing: " + e.getMessage());
    }
  }

  private BatchRequest parse(HttpServletRequest req) throws IOException {
    JsonNode body;
    try {
      body = ApiResponses.mapper().readTree(req.getInputStream());
    } catch (JsonProcessingException e) {
      throw new ValidationException("Invalid JSON body: " + e.getOriginalMessage());
    }
    if (body == null || !body.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }

    String rawPath = body.path("path").asText("");
    if (rawPath.isBlank()) {
      throw new ValidationException("Missing required field 'path'");
    }
    Path folder;
    try {
      folder = Paths.get(rawPath);
    } catch (InvalidPathException e) {
      throw new ValidationException("Invalid path: " + rawPath);
    }
    if (!Files.exists(folder)) {
      throw new ValidationException("Folder not found: " + rawPath);
    }
    if (!Files.isDirectory(folder)) {
      throw new ValidationException("Not a directory: " + rawPath);
    }

    boolean recursive = body.path("recursive").asBoolean(false);
    SaveMode saveMode =
        body.hasNonNull("save_mode")
            ? SaveMode.parse(body.get("save_mode").asText())
            : defaultSaveMode;
    TagMode tagMode =
        body.hasNonNull("tag_mode") ? TagMode.parse(body.get("tag_mode").asText()) : defaultTagMode;
    return new BatchRequest(folder, recursive, saveMode, tagMode);
  }
}
