package com.gentoro.autotag.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/** Response bodies of the processing API and the helper that writes them. */
final class ApiResponses {
  private static final ObjectMapper MAPPER = JacksonUtility.getApiMapper();

  private ApiResponses() {}

  record ImageProcessed(
      boolean success,
      String filename,
      String outputPath,
      List<String> tags,
      SaveMode saveMode,
      double processingTime) {}

  record FolderAccepted(boolean success, String message, String statusEndpoint) {}

  record Failure(boolean success, String error) {
    Failure(String error) {
      this(false, error);
    }
  }

  record Health(String status) {}

  static void write(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(MAPPER.writeValueAsString(body));
  }

  static void error(HttpServletResponse resp, int status, String message) throws IOException {
    write(resp, status, new Failure(message));
  }

  static ObjectMapper mapper() {
    return MAPPER;
  }
}
