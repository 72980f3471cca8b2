package com.gentoro.autotag.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.autotag.image.ValidationResult;
import com.gentoro.autotag.tagging.ProcessingOutcome;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import com.gentoro.autotag.tagging.TaggingPipeline;
import com.gentoro.autotag.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProcessImageServletTest {

  private static final String BOUNDARY = "----autotag-test-boundary";

  private TaggingPipeline pipeline;
  private ServletTester tester;
  private final AtomicReference<Path> staged = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    pipeline = mock(TaggingPipeline.class);
    when(pipeline.defaultTagMode()).thenReturn(TagMode.APPEND);
    when(pipeline.defaultSaveMode()).thenReturn(SaveMode.REPLACE);
    when(pipeline.validate(any(), anyString())).thenReturn(ValidationResult.ok());
    when(pipeline.process(any(), any(), any()))
        .thenAnswer(
            inv -> {
              Path temp = inv.getArgument(0);
              staged.set(temp);
              assertTrue(Files.exists(temp));
              return new ProcessingOutcome(
                  true,
                  List.of("scene/indoor", "people/none"),
                  temp,
                  null,
                  Duration.ofMillis(1234));
            });

    tester = new ServletTester();
    ServletHolder holder = new ServletHolder(new ProcessImageServlet(pipeline));
    holder.getRegistration().setMultipartConfig(ProcessingServer.multipartConfig(1024 * 1024));
    tester.addServlet(holder, "/process/image");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private static String multipart(String filename, String content, String... fields) {
    StringBuilder sb = new StringBuilder();
    if (filename != null) {
      sb.append("--").append(BOUNDARY).append("\r\n")
          .append("Content-Disposition: form-data; name=\"file\"; filename=\"")
          .append(filename).append("\"\r\n")
          .append("Content-Type: application/octet-stream\r\n\r\n")
          .append(content).append("\r\n");
    }
    for (int i = 0; i < fields.length; i += 2) {
      sb.append("--").append(BOUNDARY).append("\r\n")
          .append("Content-Disposition: form-data; name=\"").append(fields[i]).append("\"\r\n\r\n")
          .append(fields[i + 1]).append("\r\n");
    }
    sb.append("--").append(BOUNDARY).append("--\r\n");
    return sb.toString();
  }

  private HttpTester.Response post(String query, String body) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("POST");
    req.setURI("/process/image" + query);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "localhost");
    req.setHeader("Content-Type", "multipart/form-data; boundary=" + BOUNDARY);
    req.setContent(body);
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void tagsUploadAndRemovesTempFile() throws Exception {
    HttpTester.Response resp = post("", multipart("kitchen.jpg", "fake-jpeg-bytes"));

    assertEquals(200, resp.getStatus(), resp.getContent());
    JsonNode json = JacksonUtility.getApiMapper().readTree(resp.getContent());
    assertTrue(json.get("success").asBoolean());
    assertEquals("kitchen.jpg", json.get("filename").asText());
    assertEquals("replace", json.get("save_mode").asText());
    assertEquals(1.23, json.get("processing_time").asDouble(), 1e-9);
    assertEquals("scene/indoor", json.get("tags").get(0).asText());

    Path temp = staged.get();
    assertNotNull(temp);
    assertTrue(temp.getFileName().toString().startsWith(ProcessImageServlet.TEMP_PREFIX));
    assertTrue(temp.getFileName().toString().endsWith(".jpg"));
    assertEquals(temp.toString(), json.get("output_path").asText());
    assertFalse(Files.exists(temp));
    verify(pipeline).validate(any(), eq("kitchen.jpg"));
  }

  @Test
  void modesFromQueryParameters() throws Exception {
    HttpTester.Response resp =
        post("?tag_mode=overwrite&save_mode=suffix", multipart("a.png", "x"));

    assertEquals(200, resp.getStatus(), resp.getContent());
    verify(pipeline).process(any(), eq(TagMode.OVERWRITE), eq(SaveMode.SUFFIX));
  }

  @Test
  void modesFromFormFields() throws Exception {
    HttpTester.Response resp =
        post("", multipart("a.png", "x", "tag_mode", "overwrite", "save_mode", "suffix"));

    assertEquals(200, resp.getStatus(), resp.getContent());
    verify(pipeline).process(any(), eq(TagMode.OVERWRITE), eq(SaveMode.SUFFIX));
  }

  @Test
  void invalidImageIs400() throws Exception {
    when(pipeline.validate(any(), anyString()))
        .thenReturn(ValidationResult.invalid("Invalid image: unrecognized image data in a.png"));

    HttpTester.Response resp = post("", multipart("a.png", "junk"));

    assertEquals(400, resp.getStatus());
    JsonNode json = JacksonUtility.getApiMapper().readTree(resp.getContent());
    assertFalse(json.get("success").asBoolean());
    assertTrue(json.get("error").asText().contains("unrecognized"));
    verify(pipeline, never()).process(any(), any(), any());
  }

  @Test
  void badModeIs400() throws Exception {
    HttpTester.Response resp = post("?save_mode=copy", multipart("a.png", "x"));

    assertEquals(400, resp.getStatus());
    assertTrue(resp.getContent().contains("save_mode"));
  }

  @Test
  void missingFileIs400() throws Exception {
    HttpTester.Response resp = post("", multipart(null, null, "tag_mode", "append"));
    assertEquals(400, resp.getStatus());
  }

  @Test
  void pipelineFailureIs400AndCleansUp() throws Exception {
    doAnswer(
            inv -> {
              staged.set(inv.getArgument(0));
              return ProcessingOutcome.failed(
                  inv.getArgument(0), "Failed to write metadata", Duration.ofMillis(5));
            })
        .when(pipeline)
        .process(any(), any(), any());

    HttpTester.Response resp = post("", multipart("a.png", "x"));

    assertEquals(400, resp.getStatus());
    assertTrue(resp.getContent().contains("Failed to write metadata"));
    assertFalse(Files.exists(staged.get()));
  }

  @Test
  void unexpectedErrorIs500() throws Exception {
    doThrow(new IllegalStateException("boom")).when(pipeline).process(any(), any(), any());

    HttpTester.Response resp = post("", multipart("a.png", "x"));

    assertEquals(500, resp.getStatus());
    assertTrue(resp.getContent().contains("boom"));
  }
}
