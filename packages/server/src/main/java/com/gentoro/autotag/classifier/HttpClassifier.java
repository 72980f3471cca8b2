package com.gentoro.autotag.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.autotag.exception.ClassifierException;
import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.http.OkHttpFactory;
import com.gentoro.autotag.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link Classifier} backed by a model-serving sidecar over HTTP.
 *
 * <ul>
 *   <li>{@code POST /v1/classify}: multipart {@code image} plus a {@code labels} JSON part listing
 *       candidate labels per aspect; the response maps each aspect to label probabilities and the
 *       top label wins.
 *   <li>{@code POST /v1/detect}: multipart {@code image}; the response lists detections, of which
 *       class 0 boxes at least {@code minPersonHeight} pixels tall count as people.
 * </ul>
 */
public final class HttpClassifier implements Classifier {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(HttpClassifier.class);

  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
  private static final int PERSON_CLASS = 0;

  private final HttpUrl endpoint;
  private final OkHttpClient client;
  private final ClassifierSettings settings;

  public HttpClassifier(ClassifierSettings settings) {
    this(settings, OkHttpFactory.create(settings.connectTimeout(), settings.readTimeout()));
  }

  HttpClassifier(ClassifierSettings settings, OkHttpClient client) {
    HttpUrl url = HttpUrl.parse(settings.endpoint());
    if (url == null) {
      throw new ConfigException("Invalid classifier.endpoint: " + settings.endpoint());
    }
    this.endpoint = url;
    this.client = client;
    this.settings = settings;
  }

  @Override
  public ClassificationResult analyze(Path image) {
    try {
      return classify(image);
    } catch (Exception e) {
      log.warn("Scene classification failed for {}: {}", image.getFileName(), e.getMessage());
      return ClassificationResult.empty();
    }
  }

  @Override
  public PersonCategory countPeople(Path image) {
    try {
      return PersonCategory.fromCount(detectPeople(image));
    } catch (Exception e) {
      log.warn("Person detection failed for {}: {}", image.getFileName(), e.getMessage());
      return PersonCategory.NONE;
    }
  }

  @Override
  public String name() {
    return "http:" + endpoint;
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }

  ClassificationResult classify(Path image) throws IOException {
    Map<String, List<String>> candidates = new LinkedHashMap<>();
    settings.labels().forEach((aspect, labels) -> candidates.put(aspect.key(), labels));

    RequestBody body =
        imagePart(image)
            .addFormDataPart(
                "labels", JacksonUtility.getJsonMapper().writeValueAsString(candidates))
            .build();
    JsonNode root = post("v1/classify", body);

    Map<Aspect, LabelScore> result = new EnumMap<>(Aspect.class);
    for (Aspect aspect : settings.labels().keySet()) {
      LabelScore best = topLabel(root.get(aspect.key()));
      if (best != null) {
        result.put(aspect, best);
      }
    }
    return ClassificationResult.of(result);
  }

  int detectPeople(Path image) throws IOException {
    JsonNode root = post("v1/detect", imagePart(image).build());
    JsonNode detections = root.get("detections");
    if (detections == null || !detections.isArray()) {
      throw new ClassifierException("Malformed detection response: missing 'detections'");
    }
    int count = 0;
    for (JsonNode detection : detections) {
      if (detection.path("class").asInt(-1) != PERSON_CLASS) {
        continue;
      }
      JsonNode box = detection.get("box");
      if (box == null || !box.isArray() || box.size() < 4) {
        continue;
      }
      if (box.get(3).asDouble() >= settings.minPersonHeight()) {
        count++;
      }
    }
    return count;
  }

  private MultipartBody.Builder imagePart(Path image) {
    if (!Files.isRegularFile(image)) {
      throw new ClassifierException("Image file not found: " + image);
    }
    return new MultipartBody.Builder()
        .setType(MultipartBody.FORM)
        .addFormDataPart(
            "image",
            image.getFileName().toString(),
            RequestBody.create(image.toFile(), OCTET_STREAM));
  }

  private JsonNode post(String path, RequestBody body) throws IOException {
    HttpUrl url = endpoint.newBuilder().addPathSegments(path).build();
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new ClassifierException(
            "Classifier returned HTTP " + response.code() + " for " + url.encodedPath());
      }
      ResponseBody responseBody = response.body();
      if (responseBody == null) {
        throw new ClassifierException("Empty classifier response for " + url.encodedPath());
      }
      JsonNode root = JacksonUtility.getJsonMapper().readTree(responseBody.string());
      if (root == null || !root.isObject()) {
        throw new ClassifierException("Malformed classifier response for " + url.encodedPath());
      }
      return root;
    }
  }

  /** Highest-probability entry of {@code {"label": probability, ...}}, or null if none. */
  private static LabelScore topLabel(JsonNode probabilities) {
    if (probabilities == null || !probabilities.isObject()) {
      return null;
    }
    LabelScore best = null;
    for (Iterator<Map.Entry<String, JsonNode>> it = probabilities.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!entry.getValue().isNumber()) {
        continue;
      }
      double p = entry.getValue().asDouble();
      if (best == null || p > best.confidence()) {
        best = new LabelScore(entry.getKey(), p);
      }
    }
    return best;
  }
}
