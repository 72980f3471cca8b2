package com.gentoro.autotag.classifier;

import com.gentoro.autotag.exception.ConfigException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/** Connection and labeling parameters for {@link HttpClassifier}. */
public record ClassifierSettings(
    String endpoint,
    Duration connectTimeout,
    Duration readTimeout,
    int minPersonHeight,
    Map<Aspect, List<String>> labels) {

  static final Map<Aspect, List<String>> DEFAULT_LABELS =
      Map.of(
          Aspect.SCENE, List.of("indoor", "outdoor"),
          Aspect.ROOMTYPE, List.of("kitchen", "bathroom", "bedroom", "living room", "office"),
          Aspect.CLOTHING, List.of("dressed", "naked"));

  public static ClassifierSettings from(Configuration config) {
    String endpoint =
        StringUtils.trimToNull(config.getString("classifier.endpoint", "http://localhost:9000"));
    if (endpoint == null) {
      throw new ConfigException("Missing classifier.endpoint configuration");
    }
    int connect = config.getInt("classifier.connect-timeout-seconds", 10);
    int read = config.getInt("classifier.read-timeout-seconds", 60);
    if (connect <= 0 || read <= 0) {
      throw new ConfigException("Classifier timeouts must be positive");
    }

    Map<Aspect, List<String>> labels = new EnumMap<>(Aspect.class);
    for (Aspect aspect : Aspect.values()) {
      List<String> configured = config.getList(String.class, "classifier.labels." + aspect.key());
      labels.put(
          aspect,
          configured == null || configured.isEmpty()
              ? DEFAULT_LABELS.get(aspect)
              : List.copyOf(configured));
    }

    return new ClassifierSettings(
        endpoint,
        Duration.ofSeconds(connect),
        Duration.ofSeconds(read),
        config.getInt("classifier.min-person-height", 40),
        labels);
  }
}
