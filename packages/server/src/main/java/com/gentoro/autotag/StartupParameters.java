package com.gentoro.autotag;

import com.gentoro.autotag.exception.ConfigException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line parameters in {@code --name=value} or {@code --name value} form.
 *
 * <p>Recognized parameters: {@code --config-file}.
 */
public class StartupParameters {
  private final Map<String, String> values = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        values.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        values.put(body, args[++i]);
      } else {
        values.put(body, "true");
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = values.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(raw);
    }
    if (type == Integer.class) {
      return type.cast(Integer.valueOf(raw));
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(raw));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Path passed via {@code --config-file}, or {@code null} to use the bundled defaults. */
  public Path configFile() {
    String file = getParameter("config-file", String.class);
    return file == null || file.isBlank() ? null : Path.of(file);
  }
}
