package com.gentoro.tldr;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Program arguments of the form {@code --name=value}; bare {@code --name} means {@code true}. */
public final class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new IllegalArgumentException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public Optional<String> parameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  /** Optional external YAML file given as {@code --config=<path>}. */
  public Path configFile() {
    return parameter("config").filter(s -> !s.isBlank()).map(Path::of).orElse(null);
  }
}
