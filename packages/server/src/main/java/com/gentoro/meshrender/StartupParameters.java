package com.gentoro.meshrender;

import com.gentoro.meshrender.exception.ConfigException;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Command line arguments of the form {@code --name=value} or {@code --name value}. A bare {@code
 * --flag} is read as {@code true}.
 */
public class StartupParameters {
  public static final String CONFIG_FILE = "config-file";

  private final Map<String, String> values = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
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

  /** Config file passed via {@code --config-file}, or {@code null} for the bundled defaults. */
  public String configFile() {
    return StringUtils.trimToNull(values.get(CONFIG_FILE));
  }

  public boolean hasParameter(String name) {
    return values.containsKey(name);
  }

  @SuppressWarnings("unchecked")
  public <T> T getParameter(String name, Class<T> type) {
    String raw = values.get(name);
    if (raw == null) return null;
    if (type == String.class) return (T) raw;
    if (type == Integer.class) {
      if (!NumberUtils.isCreatable(raw)) {
        throw new ConfigException("Parameter --" + name + " is not a number: " + raw);
      }
      return (T) Integer.valueOf(NumberUtils.toInt(raw));
    }
    if (type == Boolean.class) return (T) Boolean.valueOf(raw);
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }
}
