package io.lexlink.courier.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI {@code key=value} overrides; may be {@code null}
   * @param defaults embedded defaults; may be {@code null}
   * @param warn receives a notice for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when cross-field validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (warn != null && yamlValues.containsKey(entry.getKey())) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String base = trim(effective.get(ClientConfig.KEY_RECONNECT_BASE));
    String cap = trim(effective.get(ClientConfig.KEY_RECONNECT_CAP));
    if (!base.isEmpty() && !cap.isEmpty()) {
      try {
        if (Long.parseLong(cap) < Long.parseLong(base)) {
          throw new IllegalArgumentException(ClientConfig.KEY_RECONNECT_CAP + " (" + cap + ") must not be below "
              + ClientConfig.KEY_RECONNECT_BASE + " (" + base + ")");
        }
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Reconnect delays must be whole numbers (base=" + base
            + ", cap=" + cap + ")", ex);
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
