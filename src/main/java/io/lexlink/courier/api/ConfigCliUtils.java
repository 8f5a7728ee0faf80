package io.lexlink.courier.api;

import io.lexlink.courier.config.ClientConfig;
import io.lexlink.courier.config.ConfigMerger;
import io.lexlink.courier.config.YamlConfigLoader;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers combining CLI arguments with YAML configuration.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  static final String KEY_CONFIG = "config";
  static final String KEY_CONVERSATION = "conversation";
  static final String KEY_TOKEN = "token";

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null}
   */
  static Path extractConfigPath(Map<String, String> args) {
    String value = args.remove(KEY_CONFIG);
    return value == null || value.isBlank() ? null : Path.of(value.trim());
  }

  /**
   * Merges defaults, the YAML section and CLI overrides.
   *
   * @param cli mutable CLI map; {@code config=PATH} is consumed
   * @param section YAML section merged over {@code common}
   * @return effective settings
   * @throws IOException when the configuration file cannot be read
   * @throws IllegalArgumentException when a named configuration file is missing or invalid
   */
  static Map<String, String> effectiveSettings(Map<String, String> cli, String section) throws IOException {
    Path configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      if (!Files.exists(configPath)) {
        throw new IllegalArgumentException("config file not found: " + configPath);
      }
      yaml = YamlConfigLoader.load(configPath, section);
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), configPath);
    }
    return ConfigMerger.buildEffectiveConfig(yaml, cli, ClientConfig.defaultsAsMap(), log::warn);
  }

  static ConversationIdentity identity(Map<String, String> settings) {
    return new ConversationIdentity(settings.get(KEY_CONVERSATION), settings.get(KEY_TOKEN));
  }
}
