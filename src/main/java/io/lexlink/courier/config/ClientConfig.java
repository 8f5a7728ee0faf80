package io.lexlink.courier.config;

import io.lexlink.courier.application.conversation.ReconnectPolicy;
import io.lexlink.courier.application.conversation.TypingSignalThrottle;
import io.lexlink.courier.validation.Numbers;
import io.lexlink.courier.validation.Strings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable client settings for one Courier session.
 * <p><strong>Why:</strong> Keeps the reconnect, typing and history knobs in one validated place so the composition
 * root never sees raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param apiBaseUrl REST API base URL; the WebSocket base is derived from it
 * @param reconnectBaseDelayMillis first reconnect delay
 * @param reconnectCapDelayMillis upper bound for any reconnect delay
 * @param maxReconnectAttempts consecutive retries before giving up
 * @param typingDebounceMillis debounce window for outbound typing-started signals
 * @param typingIdleStopMillis inactivity before typing is stopped automatically; {@code 0} disables it
 * @param connectTimeoutMillis WebSocket handshake and history request timeout
 * @param loadHistory whether the REST history is fetched before the live channel opens
 * @since 1.0.0
 */
public record ClientConfig(
    String apiBaseUrl,
    long reconnectBaseDelayMillis,
    long reconnectCapDelayMillis,
    int maxReconnectAttempts,
    long typingDebounceMillis,
    long typingIdleStopMillis,
    long connectTimeoutMillis,
    boolean loadHistory) {

  public static final String KEY_API = "api";
  public static final String KEY_RECONNECT_BASE = "reconnectBaseDelayMillis";
  public static final String KEY_RECONNECT_CAP = "reconnectCapDelayMillis";
  public static final String KEY_MAX_ATTEMPTS = "maxReconnectAttempts";
  public static final String KEY_TYPING_DEBOUNCE = "typingDebounceMillis";
  public static final String KEY_TYPING_IDLE_STOP = "typingIdleStopMillis";
  public static final String KEY_CONNECT_TIMEOUT = "connectTimeoutMillis";
  public static final String KEY_LOAD_HISTORY = "loadHistory";

  public static final String DEFAULT_API_BASE_URL = "http://localhost:8000";
  public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000L;

  private static final long MAX_DELAY_MILLIS = 3_600_000L;

  public ClientConfig {
    apiBaseUrl = Strings.requireHttpUrl(KEY_API, apiBaseUrl);
    Numbers.requireRange(KEY_RECONNECT_BASE, reconnectBaseDelayMillis, 1, MAX_DELAY_MILLIS);
    Numbers.requireRange(KEY_RECONNECT_CAP, reconnectCapDelayMillis, reconnectBaseDelayMillis, MAX_DELAY_MILLIS);
    Numbers.requireRange(KEY_MAX_ATTEMPTS, maxReconnectAttempts, 0, 1_000);
    Numbers.requireRange(KEY_TYPING_DEBOUNCE, typingDebounceMillis, 0, 60_000);
    Numbers.requireRange(KEY_TYPING_IDLE_STOP, typingIdleStopMillis, 0, 600_000);
    Numbers.requireRange(KEY_CONNECT_TIMEOUT, connectTimeoutMillis, 1, 600_000);
  }

  /**
   * Returns the built-in settings.
   *
   * @return defaults matching the conversation server's documented behavior
   */
  public static ClientConfig defaults() {
    return new ClientConfig(
        DEFAULT_API_BASE_URL,
        ReconnectPolicy.DEFAULT_BASE_DELAY_MILLIS,
        ReconnectPolicy.DEFAULT_CAP_DELAY_MILLIS,
        ReconnectPolicy.DEFAULT_MAX_ATTEMPTS,
        TypingSignalThrottle.DEFAULT_DEBOUNCE_MILLIS,
        TypingSignalThrottle.DEFAULT_IDLE_STOP_MILLIS,
        DEFAULT_CONNECT_TIMEOUT_MILLIS,
        true);
  }

  /**
   * Returns {@link #defaults()} as a flat key/value map suitable for {@link ConfigMerger}.
   *
   * @return ordered map of default values
   */
  public static Map<String, String> defaultsAsMap() {
    ClientConfig d = defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(KEY_API, d.apiBaseUrl());
    map.put(KEY_RECONNECT_BASE, Long.toString(d.reconnectBaseDelayMillis()));
    map.put(KEY_RECONNECT_CAP, Long.toString(d.reconnectCapDelayMillis()));
    map.put(KEY_MAX_ATTEMPTS, Integer.toString(d.maxReconnectAttempts()));
    map.put(KEY_TYPING_DEBOUNCE, Long.toString(d.typingDebounceMillis()));
    map.put(KEY_TYPING_IDLE_STOP, Long.toString(d.typingIdleStopMillis()));
    map.put(KEY_CONNECT_TIMEOUT, Long.toString(d.connectTimeoutMillis()));
    map.put(KEY_LOAD_HISTORY, Boolean.toString(d.loadHistory()));
    return map;
  }

  /**
   * Builds a configuration from a flat map; absent keys fall back to {@link #defaults()} and unknown keys are
   * ignored.
   *
   * @param values configuration values keyed by the {@code KEY_*} constants
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ClientConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ClientConfig d = defaults();
    return new ClientConfig(
        valueOr(values, KEY_API, d.apiBaseUrl()),
        longOr(values, KEY_RECONNECT_BASE, d.reconnectBaseDelayMillis()),
        longOr(values, KEY_RECONNECT_CAP, d.reconnectCapDelayMillis()),
        (int) longOr(values, KEY_MAX_ATTEMPTS, d.maxReconnectAttempts()),
        longOr(values, KEY_TYPING_DEBOUNCE, d.typingDebounceMillis()),
        longOr(values, KEY_TYPING_IDLE_STOP, d.typingIdleStopMillis()),
        longOr(values, KEY_CONNECT_TIMEOUT, d.connectTimeoutMillis()),
        booleanOr(values, KEY_LOAD_HISTORY, d.loadHistory()));
  }

  /**
   * Builds the reconnect policy described by this configuration.
   *
   * @return reconnect policy
   */
  public ReconnectPolicy reconnectPolicy() {
    return new ReconnectPolicy(reconnectBaseDelayMillis, reconnectCapDelayMillis, maxReconnectAttempts);
  }

  public Duration connectTimeout() {
    return Duration.ofMillis(connectTimeoutMillis);
  }

  private static String valueOr(Map<String, String> values, String key, String fallback) {
    String raw = values.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  private static long longOr(Map<String, String> values, String key, long fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseRange(key, raw, Long.MIN_VALUE, Long.MAX_VALUE);
  }

  private static boolean booleanOr(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "true":
      case "yes":
      case "on":
        return true;
      case "false":
      case "no":
      case "off":
        return false;
      default:
        throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    }
  }
}
