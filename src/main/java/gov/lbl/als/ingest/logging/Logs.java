package gov.lbl.als.ingest.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * <strong>What:</strong> Logging hygiene helpers for registry traffic and configuration dumps.
 * <p><strong>Why:</strong> Registry error bodies can be large and configuration carries passwords; neither
 * belongs verbatim in a run log that is persisted next to the data.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the original value when it fits, otherwise the shortened value with a
   *     {@code "... (truncated, X of Y bytes)"} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String kept;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      kept = buffer.toString();
    } catch (CharacterCodingException ex) {
      kept = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return kept + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Returns the redaction placeholder.
   *
   * @param value ignored original value
   * @return {@code [REDACTED]}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Copies a settings map, redacting values whose key names a secret ({@code password},
   * {@code token} or {@code secret}, case-insensitive). Blank values stay blank so missing credentials
   * remain visible.
   *
   * @param settings settings keyed by name
   * @return ordered copy safe to log
   */
  public static Map<String, String> redactSecrets(Map<String, String> settings) {
    Map<String, String> safe = new LinkedHashMap<>();
    settings.forEach((key, value) -> {
      boolean secret = isSecretKey(key);
      safe.put(key, secret && value != null && !value.isBlank() ? redact(value) : value);
    });
    return safe;
  }

  static boolean isSecretKey(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    return lower.contains("password") || lower.contains("token") || lower.contains("secret");
  }
}
