package gov.lbl.als.ingest.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through CLI arguments, environment
 * variables and YAML configuration.
 * <p><strong>Why:</strong> Registry URLs, credentials and share slugs end up in HTTP requests and in the
 * persisted descriptor, so malformed values are rejected before any adapter is built.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern SLUG_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns the trimmed value, or {@code null} when it is {@code null} or blank.
   *
   * @param value candidate text
   * @return trimmed value or {@code null}
   */
  public static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Validates a registry slug such as a Tracker share identifier.
   *
   * @param name parameter name for diagnostics
   * @param value candidate slug
   * @return trimmed slug
   * @throws IllegalArgumentException if the slug is blank or uses characters outside
   *     {@code [A-Za-z0-9._-]}
   */
  public static String requireSlug(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!SLUG_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name, "must match [A-Za-z0-9._-]+"));
    }
    return trimmed;
  }

  /**
   * Validates an absolute {@code http} or {@code https} URL and strips trailing slashes.
   *
   * @param name parameter name for diagnostics
   * @param value candidate URL
   * @return normalized URL without trailing slash
   * @throws IllegalArgumentException if the value is not an absolute http(s) URL with a host
   */
  public static String requireHttpUrl(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(message(name, "must be a valid URL"), ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null) {
      throw new IllegalArgumentException(message(name, "must use http or https scheme"));
    }
    String lower = scheme.toLowerCase(Locale.ROOT);
    if (!lower.equals("http") && !lower.equals("https")) {
      throw new IllegalArgumentException(message(name, "must use http or https scheme"));
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(message(name, "must include a host"));
    }
    String normalized = trimmed;
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = name == null || name.isBlank() ? "value" : name;
    return label + " " + suffix;
  }
}
