package gov.lbl.als.ingest.application.extract;

import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contact e-mail clean-up for metadata read from instrument files.
 *
 * @since 0.1.0
 */
public final class Emails {
  private static final Logger log = LoggerFactory.getLogger(Emails.class);

  /** Address used when the metadata carries no usable e-mail. */
  public static final String UNKNOWN_EMAIL = "unknown@example.com";

  private static final Pattern EDGE_JUNK = Pattern.compile("^[\"'\\s,]+|[\"'\\s,]+$");

  private Emails() {}

  /**
   * Strips quotes, commas and spaces from an e-mail address.
   *
   * @param raw value from metadata, may be {@code null}
   * @return cleaned address, or {@link #UNKNOWN_EMAIL} when none is usable
   */
  public static String clean(Object raw) {
    if (!(raw instanceof String value)) {
      log.info("Contact e-mail is not a string; using {}", UNKNOWN_EMAIL);
      return UNKNOWN_EMAIL;
    }
    String cleaned = EDGE_JUNK.matcher(value).replaceAll("");
    if (cleaned.isEmpty() || "NONE".equals(cleaned.toUpperCase(Locale.ROOT)) || !cleaned.contains("@")) {
      log.info("Invalid contact e-mail; using {}", UNKNOWN_EMAIL);
      return UNKNOWN_EMAIL;
    }
    return cleaned.replace(" ", "");
  }
}
