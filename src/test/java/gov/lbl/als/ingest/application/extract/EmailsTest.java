package gov.lbl.als.ingest.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class EmailsTest {
  @Test
  void stripsQuotesCommasAndSpaces() {
    assertEquals("pi@lbl.gov", Emails.clean(" \"pi @lbl.gov\", "));
  }

  @Test
  void invalidValuesBecomeUnknown() {
    assertEquals(Emails.UNKNOWN_EMAIL, Emails.clean(null));
    assertEquals(Emails.UNKNOWN_EMAIL, Emails.clean(42));
    assertEquals(Emails.UNKNOWN_EMAIL, Emails.clean("none"));
    assertEquals(Emails.UNKNOWN_EMAIL, Emails.clean("no-at-sign"));
    assertEquals(Emails.UNKNOWN_EMAIL, Emails.clean("  ,"));
  }
}
