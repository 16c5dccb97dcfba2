package gov.lbl.als.ingest.application.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a sample or dataset name into lowercase alphanumeric search keywords.
 *
 * @since 0.1.0
 */
public final class SearchTerms {
  private SearchTerms() {}

  /**
   * Extracts search terms.
   *
   * @param name dataset or sample name, may be {@code null}
   * @return distinct lowercase terms in order of appearance
   */
  public static List<String> fromName(String name) {
    if (name == null) {
      return List.of();
    }
    Set<String> terms = new LinkedHashSet<>();
    for (String term : name.split("[^a-zA-Z0-9]")) {
      if (!term.isEmpty()) {
        terms.add(term.toLowerCase(Locale.ROOT));
      }
    }
    return new ArrayList<>(terms);
  }
}
