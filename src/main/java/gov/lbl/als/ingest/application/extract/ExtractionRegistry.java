package gov.lbl.als.ingest.application.extract;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps extractor names to strategies. Unknown names fail closed with
 * {@link FailureKind#UNKNOWN_SPEC}.
 *
 * @since 0.1.0
 */
public final class ExtractionRegistry {
  private final Map<String, ExtractionStrategy> strategies = new TreeMap<>();

  /**
   * Creates a registry holding only the built-in {@code generic} strategy.
   *
   * @return new registry
   */
  public static ExtractionRegistry withDefaults() {
    ExtractionRegistry registry = new ExtractionRegistry();
    registry.register(GenericExtractionStrategy.NAME, new GenericExtractionStrategy());
    return registry;
  }

  /**
   * Registers a strategy under a name, replacing any earlier registration.
   *
   * @param name extractor name; trimmed, must not be blank
   * @param strategy strategy implementation
   * @return this registry
   */
  public ExtractionRegistry register(String name, ExtractionStrategy strategy) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(strategy, "strategy");
    String key = name.trim();
    if (key.isEmpty()) {
      throw new IllegalArgumentException("extractor name must not be blank");
    }
    strategies.put(key, strategy);
    return this;
  }

  /**
   * Resolves an extractor name.
   *
   * @param name requested extractor
   * @return registered strategy
   * @throws IngestException {@code UNKNOWN_SPEC} when nothing is registered under the name
   */
  public ExtractionStrategy resolve(String name) throws IngestException {
    ExtractionStrategy strategy = name == null ? null : strategies.get(name.trim());
    if (strategy == null) {
      throw new IngestException(FailureKind.UNKNOWN_SPEC,
          "No extractor registered for spec '" + name + "'; known: " + strategies.keySet());
    }
    return strategy;
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(strategies.keySet());
  }
}
