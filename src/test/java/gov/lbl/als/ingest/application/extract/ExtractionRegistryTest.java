package gov.lbl.als.ingest.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExtractionRegistryTest {
  @Test
  void defaultsContainGenericExtractor() throws Exception {
    ExtractionRegistry registry = ExtractionRegistry.withDefaults();

    assertEquals(Set.of("generic"), registry.names());
    assertInstanceOf(GenericExtractionStrategy.class, registry.resolve(" generic "));
  }

  @Test
  void registeredStrategyResolvesByName() throws Exception {
    ExtractionStrategy custom = (manifest, descriptor, context) -> descriptor;
    ExtractionRegistry registry = ExtractionRegistry.withDefaults().register("bl733_tomo", custom);

    assertSame(custom, registry.resolve("bl733_tomo"));
  }

  @Test
  void unknownSpecFails() {
    IngestException e = assertThrows(IngestException.class,
        () -> ExtractionRegistry.withDefaults().resolve("bl999"));

    assertEquals(FailureKind.UNKNOWN_SPEC, e.kind());
    assertTrue(e.getMessage().contains("generic"));
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExtractionRegistry().register(" ", (m, d, c) -> d));
  }
}
