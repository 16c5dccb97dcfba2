package gov.lbl.als.ingest.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class AccessControlsTest {
  @Test
  void proposalBecomesOwnerGroup() {
    AccessControls access = AccessControls.calculate("ingestor", "7.3.3", "ALS-11111");

    assertEquals("ALS-11111", access.ownerGroup());
    assertEquals(List.of("7.3.3", "ingestor"), access.accessGroups());
  }

  @Test
  void missingOrNoneProposalFallsBackToUsername() {
    assertEquals("ingestor", AccessControls.calculate("ingestor", "7.3.3", null).ownerGroup());
    assertEquals("ingestor", AccessControls.calculate("ingestor", "7.3.3", "None").ownerGroup());
  }

  @Test
  void bl832AliasAddsNumericGroup() {
    AccessControls access = AccessControls.calculate("ingestor", " 'BL832', ", "p");

    assertEquals(List.of("8.3.2", "bl832", "ingestor"), access.accessGroups());
  }

  @Test
  void usernameMatchingBeamlineIsNotRepeated() {
    assertEquals(List.of("bl733"), AccessControls.calculate("bl733", "bl733", "p").accessGroups());
  }

  @Test
  void noBeamlineMeansNoAccessGroups() {
    assertEquals(List.of(), AccessControls.calculate("ingestor", "", "p").accessGroups());
  }
}
