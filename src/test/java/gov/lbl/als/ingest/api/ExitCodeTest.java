package gov.lbl.als.ingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import org.junit.jupiter.api.Test;

class ExitCodeTest {
  @Test
  void mapsFailureCategoriesToExitCodes() {
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(FailureKind.UNKNOWN_SPEC));
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(FailureKind.MISSING_CREDENTIALS));
    assertEquals(ExitCode.VALIDATION_ERROR, ExitCode.forFailure(FailureKind.MANIFEST_MISMATCH));
    assertEquals(ExitCode.VALIDATION_ERROR, ExitCode.forFailure(FailureKind.RUN_IN_PROGRESS));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(FailureKind.EXTRACTION_FAILED));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(FailureKind.FILE_SYNC_FAILED));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(FailureKind.DESCRIPTOR_WRITE_FAILED));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(FailureKind.UNEXPECTED_ERROR));
  }

  @Test
  void unavailableRegistryIsRetryable() {
    assertEquals(ExitCode.TRANSIENT_FAILURE, ExitCode.forFailure(FailureKind.REGISTRY_UNAVAILABLE));
    assertEquals(75, ExitCode.TRANSIENT_FAILURE.code());
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
  }
}
