package gov.lbl.als.ingest.application.port;

import gov.lbl.als.ingest.domain.ingest.IngestException;
import java.nio.file.Path;

/**
 * Advisory per-dataset lock that keeps two runs from working on the same dataset at once.
 *
 * @since 0.1.0
 */
public interface DatasetLockPort {
  /**
   * Takes the lock without waiting.
   *
   * @param datasetRoot dataset root directory
   * @return held lock; closing it releases the lock
   * @throws IngestException {@code RUN_IN_PROGRESS} when another run holds it
   */
  Held acquire(Path datasetRoot) throws IngestException;

  /**
   * Tells whether a file name in the dataset root belongs to the lock.
   *
   * @param fileName bare file name
   * @return {@code true} for lock files
   */
  boolean isLockFile(String fileName);

  /** Lock held by the current run. */
  interface Held extends AutoCloseable {
    @Override
    void close();
  }

  /** Lock that never blocks; for tests and dry runs. */
  DatasetLockPort NONE = new DatasetLockPort() {
    @Override
    public Held acquire(Path datasetRoot) {
      return () -> { };
    }

    @Override
    public boolean isLockFile(String fileName) {
      return false;
    }
  };
}
