package gov.lbl.als.ingest.infrastructure.persistence;

import gov.lbl.als.ingest.application.port.DatasetLockPort;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DatasetLockPort} backed by an OS file lock on {@value #LOCK_FILE_NAME} in the dataset root.
 *
 * <p>The lock is advisory: it only keeps other ingestion runs out. A lock held by this JVM counts as
 * held. The lock file is never deleted: a run that opened it while another run held it would
 * otherwise lock an unlinked file while a third run locks a fresh one.</p>
 *
 * @since 0.1.0
 */
public final class DatasetLock implements DatasetLockPort {
  private static final Logger log = LoggerFactory.getLogger(DatasetLock.class);

  public static final String LOCK_FILE_NAME = ".als-ingest.lock";

  @Override
  public Held acquire(Path datasetRoot) throws IngestException {
    Path lockFile = datasetRoot.resolve(LOCK_FILE_NAME);
    FileChannel channel;
    try {
      channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    } catch (IOException e) {
      throw new IngestException(FailureKind.INVALID_DATASET_ROOT,
          "Unable to create lock file " + lockFile + ": " + e.getMessage(), e);
    }
    FileLock lock;
    try {
      lock = channel.tryLock();
    } catch (OverlappingFileLockException e) {
      lock = null;
    } catch (IOException e) {
      closeAfterFailure(channel, e);
      throw new IngestException(FailureKind.INVALID_DATASET_ROOT,
          "Unable to lock " + lockFile + ": " + e.getMessage(), e);
    }
    if (lock == null) {
      IngestException busy = new IngestException(FailureKind.RUN_IN_PROGRESS,
          "Another ingestion run holds " + lockFile);
      closeAfterFailure(channel, busy);
      throw busy;
    }
    log.debug("Acquired dataset lock {}", lockFile);
    FileLock held = lock;
    return () -> release(lockFile, channel, held);
  }

  @Override
  public boolean isLockFile(String fileName) {
    return LOCK_FILE_NAME.equals(fileName);
  }

  private static void release(Path lockFile, FileChannel channel, FileLock lock) {
    try (channel) {
      lock.release();
      log.debug("Released dataset lock {}", lockFile);
    } catch (IOException e) {
      log.warn("Unable to release dataset lock {}", lockFile, e);
    }
  }

  private static void closeAfterFailure(FileChannel channel, Exception failure) {
    try {
      channel.close();
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }
}
