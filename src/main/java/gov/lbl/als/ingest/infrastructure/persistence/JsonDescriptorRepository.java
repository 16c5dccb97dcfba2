package gov.lbl.als.ingest.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import gov.lbl.als.ingest.application.port.DescriptorRepository;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.validation.Strings;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores the descriptor as a JSON file in the dataset root.
 * <p><strong>Naming:</strong> {@code als-dataset-metadata.json} until the dataset has a Tracker id,
 * then {@code als-dataset-metadata-<trackerId>.json}. After a rename the previous file is removed
 * once the new one is in place.</p>
 * <p><strong>Atomicity:</strong> Writes go to a hidden temporary file in the same directory that is
 * then moved over the target, so readers see either the old or the new document.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the mapper; callers serialize writes per
 * dataset through the dataset lock.</p>
 *
 * @since 0.1.0
 */
public final class JsonDescriptorRepository implements DescriptorRepository {
  private static final Logger log = LoggerFactory.getLogger(JsonDescriptorRepository.class);

  static final String BASE_NAME = "als-dataset-metadata";
  static final String EXTENSION = ".json";
  private static final String TEMP_PREFIX = "." + BASE_NAME + "-";

  private final ObjectMapper mapper;
  private final DescriptorJsonMapper json;

  public JsonDescriptorRepository() {
    this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
  }

  JsonDescriptorRepository(ObjectMapper mapper) {
    this.mapper = mapper;
    this.json = new DescriptorJsonMapper(mapper);
  }

  /**
   * File name for a descriptor.
   *
   * @param descriptor descriptor to store
   * @return file name inside the dataset root
   * @throws IngestException {@code DESCRIPTOR_WRITE_FAILED} when the Tracker dataset id is not a slug
   */
  public static String fileNameFor(Descriptor descriptor) throws IngestException {
    if (!descriptor.tracker().hasDataset()) {
      return BASE_NAME + EXTENSION;
    }
    try {
      String slug = Strings.requireSlug("trackerDatasetId", descriptor.tracker().trackerDatasetId());
      return BASE_NAME + "-" + slug + EXTENSION;
    } catch (IllegalArgumentException e) {
      throw new IngestException(FailureKind.DESCRIPTOR_WRITE_FAILED,
          "Descriptor file name cannot be derived: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isDescriptorFile(String fileName) {
    return (fileName.startsWith(BASE_NAME) && fileName.endsWith(EXTENSION))
        || fileName.startsWith(TEMP_PREFIX);
  }

  @Override
  public Optional<Descriptor> read(Path datasetRoot) throws IngestException {
    List<Path> candidates = descriptorFiles(datasetRoot);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    if (candidates.size() > 1) {
      throw new IngestException(FailureKind.MULTIPLE_DESCRIPTORS,
          "Found " + candidates.size() + " descriptor files in " + datasetRoot + ": " + candidates);
    }
    Path file = candidates.get(0);
    try {
      JsonNode document = mapper.readTree(file.toFile());
      Descriptor descriptor = json.fromJson(document);
      log.info("Loaded descriptor {}", file.getFileName());
      return Optional.of(descriptor);
    } catch (IOException | IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
      throw new IngestException(FailureKind.DESCRIPTOR_UNREADABLE,
          "Descriptor " + file + " could not be read: " + e.getMessage(), e);
    }
  }

  @Override
  public Path write(Path datasetRoot, Descriptor descriptor) throws IngestException {
    Path target = datasetRoot.resolve(fileNameFor(descriptor));
    byte[] bytes;
    try {
      bytes = mapper.writeValueAsBytes(json.toJson(descriptor));
    } catch (JsonProcessingException e) {
      throw new IngestException(FailureKind.DESCRIPTOR_WRITE_FAILED,
          "Descriptor could not be serialized: " + e.getOriginalMessage(), e);
    }
    Path temp = null;
    try {
      temp = Files.createTempFile(datasetRoot, TEMP_PREFIX, ".tmp");
      Files.write(temp, bytes);
      moveIntoPlace(temp, target);
    } catch (IOException e) {
      IngestException failure = new IngestException(FailureKind.DESCRIPTOR_WRITE_FAILED,
          "Descriptor " + target + " could not be written: " + e.getMessage(), e);
      deleteQuietly(temp, failure);
      throw failure;
    }
    removeSuperseded(datasetRoot, target);
    return target;
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}; falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void removeSuperseded(Path datasetRoot, Path target) {
    List<Path> existing;
    try {
      existing = descriptorFiles(datasetRoot);
    } catch (IngestException e) {
      log.warn("Unable to list descriptor files in {} after write", datasetRoot, e);
      return;
    }
    for (Path other : existing) {
      if (other.getFileName().equals(target.getFileName())) {
        continue;
      }
      try {
        Files.deleteIfExists(other);
        log.info("Removed superseded descriptor {}", other.getFileName());
      } catch (IOException e) {
        log.warn("Unable to remove superseded descriptor {}", other, e);
      }
    }
  }

  private List<Path> descriptorFiles(Path datasetRoot) throws IngestException {
    List<Path> found = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(datasetRoot)) {
      for (Path entry : stream) {
        String name = entry.getFileName().toString();
        if (name.startsWith(BASE_NAME) && name.endsWith(EXTENSION) && Files.isRegularFile(entry)) {
          found.add(entry);
        }
      }
    } catch (IOException e) {
      throw new IngestException(FailureKind.DESCRIPTOR_UNREADABLE,
          "Unable to list " + datasetRoot + ": " + e.getMessage(), e);
    }
    found.sort(null);
    return found;
  }

  private static void deleteQuietly(Path temp, Exception failure) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanup) {
      failure.addSuppressed(cleanup);
    }
  }
}
