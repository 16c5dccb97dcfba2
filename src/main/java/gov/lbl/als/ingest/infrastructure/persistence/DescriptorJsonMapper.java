package gov.lbl.als.ingest.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import gov.lbl.als.ingest.domain.descriptor.CatalogLink;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.descriptor.TrackerLink;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps {@link Descriptor} to and from the {@code {"als": {...}}} JSON document.
 *
 * <p>Keys of the {@code als} object that are not modelled here are kept in
 * {@link Descriptor#extensions()} and written back in their original order. The persisted
 * {@code total_size_bytes} is ignored on read; the manifest recomputes it.</p>
 *
 * @since 0.1.0
 */
final class DescriptorJsonMapper {
  static final String ROOT = "als";

  private static final Set<String> KNOWN_KEYS = Set.of(
      "beamline_id", "proposal_id", "principal_investigator", "name", "description",
      "date_of_acquisition", "file_manifest", "scicat", "dataset_tracker");

  private final ObjectMapper mapper;

  DescriptorJsonMapper(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Reads a descriptor document.
   *
   * @param document parsed JSON
   * @return descriptor
   * @throws IllegalArgumentException when the document is not a descriptor
   */
  Descriptor fromJson(JsonNode document) {
    JsonNode als = document == null ? null : document.get(ROOT);
    if (als == null || !als.isObject()) {
      throw new IllegalArgumentException("descriptor has no '" + ROOT + "' object");
    }
    Map<String, Object> extensions = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = als.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!KNOWN_KEYS.contains(field.getKey())) {
        extensions.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
      }
    }
    return new Descriptor(
        text(als, "beamline_id"),
        text(als, "proposal_id"),
        text(als, "principal_investigator"),
        text(als, "name"),
        text(als, "description"),
        text(als, "date_of_acquisition"),
        manifest(als.get("file_manifest")),
        catalog(als.get("scicat")),
        tracker(als.get("dataset_tracker")),
        extensions);
  }

  /**
   * Writes a descriptor document.
   *
   * @param descriptor descriptor to serialize
   * @return JSON document
   */
  ObjectNode toJson(Descriptor descriptor) {
    ObjectNode document = mapper.createObjectNode();
    ObjectNode als = document.putObject(ROOT);
    putText(als, "beamline_id", descriptor.beamlineId());
    putText(als, "proposal_id", descriptor.proposalId());
    putText(als, "principal_investigator", descriptor.principalInvestigator());
    putText(als, "name", descriptor.name());
    putText(als, "description", descriptor.description());
    putText(als, "date_of_acquisition", descriptor.dateOfAcquisition());

    FileManifest manifest = descriptor.fileManifest();
    ObjectNode manifestNode = als.putObject("file_manifest");
    ArrayNode files = manifestNode.putArray("files");
    for (FileManifestEntry entry : manifest.entries()) {
      ObjectNode file = files.addObject();
      file.put("path", entry.path());
      file.put("size_bytes", entry.sizeBytes());
      file.put("date_last_modified", formatInstant(entry.dateLastModified()));
      file.put("is_supplemental", entry.supplemental());
    }
    manifestNode.put("total_size_bytes", manifest.totalSizeBytes());

    CatalogLink catalog = descriptor.catalog();
    ObjectNode scicat = als.putObject("scicat");
    putText(scicat, "scicat_dataset_id", catalog.datasetId());
    putText(scicat, "scicat_instance", catalog.registryInstance());
    putText(scicat, "date_ingested", catalog.dateIngested() == null ? null : formatInstant(catalog.dateIngested()));
    putText(scicat, "ingester_used", catalog.extractorUsed());
    ArrayNode log = scicat.putArray("ingestion_log");
    catalog.runLog().forEach(log::add);

    TrackerLink tracker = descriptor.tracker();
    ObjectNode trackerNode = als.putObject("dataset_tracker");
    putText(trackerNode, "dataset_tracker_id", tracker.trackerDatasetId());
    putText(trackerNode, "dataset_tracker_instance", tracker.registryInstance());
    putText(trackerNode, "instance_record_id", tracker.instanceRecordId());
    ArrayNode comments = trackerNode.putArray("instance_comments");
    tracker.instanceComments().forEach(comments::add);

    for (Map.Entry<String, Object> extension : descriptor.extensions().entrySet()) {
      als.set(extension.getKey(), mapper.valueToTree(extension.getValue()));
    }
    return document;
  }

  private static FileManifest manifest(JsonNode node) {
    if (node == null || node.isNull()) {
      return FileManifest.empty();
    }
    JsonNode files = node.get("files");
    if (files == null || files.isNull()) {
      return FileManifest.empty();
    }
    if (!files.isArray()) {
      throw new IllegalArgumentException("file_manifest.files must be an array");
    }
    List<FileManifestEntry> entries = new ArrayList<>(files.size());
    for (JsonNode file : files) {
      String path = text(file, "path");
      if (path == null) {
        throw new IllegalArgumentException("manifest entry without a path");
      }
      String modified = text(file, "date_last_modified");
      if (modified == null) {
        throw new IllegalArgumentException("manifest entry " + path + " has no date_last_modified");
      }
      JsonNode supplemental = file.get("is_supplemental");
      entries.add(new FileManifestEntry(
          path,
          file.path("size_bytes").asLong(0),
          parseInstant(modified),
          supplemental != null && supplemental.asBoolean(false)));
    }
    return FileManifest.of(entries);
  }

  private static CatalogLink catalog(JsonNode node) {
    if (node == null || node.isNull()) {
      return CatalogLink.empty();
    }
    String ingested = text(node, "date_ingested");
    return new CatalogLink(
        text(node, "scicat_dataset_id"),
        text(node, "scicat_instance"),
        ingested == null ? null : parseInstant(ingested),
        text(node, "ingester_used"),
        strings(node.get("ingestion_log")));
  }

  private static TrackerLink tracker(JsonNode node) {
    if (node == null || node.isNull()) {
      return TrackerLink.empty();
    }
    return new TrackerLink(
        text(node, "dataset_tracker_id"),
        text(node, "dataset_tracker_instance"),
        text(node, "instance_record_id"),
        strings(node.get("instance_comments")));
  }

  private static List<String> strings(JsonNode node) {
    List<String> values = new ArrayList<>();
    if (node != null && node.isArray()) {
      for (JsonNode item : node) {
        values.add(item.asText());
      }
    }
    return values;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static void putText(ObjectNode node, String field, String value) {
    if (value == null) {
      node.putNull(field);
    } else {
      node.put(field, value);
    }
  }

  static String formatInstant(Instant instant) {
    return instant.truncatedTo(ChronoUnit.SECONDS).toString();
  }

  static Instant parseInstant(String raw) {
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException notUtc) {
      return OffsetDateTime.parse(raw).toInstant();
    }
  }
}
