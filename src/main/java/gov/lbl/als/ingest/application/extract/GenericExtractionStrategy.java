package gov.lbl.als.ingest.application.extract;

import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Instrument-neutral extractor registered as {@code generic}.
 * <p><strong>Why:</strong> Lets datasets from beamlines without a dedicated extractor be catalogued from
 * the descriptor fields and the manifest alone.</p>
 * <p><strong>Behavior:</strong> Creates one Catalog dataset, then one datablock listing every manifest
 * file. Identity fields absent from the descriptor fall back to the dataset directory name.</p>
 *
 * @since 0.1.0
 */
public final class GenericExtractionStrategy implements ExtractionStrategy {
  private static final Logger log = LoggerFactory.getLogger(GenericExtractionStrategy.class);

  public static final String NAME = "generic";
  static final String CONTACT_EMAIL_KEY = "contact_email";

  @Override
  public Descriptor extract(FileManifest manifest, Descriptor descriptor, ExtractionContext context)
      throws ExtractionException {
    if (manifest.isEmpty()) {
      throw new ExtractionException("Manifest lists no files");
    }
    String datasetName = firstNonBlank(descriptor.name(), directoryName(context));
    String description = firstNonBlank(descriptor.description(), datasetName);
    AccessControls access = AccessControls.calculate(
        context.ownerUsername(), descriptor.beamlineId(), descriptor.proposalId());

    Map<String, Object> scientific = new LinkedHashMap<>();
    scientific.put("extractor", NAME);
    scientific.put("file_count", manifest.size());
    scientific.put("total_size_bytes", manifest.totalSizeBytes());
    if (descriptor.dateOfAcquisition() != null) {
      scientific.put("date_of_acquisition", descriptor.dateOfAcquisition());
    }

    CatalogDataset dataset = new CatalogDataset(
        datasetName,
        description,
        context.ownerUsername(),
        access.ownerGroup(),
        access.accessGroups(),
        Emails.clean(descriptor.extensions().get(CONTACT_EMAIL_KEY)),
        descriptor.principalInvestigator(),
        "/als/" + firstNonBlank(descriptor.beamlineId(), "unknown"),
        context.datasetRoot().toString(),
        descriptor.proposalId(),
        creationTime(descriptor, manifest),
        manifest.totalSizeBytes(),
        manifest.size(),
        SearchTerms.fromName(datasetName),
        scientific);

    String datasetId;
    try {
      datasetId = context.catalog().createDataset(dataset);
      context.catalog().createDatablock(datasetId, datablock(manifest, access));
    } catch (RegistryException e) {
      throw new ExtractionException("Catalog call failed: " + e.getMessage(), e);
    }
    log.info("Catalog dataset {} created with {} files", datasetId, manifest.size());

    Descriptor named = descriptor.withIdentity(descriptor.beamlineId(), descriptor.proposalId(),
        descriptor.principalInvestigator(), datasetName, description,
        descriptor.dateOfAcquisition());
    return named.withFileManifest(manifest).withCatalog(named.catalog().withDatasetId(datasetId));
  }

  private static Datablock datablock(FileManifest manifest, AccessControls access) {
    List<Datablock.DataFile> files = new ArrayList<>(manifest.size());
    for (FileManifestEntry entry : manifest.entries()) {
      files.add(new Datablock.DataFile(entry.path(), entry.sizeBytes(), entry.dateLastModified()));
    }
    return new Datablock(access.ownerGroup(), access.accessGroups(), manifest.totalSizeBytes(), files);
  }

  private static Instant creationTime(Descriptor descriptor, FileManifest manifest) {
    String acquired = descriptor.dateOfAcquisition();
    if (acquired != null && !acquired.isBlank()) {
      try {
        return Instant.parse(acquired);
      } catch (DateTimeParseException notInstant) {
        try {
          return LocalDate.parse(acquired).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException notDate) {
          log.warn("Unparseable date_of_acquisition '{}'; using newest file time", acquired);
        }
      }
    }
    Instant newest = Instant.EPOCH;
    for (FileManifestEntry entry : manifest.entries()) {
      if (entry.dateLastModified().isAfter(newest)) {
        newest = entry.dateLastModified();
      }
    }
    return newest;
  }

  private static String directoryName(ExtractionContext context) {
    Path fileName = context.datasetRoot().getFileName();
    return fileName == null ? context.datasetRoot().toString() : fileName.toString();
  }

  private static String firstNonBlank(String first, String fallback) {
    return first != null && !first.isBlank() ? first : fallback;
  }
}
