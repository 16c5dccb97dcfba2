package gov.lbl.als.ingest.domain.catalog;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Raw dataset document submitted to the Catalog.
 * <p><strong>Role:</strong> Built by extraction strategies and handed to
 * {@link gov.lbl.als.ingest.application.port.CatalogPort#createDataset(CatalogDataset)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #scientificMetadata()} keeps insertion order.</p>
 *
 * @param name dataset name
 * @param description dataset description
 * @param owner owning user
 * @param ownerGroup group that owns the dataset (normally the proposal)
 * @param accessGroups groups granted read access
 * @param contactEmail contact e-mail, already cleaned
 * @param principalInvestigator principal investigator
 * @param creationLocation instrument location, for example {@code /als/8.3.2}
 * @param sourceFolder folder holding the files as seen by the Catalog
 * @param proposalId proposal identifier
 * @param creationTime acquisition time
 * @param size total size in bytes
 * @param numberOfFiles number of files
 * @param keywords search keywords
 * @param scientificMetadata instrument metadata, in extraction order
 * @since 0.1.0
 */
public record CatalogDataset(
    String name,
    String description,
    String owner,
    String ownerGroup,
    List<String> accessGroups,
    String contactEmail,
    String principalInvestigator,
    String creationLocation,
    String sourceFolder,
    String proposalId,
    Instant creationTime,
    long size,
    int numberOfFiles,
    List<String> keywords,
    Map<String, Object> scientificMetadata) {

  public CatalogDataset {
    Objects.requireNonNull(name, "name");
    accessGroups = accessGroups == null ? List.of() : List.copyOf(accessGroups);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    scientificMetadata = scientificMetadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(scientificMetadata));
  }
}
