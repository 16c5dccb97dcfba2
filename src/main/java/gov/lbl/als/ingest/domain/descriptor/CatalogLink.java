package gov.lbl.als.ingest.domain.descriptor;

import java.time.Instant;
import java.util.List;

/**
 * Catalog side of a descriptor: which Catalog dataset this data became and how.
 *
 * @param datasetId Catalog dataset identifier; {@code null} until ingestion succeeded
 * @param registryInstance base URL of the Catalog instance that holds the dataset
 * @param dateIngested when the Catalog dataset was created
 * @param extractorUsed name of the extraction strategy that produced the dataset
 * @param runLog log lines captured during the ingesting run
 * @since 0.1.0
 */
public record CatalogLink(
    String datasetId,
    String registryInstance,
    Instant dateIngested,
    String extractorUsed,
    List<String> runLog) {

  private static final CatalogLink EMPTY = new CatalogLink(null, null, null, null, List.of());

  public CatalogLink {
    runLog = runLog == null ? List.of() : List.copyOf(runLog);
  }

  public static CatalogLink empty() {
    return EMPTY;
  }

  /**
   * Indicates whether a Catalog dataset already exists for this descriptor.
   *
   * @return {@code true} when {@link #datasetId()} is set
   */
  public boolean isIngested() {
    return datasetId != null && !datasetId.isBlank();
  }

  public CatalogLink withDatasetId(String id) {
    return new CatalogLink(id, registryInstance, dateIngested, extractorUsed, runLog);
  }

  public CatalogLink withRunLog(List<String> lines) {
    return new CatalogLink(datasetId, registryInstance, dateIngested, extractorUsed, lines);
  }
}
