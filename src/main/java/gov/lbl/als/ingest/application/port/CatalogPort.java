package gov.lbl.als.ingest.application.port;

import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;

/**
 * <strong>What:</strong> Port to the metadata Catalog.
 * <p><strong>Role:</strong> Used by extraction strategies only; the engine itself never writes to the
 * Catalog.</p>
 * <p><strong>Thread-safety:</strong> Implementations are used by one run at a time.</p>
 *
 * @since 0.1.0
 */
public interface CatalogPort {
  /**
   * Creates a raw dataset.
   *
   * @param dataset dataset document
   * @return Catalog-assigned dataset id
   * @throws RegistryException when the Catalog is unreachable or refuses the document
   */
  String createDataset(CatalogDataset dataset) throws RegistryException;

  /**
   * Attaches the file list to a dataset.
   *
   * @param datasetId Catalog dataset id
   * @param datablock files backing the dataset
   * @throws RegistryException when the call fails
   */
  void createDatablock(String datasetId, Datablock datablock) throws RegistryException;

  /**
   * Attaches a thumbnail to a dataset.
   *
   * @param datasetId Catalog dataset id
   * @param thumbnail data URI of the image
   * @param caption attachment caption
   * @throws RegistryException when the call fails
   */
  void createAttachment(String datasetId, String thumbnail, String caption) throws RegistryException;
}
