package gov.lbl.als.ingest.testutil;

import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Catalog fake handing out ids {@code pid-1}, {@code pid-2}, ... */
public final class InMemoryCatalog implements CatalogPort {
  public final Map<String, CatalogDataset> datasets = new LinkedHashMap<>();
  public final Map<String, List<Datablock>> datablocks = new LinkedHashMap<>();
  public final List<String> attachments = new ArrayList<>();
  private RegistryException nextFailure;

  public void failNext(RegistryException failure) {
    this.nextFailure = failure;
  }

  @Override
  public String createDataset(CatalogDataset dataset) throws RegistryException {
    maybeFail();
    String id = "pid-" + (datasets.size() + 1);
    datasets.put(id, dataset);
    return id;
  }

  @Override
  public void createDatablock(String datasetId, Datablock datablock) throws RegistryException {
    maybeFail();
    datablocks.computeIfAbsent(datasetId, id -> new ArrayList<>()).add(datablock);
  }

  @Override
  public void createAttachment(String datasetId, String thumbnail, String caption) throws RegistryException {
    maybeFail();
    attachments.add(datasetId + ":" + caption);
  }

  private void maybeFail() throws RegistryException {
    RegistryException failure = nextFailure;
    nextFailure = null;
    if (failure != null) {
      throw failure;
    }
  }
}
