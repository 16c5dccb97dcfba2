package gov.lbl.als.ingest.infrastructure.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.application.port.TrackerPort;
import gov.lbl.als.ingest.domain.tracker.Beamline;
import gov.lbl.als.ingest.domain.tracker.DatasetInstance;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import gov.lbl.als.ingest.domain.tracker.Proposal;
import gov.lbl.als.ingest.domain.tracker.Share;
import gov.lbl.als.ingest.domain.tracker.TrackerDataset;
import gov.lbl.als.ingest.infrastructure.http.JsonHttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> {@link TrackerPort} against the Dataset Tracker REST API.
 * <p><strong>Protocol:</strong> HTTP basic authentication; one collection per record type
 * ({@code /beamlines}, {@code /proposals}, {@code /datasets}, {@code /dataset-instances},
 * {@code /dataset-instance-files}, {@code /share-sublocations}), filtered with query parameters.
 * List endpoints may answer with a bare array or a paginated {@code {"results": [...]}} object.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class HttpTrackerAdapter implements TrackerPort {
  private static final int NOT_FOUND = 404;

  private final JsonHttpClient client;
  private final Map<String, String> auth;

  /**
   * Creates the adapter.
   *
   * @param client HTTP client bound to the Tracker base URL
   * @param username Tracker user
   * @param password Tracker password
   */
  public HttpTrackerAdapter(JsonHttpClient client, String username, String password) {
    this.client = Objects.requireNonNull(client, "client");
    String credentials = Objects.requireNonNull(username, "username") + ":"
        + Objects.requireNonNull(password, "password");
    this.auth = Map.of("Authorization",
        "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
  }

  @Override
  public List<Beamline> findBeamlines(String name) throws RegistryException {
    return list("/beamlines" + query("name", name), HttpTrackerAdapter::beamline);
  }

  @Override
  public Beamline createBeamline(Beamline beamline) throws RegistryException {
    ObjectNode body = object();
    body.put("name", beamline.name());
    body.put("description", beamline.description());
    return map("/beamlines", client.send("POST", "/beamlines", body, auth), HttpTrackerAdapter::beamline);
  }

  @Override
  public List<Proposal> findProposals(String name) throws RegistryException {
    return list("/proposals" + query("name", name), HttpTrackerAdapter::proposal);
  }

  @Override
  public Proposal createProposal(Proposal proposal) throws RegistryException {
    ObjectNode body = object();
    body.put("name", proposal.name());
    body.put("description", proposal.description());
    return map("/proposals", client.send("POST", "/proposals", body, auth), HttpTrackerAdapter::proposal);
  }

  @Override
  public Optional<Share> findShare(String slug) throws RegistryException {
    return one("/share-sublocations/" + JsonHttpClient.encode(slug),
        node -> new Share(required(node, "slug"), text(node, "name")));
  }

  @Override
  public Optional<TrackerDataset> findDataset(String slug) throws RegistryException {
    return one("/datasets/" + JsonHttpClient.encode(slug), HttpTrackerAdapter::dataset);
  }

  @Override
  public List<TrackerDataset> findDatasetsByCatalogId(String catalogDatasetId) throws RegistryException {
    return list("/datasets" + query("scicat_dataset_id", catalogDatasetId), HttpTrackerAdapter::dataset);
  }

  @Override
  public TrackerDataset createDataset(TrackerDataset dataset) throws RegistryException {
    return map("/datasets", client.send("POST", "/datasets", datasetBody(dataset), auth),
        HttpTrackerAdapter::dataset);
  }

  @Override
  public TrackerDataset updateDataset(TrackerDataset dataset) throws RegistryException {
    String path = "/datasets/" + JsonHttpClient.encode(dataset.slug());
    return map(path, client.send("PUT", path, datasetBody(dataset), auth), HttpTrackerAdapter::dataset);
  }

  @Override
  public List<DatasetInstance> findInstances(String datasetSlug, String shareSlug, String path)
      throws RegistryException {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("slug_dataset", datasetSlug);
    params.put("slug_share_sublocation", shareSlug);
    params.put("path", path);
    params.put("date_files_deleted__isnull", "true");
    List<DatasetInstance> instances =
        list("/dataset-instances" + JsonHttpClient.query(params), HttpTrackerAdapter::instance);
    List<DatasetInstance> sorted = new ArrayList<>(instances);
    sorted.sort(Comparator.comparing(DatasetInstance::dateCreated,
        Comparator.nullsLast(Comparator.reverseOrder())));
    return sorted;
  }

  @Override
  public DatasetInstance createInstance(DatasetInstance instance) throws RegistryException {
    ObjectNode body = object();
    body.put("slug_dataset", instance.datasetSlug());
    body.put("slug_share_sublocation", instance.shareSlug());
    body.put("path", instance.path());
    body.put("prefect_flow_run_id", instance.flowRunId());
    body.put("files_size_bytes", instance.filesSizeBytes());
    return map("/dataset-instances", client.send("POST", "/dataset-instances", body, auth),
        HttpTrackerAdapter::instance);
  }

  @Override
  public List<DatasetInstanceFile> findInstanceFiles(String instanceId) throws RegistryException {
    return list("/dataset-instance-files" + query("id_dataset_instance", instanceId),
        HttpTrackerAdapter::instanceFile);
  }

  @Override
  public DatasetInstanceFile createInstanceFile(DatasetInstanceFile file) throws RegistryException {
    return map("/dataset-instance-files",
        client.send("POST", "/dataset-instance-files", fileBody(file), auth), HttpTrackerAdapter::instanceFile);
  }

  @Override
  public DatasetInstanceFile updateInstanceFile(DatasetInstanceFile file) throws RegistryException {
    String path = "/dataset-instance-files/" + JsonHttpClient.encode(file.id());
    return map(path, client.send("PUT", path, fileBody(file), auth), HttpTrackerAdapter::instanceFile);
  }

  @Override
  public void deleteInstanceFile(String fileId) throws RegistryException {
    client.send("DELETE", "/dataset-instance-files/" + JsonHttpClient.encode(fileId), null, auth);
  }

  private ObjectNode datasetBody(TrackerDataset dataset) {
    ObjectNode body = object();
    body.put("name", dataset.name());
    body.put("description", dataset.description());
    body.put("slug_beamline", dataset.beamlineSlug());
    body.put("slug_proposal", dataset.proposalSlug());
    body.put("date_of_acquisition", dataset.dateOfAcquisition());
    body.put("scicat_dataset_id", dataset.catalogDatasetId());
    body.put("scicat_date_ingested",
        dataset.catalogDateIngested() == null ? null : dataset.catalogDateIngested().toString());
    body.put("scicat_ingestion_flow_run_id", dataset.ingestionFlowRunId());
    return body;
  }

  private ObjectNode fileBody(DatasetInstanceFile file) {
    ObjectNode body = object();
    body.put("id_dataset_instance", file.instanceId());
    body.put("file_path", file.path());
    body.put("file_size_bytes", file.sizeBytes());
    body.put("date_file_last_modified",
        file.dateLastModified() == null ? null : file.dateLastModified().toString());
    body.put("is_supplemental", file.supplemental());
    return body;
  }

  private ObjectNode object() {
    return client.mapper().createObjectNode();
  }

  @FunctionalInterface
  private interface RecordMapper<T> {
    T apply(JsonNode node) throws RegistryException;
  }

  private <T> List<T> list(String path, RecordMapper<T> mapper) throws RegistryException {
    JsonNode response = client.send("GET", path, null, auth);
    JsonNode items = response.isArray() ? response : response.path("results");
    List<T> values = new ArrayList<>();
    for (JsonNode item : items) {
      values.add(map(path, item, mapper));
    }
    return values;
  }

  private <T> Optional<T> one(String path, RecordMapper<T> mapper) throws RegistryException {
    try {
      JsonNode response = client.send("GET", path, null, auth);
      return response.isMissingNode() ? Optional.empty() : Optional.of(map(path, response, mapper));
    } catch (RegistryException e) {
      if (e.status() == NOT_FOUND) {
        return Optional.empty();
      }
      throw e;
    }
  }

  private static <T> T map(String path, JsonNode node, RecordMapper<T> mapper) throws RegistryException {
    try {
      return mapper.apply(node);
    } catch (DateTimeParseException | RegistryException e) {
      throw new RegistryException("Malformed Tracker record from " + path + ": " + e.getMessage(), false, e);
    }
  }

  private static String query(String name, String value) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put(name, value);
    return JsonHttpClient.query(params);
  }

  private static Beamline beamline(JsonNode node) throws RegistryException {
    return new Beamline(required(node, "slug"), text(node, "name"), text(node, "description"));
  }

  private static Proposal proposal(JsonNode node) throws RegistryException {
    return new Proposal(required(node, "slug"), text(node, "name"), text(node, "description"));
  }

  private static TrackerDataset dataset(JsonNode node) throws RegistryException {
    return new TrackerDataset(
        required(node, "slug"),
        text(node, "name"),
        text(node, "description"),
        text(node, "slug_beamline"),
        text(node, "slug_proposal"),
        text(node, "date_of_acquisition"),
        text(node, "scicat_dataset_id"),
        instant(node, "scicat_date_ingested"),
        text(node, "scicat_ingestion_flow_run_id"));
  }

  private static DatasetInstance instance(JsonNode node) throws RegistryException {
    return new DatasetInstance(
        required(node, "id"),
        text(node, "slug_dataset"),
        text(node, "slug_share_sublocation"),
        text(node, "path"),
        node.path("files_size_bytes").asLong(0),
        text(node, "prefect_flow_run_id"),
        instant(node, "date_created"),
        instant(node, "date_files_deleted"));
  }

  private static DatasetInstanceFile instanceFile(JsonNode node) throws RegistryException {
    return new DatasetInstanceFile(
        required(node, "id"),
        text(node, "id_dataset_instance"),
        text(node, "file_path"),
        node.path("file_size_bytes").asLong(0),
        instant(node, "date_file_last_modified"),
        node.path("is_supplemental").asBoolean(false));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static String required(JsonNode node, String field) throws RegistryException {
    String value = text(node, field);
    if (value == null || value.isBlank()) {
      throw new RegistryException("record has no " + field, false, -1);
    }
    return value;
  }

  private static Instant instant(JsonNode node, String field) {
    String raw = text(node, field);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException notUtc) {
      return OffsetDateTime.parse(raw).toInstant();
    }
  }
}
