package gov.lbl.als.ingest.infrastructure.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import gov.lbl.als.ingest.infrastructure.http.JsonHttpClient;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CatalogPort} against a SciCat-style v3 REST API.
 * <p><strong>Protocol:</strong> logs in once through {@code POST /Users/login} and sends the returned
 * token as a bearer token; datasets go to {@code POST /Datasets}, file lists to
 * {@code POST /Datasets/{pid}/origdatablocks}, thumbnails to {@code POST /Datasets/{pid}/attachments}.</p>
 * <p><strong>Thread-safety:</strong> Login is synchronized; otherwise used by one run at a time.</p>
 * <p><strong>Security:</strong> The password is only sent to the login endpoint and never logged.</p>
 *
 * @since 0.1.0
 */
public final class HttpCatalogAdapter implements CatalogPort {
  private static final Logger log = LoggerFactory.getLogger(HttpCatalogAdapter.class);

  private final JsonHttpClient client;
  private final String username;
  private final String password;
  private String token;

  /**
   * Creates the adapter. No request is sent until the first call.
   *
   * @param client HTTP client bound to the Catalog base URL
   * @param username Catalog user
   * @param password Catalog password
   */
  public HttpCatalogAdapter(JsonHttpClient client, String username, String password) {
    this.client = Objects.requireNonNull(client, "client");
    this.username = Objects.requireNonNull(username, "username");
    this.password = Objects.requireNonNull(password, "password");
  }

  @Override
  public String createDataset(CatalogDataset dataset) throws RegistryException {
    ObjectNode body = client.mapper().createObjectNode();
    body.put("type", "raw");
    body.put("datasetName", dataset.name());
    body.put("description", dataset.description());
    body.put("owner", dataset.owner());
    body.put("ownerGroup", dataset.ownerGroup());
    strings(body.putArray("accessGroups"), dataset.accessGroups());
    body.put("contactEmail", dataset.contactEmail());
    body.put("principalInvestigator", dataset.principalInvestigator());
    body.put("creationLocation", dataset.creationLocation());
    body.put("sourceFolder", dataset.sourceFolder());
    body.put("proposalId", dataset.proposalId());
    body.put("creationTime", dataset.creationTime() == null ? null : dataset.creationTime().toString());
    body.put("size", dataset.size());
    body.put("numberOfFiles", dataset.numberOfFiles());
    body.put("isPublished", false);
    strings(body.putArray("keywords"), dataset.keywords());
    body.set("scientificMetadata", client.mapper().valueToTree(dataset.scientificMetadata()));

    JsonNode response = client.send("POST", "/Datasets", body, auth());
    String pid = response.path("pid").asText(null);
    if (pid == null || pid.isBlank()) {
      throw new RegistryException("Catalog accepted the dataset but returned no pid", false, 200);
    }
    log.info("Created Catalog dataset {}", pid);
    return pid;
  }

  @Override
  public void createDatablock(String datasetId, Datablock datablock) throws RegistryException {
    ObjectNode body = client.mapper().createObjectNode();
    body.put("datasetId", datasetId);
    body.put("ownerGroup", datablock.ownerGroup());
    strings(body.putArray("accessGroups"), datablock.accessGroups());
    body.put("size", datablock.size());
    ArrayNode files = body.putArray("dataFileList");
    for (Datablock.DataFile file : datablock.files()) {
      ObjectNode node = files.addObject();
      node.put("path", file.path());
      node.put("size", file.size());
      node.put("time", file.time().toString());
    }
    client.send("POST", "/Datasets/" + JsonHttpClient.encode(datasetId) + "/origdatablocks", body, auth());
    log.info("Attached datablock with {} files to Catalog dataset {}", datablock.files().size(), datasetId);
  }

  @Override
  public void createAttachment(String datasetId, String thumbnail, String caption) throws RegistryException {
    ObjectNode body = client.mapper().createObjectNode();
    body.put("datasetId", datasetId);
    body.put("thumbnail", thumbnail);
    body.put("caption", caption);
    client.send("POST", "/Datasets/" + JsonHttpClient.encode(datasetId) + "/attachments", body, auth());
    log.info("Created thumbnail attachment for Catalog dataset {} with caption \"{}\"", datasetId, caption);
  }

  private synchronized Map<String, String> auth() throws RegistryException {
    if (token == null) {
      ObjectNode credentials = client.mapper().createObjectNode();
      credentials.put("username", username);
      credentials.put("password", password);
      JsonNode response = client.send("POST", "/Users/login", credentials, Map.of());
      String issued = response.path("id").asText(null);
      if (issued == null || issued.isBlank()) {
        issued = response.path("access_token").asText(null);
      }
      if (issued == null || issued.isBlank()) {
        throw new RegistryException("Catalog login for " + username + " returned no token", false, 200);
      }
      token = issued;
      log.debug("Logged in to Catalog at {} as {}", client.baseUrl(), username);
    }
    return Map.of("Authorization", "Bearer " + token);
  }

  private static void strings(ArrayNode array, List<String> values) {
    values.forEach(array::add);
  }
}
