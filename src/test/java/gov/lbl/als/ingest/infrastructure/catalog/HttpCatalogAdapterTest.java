package gov.lbl.als.ingest.infrastructure.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import gov.lbl.als.ingest.infrastructure.http.JsonHttpClient;
import gov.lbl.als.ingest.testutil.StubHttpServer;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpCatalogAdapterTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private final ObjectMapper mapper = new ObjectMapper();
  private StubHttpServer server;
  private HttpCatalogAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubHttpServer();
    adapter = new HttpCatalogAdapter(
        new JsonHttpClient(server.baseUrl(), Duration.ofSeconds(5), mapper), "ingestor", "secret");
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void logsInOnceAndCreatesDatasetAndDatablock() throws Exception {
    server.respond("POST /Users/login", 200, "{\"id\":\"tok-1\"}");
    server.respond("POST /Datasets", 200, "{\"pid\":\"20.500.12269/abc\"}");
    server.respond("POST /Datasets/20.500.12269%2Fabc/origdatablocks", 200, "{}");

    String pid = adapter.createDataset(dataset());
    adapter.createDatablock(pid, new Datablock("ALS-1", List.of("7.3.3"), 3,
        List.of(new Datablock.DataFile("a.txt", 3, T0))));

    assertEquals("20.500.12269/abc", pid);
    assertEquals(3, server.requests.size());
    JsonNode login = mapper.readTree(server.requests.get(0).body());
    assertEquals("ingestor", login.path("username").asText());
    StubHttpServer.Request create = server.requests.get(1);
    assertEquals("Bearer tok-1", create.header("Authorization"));
    JsonNode body = mapper.readTree(create.body());
    assertEquals("raw", body.path("type").asText());
    assertEquals("sample", body.path("datasetName").asText());
    assertEquals("2024-03-01T10:00:00Z", body.path("creationTime").asText());
    assertEquals("7.3.3", body.path("accessGroups").get(0).asText());
    assertEquals(1, body.path("scientificMetadata").path("file_count").asInt());
    JsonNode block = mapper.readTree(server.requests.get(2).body());
    assertEquals("a.txt", block.path("dataFileList").get(0).path("path").asText());
    assertEquals("Bearer tok-1", server.requests.get(2).header("Authorization"));
  }

  @Test
  void rejectedLoginSurfacesAsNonTransient() {
    server.respond("POST /Users/login", 401, "{\"error\":\"bad credentials\"}");

    RegistryException e = assertThrows(RegistryException.class, () -> adapter.createDataset(dataset()));

    assertEquals(401, e.status());
    assertFalse(e.isTransient());
  }

  @Test
  void responseWithoutPidIsAnError() {
    server.respond("POST /Users/login", 200, "{\"access_token\":\"tok-2\"}");
    server.respond("POST /Datasets", 200, "{}");

    assertThrows(RegistryException.class, () -> adapter.createDataset(dataset()));
    assertEquals("Bearer tok-2", server.requests.get(1).header("Authorization"));
  }

  @Test
  void attachmentIsPostedUnderEncodedPid() throws Exception {
    server.respond("POST /Users/login", 200, "{\"id\":\"tok-1\"}");
    server.respond("POST /Datasets/20.500.12269%2Fabc/attachments", 201, "{}");

    adapter.createAttachment("20.500.12269/abc", "data:image/png;base64,AAAA", "scattering");

    JsonNode body = mapper.readTree(server.requests.get(1).body());
    assertEquals("20.500.12269/abc", body.path("datasetId").asText());
    assertEquals("scattering", body.path("caption").asText());
    assertEquals("data:image/png;base64,AAAA", body.path("thumbnail").asText());
  }

  private static CatalogDataset dataset() {
    return new CatalogDataset("sample", "a sample", "ingestor", "ALS-1", List.of("7.3.3"),
        "pi@lbl.gov", "Dr. PI", "/als/7.3.3", "/data/sample", "ALS-1", T0, 3, 1,
        List.of("sample"), Map.of("file_count", 1));
  }
}
