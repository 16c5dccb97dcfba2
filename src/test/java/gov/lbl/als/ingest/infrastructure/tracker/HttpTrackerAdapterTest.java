package gov.lbl.als.ingest.infrastructure.tracker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.domain.tracker.Beamline;
import gov.lbl.als.ingest.domain.tracker.DatasetInstance;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import gov.lbl.als.ingest.infrastructure.http.JsonHttpClient;
import gov.lbl.als.ingest.testutil.StubHttpServer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpTrackerAdapterTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private StubHttpServer server;
  private HttpTrackerAdapter adapter;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubHttpServer();
    adapter = new HttpTrackerAdapter(
        new JsonHttpClient(server.baseUrl(), Duration.ofSeconds(5), mapper), "tracker", "pw");
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void findBeamlinesSendsBasicAuthAndReadsPagedResults() throws Exception {
    server.respond("GET /beamlines?name=7.3.3", 200,
        "{\"results\":[{\"slug\":\"bl-733\",\"name\":\"7.3.3\",\"description\":null}]}");

    List<Beamline> found = adapter.findBeamlines("7.3.3");

    assertEquals(List.of(new Beamline("bl-733", "7.3.3", null)), found);
    String expected = "Basic " + Base64.getEncoder()
        .encodeToString("tracker:pw".getBytes(StandardCharsets.UTF_8));
    assertEquals(expected, server.requests.get(0).header("Authorization"));
  }

  @Test
  void missingShareAndDatasetAreEmpty() throws Exception {
    assertTrue(adapter.findShare("als-beegfs").isEmpty());
    assertTrue(adapter.findDataset("ds-404").isEmpty());
  }

  @Test
  void instancesAreSortedNewestFirst() throws Exception {
    server.respond("GET /dataset-instances?slug_dataset=ds-1&slug_share_sublocation=als-beegfs"
            + "&path=bl733%2Fsample&date_files_deleted__isnull=true", 200, """
        [
          {"id": "inst-1", "slug_dataset": "ds-1", "slug_share_sublocation": "als-beegfs",
           "path": "bl733/sample", "files_size_bytes": 3, "date_created": "2024-01-01T00:00:00Z"},
          {"id": "inst-2", "slug_dataset": "ds-1", "slug_share_sublocation": "als-beegfs",
           "path": "bl733/sample", "files_size_bytes": 3, "date_created": "2024-02-01T00:00:00+01:00"}
        ]
        """);

    List<DatasetInstance> instances = adapter.findInstances("ds-1", "als-beegfs", "bl733/sample");

    assertEquals(List.of("inst-2", "inst-1"), instances.stream().map(DatasetInstance::id).toList());
    assertEquals(Instant.parse("2024-01-31T23:00:00Z"), instances.get(0).dateCreated());
  }

  @Test
  void createInstanceFileSendsManifestValues() throws Exception {
    server.respond("POST /dataset-instance-files", 201, """
        {"id": "file-9", "id_dataset_instance": "inst-1", "file_path": "raw/a.h5",
         "file_size_bytes": 42, "date_file_last_modified": "2024-03-01T10:00:00Z", "is_supplemental": false}
        """);
    FileManifestEntry entry = new FileManifestEntry("raw/a.h5", 42, Instant.parse("2024-03-01T10:00:00Z"), false);

    DatasetInstanceFile created = adapter.createInstanceFile(DatasetInstanceFile.fromManifest("inst-1", entry));

    assertEquals("file-9", created.id());
    assertTrue(created.matches(entry));
    JsonNode body = mapper.readTree(server.requests.get(0).body());
    assertEquals("raw/a.h5", body.path("file_path").asText());
    assertEquals(42, body.path("file_size_bytes").asLong());
    assertEquals("2024-03-01T10:00:00Z", body.path("date_file_last_modified").asText());
  }

  @Test
  void deleteFailurePropagatesStatus() {
    server.respond("DELETE /dataset-instance-files/file-1", 500, "oops");

    RegistryException e = assertThrows(RegistryException.class, () -> adapter.deleteInstanceFile("file-1"));
    assertEquals(500, e.status());
    assertTrue(e.isTransient());
  }

  @Test
  void malformedDateIsRejected() {
    server.respond("GET /datasets/ds-1", 200, "{\"slug\":\"ds-1\",\"scicat_date_ingested\":\"yesterday\"}");

    assertThrows(RegistryException.class, () -> adapter.findDataset("ds-1"));
  }

  @Test
  void createdRecordWithoutIdIsRejected() {
    server.respond("POST /dataset-instance-files", 201, "{\"file_path\": \"raw/a.h5\"}");
    FileManifestEntry entry = new FileManifestEntry("raw/a.h5", 42, Instant.parse("2024-03-01T10:00:00Z"), false);

    RegistryException e = assertThrows(RegistryException.class,
        () -> adapter.createInstanceFile(DatasetInstanceFile.fromManifest("inst-1", entry)));

    assertFalse(e.isTransient());
    assertTrue(e.getMessage().contains("no id"), e.getMessage());
  }

  @Test
  void listedDatasetWithoutSlugIsRejected() {
    server.respond("GET /datasets?scicat_dataset_id=pid-1", 200, "[{\"name\": \"sample\"}]");

    assertThrows(RegistryException.class, () -> adapter.findDatasetsByCatalogId("pid-1"));
  }
}
