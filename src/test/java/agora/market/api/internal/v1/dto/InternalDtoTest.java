package agora.market.api.internal.v1.dto;

import agora.market.model.WorkerRecord;
import agora.market.model.WorkerStatus;
import agora.market.util.Json;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = Json.mapper();

    @Test
    void registerWorkerRequestDeserialization() throws Exception {
        String json = """
                {
                  "workerId": "w-42",
                  "capabilities": ["gpu", "cuda"],
                  "capacity": 4,
                  "quality": 92.5,
                  "region": "eu-west",
                  "endpoint": "10.0.0.5:9000"
                }
                """;

        RegisterWorkerRequest req = mapper.readValue(json, RegisterWorkerRequest.class);

        assertEquals("w-42", req.workerId());
        assertEquals(Set.of("gpu", "cuda"), req.capabilities());
        assertEquals(4, req.capacity());
        assertDoesNotThrow(req::validate);

        WorkerRecord record = req.toRecord(70.0);
        assertEquals(WorkerStatus.ONLINE, record.status());
        assertEquals(4, record.capacity());
        assertEquals(92.5, record.quality(), 0.001);
        assertEquals(70.0, record.reputation(), 0.001);
        assertEquals("eu-west", record.region());
    }

    @Test
    void registerWorkerDefaults() {
        RegisterWorkerRequest req = new RegisterWorkerRequest("w-1", Set.of("cpu"), null, null, null, null);

        WorkerRecord record = req.toRecord(50.0);

        assertEquals(WorkerRecord.DEFAULT_CAPACITY, record.capacity());
        assertEquals(WorkerRecord.DEFAULT_QUALITY, record.quality(), 0.001);
    }

    @Test
    void registerWorkerRequestValidation() {
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("", Set.of("gpu"), null, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("w-1", Set.of(), null, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("w-1", Set.of("gpu"), 0, null, null, null)::validate);
        assertThrows(IllegalArgumentException.class,
                new RegisterWorkerRequest("w-1", Set.of("gpu"), 2, 120.0, null, null)::validate);
    }

    @Test
    void statusUpdateParsing() {
        assertEquals(WorkerStatus.MAINTENANCE, new StatusUpdateRequest("maintenance").parsedStatus());
        assertEquals(WorkerStatus.OFFLINE, new StatusUpdateRequest(" OFFLINE ").parsedStatus());
        assertThrows(IllegalArgumentException.class, new StatusUpdateRequest("sleeping")::validate);
        assertThrows(IllegalArgumentException.class, new StatusUpdateRequest(null)::validate);
    }

    @Test
    void workerResponseSortsCapabilities() throws Exception {
        WorkerRecord worker = WorkerRecord.builder()
                .id("w-1")
                .capabilities(Set.of("tpu", "cpu", "gpu"))
                .avgResponseTime(Duration.ofMillis(130))
                .build();

        WorkerResponse response = WorkerResponse.from(worker);

        assertEquals(List.of("cpu", "gpu", "tpu"), response.capabilities());
        assertEquals(130L, response.avgResponseTimeMs());
        String json = mapper.writeValueAsString(response);
        assertTrue(json.contains("\"workerId\":\"w-1\""));
        assertFalse(json.contains("region"));
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String json = mapper.writeValueAsString(OperationResponse.success());
        assertTrue(json.contains("\"ok\":true"));
        assertFalse(json.contains("error"));

        String notFound = mapper.writeValueAsString(OperationResponse.workerNotFound());
        assertTrue(notFound.contains("\"ok\":false"));
        assertTrue(notFound.contains("worker_not_found"));
    }
}
