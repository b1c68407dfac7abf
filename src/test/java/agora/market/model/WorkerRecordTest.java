package agora.market.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRecordTest {

    @Test
    void builderAppliesDefaults() {
        WorkerRecord worker = WorkerRecord.builder()
                .id("w-1")
                .capabilities(Set.of("gpu"))
                .build();

        assertEquals(WorkerStatus.ONLINE, worker.status());
        assertEquals(WorkerRecord.DEFAULT_CAPACITY, worker.capacity());
        assertEquals(WorkerRecord.DEFAULT_QUALITY, worker.quality());
        assertEquals(0, worker.load());
        assertTrue(worker.hasCapability("gpu"));
        assertFalse(worker.hasCapability("cuda"));
    }

    @Test
    void utilizationAndCapacity() {
        WorkerRecord worker = WorkerRecord.builder()
                .id("w-1")
                .capabilities(Set.of("gpu"))
                .capacity(4)
                .load(3)
                .build();

        assertEquals(0.75, worker.utilization(), 1e-9);
        assertFalse(worker.isAtCapacity());

        WorkerRecord full = worker.toBuilder().load(4).build();
        assertEquals(1.0, full.utilization(), 1e-9);
        assertTrue(full.isAtCapacity());

        WorkerRecord noCapacity = worker.toBuilder().capacity(0).load(0).build();
        assertEquals(1.0, noCapacity.utilization(), 1e-9);
        assertTrue(noCapacity.isAtCapacity());
    }

    @Test
    void identityIsTheWorkerId() {
        WorkerRecord a = WorkerRecord.builder().id("w-1").capabilities(Set.of("gpu")).load(1).build();
        WorkerRecord b = a.toBuilder().load(5).status(WorkerStatus.BUSY).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void missingIdIsRejected() {
        assertThrows(NullPointerException.class,
                () -> WorkerRecord.builder().capabilities(Set.of("gpu")).build());
    }
}
