package agora.market.gateway;

import agora.market.model.WorkerRecord;

import java.time.Duration;

/**
 * Liveness probe. Returns the measured round trip or throws when the worker is unreachable.
 */
@FunctionalInterface
public interface HealthProbe {

    Duration probe(WorkerRecord worker) throws Exception;
}
