package agora.market.gateway;

import agora.market.model.ExecutionResult;
import agora.market.model.TaskSpec;

/**
 * Runs a task on a worker. Implementations may block; the orchestrator bounds the call
 * with the task timeout.
 */
public interface ExecutionGateway {

    ExecutionResult execute(TaskSpec task, String workerId) throws Exception;
}
