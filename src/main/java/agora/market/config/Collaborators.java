package agora.market.config;

import agora.market.exception.CollaboratorException;
import agora.market.gateway.ExecutionGateway;
import agora.market.gateway.HealthProbe;
import agora.market.gateway.InMemoryReputationGateway;
import agora.market.gateway.LoggingTransportGateway;
import agora.market.gateway.ReputationGateway;
import agora.market.gateway.TcpHealthProbe;
import agora.market.gateway.TransportGateway;

/**
 * External services the marketplace calls out to.
 */
public record Collaborators(
        ExecutionGateway execution,
        TransportGateway transport,
        ReputationGateway reputation,
        HealthProbe probe) {

    /**
     * Standalone defaults: in-process reputation, logged invitations, TCP probes.
     * No execution backend is attached, so executions fail until one is supplied.
     */
    public static Collaborators defaults(MarketConfig config) {
        return new Collaborators(
                (task, workerId) -> {
                    throw new CollaboratorException(
                            "No execution backend configured for task " + task.taskId(), null);
                },
                new LoggingTransportGateway(),
                new InMemoryReputationGateway(),
                new TcpHealthProbe(config.probeTimeout()));
    }

    public Collaborators withExecution(ExecutionGateway gateway) {
        return new Collaborators(gateway, transport, reputation, probe);
    }

    public Collaborators withTransport(TransportGateway gateway) {
        return new Collaborators(execution, gateway, reputation, probe);
    }

    public Collaborators withReputation(ReputationGateway gateway) {
        return new Collaborators(execution, transport, gateway, probe);
    }

    public Collaborators withProbe(HealthProbe healthProbe) {
        return new Collaborators(execution, transport, reputation, healthProbe);
    }
}
