package agora.market.gateway;

import agora.market.model.WorkerRecord;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Probes a worker by opening a TCP connection to its advertised endpoint (host:port).
 */
public class TcpHealthProbe implements HealthProbe {

    private final int connectTimeoutMs;

    public TcpHealthProbe(Duration connectTimeout) {
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
    }

    @Override
    public Duration probe(WorkerRecord worker) throws IOException {
        String endpoint = worker.endpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new IOException("Worker " + worker.id() + " has no endpoint");
        }
        int sep = endpoint.lastIndexOf(':');
        if (sep <= 0 || sep == endpoint.length() - 1) {
            throw new IOException("Invalid endpoint for worker " + worker.id() + ": " + endpoint);
        }
        String host = endpoint.substring(0, sep);
        int port;
        try {
            port = Integer.parseInt(endpoint.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IOException("Invalid port for worker " + worker.id() + ": " + endpoint, e);
        }

        long started = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
        }
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
