package agora.market.metrics;

import agora.market.model.WorkerStatus;

import java.util.Map;

/**
 * Renders {@link MarketMetrics} in the Prometheus text exposition format.
 */
public final class PrometheusFormatter {

    private static final String WINNING_PRICE = "agora_auction_winning_price";

    private PrometheusFormatter() {
    }

    public static String format(MarketMetrics metrics, Map<WorkerStatus, Long> workersByStatus) {
        StringBuilder sb = new StringBuilder();

        appendHeader(sb, "agora_workers", "Registered workers grouped by status", "gauge");
        long total = 0;
        for (WorkerStatus status : WorkerStatus.values()) {
            long count = workersByStatus.getOrDefault(status, 0L);
            total += count;
            sb.append("agora_workers{status=\"").append(escapeLabel(status.name().toLowerCase())).append("\"} ")
                    .append(count).append('\n');
        }
        appendHeader(sb, "agora_workers_registered", "Total registered workers", "gauge");
        sb.append("agora_workers_registered ").append(total).append('\n');

        for (Map.Entry<String, Number> e : metrics.counters().entrySet()) {
            appendHeader(sb, e.getKey(), help(e.getKey()), "counter");
            sb.append(e.getKey()).append(' ').append(e.getValue()).append('\n');
        }

        appendHeader(sb, WINNING_PRICE, "Clearing price of awarded auctions", "histogram");
        for (Map.Entry<String, Long> e : metrics.winningPriceHistogram().entrySet()) {
            sb.append(WINNING_PRICE).append("_bucket{le=\"").append(escapeLabel(e.getKey())).append("\"} ")
                    .append(e.getValue()).append('\n');
        }
        sb.append(WINNING_PRICE).append("_sum ").append(metrics.winningPriceSum()).append('\n');
        sb.append(WINNING_PRICE).append("_count ").append(metrics.auctionsAwarded()).append('\n');

        return sb.toString();
    }

    private static void appendHeader(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static String help(String metric) {
        String name = metric.startsWith("agora_") ? metric.substring("agora_".length()) : metric;
        if (name.endsWith("_total")) {
            name = name.substring(0, name.length() - "_total".length());
        }
        return "Total " + name.replace('_', ' ');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
