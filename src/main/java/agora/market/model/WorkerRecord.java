package agora.market.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of a registered worker.
 * The capability index replaces the whole record on every update.
 */
public final class WorkerRecord {

    public static final int DEFAULT_CAPACITY = 10;
    public static final double DEFAULT_QUALITY = 80.0;

    private final String id;
    private final Set<String> capabilities;
    private final WorkerStatus status;
    private final int load;
    private final int capacity;
    private final Instant lastSeen;
    private final Duration avgResponseTime;
    private final int consecutiveFailures;
    private final String region;
    private final String endpoint;
    private final double reputation;
    private final double quality;
    private final Instant registeredAt;

    private WorkerRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.capabilities = Set.copyOf(Objects.requireNonNull(builder.capabilities, "capabilities are required"));
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.load = builder.load;
        this.capacity = builder.capacity;
        this.lastSeen = builder.lastSeen;
        this.avgResponseTime = builder.avgResponseTime;
        this.consecutiveFailures = builder.consecutiveFailures;
        this.region = builder.region;
        this.endpoint = builder.endpoint;
        this.reputation = builder.reputation;
        this.quality = builder.quality;
        this.registeredAt = builder.registeredAt;
    }

    public String id() {
        return id;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public WorkerStatus status() {
        return status;
    }

    public int load() {
        return load;
    }

    public int capacity() {
        return capacity;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    /** EMA of probe round trips, null until the first successful probe */
    public Duration avgResponseTime() {
        return avgResponseTime;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public String region() {
        return region;
    }

    /** host:port used by the liveness probe, may be null */
    public String endpoint() {
        return endpoint;
    }

    public double reputation() {
        return reputation;
    }

    public double quality() {
        return quality;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public double utilization() {
        if (capacity <= 0) {
            return 1.0;
        }
        return (double) load / capacity;
    }

    public boolean isAtCapacity() {
        return load >= capacity;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .capabilities(capabilities)
                .status(status)
                .load(load)
                .capacity(capacity)
                .lastSeen(lastSeen)
                .avgResponseTime(avgResponseTime)
                .consecutiveFailures(consecutiveFailures)
                .region(region)
                .endpoint(endpoint)
                .reputation(reputation)
                .quality(quality)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Set<String> capabilities = Set.of();
        private WorkerStatus status = WorkerStatus.ONLINE;
        private int load;
        private int capacity = DEFAULT_CAPACITY;
        private Instant lastSeen;
        private Duration avgResponseTime;
        private int consecutiveFailures;
        private String region;
        private String endpoint;
        private double reputation;
        private double quality = DEFAULT_QUALITY;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder load(int load) {
            this.load = load;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder avgResponseTime(Duration avgResponseTime) {
            this.avgResponseTime = avgResponseTime;
            return this;
        }

        public Builder consecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder reputation(double reputation) {
            this.reputation = reputation;
            return this;
        }

        public Builder quality(double quality) {
            this.quality = quality;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public WorkerRecord build() {
            return new WorkerRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkerRecord that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerRecord{id='" + id + "', status=" + status + ", load=" + load + "/" + capacity + "}";
    }
}
