package agora.market.model;

/**
 * Worker lifecycle states as seen by the capability index.
 */
public enum WorkerStatus {
    /** Worker is healthy and has spare capacity */
    ONLINE,

    /** Worker is healthy but running at full capacity */
    BUSY,

    /** Worker missed too many health probes */
    OFFLINE,

    /** Worker was taken out of rotation by an operator */
    MAINTENANCE;

    /** Only online and busy workers are returned by discovery */
    public boolean isDiscoverable() {
        return this == ONLINE || this == BUSY;
    }
}
