package in.receipttrack.relay.registry;

/**
 * Thrown when the registry has reached its configured connection limit.
 */
public class RegistryExhaustedException extends Exception {

    private final int limit;

    public RegistryExhaustedException(int limit) {
        super("Connection limit reached (" + limit + ")");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
