package gpuhub.coordinator.service;

/**
 * A user already has the maximum number of running jobs.
 */
public class ConcurrencyLimitExceededException extends RuntimeException {

    private final String userId;
    private final int limit;

    public ConcurrencyLimitExceededException(String userId, int limit) {
        super("User " + userId + " already has " + limit + " running jobs");
        this.userId = userId;
        this.limit = limit;
    }

    public String userId() {
        return userId;
    }

    public int limit() {
        return limit;
    }
}
