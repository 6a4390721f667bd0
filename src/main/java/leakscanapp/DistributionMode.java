package leakscanapp;

/**
 * How repositories are spread across workers
 */
public enum DistributionMode {
    /**
     * One worker per repository, used when the repository count fits under the worker cap
     */
    DIRECT("direct", "One worker per repository"),
    
    /**
     * A capped pool of workers draining a shared queue
     */
    QUEUE("queue", "Capped worker pool draining a shared queue");
    
    private final String id;
    private final String description;
    
    DistributionMode(String id, String description) {
        this.id = id;
        this.description = description;
    }
    
    public String getId() {
        return id;
    }
    
    public String getDescription() {
        return description;
    }
}
