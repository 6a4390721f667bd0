package leakscanapp;

/**
 * Outcome of scanning a single branch
 */
public enum ScanStatus {
    PASSED("passed", "gitleaks exited cleanly"),
    LEAKS_FOUND("leaks-found", "gitleaks exited with a nonzero code"),
    TIMED_OUT("timed-out", "gitleaks did not finish within the command timeout");
    
    private final String id;
    private final String description;
    
    ScanStatus(String id, String description) {
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
