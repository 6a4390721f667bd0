package leakscanapp;

/**
 * Shared constants and configuration for the leak scanning application
 */
public interface Shared {
    // Task queue for leak scan workflows and activities
    static final String LEAK_SCAN_TASK_QUEUE = "LEAK_SCAN_TASK_QUEUE";
    
    static final String DEFAULT_TEMPORAL_ADDRESS = "localhost:7233";
    
    // Workspace base used when PWD is not set
    static final String DEFAULT_HOME = "/opt/leakscan";
    
    // Upper bound on concurrently scanned repositories
    static final int MAX_WORKERS = 35;
    
    // A queue worker that waits this long without receiving a repository stops
    static final int QUEUE_IDLE_TIMEOUT_SECONDS = 10;
    
    // Per-command timeout for git and gitleaks invocations
    static final int COMMAND_TIMEOUT_SECONDS = 1800; // 30 minutes
    
    // Default activity timeout for cloning and scanning every branch of one repository
    static final int REPOSITORY_SCAN_TIMEOUT_SECONDS = 6 * 60 * 60;
    
    // Added to the command timeout to get the activity heartbeat timeout;
    // the activity heartbeats before every command
    static final int HEARTBEAT_GRACE_SECONDS = 60;
    
    // Parallelism hint passed to gitleaks
    static final int GITLEAKS_THREADS = 10;
    
    // GitHub API access
    static final String GITHUB_TOKEN_ENV = "GH_TOKEN_PSW";
    static final String GITHUB_API_URL_ENV = "GH_API_URL";
    static final String DEFAULT_GITHUB_API_URL = "https://api.github.com";
    
    /**
     * Read an environment variable, falling back to a default when unset or empty
     */
    static String getEnvOrDefault(String name, String defaultValue) {
        String value = System.getenv(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return value;
    }
}
