package leakscanapp;

/**
 * Per-run settings handed to every repository scan activity
 */
public class ScanOptions {
    private String workspacePath;
    private int gitleaksThreads = Shared.GITLEAKS_THREADS;
    private int commandTimeoutSeconds = Shared.COMMAND_TIMEOUT_SECONDS;
    private int repositoryTimeoutSeconds = Shared.REPOSITORY_SCAN_TIMEOUT_SECONDS;
    
    public ScanOptions() {
    }
    
    public ScanOptions(String workspacePath) {
        this.workspacePath = workspacePath;
    }
    
    // Getters and Setters
    public String getWorkspacePath() {
        return workspacePath;
    }
    
    public void setWorkspacePath(String workspacePath) {
        this.workspacePath = workspacePath;
    }
    
    public int getGitleaksThreads() {
        return gitleaksThreads;
    }
    
    public void setGitleaksThreads(int gitleaksThreads) {
        this.gitleaksThreads = gitleaksThreads;
    }
    
    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }
    
    public void setCommandTimeoutSeconds(int commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }
    
    /**
     * Limit on cloning and scanning all branches of one repository
     */
    public int getRepositoryTimeoutSeconds() {
        return repositoryTimeoutSeconds;
    }
    
    public void setRepositoryTimeoutSeconds(int repositoryTimeoutSeconds) {
        this.repositoryTimeoutSeconds = repositoryTimeoutSeconds;
    }
}
