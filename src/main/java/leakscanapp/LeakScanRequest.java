package leakscanapp;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of one leak scan run: the matched repositories and how to distribute them
 */
public class LeakScanRequest {
    private String scanId;
    private List<RepoRef> repositories;
    private int workerCap = Shared.MAX_WORKERS;
    private int queueIdleTimeoutSeconds = Shared.QUEUE_IDLE_TIMEOUT_SECONDS;
    private ScanOptions scanOptions;
    
    public LeakScanRequest() {
        this.repositories = new ArrayList<>();
    }
    
    public LeakScanRequest(String scanId, List<RepoRef> repositories, ScanOptions scanOptions) {
        this.scanId = scanId;
        this.repositories = new ArrayList<>(repositories);
        this.scanOptions = scanOptions;
    }
    
    /**
     * Workflow ID used for this run
     */
    public String generateWorkflowId() {
        return "leak-scan-" + scanId;
    }
    
    // Getters and Setters
    public String getScanId() {
        return scanId;
    }
    
    public void setScanId(String scanId) {
        this.scanId = scanId;
    }
    
    public List<RepoRef> getRepositories() {
        return repositories;
    }
    
    public void setRepositories(List<RepoRef> repositories) {
        this.repositories = repositories;
    }
    
    public int getWorkerCap() {
        return workerCap;
    }
    
    public void setWorkerCap(int workerCap) {
        this.workerCap = workerCap;
    }
    
    public int getQueueIdleTimeoutSeconds() {
        return queueIdleTimeoutSeconds;
    }
    
    public void setQueueIdleTimeoutSeconds(int queueIdleTimeoutSeconds) {
        this.queueIdleTimeoutSeconds = queueIdleTimeoutSeconds;
    }
    
    public ScanOptions getScanOptions() {
        return scanOptions;
    }
    
    public void setScanOptions(ScanOptions scanOptions) {
        this.scanOptions = scanOptions;
    }
}
