package leakscanapp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final result of a leak scan run
 */
public class LeakScanSummary {
    private String scanId;
    private DistributionMode mode;
    private int workerCount;
    private Map<String, BranchOutcome> results;
    private List<WorkerReport> workerReports;
    private long totalExecutionTimeMs;
    
    public LeakScanSummary() {
        this.results = new LinkedHashMap<>();
        this.workerReports = new ArrayList<>();
    }
    
    public LeakScanSummary(String scanId) {
        this();
        this.scanId = scanId;
    }
    
    /**
     * Keys of every (repository, branch) that did not pass, with their outcome
     */
    public Map<String, BranchOutcome> failures() {
        Map<String, BranchOutcome> failures = new LinkedHashMap<>();
        for (Map.Entry<String, BranchOutcome> entry : results.entrySet()) {
            if (entry.getValue().failed()) {
                failures.put(entry.getKey(), entry.getValue());
            }
        }
        return failures;
    }
    
    // Getters and Setters
    public String getScanId() {
        return scanId;
    }
    
    public void setScanId(String scanId) {
        this.scanId = scanId;
    }
    
    public DistributionMode getMode() {
        return mode;
    }
    
    public void setMode(DistributionMode mode) {
        this.mode = mode;
    }
    
    public int getWorkerCount() {
        return workerCount;
    }
    
    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }
    
    public Map<String, BranchOutcome> getResults() {
        return results;
    }
    
    public void setResults(Map<String, BranchOutcome> results) {
        this.results = results;
    }
    
    public List<WorkerReport> getWorkerReports() {
        return workerReports;
    }
    
    public void setWorkerReports(List<WorkerReport> workerReports) {
        this.workerReports = workerReports;
    }
    
    public long getTotalExecutionTimeMs() {
        return totalExecutionTimeMs;
    }
    
    public void setTotalExecutionTimeMs(long totalExecutionTimeMs) {
        this.totalExecutionTimeMs = totalExecutionTimeMs;
    }
}
