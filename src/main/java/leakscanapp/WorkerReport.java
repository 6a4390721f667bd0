package leakscanapp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial result of one worker: the repositories it scanned and the outcome of each branch
 */
public class WorkerReport {
    private String workerLabel;
    private List<String> repositories;
    private Map<String, BranchOutcome> results;
    
    public WorkerReport() {
        this.repositories = new ArrayList<>();
        this.results = new LinkedHashMap<>();
    }
    
    public WorkerReport(String workerLabel) {
        this();
        this.workerLabel = workerLabel;
    }
    
    public void addRepository(String fullName, Map<String, BranchOutcome> branchResults) {
        repositories.add(fullName);
        results.putAll(branchResults);
    }
    
    // Getters and Setters
    public String getWorkerLabel() {
        return workerLabel;
    }
    
    public void setWorkerLabel(String workerLabel) {
        this.workerLabel = workerLabel;
    }
    
    public List<String> getRepositories() {
        return repositories;
    }
    
    public void setRepositories(List<String> repositories) {
        this.repositories = repositories;
    }
    
    public Map<String, BranchOutcome> getResults() {
        return results;
    }
    
    public void setResults(Map<String, BranchOutcome> results) {
        this.results = results;
    }
}
