package leakscanapp;

import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the partial result maps of all workers into one.
 * Workers own disjoint (repository, branch) pairs, so the merge is a plain union;
 * a repeated key can only come from a repository listed twice in the input.
 */
public class ResultAggregator {
    
    private final Logger log;
    
    public ResultAggregator(Logger log) {
        this.log = log;
    }
    
    /**
     * @param reports Worker reports in worker order
     * @return Union of all partial maps, in worker order then scan order
     */
    public Map<String, BranchOutcome> merge(List<WorkerReport> reports) {
        Map<String, BranchOutcome> merged = new LinkedHashMap<>();
        for (WorkerReport report : reports) {
            for (Map.Entry<String, BranchOutcome> entry : report.getResults().entrySet()) {
                if (merged.put(entry.getKey(), entry.getValue()) != null) {
                    log.warn("{} was scanned by more than one worker; keeping the result from worker {}",
                        entry.getKey(), report.getWorkerLabel());
                }
            }
        }
        return merged;
    }
}
