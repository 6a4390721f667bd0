package leakscanapp;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses between direct mode and queue mode for a set of repositories.
 * Pure and deterministic so it can run inside workflow code.
 */
public class DistributionStrategy {
    
    /**
     * Build per-worker assignments.
     * N &lt;= cap gives N direct workers; N &gt; cap gives cap queue workers.
     *
     * @param repositories Matched repositories
     * @param workerCap Maximum number of concurrent workers
     * @return Distribution plan
     * @throws ScanConfigurationException if there is nothing to scan or the cap is not positive
     */
    public DistributionPlan plan(List<RepoRef> repositories, int workerCap) {
        if (repositories == null || repositories.isEmpty()) {
            throw new ScanConfigurationException("No repositories to scan");
        }
        if (workerCap < 1) {
            throw new ScanConfigurationException("Worker cap must be at least 1, was " + workerCap);
        }
        
        List<WorkAssignment> assignments = new ArrayList<>();
        if (repositories.size() <= workerCap) {
            for (RepoRef repo : repositories) {
                assignments.add(new DirectAssignment(repo));
            }
            return new DistributionPlan(DistributionMode.DIRECT, assignments);
        }
        
        for (int offset = 0; offset < workerCap; offset++) {
            assignments.add(new QueuedAssignment(offset, offsetLabel(offset, workerCap)));
        }
        return new DistributionPlan(DistributionMode.QUEUE, assignments);
    }
    
    /**
     * Zero-pad an offset to the width of the largest offset so labels line up
     */
    static String offsetLabel(int offset, int workerCap) {
        int width = String.valueOf(workerCap - 1).length();
        return String.format("%0" + width + "d", offset);
    }
}
