package leakscanapp;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

import java.util.Map;

/**
 * Activity interface for scanning every branch of one repository
 */
@ActivityInterface
public interface RepositoryScanActivity {
    
    /**
     * Clone the repository, check out each remote branch and run gitleaks on it
     * @param repository Repository to scan
     * @param workerLabel Label of the worker running the scan, used for progress
     * @param options Workspace and command settings
     * @return Outcome per "owner/name:branch" key, in branch listing order
     */
    @ActivityMethod
    Map<String, BranchOutcome> scanRepository(RepoRef repository, String workerLabel, ScanOptions options);
}
