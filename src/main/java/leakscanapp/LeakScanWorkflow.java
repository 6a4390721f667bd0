package leakscanapp;

import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Workflow interface for scanning many repositories with a bounded number of workers
 */
@WorkflowInterface
public interface LeakScanWorkflow {
    
    /**
     * Distribute the repositories over workers, scan every branch and merge the results
     * @param request Repositories and distribution settings
     * @return Merged per-branch results
     */
    @WorkflowMethod
    LeakScanSummary scanRepositories(LeakScanRequest request);
    
    /**
     * @return Mode chosen for this run, null until the plan is built
     */
    @QueryMethod
    DistributionMode getDistributionMode();
    
    @QueryMethod
    int getWorkerCount();
    
    /**
     * @return Repositories still waiting in the shared queue (always 0 in direct mode)
     */
    @QueryMethod
    int getQueuedRepositoryCount();
    
    @QueryMethod
    int getCompletedRepositoryCount();
}
