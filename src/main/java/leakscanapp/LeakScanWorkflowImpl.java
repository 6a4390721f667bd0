package leakscanapp;

import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ApplicationFailure;
import io.temporal.workflow.Async;
import io.temporal.workflow.Promise;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Implementation of the leak scan workflow.
 * Builds a distribution plan, runs one lane per worker in parallel, joins all of them
 * and merges their partial results. Any failed lane fails the whole run, but only
 * after every lane has been joined.
 */
public class LeakScanWorkflowImpl implements LeakScanWorkflow {
    
    static final String WORKER_FAILURE = "WorkerFailure";
    
    private static final Logger log = Workflow.getLogger(LeakScanWorkflowImpl.class);
    
    private final DistributionStrategy distributionStrategy = new DistributionStrategy();
    
    private DistributionMode distributionMode;
    private int workerCount;
    private RepoWorkQueue workQueue;
    private int completedRepositories;
    
    /**
     * One attempt per repository; clone and checkout failures are recorded as scan failures.
     * The heartbeat timeout lets the server notice a dead worker within one command timeout,
     * and lets a timed-out activity stop at its next heartbeat.
     */
    static ActivityOptions scanActivityOptions(ScanOptions options) {
        return ActivityOptions.newBuilder()
            .setRetryOptions(RetryOptions.newBuilder()
                .setMaximumAttempts(1)
                .build())
            .setStartToCloseTimeout(Duration.ofSeconds(options.getRepositoryTimeoutSeconds()))
            .setHeartbeatTimeout(Duration.ofSeconds(options.getCommandTimeoutSeconds() + Shared.HEARTBEAT_GRACE_SECONDS))
            .build();
    }
    
    @Override
    public LeakScanSummary scanRepositories(LeakScanRequest request) {
        long startTime = Workflow.currentTimeMillis();
        ScanOptions scanOptions = request.getScanOptions() != null ? request.getScanOptions() : new ScanOptions();
        RepositoryScanActivity scanActivity =
            Workflow.newActivityStub(RepositoryScanActivity.class, scanActivityOptions(scanOptions));
        
        DistributionPlan plan;
        try {
            plan = distributionStrategy.plan(request.getRepositories(), request.getWorkerCap());
        } catch (ScanConfigurationException e) {
            throw ApplicationFailure.newNonRetryableFailure(
                e.getMessage(), ScanConfigurationException.class.getSimpleName());
        }
        distributionMode = plan.getMode();
        workerCount = plan.getWorkerCount();
        log.info("scanning {} repositories with {} workers in {} mode",
            request.getRepositories().size(), workerCount, distributionMode.getId());
        
        if (distributionMode == DistributionMode.QUEUE) {
            workQueue = new RepoWorkQueue();
            for (RepoRef repository : request.getRepositories()) {
                workQueue.put(repository);
            }
        }
        
        int idleSeconds = request.getQueueIdleTimeoutSeconds() > 0
            ? request.getQueueIdleTimeoutSeconds()
            : Shared.QUEUE_IDLE_TIMEOUT_SECONDS;
        Duration idleTimeout = Duration.ofSeconds(idleSeconds);
        
        List<Promise<WorkerReport>> lanes = new ArrayList<>();
        for (WorkAssignment assignment : plan.getAssignments()) {
            ScanLane lane = new ScanLane(assignment, workQueue, scanActivity,
                scanOptions, idleTimeout, () -> completedRepositories++);
            lanes.add(Async.function(lane::run));
        }
        
        // Join every lane before deciding; a failure does not interrupt the others
        List<WorkerReport> reports = new ArrayList<>();
        RuntimeException firstFailure = null;
        int failedLanes = 0;
        for (int i = 0; i < lanes.size(); i++) {
            try {
                reports.add(lanes.get(i).get());
            } catch (RuntimeException e) {
                failedLanes++;
                log.error("worker {} failed: {}", plan.getAssignments().get(i).getWorkerLabel(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        
        if (firstFailure != null) {
            throw ApplicationFailure.newNonRetryableFailureWithCause(
                failedLanes + " of " + lanes.size() + " workers failed: " + firstFailure.getMessage(),
                WORKER_FAILURE,
                firstFailure
            );
        }
        
        LeakScanSummary summary = new LeakScanSummary(request.getScanId());
        summary.setMode(distributionMode);
        summary.setWorkerCount(workerCount);
        summary.setWorkerReports(reports);
        summary.setResults(new ResultAggregator(log).merge(reports));
        summary.setTotalExecutionTimeMs(Workflow.currentTimeMillis() - startTime);
        
        log.info("scan {} complete: {} branches scanned, {} failed",
            request.getScanId(), summary.getResults().size(), summary.failures().size());
        return summary;
    }
    
    @Override
    public DistributionMode getDistributionMode() {
        return distributionMode;
    }
    
    @Override
    public int getWorkerCount() {
        return workerCount;
    }
    
    @Override
    public int getQueuedRepositoryCount() {
        return workQueue == null ? 0 : workQueue.size();
    }
    
    @Override
    public int getCompletedRepositoryCount() {
        return completedRepositories;
    }
}
