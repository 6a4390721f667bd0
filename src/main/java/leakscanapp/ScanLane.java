package leakscanapp;

import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Map;

/**
 * Workflow-side execution loop of one worker.
 * A direct worker scans its single repository; a queued worker keeps pulling
 * repositories from the shared queue until a pull times out.
 */
public class ScanLane {
    
    private static final Logger log = Workflow.getLogger(ScanLane.class);
    
    private final WorkAssignment assignment;
    private final RepoWorkQueue queue;
    private final RepositoryScanActivity scanActivity;
    private final ScanOptions options;
    private final Duration idleTimeout;
    private final Runnable onRepositoryScanned;
    
    public ScanLane(WorkAssignment assignment, RepoWorkQueue queue, RepositoryScanActivity scanActivity,
                    ScanOptions options, Duration idleTimeout, Runnable onRepositoryScanned) {
        this.assignment = assignment;
        this.queue = queue;
        this.scanActivity = scanActivity;
        this.options = options;
        this.idleTimeout = idleTimeout;
        this.onRepositoryScanned = onRepositoryScanned;
    }
    
    public WorkerReport run() {
        WorkerReport report = new WorkerReport(assignment.getWorkerLabel());
        
        if (assignment instanceof DirectAssignment) {
            scan(((DirectAssignment) assignment).getRepository(), report);
            return report;
        }
        
        RepoRef repository;
        while ((repository = queue.tryGet(idleTimeout)) != null) {
            scan(repository, report);
        }
        log.info("worker {} found the queue empty after {}s, scanned {} repositories",
            assignment.getWorkerLabel(), idleTimeout.getSeconds(), report.getRepositories().size());
        return report;
    }
    
    private void scan(RepoRef repository, WorkerReport report) {
        Map<String, BranchOutcome> results =
            scanActivity.scanRepository(repository, assignment.getWorkerLabel(), options);
        report.addRepository(repository.fullName(), results);
        onRepositoryScanned.run();
    }
}
