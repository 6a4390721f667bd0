package leakscanapp;

import io.temporal.client.WorkflowClient;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Worker that processes leak scan workflows and repository scan activities
 */
public class LeakScanWorker {
    
    private static final Logger log = LoggerFactory.getLogger(LeakScanWorker.class);
    
    public static void main(String[] args) {
        String temporalAddress = Shared.getEnvOrDefault("TEMPORAL_ADDRESS", Shared.DEFAULT_TEMPORAL_ADDRESS);
        String taskQueue = Shared.getEnvOrDefault("TASK_QUEUE", Shared.LEAK_SCAN_TASK_QUEUE);
        Path workspace = workspaceFromEnvironment();
        
        // Verify the host can clone and scan before polling
        try {
            ToolHealthChecker.verifyHealth(workspace);
        } catch (ScanHostException e) {
            log.error("Host check failed ({}): {}", e.getRequirement().getId(), e.getMessage());
            System.exit(1);
        }
        
        GitHubClient gitHubClient;
        try {
            gitHubClient = GitHubApiClient.fromEnvironment();
        } catch (ScanPreconditionException e) {
            log.error("Worker cannot start: {}", e.getMessage());
            System.exit(2);
            return;
        }
        
        WorkflowServiceStubs serviceStub = LeakScanClient.newServiceStubs(temporalAddress);
        WorkflowClient client = WorkflowClient.newInstance(serviceStub);
        WorkerFactory factory = WorkerFactory.newInstance(client);
        
        Worker worker = factory.newWorker(taskQueue);
        registerWorkerComponents(worker, gitHubClient, new ProcessCommandRunner(), new ProgressBoard(null), workspace);
        
        log.info("Leak Scan Worker started on task queue {}, workspace {}", taskQueue, workspace);
        factory.start();
    }
    
    /**
     * Register workflow and activity implementations with a worker
     */
    public static void registerWorkerComponents(Worker worker, GitHubClient gitHubClient,
                                                CommandRunner commandRunner, ProgressListener progressListener,
                                                Path workspace) {
        worker.registerWorkflowImplementationTypes(LeakScanWorkflowImpl.class);
        worker.registerActivitiesImplementations(
            new RepositoryScanActivityImpl(gitHubClient, commandRunner, progressListener, workspace)
        );
    }
    
    /**
     * Workspace base: PWD, then LEAKSCAN_HOME, then the built-in default
     */
    public static Path workspaceFromEnvironment() {
        String home = Shared.getEnvOrDefault("LEAKSCAN_HOME", Shared.DEFAULT_HOME);
        return Paths.get(Shared.getEnvOrDefault("PWD", home));
    }
}
