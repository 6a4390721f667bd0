package leakscanapp;

import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts leak scan workflows on a task queue
 */
public class LeakScanClient {
    
    private static final Logger log = LoggerFactory.getLogger(LeakScanClient.class);
    
    private final WorkflowClient client;
    private final String taskQueue;
    
    public LeakScanClient(WorkflowClient client, String taskQueue) {
        this.client = client;
        this.taskQueue = taskQueue;
    }
    
    /**
     * Create service stubs connected to a Temporal frontend
     *
     * @param temporalAddress host:port of the Temporal service
     */
    public static WorkflowServiceStubs newServiceStubs(String temporalAddress) {
        log.info("Connecting to Temporal service at: {}", temporalAddress);
        return WorkflowServiceStubs.newServiceStubs(
            WorkflowServiceStubsOptions.newBuilder()
                .setTarget(temporalAddress)
                .build()
        );
    }
    
    /**
     * Start a scan and block until it completes
     *
     * @throws io.temporal.client.WorkflowFailedException if the run failed
     */
    public LeakScanSummary submitScanAndWait(LeakScanRequest request) {
        LeakScanWorkflow workflow = newWorkflowStub(request);
        LeakScanSummary summary = workflow.scanRepositories(request);
        log.info("Workflow completed: {} branches scanned, {} failed, {} ms",
            summary.getResults().size(), summary.failures().size(), summary.getTotalExecutionTimeMs());
        return summary;
    }
    
    private LeakScanWorkflow newWorkflowStub(LeakScanRequest request) {
        WorkflowOptions options = WorkflowOptions.newBuilder()
            .setTaskQueue(taskQueue)
            .setWorkflowId(request.generateWorkflowId())
            .build();
        logScanInitiation(request, options.getWorkflowId());
        return client.newWorkflowStub(LeakScanWorkflow.class, options);
    }
    
    private void logScanInitiation(LeakScanRequest request, String workflowId) {
        log.info("Initiating leak scan workflow {} on task queue {}", workflowId, taskQueue);
        log.info("Repositories: {}, worker cap: {}", request.getRepositories().size(), request.getWorkerCap());
    }
}
