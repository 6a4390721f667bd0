package leakscanapp;

import io.temporal.workflow.Workflow;
import io.temporal.workflow.WorkflowQueue;

import java.time.Duration;

/**
 * Shared backlog drained by queue-mode workers.
 * Backed by a {@link WorkflowQueue}, so it must be created and used from workflow code.
 * Filled completely before any worker starts; a worker that gets nothing within the
 * idle timeout treats the queue as drained.
 */
public class RepoWorkQueue {
    
    private final WorkflowQueue<RepoRef> queue = Workflow.newWorkflowQueue(Integer.MAX_VALUE);
    private int inserted;
    private int removed;
    
    public void put(RepoRef repository) {
        queue.put(repository);
        inserted++;
    }
    
    /**
     * @return The next repository, or null if none became available within the timeout
     */
    public RepoRef tryGet(Duration timeout) {
        RepoRef repository = queue.poll(timeout);
        if (repository != null) {
            removed++;
        }
        return repository;
    }
    
    public int size() {
        return inserted - removed;
    }
}
