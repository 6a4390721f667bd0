package leakscanapp;

import io.temporal.activity.ActivityExecutionContext;

/**
 * Publishes progress as activity heartbeat details so it is visible from the Temporal UI.
 * A heartbeat on an activity the server has cancelled or timed out throws
 * {@link io.temporal.client.ActivityCompletionException}; it is not caught here,
 * so the scan stops before running its next command.
 */
public class HeartbeatProgressListener implements ProgressListener {
    
    private final ActivityExecutionContext context;
    
    public HeartbeatProgressListener(ActivityExecutionContext context) {
        this.context = context;
    }
    
    @Override
    public void onEvent(ProgressEvent event) {
        context.heartbeat(event.toString());
    }
}
