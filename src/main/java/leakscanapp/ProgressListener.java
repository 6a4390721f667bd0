package leakscanapp;

/**
 * Consumer of worker progress signals. Implementations must be thread safe:
 * activities for different workers report concurrently.
 */
public interface ProgressListener {
    
    void onEvent(ProgressEvent event);
}
