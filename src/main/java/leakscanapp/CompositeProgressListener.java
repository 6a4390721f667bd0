package leakscanapp;

import java.util.Arrays;
import java.util.List;

/**
 * Forwards every event to each delegate in order
 */
public class CompositeProgressListener implements ProgressListener {
    
    private final List<ProgressListener> delegates;
    
    public CompositeProgressListener(ProgressListener... delegates) {
        this.delegates = Arrays.asList(delegates);
    }
    
    @Override
    public void onEvent(ProgressEvent event) {
        for (ProgressListener delegate : delegates) {
            delegate.onEvent(event);
        }
    }
}
