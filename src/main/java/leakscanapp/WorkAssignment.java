package leakscanapp;

/**
 * What a single worker is bound to: one repository ({@link DirectAssignment})
 * or an offset into the shared queue ({@link QueuedAssignment})
 */
public interface WorkAssignment {
    
    /**
     * Label shown for this worker on the progress display
     */
    String getWorkerLabel();
}
