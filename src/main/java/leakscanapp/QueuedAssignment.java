package leakscanapp;

/**
 * Worker bound to an offset; it pulls repositories from the shared queue until the queue runs dry
 */
public class QueuedAssignment implements WorkAssignment {
    private final int offset;
    private final String workerLabel;
    
    public QueuedAssignment(int offset, String workerLabel) {
        this.offset = offset;
        this.workerLabel = workerLabel;
    }
    
    public int getOffset() {
        return offset;
    }
    
    @Override
    public String getWorkerLabel() {
        return workerLabel;
    }
}
