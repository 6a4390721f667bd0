package leakscanapp;

import java.util.Objects;

/**
 * A single progress signal from a worker
 */
public class ProgressEvent {
    private final ProgressEventType type;
    private final String workerLabel;
    private final String detail;
    private final int total;
    
    private ProgressEvent(ProgressEventType type, String workerLabel, String detail, int total) {
        this.type = type;
        this.workerLabel = workerLabel;
        this.detail = detail;
        this.total = total;
    }
    
    public static ProgressEvent identity(String workerLabel, String repository) {
        return new ProgressEvent(ProgressEventType.IDENTITY, workerLabel, repository, 0);
    }
    
    public static ProgressEvent total(String workerLabel, int total) {
        return new ProgressEvent(ProgressEventType.TOTAL, workerLabel, null, total);
    }
    
    public static ProgressEvent increment(String workerLabel, String command) {
        return new ProgressEvent(ProgressEventType.INCREMENT, workerLabel, command, 0);
    }
    
    public ProgressEventType getType() {
        return type;
    }
    
    public String getWorkerLabel() {
        return workerLabel;
    }
    
    /**
     * Repository for IDENTITY, command line for INCREMENT, null for TOTAL
     */
    public String getDetail() {
        return detail;
    }
    
    public int getTotal() {
        return total;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressEvent)) return false;
        ProgressEvent other = (ProgressEvent) o;
        return total == other.total
            && type == other.type
            && Objects.equals(workerLabel, other.workerLabel)
            && Objects.equals(detail, other.detail);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, workerLabel, detail, total);
    }
    
    @Override
    public String toString() {
        switch (type) {
            case IDENTITY:
                return "[" + workerLabel + "] processing repo " + detail;
            case TOTAL:
                return "[" + workerLabel + "] processing total of " + total + " commands";
            default:
                return "[" + workerLabel + "] executing command: " + detail;
        }
    }
}
