package leakscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-worker progress counters fed by {@link ProgressEvent}s.
 * A TOTAL event (re)sizes the worker's counter and restarts it at zero, so in
 * queue mode the bar visibly resets between repositories.
 */
public class ProgressBoard implements ProgressListener {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBoard.class);
    private static final int BAR_WIDTH = 30;
    
    private final Map<String, WorkerProgress> workers = new LinkedHashMap<>();
    private final PrintStream out;
    
    /**
     * @param out Where rendered lines are printed, or null to only track state
     */
    public ProgressBoard(PrintStream out) {
        this.out = out;
    }
    
    @Override
    public synchronized void onEvent(ProgressEvent event) {
        WorkerProgress progress = workers.computeIfAbsent(event.getWorkerLabel(), WorkerProgress::new);
        switch (event.getType()) {
            case IDENTITY:
                progress.repository = event.getDetail();
                break;
            case TOTAL:
                progress.total = event.getTotal();
                progress.completed = 0;
                break;
            case INCREMENT:
                progress.completed++;
                break;
            default:
                break;
        }
        log.debug("{}", event);
        if (out != null && event.getType() != ProgressEventType.IDENTITY) {
            out.println(render(progress));
        }
    }
    
    public synchronized WorkerProgress getProgress(String workerLabel) {
        WorkerProgress progress = workers.get(workerLabel);
        return progress == null ? null : progress.copy();
    }
    
    public synchronized int getWorkerCount() {
        return workers.size();
    }
    
    /**
     * Render one line per worker in the order workers first reported
     */
    public synchronized List<String> render() {
        List<String> lines = new ArrayList<>();
        int width = 0;
        for (String label : workers.keySet()) {
            width = Math.max(width, label.length());
        }
        for (WorkerProgress progress : workers.values()) {
            lines.add(render(progress, width));
        }
        return lines;
    }
    
    private String render(WorkerProgress progress) {
        return render(progress, progress.label.length());
    }
    
    private String render(WorkerProgress progress, int labelWidth) {
        int filled = progress.total == 0 ? 0 : Math.min(BAR_WIDTH, progress.completed * BAR_WIDTH / progress.total);
        StringBuilder bar = new StringBuilder();
        for (int i = 0; i < BAR_WIDTH; i++) {
            bar.append(i < filled ? '#' : '.');
        }
        String line = String.format("%-" + labelWidth + "s [%s] %d/%d", progress.label, bar, progress.completed, progress.total);
        if (progress.repository != null && !progress.repository.equals(progress.label)) {
            line += " " + progress.repository;
        }
        return line;
    }
    
    /**
     * Snapshot of one worker's counter
     */
    public static class WorkerProgress {
        private final String label;
        private String repository;
        private int total;
        private int completed;
        
        WorkerProgress(String label) {
            this.label = label;
        }
        
        private WorkerProgress copy() {
            WorkerProgress copy = new WorkerProgress(label);
            copy.repository = repository;
            copy.total = total;
            copy.completed = completed;
            return copy;
        }
        
        public String getLabel() {
            return label;
        }
        
        public String getRepository() {
            return repository;
        }
        
        public int getTotal() {
            return total;
        }
        
        public int getCompleted() {
            return completed;
        }
        
        public boolean isComplete() {
            return total > 0 && completed >= total;
        }
    }
}
