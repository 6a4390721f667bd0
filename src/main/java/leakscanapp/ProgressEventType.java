package leakscanapp;

/**
 * Kinds of progress signals a worker emits
 */
public enum ProgressEventType {
    /**
     * Which repository the worker is processing now
     */
    IDENTITY,
    
    /**
     * Number of commands the current repository needs; resets the worker's counter
     */
    TOTAL,
    
    /**
     * One command was started
     */
    INCREMENT
}
