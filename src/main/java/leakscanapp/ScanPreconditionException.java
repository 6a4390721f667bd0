package leakscanapp;

/**
 * Exception thrown when a run cannot start: missing credentials, unreadable
 * repository file, or nothing left to scan after filtering
 */
public class ScanPreconditionException extends RuntimeException {
    
    public ScanPreconditionException(String message) {
        super(message);
    }
    
    public ScanPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
