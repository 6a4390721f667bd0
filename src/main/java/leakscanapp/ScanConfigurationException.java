package leakscanapp;

/**
 * Thrown when a run cannot be distributed, e.g. no repositories or a worker cap below one.
 * Raised before any worker starts.
 */
public class ScanConfigurationException extends RuntimeException {
    
    public ScanConfigurationException(String message) {
        super(message);
    }
}
