package leakscanapp;

/**
 * Exception thrown when a GitHub API call fails or returns an unexpected payload
 */
public class GitHubApiException extends RuntimeException {
    private final String path;
    private final int statusCode;
    
    public GitHubApiException(String message, String path, int statusCode) {
        super(message);
        this.path = path;
        this.statusCode = statusCode;
    }
    
    public GitHubApiException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.statusCode = -1;
    }
    
    public String getPath() {
        return path;
    }
    
    /**
     * HTTP status, or -1 when the request never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
