package leakscanapp;

/**
 * The host cannot run scans: git or gitleaks is not on PATH, or the workspace
 * cannot be written. Raised by {@link ToolHealthChecker} before any repository is cloned.
 */
public class ScanHostException extends RuntimeException {
    
    /**
     * What a scanning host must provide
     */
    public enum Requirement {
        GIT("git", "git on PATH, used to clone and check out branches"),
        GITLEAKS("gitleaks", "gitleaks on PATH, used to scan each branch"),
        WRITABLE_WORKSPACE("workspace", "a writable workspace for clones and reports");
        
        private final String id;
        private final String description;
        
        Requirement(String id, String description) {
            this.id = id;
            this.description = description;
        }
        
        public String getId() {
            return id;
        }
        
        public String getDescription() {
            return description;
        }
    }
    
    private final Requirement requirement;
    
    public ScanHostException(Requirement requirement, String message) {
        super(message);
        this.requirement = requirement;
    }
    
    public ScanHostException(Requirement requirement, String message, Throwable cause) {
        super(message, cause);
        this.requirement = requirement;
    }
    
    public Requirement getRequirement() {
        return requirement;
    }
}
