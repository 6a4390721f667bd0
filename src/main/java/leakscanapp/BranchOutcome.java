package leakscanapp;

import java.util.Objects;

/**
 * Result recorded for one (repository, branch) pair.
 * A passing branch has no report path; a failing branch points at its gitleaks report.
 */
public class BranchOutcome {
    private ScanStatus status;
    private String reportPath;
    private int exitCode;
    
    public BranchOutcome() {
    }
    
    public BranchOutcome(ScanStatus status, String reportPath, int exitCode) {
        this.status = status;
        this.reportPath = reportPath;
        this.exitCode = exitCode;
    }
    
    public static BranchOutcome passed() {
        return new BranchOutcome(ScanStatus.PASSED, null, 0);
    }
    
    /**
     * Map a finished gitleaks invocation to an outcome. Any nonzero exit code is a failure.
     */
    public static BranchOutcome fromCommand(CommandResult result, String reportPath) {
        if (result.isTimedOut()) {
            return new BranchOutcome(ScanStatus.TIMED_OUT, reportPath, result.getExitCode());
        }
        if (result.getExitCode() == 0) {
            return passed();
        }
        return new BranchOutcome(ScanStatus.LEAKS_FOUND, reportPath, result.getExitCode());
    }
    
    public boolean failed() {
        return status != ScanStatus.PASSED;
    }
    
    // Getters and Setters
    public ScanStatus getStatus() {
        return status;
    }
    
    public void setStatus(ScanStatus status) {
        this.status = status;
    }
    
    public String getReportPath() {
        return reportPath;
    }
    
    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }
    
    public int getExitCode() {
        return exitCode;
    }
    
    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchOutcome)) return false;
        BranchOutcome other = (BranchOutcome) o;
        return exitCode == other.exitCode
            && status == other.status
            && Objects.equals(reportPath, other.reportPath);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(status, reportPath, exitCode);
    }
    
    @Override
    public String toString() {
        return failed() ? status.getId() + " " + reportPath : status.getId();
    }
}
