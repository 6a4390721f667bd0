package leakscanapp;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Verifies at worker startup that the host can clone and scan
 */
public class ToolHealthChecker {
    
    /**
     * @param workspace Base directory the scans directory is created under
     * @throws ScanHostException if a tool is missing or the workspace is not writable
     */
    public static void verifyHealth(Path workspace) {
        verifyCommand(ScanHostException.Requirement.GIT);
        verifyCommand(ScanHostException.Requirement.GITLEAKS);
        verifyWorkspace(workspace);
    }
    
    static void verifyCommand(ScanHostException.Requirement tool) {
        verifyCommand(tool.getId(), tool);
    }
    
    static void verifyCommand(String command, ScanHostException.Requirement tool) {
        if (!isCommandAvailable(command)) {
            throw new ScanHostException(tool,
                command + " is not on PATH; leakscan needs " + tool.getDescription());
        }
    }
    
    /**
     * Verify the workspace directory can be created and written
     */
    public static void verifyWorkspace(Path workspace) {
        try {
            Files.createDirectories(workspace);
            Path scratch = Files.createTempFile(workspace, ".leakscan-", ".tmp");
            Files.delete(scratch);
        } catch (Exception e) {
            throw new ScanHostException(ScanHostException.Requirement.WRITABLE_WORKSPACE,
                "cannot write to workspace " + workspace + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Check if a command is available in PATH
     */
    static boolean isCommandAvailable(String command) {
        try {
            ProcessBuilder processBuilder = new ProcessBuilder("sh", "-c", "command -v \"$0\"", command);
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = processBuilder.start();
            return process.waitFor() == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            return false;
        }
    }
}
