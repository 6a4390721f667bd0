package leakscanapp;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs git and gitleaks as external processes
 */
public interface CommandRunner {
    
    /**
     * Run a command and wait for it to exit or for the timeout to elapse
     *
     * @param command Program and arguments
     * @param workingDirectory Directory the command runs in
     * @param timeout Maximum time to wait before the process is killed
     * @return Exit code and output; timed out results carry exit code -1
     * @throws IOException if the process cannot be started
     */
    CommandResult run(List<String> command, Path workingDirectory, Duration timeout) throws IOException;
}
