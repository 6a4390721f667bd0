package leakscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * Output is redirected to a temporary file so a chatty process can never block on a full pipe
 * while we wait on the timeout.
 */
public class ProcessCommandRunner implements CommandRunner {
    
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final long EXIT_WAIT_SECONDS = 10;
    
    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout) throws IOException {
        log.debug("executing command: {}", String.join(" ", command));
        
        Path outputFile = Files.createTempFile("leakscan-command", ".log");
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.directory(workingDirectory.toFile());
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(outputFile.toFile());
            
            Process process = processBuilder.start();
            
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for: " + command.get(0), e);
            }
            
            if (!finished) {
                destroyTree(process);
                String output = readOutput(outputFile);
                log.warn("command timed out after {}s: {}", timeout.getSeconds(), String.join(" ", command));
                return CommandResult.timedOut(output);
            }
            
            int exitCode = process.exitValue();
            String output = readOutput(outputFile);
            log.debug("returncode: {}", exitCode);
            if (!output.isEmpty()) {
                log.debug("output:\n{}", output);
            }
            return new CommandResult(exitCode, false, output);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }
    
    /**
     * Kill the process and everything it spawned (ssh, git-remote-https, index-pack),
     * then wait briefly for it to exit. Descendants are collected before the parent dies,
     * while they are still reachable through it.
     */
    private void destroyTree(Process process) throws IOException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(EXIT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("process {} did not exit within {}s of being killed", process.pid(), EXIT_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for killed process " + process.pid(), e);
        }
    }
    
    private String readOutput(Path outputFile) throws IOException {
        return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
    }
}
