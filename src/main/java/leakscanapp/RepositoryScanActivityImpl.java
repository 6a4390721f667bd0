package leakscanapp;

import io.temporal.activity.Activity;
import io.temporal.activity.ActivityExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Implementation of the repository scan activity.
 * Clone, checkout and scan failures are not told apart: every command runs and the
 * gitleaks exit code of each branch decides its outcome.
 */
public class RepositoryScanActivityImpl implements RepositoryScanActivity {
    
    private static final Logger log = LoggerFactory.getLogger(RepositoryScanActivityImpl.class);
    private static final int MISSING_DIRECTORY_EXIT_CODE = 128;
    
    private final GitHubClient gitHubClient;
    private final CommandRunner commandRunner;
    private final ProgressListener progressListener;
    private final Path defaultWorkspace;
    
    /**
     * @param defaultWorkspace Workspace used when the request does not name one
     */
    public RepositoryScanActivityImpl(GitHubClient gitHubClient, CommandRunner commandRunner,
                                      ProgressListener progressListener, Path defaultWorkspace) {
        this.gitHubClient = gitHubClient;
        this.commandRunner = commandRunner;
        this.progressListener = progressListener;
        this.defaultWorkspace = defaultWorkspace;
    }
    
    @Override
    public Map<String, BranchOutcome> scanRepository(RepoRef repository, String workerLabel, ScanOptions options) {
        ActivityExecutionContext context = Activity.getExecutionContext();
        ProgressListener progress = new CompositeProgressListener(
            progressListener, new HeartbeatProgressListener(context));
        
        String fullName = repository.fullName();
        log.debug("processing repo {}", fullName);
        progress.onEvent(ProgressEvent.identity(workerLabel, fullName));
        
        List<String> branches = gitHubClient.listBranches(repository.getOwner(), repository.getName());
        // checkout + scan per branch, plus the clone
        int totalCommands = branches.size() * 2 + 1;
        log.debug("processing total of {} commands for repo {}", totalCommands, fullName);
        progress.onEvent(ProgressEvent.total(workerLabel, totalCommands));
        
        try {
            Path workspace = options.getWorkspacePath() != null
                ? Paths.get(options.getWorkspacePath())
                : defaultWorkspace;
            ScanDirectories dirs = ScanDirectories.under(workspace).create();
            Duration timeout = Duration.ofSeconds(options.getCommandTimeoutSeconds());
            
            Path ownerDir = dirs.ownerCloneDirectory(repository);
            Path cloneDir = dirs.cloneDirectory(repository);
            deleteDirectory(cloneDir);
            Files.createDirectories(ownerDir);
            execute(Arrays.asList("git", "clone", repository.getAddress(), repository.getName()),
                ownerDir, timeout, workerLabel, progress);
            
            Map<String, BranchOutcome> results = new LinkedHashMap<>();
            for (String branch : branches) {
                log.debug("processing branch {} for repo {}", branch, fullName);
                execute(Arrays.asList("git", "checkout", "-b", branch, "origin/" + branch),
                    cloneDir, timeout, workerLabel, progress);
                
                Path report = dirs.reportFile(repository, branch);
                Files.createDirectories(report.getParent());
                CommandResult scan = execute(buildGitleaksCommand(branch, report, options),
                    cloneDir, timeout, workerLabel, progress);
                
                BranchOutcome outcome = BranchOutcome.fromCommand(scan, report.toString());
                results.put(repository.scanKey(branch), outcome);
                log.debug("processing of branch {} for repo {} is complete: {}", branch, fullName, outcome);
            }
            
            log.debug("processing of repo {} complete", fullName);
            return results;
            
        } catch (IOException e) {
            throw Activity.wrap(e);
        }
    }
    
    private CommandResult execute(List<String> command, Path workingDirectory, Duration timeout,
                                  String workerLabel, ProgressListener progress) throws IOException {
        String commandLine = String.join(" ", command);
        progress.onEvent(ProgressEvent.increment(workerLabel, commandLine));
        // The clone failed; report the command as failed the way git would
        if (!Files.isDirectory(workingDirectory)) {
            log.warn("{} does not exist, not executing: {}", workingDirectory, commandLine);
            return CommandResult.exited(MISSING_DIRECTORY_EXIT_CODE);
        }
        return commandRunner.run(command, workingDirectory, timeout);
    }
    
    private List<String> buildGitleaksCommand(String branch, Path report, ScanOptions options) {
        List<String> command = new ArrayList<>();
        command.add("gitleaks");
        command.add("--path=.");
        command.add("--branch=" + branch);
        command.add("--report=" + report);
        command.add("--threads=" + options.getGitleaksThreads());
        return command;
    }
    
    /**
     * Remove a stale clone; a directory that does not exist is fine
     */
    private void deleteDirectory(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(path)) {
            List<Path> ordered = new ArrayList<>();
            paths.sorted(Comparator.reverseOrder()).forEach(ordered::add);
            for (Path p : ordered) {
                Files.delete(p);
            }
        }
    }
}
