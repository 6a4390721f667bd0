package leakscanapp;

import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowFailedException;
import io.temporal.failure.ApplicationFailure;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import java.util.regex.PatternSyntaxException;

/**
 * Command line entry point: pick repositories, start the scan workflow, print which branches leaked
 */
@Command(
        name = "leakscan",
        mixinStandardHelpOptions = true,
        version = "leakscan 1.0.0",
        description = "Runs gitleaks on every branch of many repositories in parallel"
)
public class LeakScanCommand implements Callable<Integer> {
    
    static final int EXIT_OK = 0;
    static final int EXIT_WORKER_FAILURE = 1;
    static final int EXIT_PRECONDITION = 2;
    
    private static final Logger log = LoggerFactory.getLogger(LeakScanCommand.class);
    
    @Option(names = "--file", defaultValue = "repos.txt",
            description = "File containing repository addresses to scan, one per line (default: ${DEFAULT-VALUE})")
    Path file;
    
    @Option(names = "--user", description = "Scan all repositories of the authenticated user instead of --file")
    boolean user;
    
    @Option(names = "--org", description = "Scan all repositories of this organization instead of --file")
    String organization;
    
    @Option(names = "--include", defaultValue = "",
            description = "Regex matched against the start of each repository name, without the owner")
    String include;
    
    @Option(names = "--exclude", defaultValue = "",
            description = "Regex matched against the start of each repository name, without the owner; "
                    + "matching repositories are skipped")
    String exclude;
    
    @Option(names = "--progress", description = "Display progress for each worker")
    boolean progress;
    
    @Option(names = "--workers", defaultValue = "" + Shared.MAX_WORKERS,
            description = "Maximum number of repositories scanned at once (default: ${DEFAULT-VALUE})")
    int workers;
    
    @Option(names = "--workspace", description = "Base directory for clones and reports (default: $PWD)")
    Path workspace;
    
    @Option(names = "--threads", defaultValue = "" + Shared.GITLEAKS_THREADS,
            description = "Threads passed to gitleaks (default: ${DEFAULT-VALUE})")
    int threads;
    
    @Option(names = "--command-timeout", defaultValue = "" + Shared.COMMAND_TIMEOUT_SECONDS,
            description = "Seconds before a git or gitleaks command is killed (default: ${DEFAULT-VALUE})")
    int commandTimeoutSeconds;
    
    @Option(names = "--repository-timeout", defaultValue = "" + Shared.REPOSITORY_SCAN_TIMEOUT_SECONDS,
            description = "Seconds allowed for cloning and scanning all branches of one repository "
                    + "(default: ${DEFAULT-VALUE})")
    int repositoryTimeoutSeconds;
    
    @Option(names = "--remote-worker", description = "Do not start an in-process worker; rely on LeakScanWorker")
    boolean remoteWorker;
    
    private final ScanSummaryReporter reporter = new ScanSummaryReporter();
    private final Supplier<GitHubClient> gitHubClientFactory;
    private final ScanRunner scanRunner;
    
    /**
     * Runs a request to completion and returns its summary
     */
    @FunctionalInterface
    interface ScanRunner {
        LeakScanSummary run(LeakScanRequest request, GitHubClient gitHubClient, Path base);
    }
    
    public LeakScanCommand() {
        this.gitHubClientFactory = GitHubApiClient::fromEnvironment;
        this.scanRunner = this::runOnTemporal;
    }
    
    LeakScanCommand(Supplier<GitHubClient> gitHubClientFactory, ScanRunner scanRunner) {
        this.gitHubClientFactory = gitHubClientFactory;
        this.scanRunner = scanRunner;
    }
    
    public static void main(String[] args) {
        System.exit(new CommandLine(new LeakScanCommand()).execute(args));
    }
    
    @Override
    public Integer call() {
        Path base = workspace != null ? workspace : LeakScanWorker.workspaceFromEnvironment();
        try {
            GitHubClient gitHubClient = gitHubClientFactory.get();
            List<RepoRef> matched = new RepoFilter(include, exclude)
                .apply(loadRepositories(new RepositorySource(gitHubClient)));
            if (matched.isEmpty()) {
                throw new ScanPreconditionException(
                    "no repositories matched include '" + include + "' and exclude '" + exclude + "'");
            }
            LeakScanRequest request = buildRequest(matched, base);
            
            LeakScanSummary summary = scanRunner.run(request, gitHubClient, base);
            reporter.print(summary, System.out);
            Path json = reporter.writeJson(summary, ScanDirectories.under(base).getScans().resolve("summary.json"));
            log.info("summary written to {}", json);
            return EXIT_OK;
            
        } catch (ScanPreconditionException | ScanHostException e) {
            log.error("scan cannot start: {}", e.getMessage(), e);
            System.err.println("error: " + e.getMessage());
            return EXIT_PRECONDITION;
        } catch (WorkflowFailedException e) {
            log.error("scan failed", e);
            System.err.println("scan failed: " + describe(e));
            return isConfigurationFailure(e) ? EXIT_PRECONDITION : EXIT_WORKER_FAILURE;
        } catch (PatternSyntaxException e) {
            log.error("invalid filter pattern", e);
            System.err.println("error: invalid --include or --exclude pattern: " + e.getMessage());
            return EXIT_PRECONDITION;
        } catch (IOException e) {
            log.error("failed to write scan summary", e);
            System.err.println("failed to write scan summary: " + e.getMessage());
            return EXIT_WORKER_FAILURE;
        } catch (RuntimeException e) {
            log.error("scan aborted", e);
            System.err.println("scan aborted: " + e.getMessage());
            return EXIT_WORKER_FAILURE;
        }
    }
    
    /**
     * Connect to Temporal, start an in-process worker unless --remote-worker is set,
     * and wait for the workflow
     */
    private LeakScanSummary runOnTemporal(LeakScanRequest request, GitHubClient gitHubClient, Path base) {
        String temporalAddress = Shared.getEnvOrDefault("TEMPORAL_ADDRESS", Shared.DEFAULT_TEMPORAL_ADDRESS);
        String taskQueue = Shared.getEnvOrDefault("TASK_QUEUE", Shared.LEAK_SCAN_TASK_QUEUE);
        
        WorkflowServiceStubs serviceStub = LeakScanClient.newServiceStubs(temporalAddress);
        WorkerFactory factory = null;
        try {
            WorkflowClient client = WorkflowClient.newInstance(serviceStub);
            if (!remoteWorker) {
                ToolHealthChecker.verifyHealth(base);
                factory = WorkerFactory.newInstance(client);
                LeakScanWorker.registerWorkerComponents(factory.newWorker(taskQueue), gitHubClient,
                    new ProcessCommandRunner(), new ProgressBoard(progress ? System.out : null), base);
                factory.start();
            }
            return new LeakScanClient(client, taskQueue).submitScanAndWait(request);
        } finally {
            if (factory != null) {
                factory.shutdown();
            }
            serviceStub.shutdown();
        }
    }
    
    /**
     * @throws ScanPreconditionException if the sources conflict, the file cannot be read,
     *                                   or GitHub cannot list the repositories
     */
    List<RepoRef> loadRepositories(RepositorySource source) {
        if (user && organization != null) {
            throw new ScanPreconditionException("--user and --org cannot be combined");
        }
        try {
            if (user) {
                return source.forAuthenticatedUser();
            }
            if (organization != null) {
                return source.forOrganization(organization);
            }
        } catch (GitHubApiException e) {
            throw new ScanPreconditionException("cannot list repositories: " + e.getMessage(), e);
        }
        return source.fromFile(file);
    }
    
    LeakScanRequest buildRequest(List<RepoRef> repositories, Path base) {
        ScanOptions options = new ScanOptions(base.toAbsolutePath().toString());
        options.setGitleaksThreads(threads);
        options.setCommandTimeoutSeconds(commandTimeoutSeconds);
        options.setRepositoryTimeoutSeconds(repositoryTimeoutSeconds);
        
        LeakScanRequest request = new LeakScanRequest("scan-" + System.currentTimeMillis(), repositories, options);
        request.setWorkerCap(workers);
        return request;
    }
    
    static boolean isConfigurationFailure(WorkflowFailedException e) {
        return e.getCause() instanceof ApplicationFailure
            && ScanConfigurationException.class.getSimpleName().equals(((ApplicationFailure) e.getCause()).getType());
    }
    
    private static String describe(WorkflowFailedException e) {
        if (e.getCause() instanceof ApplicationFailure) {
            return ((ApplicationFailure) e.getCause()).getOriginalMessage();
        }
        return e.getMessage();
    }
}
