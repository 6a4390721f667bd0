package leakscanapp;

import io.temporal.client.WorkflowFailedException;
import io.temporal.failure.ApplicationFailure;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LeakScanCommandTest {
    
    @TempDir
    Path workspace;
    
    private final GitHubClient gitHubClient = mock(GitHubClient.class);
    private final RecordingCommandRunner commandRunner = new RecordingCommandRunner();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private TestWorkflowEnvironment testEnv;
    
    @BeforeEach
    void setUp() {
        testEnv = TestWorkflowEnvironment.newInstance();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }
    
    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        testEnv.close();
    }
    
    private LeakScanSummary runInTestEnvironment(LeakScanRequest request, GitHubClient client, Path base) {
        Worker worker = testEnv.newWorker(Shared.LEAK_SCAN_TASK_QUEUE);
        LeakScanWorker.registerWorkerComponents(worker, client, commandRunner, new ProgressBoard(null), base);
        testEnv.start();
        return new LeakScanClient(testEnv.getWorkflowClient(), Shared.LEAK_SCAN_TASK_QUEUE).submitScanAndWait(request);
    }
    
    private int execute(LeakScanCommand.ScanRunner runner, String... args) {
        return new CommandLine(new LeakScanCommand(() -> gitHubClient, runner)).execute(args);
    }
    
    private int execute(String... args) {
        return execute(this::runInTestEnvironment, args);
    }
    
    private String reposFile(String... addresses) throws IOException {
        Path file = workspace.resolve("repos.txt");
        Files.write(file, Arrays.asList(addresses), StandardCharsets.UTF_8);
        return file.toString();
    }
    
    private List<String> errorLines() {
        String text = err.toString(StandardCharsets.UTF_8).trim();
        return text.isEmpty() ? Collections.emptyList() : Arrays.asList(text.split("\\R"));
    }
    
    private static LeakScanCommand parse(String... args) {
        LeakScanCommand command = new LeakScanCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }
    
    @Test
    void defaults() {
        LeakScanCommand command = parse();
        
        assertEquals(Paths.get("repos.txt"), command.file);
        assertEquals("", command.include);
        assertEquals("", command.exclude);
        assertFalse(command.progress);
        assertFalse(command.user);
        assertNull(command.organization);
        assertEquals(Shared.MAX_WORKERS, command.workers);
        assertEquals(Shared.GITLEAKS_THREADS, command.threads);
        assertEquals(Shared.COMMAND_TIMEOUT_SECONDS, command.commandTimeoutSeconds);
        assertFalse(command.remoteWorker);
    }
    
    @Test
    void parsesOptions() {
        LeakScanCommand command = parse("--file", "other.txt", "--include", "^a", "--exclude", "^ab",
            "--progress", "--workers", "4", "--threads", "2", "--command-timeout", "60", "--remote-worker");
        
        assertEquals(Paths.get("other.txt"), command.file);
        assertEquals("^a", command.include);
        assertEquals("^ab", command.exclude);
        assertTrue(command.progress);
        assertEquals(4, command.workers);
        assertEquals(2, command.threads);
        assertEquals(60, command.commandTimeoutSeconds);
        assertTrue(command.remoteWorker);
    }
    
    @Test
    void loadsFromFileByDefault() {
        RepositorySource source = mock(RepositorySource.class);
        List<RepoRef> repos = Collections.singletonList(RepoRef.fromAddress("git@github.com:acme/widget.git"));
        when(source.fromFile(Paths.get("repos.txt"))).thenReturn(repos);
        
        assertEquals(repos, parse().loadRepositories(source));
    }
    
    @Test
    void loadsOrganizationRepositories() {
        RepositorySource source = mock(RepositorySource.class);
        List<RepoRef> repos = Collections.singletonList(RepoRef.fromAddress("git@github.com:acme/widget.git"));
        when(source.forOrganization("acme")).thenReturn(repos);
        
        assertEquals(repos, parse("--org", "acme").loadRepositories(source));
        verify(source, never()).fromFile(any());
    }
    
    @Test
    void loadsUserRepositories() {
        RepositorySource source = mock(RepositorySource.class);
        when(source.forAuthenticatedUser()).thenReturn(Collections.emptyList());
        
        assertTrue(parse("--user").loadRepositories(source).isEmpty());
        verify(source).forAuthenticatedUser();
    }
    
    @Test
    void userAndOrganizationConflict() {
        RepositorySource source = mock(RepositorySource.class);
        
        assertThrows(ScanPreconditionException.class,
            () -> parse("--user", "--org", "acme").loadRepositories(source));
        verifyNoInteractions(source);
    }
    
    @Test
    void buildsRequestFromOptions() {
        List<RepoRef> repos = Arrays.asList(
            RepoRef.fromAddress("git@github.com:acme/widget.git"),
            RepoRef.fromAddress("git@github.com:acme/gadget.git"));
        Path base = Paths.get("/tmp/leakscan-base");
        
        LeakScanRequest request = parse("--workers", "3", "--threads", "4", "--command-timeout", "90")
            .buildRequest(repos, base);
        
        assertEquals(repos, request.getRepositories());
        assertEquals(3, request.getWorkerCap());
        assertTrue(request.getScanId().startsWith("scan-"));
        assertEquals("leak-scan-" + request.getScanId(), request.generateWorkflowId());
        assertEquals(base.toAbsolutePath().toString(), request.getScanOptions().getWorkspacePath());
        assertEquals(4, request.getScanOptions().getGitleaksThreads());
        assertEquals(90, request.getScanOptions().getCommandTimeoutSeconds());
    }
    
    @Test
    void configurationFailureIsRecognised() {
        WorkflowFailedException configuration = mock(WorkflowFailedException.class);
        when(configuration.getCause()).thenReturn(
            ApplicationFailure.newNonRetryableFailure("No repositories to scan", "ScanConfigurationException"));
        WorkflowFailedException worker = mock(WorkflowFailedException.class);
        when(worker.getCause()).thenReturn(
            ApplicationFailure.newNonRetryableFailure("1 of 2 workers failed", LeakScanWorkflowImpl.WORKER_FAILURE));
        
        assertTrue(LeakScanCommand.isConfigurationFailure(configuration));
        assertFalse(LeakScanCommand.isConfigurationFailure(worker));
    }
    
    @Test
    @DisplayName("a run that finds leaks still exits 0 and lists the leaking branch")
    void leaksFoundExitsZero() throws IOException {
        when(gitHubClient.listBranches("owner", "A")).thenReturn(Collections.singletonList("main"));
        commandRunner.leakIn("owner/A:main");
        
        int exitCode = execute("--file", reposFile("git@github.com:owner/A.git"), "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_OK, exitCode);
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("The following repos failed gitleaks scan:"));
        assertTrue(printed.contains("owner/A:main " + workspace.resolve("scans/reports/owner/A/main.json")));
        assertTrue(Files.exists(workspace.resolve("scans").resolve("summary.json")));
        assertTrue(errorLines().isEmpty());
    }
    
    @Test
    void cleanRunExitsZero() throws IOException {
        when(gitHubClient.listBranches("owner", "A")).thenReturn(Arrays.asList("main", "dev"));
        
        int exitCode = execute("--file", reposFile("git@github.com:owner/A.git"), "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_OK, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("All branches in all repos passed gitleaks scan"));
    }
    
    @Test
    void unreadableFileExitsTwo() {
        int exitCode = execute("--file", workspace.resolve("missing.txt").toString(),
            "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_PRECONDITION, exitCode);
        List<String> lines = errorLines();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).startsWith("error: the repos file"));
    }
    
    @Test
    void emptyFilteredSetExitsTwo() throws IOException {
        int exitCode = execute("--file", reposFile("git@github.com:owner/A.git"), "--include", "^zzz",
            "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_PRECONDITION, exitCode);
        assertTrue(errorLines().get(0).startsWith("error: no repositories matched"));
        verifyNoInteractions(gitHubClient);
    }
    
    @Test
    void invalidPatternExitsTwo() throws IOException {
        int exitCode = execute("--file", reposFile("git@github.com:owner/A.git"), "--include", "([",
            "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_PRECONDITION, exitCode);
        assertTrue(errorLines().get(0).startsWith("error: invalid --include or --exclude pattern"));
    }
    
    @Test
    @DisplayName("a GitHub listing failure is one error line and exit 2, not a stack trace")
    void organizationListingFailureExitsTwo() {
        when(gitHubClient.listOrganizationRepositories("acme")).thenThrow(
            new GitHubApiException("GitHub API request failed: /orgs/acme/repos", "orgs/acme/repos",
                new IOException("Connection refused")));
        
        int exitCode = execute("--org", "acme", "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_PRECONDITION, exitCode);
        List<String> lines = errorLines();
        assertEquals(1, lines.size());
        assertEquals("error: cannot list repositories: GitHub API request failed: /orgs/acme/repos", lines.get(0));
    }
    
    @Test
    void missingTokenExitsTwo() {
        LeakScanCommand command = new LeakScanCommand(() -> {
            throw new ScanPreconditionException("GH_TOKEN_PSW environment variable must be set to token");
        }, this::runInTestEnvironment);
        
        int exitCode = new CommandLine(command).execute("--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_PRECONDITION, exitCode);
        assertEquals(Collections.singletonList("error: GH_TOKEN_PSW environment variable must be set to token"),
            errorLines());
    }
    
    @Test
    void workerFailureExitsOne() throws IOException {
        when(gitHubClient.listBranches("owner", "A")).thenThrow(
            new GitHubApiException("GitHub API request failed with status 404", "repos/owner/A/branches", 404));
        
        int exitCode = execute("--file", reposFile("git@github.com:owner/A.git"), "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_WORKER_FAILURE, exitCode);
        List<String> lines = errorLines();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).startsWith("scan failed: 1 of 1 workers failed"));
        assertFalse(Files.exists(workspace.resolve("scans").resolve("summary.json")));
    }
    
    @Test
    void unexpectedErrorIsOneLineAndExitsOne() throws IOException {
        LeakScanCommand.ScanRunner broken = (request, client, base) -> {
            throw new IllegalStateException("connection to Temporal lost");
        };
        
        int exitCode = execute(broken, "--file", reposFile("git@github.com:owner/A.git"),
            "--workspace", workspace.toString());
        
        assertEquals(LeakScanCommand.EXIT_WORKER_FAILURE, exitCode);
        assertEquals(Collections.singletonList("scan aborted: connection to Temporal lost"), errorLines());
    }
    
    @Test
    void timeoutsReachTheRequest() {
        LeakScanRequest request = parse("--command-timeout", "60", "--repository-timeout", "7200")
            .buildRequest(Collections.singletonList(RepoRef.fromAddress("git@github.com:acme/widget.git")), workspace);
        
        assertEquals(60, request.getScanOptions().getCommandTimeoutSeconds());
        assertEquals(7200, request.getScanOptions().getRepositoryTimeoutSeconds());
    }
    
    @Test
    void filterHelpSaysPatternsSeeNameOnly() {
        CommandLine commandLine = new CommandLine(new LeakScanCommand());
        
        for (String option : Arrays.asList("--include", "--exclude")) {
            String description = String.join(" ", commandLine.getCommandSpec().findOption(option).description());
            assertTrue(description.contains("repository name, without the owner"), option);
        }
    }
}
