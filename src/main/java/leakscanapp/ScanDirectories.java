package leakscanapp;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Working directories shared by all workers of a run.
 * Clones and reports are scoped by owner so that same-named repositories
 * from different owners never share a path.
 */
public class ScanDirectories {
    
    private final Path scans;
    private final Path clones;
    private final Path reports;
    
    private ScanDirectories(Path base) {
        this.scans = base.resolve("scans");
        this.clones = scans.resolve("clones");
        this.reports = scans.resolve("reports");
    }
    
    public static ScanDirectories under(Path base) {
        return new ScanDirectories(base);
    }
    
    /**
     * Create the scans, clones and reports directories if they do not exist yet
     */
    public ScanDirectories create() throws IOException {
        Files.createDirectories(scans);
        Files.createDirectories(clones);
        Files.createDirectories(reports);
        return this;
    }
    
    public Path getScans() {
        return scans;
    }
    
    public Path getClones() {
        return clones;
    }
    
    public Path getReports() {
        return reports;
    }
    
    /**
     * Directory the repository is cloned into: clones/owner
     */
    public Path ownerCloneDirectory(RepoRef repo) {
        return clones.resolve(repo.getOwner());
    }
    
    public Path cloneDirectory(RepoRef repo) {
        return ownerCloneDirectory(repo).resolve(repo.getName());
    }
    
    /**
     * gitleaks report for one branch: reports/owner/name/branch.json.
     * The branch is URL-encoded, so every branch of a repository gets its own file
     * and the branch name can be recovered from the file name.
     */
    public Path reportFile(RepoRef repo, String branch) {
        return reports.resolve(repo.getOwner())
            .resolve(repo.getName())
            .resolve(URLEncoder.encode(branch, StandardCharsets.UTF_8) + ".json");
    }
}
