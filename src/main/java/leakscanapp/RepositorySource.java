package leakscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the repositories to scan from a file of addresses or from the GitHub API
 */
public class RepositorySource {
    
    private static final Logger log = LoggerFactory.getLogger(RepositorySource.class);
    
    private final GitHubClient gitHubClient;
    
    public RepositorySource(GitHubClient gitHubClient) {
        this.gitHubClient = gitHubClient;
    }
    
    /**
     * Read one address per line; blank lines are skipped
     *
     * @throws ScanPreconditionException if the file cannot be read
     */
    public List<RepoRef> fromFile(Path file) {
        if (!Files.isReadable(file)) {
            throw new ScanPreconditionException("the repos file '" + file + "' cannot be read");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScanPreconditionException("the repos file '" + file + "' cannot be read", e);
        }
        List<RepoRef> repositories = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String address = lines.get(i).trim();
            if (address.isEmpty()) {
                continue;
            }
            try {
                repositories.add(RepoRef.fromAddress(address));
            } catch (IllegalArgumentException e) {
                throw new ScanPreconditionException(
                    "the repos file '" + file + "' has an unparsable address on line " + (i + 1), e);
            }
        }
        log.debug("read {} repos from {}", repositories.size(), file);
        return repositories;
    }
    
    public List<RepoRef> forAuthenticatedUser() {
        List<RepoRef> repositories = gitHubClient.listUserRepositories();
        log.debug("retrieved {} repos for the authenticated user", repositories.size());
        return repositories;
    }
    
    public List<RepoRef> forOrganization(String organization) {
        List<RepoRef> repositories = gitHubClient.listOrganizationRepositories(organization);
        log.debug("retrieved {} repos for organization {}", repositories.size(), organization);
        return repositories;
    }
}
