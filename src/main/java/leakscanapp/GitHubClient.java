package leakscanapp;

import java.util.List;

/**
 * The parts of the GitHub REST API the scanner needs
 */
public interface GitHubClient {
    
    /**
     * @return Branch names in the order the API lists them
     */
    List<String> listBranches(String owner, String name);
    
    /**
     * Repositories of the authenticated identity
     */
    List<RepoRef> listUserRepositories();
    
    /**
     * Repositories of an organization
     */
    List<RepoRef> listOrganizationRepositories(String organization);
}
