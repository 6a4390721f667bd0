package leakscanapp;

/**
 * Worker bound to exactly one repository
 */
public class DirectAssignment implements WorkAssignment {
    private final RepoRef repository;
    
    public DirectAssignment(RepoRef repository) {
        this.repository = repository;
    }
    
    public RepoRef getRepository() {
        return repository;
    }
    
    @Override
    public String getWorkerLabel() {
        return repository.fullName();
    }
}
