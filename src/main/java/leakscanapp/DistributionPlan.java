package leakscanapp;

import java.util.Collections;
import java.util.List;

/**
 * Mode chosen for a run together with one assignment per worker
 */
public class DistributionPlan {
    private final DistributionMode mode;
    private final List<WorkAssignment> assignments;
    
    public DistributionPlan(DistributionMode mode, List<WorkAssignment> assignments) {
        this.mode = mode;
        this.assignments = Collections.unmodifiableList(assignments);
    }
    
    public DistributionMode getMode() {
        return mode;
    }
    
    public List<WorkAssignment> getAssignments() {
        return assignments;
    }
    
    public int getWorkerCount() {
        return assignments.size();
    }
}
