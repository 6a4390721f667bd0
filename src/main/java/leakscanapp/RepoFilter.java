package leakscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Include/exclude regex filter on repository names.
 * Patterns see the name only, never the owner, and are anchored at its start;
 * an empty include matches everything and an empty exclude matches nothing.
 */
public class RepoFilter {
    
    private static final Logger log = LoggerFactory.getLogger(RepoFilter.class);
    
    private final Pattern include;
    private final Pattern exclude;
    
    public RepoFilter(String include, String exclude) {
        this.include = compile(include);
        this.exclude = compile(exclude);
    }
    
    private static Pattern compile(String regex) {
        return regex == null || regex.isEmpty() ? null : Pattern.compile(regex);
    }
    
    public boolean matches(RepoRef repository) {
        String name = repository.getName();
        boolean included = include == null || include.matcher(name).lookingAt();
        boolean excluded = exclude != null && exclude.matcher(name).lookingAt();
        return included && !excluded;
    }
    
    public List<RepoRef> apply(List<RepoRef> repositories) {
        log.debug("matching repos using include {} and exclude {}", include, exclude);
        List<RepoRef> matched = new ArrayList<>();
        for (RepoRef repository : repositories) {
            if (matches(repository)) {
                matched.add(repository);
            }
        }
        log.debug("{} of {} repos matched", matched.size(), repositories.size());
        return matched;
    }
}
