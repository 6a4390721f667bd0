package leakscanapp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepoFilterTest {
    
    private static List<RepoRef> repos(String... names) {
        List<RepoRef> repos = new ArrayList<>();
        for (String name : names) {
            repos.add(RepoRef.fromAddress("git@github.com:acme/" + name + ".git"));
        }
        return repos;
    }
    
    private static List<String> names(List<RepoRef> repos) {
        List<String> names = new ArrayList<>();
        for (RepoRef repo : repos) {
            names.add(repo.getName());
        }
        return names;
    }
    
    @Test
    @DisplayName("include ^a, exclude ^ab -> only axy")
    void includeAndExcludeCompose() {
        RepoFilter filter = new RepoFilter("^a", "^ab");
        
        assertEquals(Arrays.asList("axy"), names(filter.apply(repos("abc", "axy", "xyz"))));
    }
    
    @Test
    void emptyPatternsKeepEverything() {
        RepoFilter filter = new RepoFilter("", "");
        
        assertEquals(Arrays.asList("abc", "axy", "xyz"), names(filter.apply(repos("abc", "axy", "xyz"))));
    }
    
    @Test
    void nullPatternsKeepEverything() {
        assertTrue(new RepoFilter(null, null).matches(RepoRef.fromAddress("git@github.com:acme/abc.git")));
    }
    
    @Test
    @DisplayName("patterns are anchored at the start of the name")
    void patternsMatchFromStartOfName() {
        RepoFilter filter = new RepoFilter("xy", "");
        
        assertEquals(Arrays.asList("xyz"), names(filter.apply(repos("abc", "axy", "xyz"))));
    }
    
    @Test
    void excludeOnly() {
        RepoFilter filter = new RepoFilter("", "x");
        
        assertEquals(Arrays.asList("abc", "axy"), names(filter.apply(repos("abc", "axy", "xyz"))));
    }
    
    @Test
    void filterMatchesNameNotOwner() {
        RepoFilter filter = new RepoFilter("^acme", "");
        
        assertTrue(filter.apply(repos("widget")).isEmpty());
    }
}
