package leakscanapp;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScanSummaryReporterTest {
    
    @TempDir
    Path tempDir;
    
    private final ScanSummaryReporter reporter = new ScanSummaryReporter();
    
    private static LeakScanSummary summary(Map<String, BranchOutcome> results) {
        LeakScanSummary summary = new LeakScanSummary("scan-1");
        summary.setMode(DistributionMode.DIRECT);
        summary.setWorkerCount(2);
        summary.setResults(results);
        return summary;
    }
    
    private static String print(ScanSummaryReporter reporter, LeakScanSummary summary) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        reporter.print(summary, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }
    
    @Test
    void allPassed() {
        Map<String, BranchOutcome> results = new LinkedHashMap<>();
        results.put("owner/A:main", BranchOutcome.passed());
        
        assertEquals("All branches in all repos passed gitleaks scan", print(reporter, summary(results)).trim());
    }
    
    @Test
    void listsOnlyFailedBranches() {
        Map<String, BranchOutcome> results = new LinkedHashMap<>();
        results.put("owner/A:main", BranchOutcome.passed());
        results.put("owner/B:main", new BranchOutcome(ScanStatus.LEAKS_FOUND, "/r/owner/B-main.json", 1));
        results.put("owner/B:dev", new BranchOutcome(ScanStatus.TIMED_OUT, "/r/owner/B-dev.json", -1));
        
        String[] lines = print(reporter, summary(results)).trim().split("\\R");
        
        assertEquals(3, lines.length);
        assertEquals("The following repos failed gitleaks scan:", lines[0]);
        assertEquals("owner/B:main /r/owner/B-main.json", lines[1]);
        assertEquals("owner/B:dev /r/owner/B-dev.json (timed out)", lines[2]);
    }
    
    @Test
    void writesJsonCreatingParentDirectories() throws Exception {
        Map<String, BranchOutcome> results = new LinkedHashMap<>();
        results.put("owner/B:main", new BranchOutcome(ScanStatus.LEAKS_FOUND, "/r/owner/B-main.json", 1));
        Path file = tempDir.resolve("scans").resolve("summary.json");
        
        Path written = reporter.writeJson(summary(results), file);
        
        assertEquals(file, written);
        JsonObject json = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        assertEquals("scan-1", json.get("scanId").getAsString());
        assertEquals("DIRECT", json.get("mode").getAsString());
        JsonObject outcome = json.getAsJsonObject("results").getAsJsonObject("owner/B:main");
        assertEquals("LEAKS_FOUND", outcome.get("status").getAsString());
        assertEquals("/r/owner/B-main.json", outcome.get("reportPath").getAsString());
    }
}
