package leakscanapp;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Prints the pass/fail summary of a run and stores it as JSON
 */
public class ScanSummaryReporter {
    
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    
    public void print(LeakScanSummary summary, PrintStream out) {
        Map<String, BranchOutcome> failures = summary.failures();
        if (failures.isEmpty()) {
            out.println("All branches in all repos passed gitleaks scan");
            return;
        }
        out.println("The following repos failed gitleaks scan:");
        for (Map.Entry<String, BranchOutcome> failure : failures.entrySet()) {
            BranchOutcome outcome = failure.getValue();
            String line = failure.getKey() + " " + outcome.getReportPath();
            if (outcome.getStatus() == ScanStatus.TIMED_OUT) {
                line += " (timed out)";
            }
            out.println(line);
        }
    }
    
    /**
     * Write the summary as pretty-printed JSON
     *
     * @return The file written
     */
    public Path writeJson(LeakScanSummary summary, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(summary, writer);
        }
        return file;
    }
}
