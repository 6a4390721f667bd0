package leakscanapp;

/**
 * Exit status and captured output of an external command
 */
public class CommandResult {
    private final int exitCode;
    private final boolean timedOut;
    private final String output;
    
    public CommandResult(int exitCode, boolean timedOut, String output) {
        this.exitCode = exitCode;
        this.timedOut = timedOut;
        this.output = output;
    }
    
    public static CommandResult exited(int exitCode) {
        return new CommandResult(exitCode, false, "");
    }
    
    public static CommandResult timedOut(String output) {
        return new CommandResult(-1, true, output);
    }
    
    public int getExitCode() {
        return exitCode;
    }
    
    public boolean isTimedOut() {
        return timedOut;
    }
    
    public String getOutput() {
        return output;
    }
}
