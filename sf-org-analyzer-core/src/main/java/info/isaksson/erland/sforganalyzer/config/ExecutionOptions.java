package info.isaksson.erland.sforganalyzer.config;

/**
 * Traversal bounds and automation gates for the execution path analyzer.
 *
 * <p>Mirrors the {@code execution.*} configuration keys in a structured form.</p>
 */
public final class ExecutionOptions {
    public int maxDepth = 10;
    public int maxIterations = 100;

    public boolean includeWorkflow = true;
    public boolean includeProcessBuilder = true;
    public boolean includeFlows = true;
    /** When false, Apex method nodes are kept but act as leaves. */
    public boolean followApex = true;
    public boolean trackSharing = true;

    public static ExecutionOptions defaults() {
        return new ExecutionOptions();
    }

    /** @throws InvalidConfigurationException if a bound is not positive */
    public ExecutionOptions validate() {
        if (maxDepth <= 0) {
            throw new InvalidConfigurationException("execution.max_depth must be > 0 but was " + maxDepth);
        }
        if (maxIterations <= 0) {
            throw new InvalidConfigurationException("execution.max_iterations must be > 0 but was " + maxIterations);
        }
        return this;
    }
}
