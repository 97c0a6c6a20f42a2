package io.specrouter.cli;

/**
 * Outcome of one validation run.
 *
 * @param passed files that loaded cleanly
 * @param failed files that failed any stage
 */
public record ValidationSummary(int passed, int failed) {

    public int total() {
        return passed + failed;
    }

    /** {@code 0} if every file passed, {@code 1} otherwise. */
    public int exitCode() {
        return failed == 0 ? 0 : 1;
    }
}
