package org.spelunk.runtime.analysis;

import org.spelunk.runtime.model.CaveGrid;

/**
 * Outcome of {@link ConnectivityValidator#validateWithFallback}.
 *
 * @param connected true if the final grid is connected
 * @param outcome how the loop ended
 * @param grid the final grid; the input grid when it was already connected
 * @param attempts number of carving attempts made
 * @param elapsedMs wall-clock time spent, for reporting only
 * @param initialReport report on the input grid
 * @param finalReport report on the final grid
 * @param error failure description, null on success
 */
public record ConnectivityResult(
    boolean connected,
    Outcome outcome,
    CaveGrid grid,
    int attempts,
    long elapsedMs,
    ConnectivityReport initialReport,
    ConnectivityReport finalReport,
    String error
) {

    public enum Outcome {
        ALREADY_CONNECTED,
        CONNECTED_AFTER_FALLBACK,
        ATTEMPTS_EXHAUSTED,
        TIMED_OUT
    }
}
