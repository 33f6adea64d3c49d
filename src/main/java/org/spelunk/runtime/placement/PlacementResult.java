package org.spelunk.runtime.placement;

/**
 * Outcome of a bounded placement search. Placement never throws for an exhausted budget; callers
 * must check {@link #success()}.
 *
 * @param success whether every constraint was met
 * @param value the placement; on failure a partial placement or null
 * @param error failure description, null on success
 * @param <T> placement type
 */
public record PlacementResult<T>(boolean success, T value, String error) {

    public static <T> PlacementResult<T> success(T value) {
        return new PlacementResult<>(true, value, null);
    }

    public static <T> PlacementResult<T> failure(String error) {
        return new PlacementResult<>(false, null, error);
    }

    public static <T> PlacementResult<T> failure(String error, T partial) {
        return new PlacementResult<>(false, partial, error);
    }
}
