package org.spelunk.runtime.placement;

import org.spelunk.runtime.spi.IRandomProvider;

/**
 * A placement stage. Placers read the current level state from a {@link PlacementContext} and
 * return their placement; they never modify the context.
 *
 * @param <T> what the placer produces
 */
public interface ILevelPlacer<T> {

    /**
     * @return short name used in logs and error messages
     */
    String name();

    /**
     * Searches for a placement within the placer's attempt budget.
     *
     * @param context the level as placed so far
     * @param random the placer's random stream
     * @return the placement, or a failure naming the unmet constraint
     */
    PlacementResult<T> place(PlacementContext context, IRandomProvider random);

    /**
     * Checks a placement against this placer's constraints.
     *
     * @param context the level the placement belongs to
     * @param placement the placement to check
     * @return true if every constraint holds
     */
    boolean validate(PlacementContext context, T placement);
}
