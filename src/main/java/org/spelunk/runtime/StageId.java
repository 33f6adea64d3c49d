package org.spelunk.runtime;

/**
 * Pipeline stages in execution order. The ordinal keys each stage's random sub-stream.
 */
public enum StageId {
    SEED,
    AUTOMATON,
    CONNECTIVITY,
    REFINE,
    SPAWN,
    GOAL,
    PLATFORMS,
    COINS,
    ENEMIES,
    VALIDATE
}
