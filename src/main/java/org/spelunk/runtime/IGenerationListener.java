package org.spelunk.runtime;

/**
 * Observes pipeline progress. Timings are coarse wall-clock values for reporting only.
 */
public interface IGenerationListener {

    IGenerationListener NONE = new IGenerationListener() {
    };

    default void onStageStart(StageId stage) {
    }

    default void onStageEnd(StageId stage, long elapsedMs) {
    }
}
