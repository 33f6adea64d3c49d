package org.spelunk.runtime;

import org.spelunk.runtime.analysis.CaveQualityReport;
import org.spelunk.runtime.analysis.SolvabilityReport;
import org.spelunk.runtime.model.LevelLayout;

import java.util.Map;

/**
 * Outcome of a full generation run.
 *
 * @param success whether a complete level was produced
 * @param level the level, null on failure
 * @param failedStage the stage that failed, null on success
 * @param error failure description, null on success
 * @param stageTimingsMs elapsed milliseconds per completed stage, in execution order
 * @param reachability reachable floor ratio of the final level, 0 on failure
 * @param quality terrain quality of the final level, null on failure
 * @param solvability final solvability check, null unless the run got that far
 */
public record GenerationResult(
    boolean success,
    LevelLayout level,
    StageId failedStage,
    String error,
    Map<StageId, Long> stageTimingsMs,
    double reachability,
    CaveQualityReport quality,
    SolvabilityReport solvability
) {

    public static GenerationResult success(LevelLayout level, Map<StageId, Long> timings, double reachability,
                                           CaveQualityReport quality, SolvabilityReport solvability) {
        return new GenerationResult(true, level, null, null, timings, reachability, quality, solvability);
    }

    public static GenerationResult failure(StageId stage, String error, Map<StageId, Long> timings) {
        return failure(stage, error, timings, null);
    }

    public static GenerationResult failure(StageId stage, String error, Map<StageId, Long> timings,
                                           SolvabilityReport solvability) {
        return new GenerationResult(false, null, stage, error, timings, 0.0, null, solvability);
    }
}
