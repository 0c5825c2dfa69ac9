package com.cropadvisor.common.phenology;

/**
 * Where a GDD total falls in a crop's stage table.
 *
 * @param stageIndex      zero-based index into the stage table
 * @param stage           the matched stage row
 * @param lowerGdd        inclusive lower bound of the stage
 * @param stageProgress   linear position within the stage, 0..1
 * @param overallProgress {@code min(1, gdd / totalGddToMaturity)}
 * @param gddToNextStage  GDD still needed to leave this stage; 0 past the last bound
 */
public record StagePosition(int stageIndex, StageBoundary stage, double lowerGdd,
                            double stageProgress, double overallProgress,
                            double gddToNextStage) {

    public String stageName() {
        return stage.name();
    }
}
