package org.carball.pgmaint.exception;

import org.carball.pgmaint.model.recommendation.RecommendationPass;

/**
 * One advisory pass failed; the remaining passes still produce recommendations.
 */
public class RecommendationPassException extends DatabaseOptimizationException {

    private final RecommendationPass pass;

    public RecommendationPassException(RecommendationPass pass, Throwable cause) {
        super("Recommendation pass '" + pass.getDisplayName() + "' failed: " + cause.getMessage(), cause);
        this.pass = pass;
    }

    public RecommendationPass getPass() {
        return pass;
    }
}
