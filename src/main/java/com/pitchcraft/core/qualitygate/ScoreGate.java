package com.pitchcraft.core.qualitygate;

import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.Decision;
import com.pitchcraft.core.workflow.WorkflowProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pass/fail gate over a critique's overall score. The threshold is inclusive.
 */
@Component
public class ScoreGate {

    public static final double DEFAULT_THRESHOLD = 7.5;

    private final double threshold;

    @Autowired
    public ScoreGate(WorkflowProperties properties) {
        this(properties.getPassThreshold());
    }

    public ScoreGate(double threshold) {
        this.threshold = threshold;
    }

    public Decision decide(double overall) {
        return overall >= threshold ? Decision.PASS : Decision.FAIL;
    }

    public Decision decide(Critique critique) {
        if (critique.degraded()) {
            return Decision.FAIL;
        }
        return decide(critique.overall());
    }

    public double threshold() {
        return threshold;
    }
}
