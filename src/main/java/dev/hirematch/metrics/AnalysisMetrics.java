package dev.hirematch.metrics;

import dev.hirematch.model.HiringDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for candidate analyses.
 */
@Component
public class AnalysisMetrics {

    private static final String TAG_FACTOR = "factor";
    private static final String TAG_DECISION = "decision";
    private final MeterRegistry registry;

    private final Counter analysesCounter;
    private final Counter scoringFailuresCounter;
    private final Timer analysisTimer;

    // Stored as hundredths so the gauge keeps two decimals
    private final AtomicLong lastOverallScore = new AtomicLong(0);
    private final AtomicLong lastSkillMatch = new AtomicLong(0);

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.analysesCounter = Counter.builder("hire_match_analyses_total")
                .description("Total candidate/job analyses performed")
                .register(registry);

        this.scoringFailuresCounter = Counter.builder("hire_match_scoring_failures_total")
                .description("Total scoring steps that returned a degraded breakdown")
                .register(registry);

        this.analysisTimer = Timer.builder("hire_match_analysis_duration")
                .description("Time to analyze one candidate against one job")
                .register(registry);

        Gauge.builder("hire_match_last_overall_score", lastOverallScore, v -> v.get() / 100.0)
                .description("Overall score of the last analysis")
                .register(registry);

        Gauge.builder("hire_match_last_skill_match", lastSkillMatch, v -> v.get() / 100.0)
                .description("Skill match percentage of the last analysis")
                .register(registry);
    }

    /**
     * Record a completed analysis.
     */
    public void recordAnalysis(HiringDecision decision, double overallScore, double skillMatch, Duration elapsed) {
        analysesCounter.increment();
        analysisTimer.record(elapsed);
        lastOverallScore.set(Math.round(overallScore * 100));
        lastSkillMatch.set(Math.round(skillMatch * 100));
        Counter.builder("hire_match_decisions_total")
                .tag(TAG_DECISION, decision.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Record a scoring step that failed and was degraded to zero.
     */
    public void recordScoringFailure(String factor) {
        scoringFailuresCounter.increment();
        Counter.builder("hire_match_scoring_failures_by_factor_total")
                .tag(TAG_FACTOR, factor)
                .register(registry)
                .increment();
    }

    public Timer getAnalysisTimer() {
        return analysisTimer;
    }
}
