package dev.hirematch.service;

import dev.hirematch.metrics.AnalysisMetrics;
import dev.hirematch.model.AnalysisReport;
import dev.hirematch.model.CandidateProfile;
import dev.hirematch.model.CategorySkills;
import dev.hirematch.model.EducationScore;
import dev.hirematch.model.ExperienceScore;
import dev.hirematch.model.JobPosting;
import dev.hirematch.model.OverallResult;
import dev.hirematch.model.RecommendationThresholds;
import dev.hirematch.model.ResumeAnalysis;
import dev.hirematch.model.ScoreBreakdown;
import dev.hirematch.model.SkillDepth;
import dev.hirematch.model.SkillMatchResult;
import dev.hirematch.model.SkillsScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the full matching and scoring flow for one candidate against one job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateAnalysisService {

    private final SkillExtractionService skillExtractionService;
    private final SkillMatchingService skillMatchingService;
    private final ScoringService scoringService;
    private final SkillAdvisoryService skillAdvisoryService;
    private final AnalysisMetrics metrics;

    public AnalysisReport analyze(CandidateProfile candidate, JobPosting job) {
        return analyze(candidate, job, null, null);
    }

    /**
     * Analyze a candidate against a job.
     *
     * @param candidate  candidate profile
     * @param job        job posting
     * @param analysis   optional structured resume fields from an upstream analysis layer
     * @param thresholds recommendation cutoffs for this analysis, the configured ones when null
     * @return the complete report
     */
    public AnalysisReport analyze(CandidateProfile candidate, JobPosting job, ResumeAnalysis analysis,
            RecommendationThresholds thresholds) {
        long start = System.nanoTime();
        CandidateProfile profile = candidate != null ? candidate : CandidateProfile.of("");
        JobPosting posting = job != null ? job : JobPosting.of("");

        CategorySkills candidateSkills = skillExtractionService.extractSkills(profile.profileText());
        CategorySkills requiredSkills = skillExtractionService.extractSkills(posting.descriptionText());
        SkillMatchResult skillMatch = skillMatchingService.matchSkills(candidateSkills, requiredSkills);

        SkillsScore skillsScore = scoringService.scoreSkills(skillMatch);
        ExperienceScore experienceScore = scoringService.scoreExperience(
                profile.resolvedWorkExperience(), analysis);
        EducationScore educationScore = scoringService.scoreEducation(
                profile.resolvedEducation(),
                posting.resolvedEducationalRequirements(),
                profile.resolvedAchievements());

        OverallResult overall = scoringService.scoreOverall(
                skillsScore, experienceScore, educationScore, profile.resolvedAchievements(), thresholds);

        recordFailure("skills", skillsScore);
        recordFailure("experience", experienceScore);
        recordFailure("education", educationScore);
        if (overall.hasError()) {
            metrics.recordScoringFailure("overall");
        }

        Map<String, List<String>> recommendations = skillAdvisoryService.recommendations(skillMatch.missingSkills());
        Set<String> matched = new LinkedHashSet<>();
        skillMatch.exactMatches().values().forEach(matched::addAll);
        Map<String, SkillDepth> depth = skillAdvisoryService.analyzeDepth(profile.profileText(), matched);

        metrics.recordAnalysis(overall.recommendation().decision(), overall.overallScore(),
                skillMatch.overallScore(), Duration.ofNanos(System.nanoTime() - start));

        log.info("Analysis complete: {} (score: {}, skills matched: {}/{}, confidence: {})",
                overall.recommendation().decision().getLabel(), overall.overallScore(),
                skillMatch.totalMatched(), skillMatch.totalRequired(),
                overall.decisionConfidence().getLabel());

        return new AnalysisReport(candidateSkills, requiredSkills, skillMatch,
                skillsScore, experienceScore, educationScore, overall, recommendations, depth);
    }

    private void recordFailure(String factor, ScoreBreakdown breakdown) {
        if (breakdown.hasError()) {
            log.warn("{} score degraded: {}", factor, breakdown.error());
            metrics.recordScoringFailure(factor);
        }
    }
}
