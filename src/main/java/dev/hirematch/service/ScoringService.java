package dev.hirematch.service;

import dev.hirematch.config.ScoringConfig;
import dev.hirematch.model.ConfidenceLevel;
import dev.hirematch.model.EducationScore;
import dev.hirematch.model.ExperienceScore;
import dev.hirematch.model.HiringDecision;
import dev.hirematch.model.OverallResult;
import dev.hirematch.model.OverallResult.ComponentScores;
import dev.hirematch.model.OverallResult.Recommendation;
import dev.hirematch.model.RecommendationThresholds;
import dev.hirematch.model.ResumeAnalysis;
import dev.hirematch.model.ScoreBreakdown;
import dev.hirematch.model.SkillMatchResult;
import dev.hirematch.model.SkillsScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Multi-factor scoring engine: skills, experience, education and the overall recommendation.
 * <p>
 * Every public method returns a structurally complete result. Malformed input yields a
 * zero-valued breakdown with its {@code error} field set instead of an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {

    private final ScoringConfig scoringConfig;
    private final Clock clock;

    // Role relevance and industry match are fixed baselines until structured experience data is scored.
    static final double ROLE_RELEVANCE_BASELINE = 75;
    static final double INDUSTRY_MATCH_BASELINE = 70;

    private static final double MAYBE_FLOOR = 50;

    private static final Pattern YEARS_MENTION = Pattern.compile("\\b(\\d{1,3})\\+?\\s*years?");
    private static final Pattern YEAR_RANGE = Pattern.compile("\\b(\\d{4})\\s*-\\s*(\\d{4})\\b");
    private static final Pattern YEAR_TO_PRESENT = Pattern.compile("\\b(\\d{4})\\s*-\\s*present");

    private static final List<String> PROGRESSION_INDICATORS = List.of(
            "promoted", "senior", "lead", "manager", "director",
            "principal", "architect", "head of", "chief");

    // Highest rank first
    private static final List<String> DEGREE_LEVELS = List.of("phd", "doctorate", "master", "bachelor", "associate");
    private static final Map<String, Integer> DEGREE_RANKS = Map.of(
            "associate", 1, "bachelor", 2, "master", 3, "doctorate", 4, "phd", 4);

    private static final List<String> TECH_FIELDS = List.of(
            "computer science", "software", "engineering", "technology",
            "information systems", "data science", "mathematics", "statistics");

    private static final List<String> CERTIFICATION_INDICATORS = List.of(
            "certified", "certification", "aws", "azure", "google cloud",
            "pmp", "scrum master", "agile", "itil", "cissp");

    private static final List<String> ACHIEVEMENT_INDICATORS = List.of(
            "award", "recognition", "published", "patent", "led team",
            "increased", "improved", "reduced", "saved", "grew", "built");

    // ---------------------------------------------------------------- skills

    /**
     * Score the candidate's skills from match statistics.
     *
     * @param skillMatch result of {@link SkillMatchingService#matchSkills}
     * @return technical, depth and relevance sub-scores with their weighted total
     */
    public SkillsScore scoreSkills(SkillMatchResult skillMatch) {
        try {
            if (skillMatch == null) {
                throw new ScoreComputationException("skill match result is missing");
            }
            double overallMatch = requireScore("overall match score", skillMatch.overallScore());
            int exactCount = skillMatch.exactMatchCount();
            int missingCount = skillMatch.missingCount();

            double technical = Math.min(overallMatch, 100);
            double depth = depthScore(exactCount);
            double relevance = relevanceScore(exactCount, missingCount);

            double total = technical * 0.4 + depth * 0.3 + relevance * 0.3;

            return new SkillsScore(round(technical), depth, round(relevance), round(total),
                    new SkillsScore.Details(exactCount, missingCount, round(overallMatch)), null);
        } catch (RuntimeException e) {
            log.warn("Skills scoring failed: {}", e.getMessage());
            return SkillsScore.failed("Skills scoring error: " + e.getMessage());
        }
    }

    private double depthScore(int exactMatches) {
        if (exactMatches >= 8) {
            return 90;
        } else if (exactMatches >= 5) {
            return 75;
        } else if (exactMatches >= 3) {
            return 60;
        }
        return 40;
    }

    private double relevanceScore(int exact, int missing) {
        if (exact + missing == 0) {
            return 50;
        }
        return Math.min(exact * 100.0 / (exact + missing), 100);
    }

    // ------------------------------------------------------------ experience

    public ExperienceScore scoreExperience(String workHistory) {
        return scoreExperience(workHistory, null);
    }

    /**
     * Score work history.
     *
     * @param workHistory free-text work experience, may be null
     * @param analysis    optional structured fields from an upstream analysis layer; role relevance
     *                    and industry match stay at their baselines regardless
     * @return years, role, industry and progression sub-scores with their weighted total
     */
    public ExperienceScore scoreExperience(String workHistory, ResumeAnalysis analysis) {
        try {
            String text = workHistory != null ? workHistory.toLowerCase() : "";

            int years = detectYears(text);
            double yearsScore = yearsScore(years);
            double progression = progressionScore(text);

            if (analysis != null && !analysis.relevantRoles().isEmpty()) {
                log.debug("Upstream roles {} not used for role relevance", analysis.relevantRoles());
            }

            double total = yearsScore * 0.3
                    + ROLE_RELEVANCE_BASELINE * 0.4
                    + INDUSTRY_MATCH_BASELINE * 0.2
                    + progression * 0.1;

            return new ExperienceScore(yearsScore, ROLE_RELEVANCE_BASELINE, INDUSTRY_MATCH_BASELINE,
                    progression, round(total), years, null);
        } catch (RuntimeException e) {
            log.warn("Experience scoring failed: {}", e.getMessage());
            return ExperienceScore.failed("Experience scoring error: " + e.getMessage());
        }
    }

    /**
     * Years of experience: the larger of the biggest "N years" mention and the summed date ranges.
     * Mentions longer than three digits are not read as durations.
     */
    int detectYears(String text) {
        int largestMention = 0;
        Matcher mention = YEARS_MENTION.matcher(text);
        while (mention.find()) {
            largestMention = Math.max(largestMention, parseNumber(mention.group(1)));
        }

        int rangeTotal = 0;
        Matcher range = YEAR_RANGE.matcher(text);
        while (range.find()) {
            rangeTotal += rangeLength(parseNumber(range.group(1)), parseNumber(range.group(2)));
        }

        int currentYear = Year.now(clock).getValue();
        Matcher toPresent = YEAR_TO_PRESENT.matcher(text);
        while (toPresent.find()) {
            rangeTotal += rangeLength(parseNumber(toPresent.group(1)), currentYear);
        }

        return Math.max(largestMention, rangeTotal);
    }

    private int rangeLength(int start, int end) {
        if (end < start) {
            log.debug("Ignoring inverted year range {}-{}", start, end);
            return 0;
        }
        return end - start;
    }

    private int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ScoreComputationException("unreadable number '" + digits + "'", e);
        }
    }

    private double yearsScore(int years) {
        if (years >= 10) {
            return 100;
        } else if (years >= 7) {
            return 90;
        } else if (years >= 5) {
            return 80;
        } else if (years >= 3) {
            return 70;
        } else if (years >= 1) {
            return 60;
        }
        return 30;
    }

    private double progressionScore(String text) {
        double score = 50;
        for (String indicator : PROGRESSION_INDICATORS) {
            if (text.contains(indicator)) {
                score += 10;
            }
        }
        return Math.min(score, 100);
    }

    // ------------------------------------------------------------- education

    /**
     * Score education with certifications counted in the candidate's education text.
     */
    public EducationScore scoreEducation(String candidateEducation, String jobEducation) {
        return scoreEducation(candidateEducation, jobEducation, candidateEducation);
    }

    /**
     * Score education against the job's educational requirements.
     *
     * @param candidateEducation candidate education text, may be null
     * @param jobEducation       job educational requirements, may be null
     * @param achievements       text searched for certifications, may be null
     * @return degree, field and certification sub-scores with their weighted total
     */
    public EducationScore scoreEducation(String candidateEducation, String jobEducation, String achievements) {
        try {
            String education = lower(candidateEducation);
            String required = lower(jobEducation);

            double degree = degreeMatch(education, required);
            double field = fieldRelevance(education, required);
            double certifications = certificationScore(lower(achievements));

            double total = degree * 0.4 + field * 0.4 + certifications * 0.2;

            return new EducationScore(degree, field, certifications, round(total), null);
        } catch (RuntimeException e) {
            log.warn("Education scoring failed: {}", e.getMessage());
            return EducationScore.failed("Education scoring error: " + e.getMessage());
        }
    }

    private double degreeMatch(String education, String required) {
        String requiredDegree = highestDegree(required);
        if (requiredDegree == null) {
            return 80;
        }
        String candidateDegree = highestDegree(education);
        if (candidateDegree == null) {
            return 30;
        }

        int candidateRank = DEGREE_RANKS.get(candidateDegree);
        int requiredRank = DEGREE_RANKS.get(requiredDegree);

        if (candidateRank >= requiredRank) {
            return 100;
        } else if (candidateRank == requiredRank - 1) {
            return 70;
        }
        return 40;
    }

    private String highestDegree(String text) {
        return DEGREE_LEVELS.stream()
                .filter(text::contains)
                .findFirst()
                .orElse(null);
    }

    private double fieldRelevance(String education, String required) {
        boolean jobRequiresTech = TECH_FIELDS.stream().anyMatch(required::contains);
        if (!jobRequiresTech) {
            return 80;
        }
        boolean candidateHasTech = TECH_FIELDS.stream().anyMatch(education::contains);
        return candidateHasTech ? 90 : 50;
    }

    private double certificationScore(String text) {
        long count = CERTIFICATION_INDICATORS.stream().filter(text::contains).count();
        return Math.min(count * 20, 100);
    }

    // --------------------------------------------------------------- overall

    /**
     * Combine the factor scores using the configured thresholds.
     */
    public OverallResult scoreOverall(SkillsScore skills, ExperienceScore experience, EducationScore education,
            String achievements) {
        return scoreOverall(skills, experience, education, achievements, null);
    }

    /**
     * Combine the factor scores into an overall score and hiring recommendation.
     *
     * @param skills       skills breakdown
     * @param experience   experience breakdown
     * @param education    education breakdown
     * @param achievements free-text achievements, may be null
     * @param thresholds   recommendation cutoffs for this call, the configured ones when null
     * @return overall score, recommendation, risks, strengths and decision confidence
     */
    public OverallResult scoreOverall(SkillsScore skills, ExperienceScore experience, EducationScore education,
            String achievements, RecommendationThresholds thresholds) {
        try {
            RecommendationThresholds cutoffs = thresholds != null ? thresholds : configuredThresholds();
            double skillsTotal = totalOf("skills", skills);
            double experienceTotal = totalOf("experience", experience);
            double educationTotal = totalOf("education", education);
            double achievementsScore = achievementsScore(lower(achievements));

            ScoringConfig.Weights weights = scoringConfig.getWeights();
            double weighted = skillsTotal * requireWeight("skills", weights.getSkills())
                    + experienceTotal * requireWeight("experience", weights.getExperience())
                    + educationTotal * requireWeight("education", weights.getEducation())
                    + achievementsScore * requireWeight("achievements", weights.getAchievements());
            double unrounded = Math.max(0, Math.min(weighted, 100));
            double overall = round(unrounded);

            // Decision uses the unrounded score
            Recommendation decided = recommend(unrounded, cutoffs);
            Recommendation recommendation = new Recommendation(decided.decision(), decided.confidence(),
                    decided.reasoning(), overall);

            log.debug("Overall score {} -> {} (skills: {}, experience: {}, education: {}, achievements: {})",
                    overall, recommendation.decision().getLabel(),
                    skillsTotal, experienceTotal, educationTotal, achievementsScore);

            return new OverallResult(
                    overall,
                    new ComponentScores(skillsTotal, experienceTotal, educationTotal, achievementsScore),
                    recommendation,
                    riskFactors(skillsTotal, experienceTotal, educationTotal),
                    strengths(skillsTotal, experienceTotal, educationTotal),
                    decisionConfidence(overall, skillsTotal, experienceTotal),
                    null);
        } catch (RuntimeException e) {
            log.warn("Overall scoring failed: {}", e.getMessage());
            return OverallResult.failed("Overall scoring error: " + e.getMessage());
        }
    }

    private RecommendationThresholds configuredThresholds() {
        try {
            return scoringConfig.toThresholds();
        } catch (IllegalArgumentException e) {
            throw new ScoreComputationException("invalid configured thresholds: " + e.getMessage(), e);
        }
    }

    private double totalOf(String factor, ScoreBreakdown breakdown) {
        if (breakdown == null) {
            throw new ScoreComputationException(factor + " breakdown is missing");
        }
        return requireScore(factor + " total", breakdown.totalScore());
    }

    private double achievementsScore(String text) {
        double score = 50;
        for (String indicator : ACHIEVEMENT_INDICATORS) {
            if (text.contains(indicator)) {
                score += 8;
            }
        }
        return Math.min(score, 100);
    }

    /**
     * Map an overall score onto a hiring recommendation.
     */
    public Recommendation recommend(double overallScore, RecommendationThresholds thresholds) {
        if (overallScore >= thresholds.strongHireThreshold()) {
            return new Recommendation(HiringDecision.STRONG_HIRE, ConfidenceLevel.HIGH,
                    "Candidate demonstrates strong alignment with role requirements", overallScore);
        } else if (overallScore >= thresholds.hireThreshold()) {
            return new Recommendation(HiringDecision.HIRE, ConfidenceLevel.MEDIUM_HIGH,
                    "Candidate meets most requirements with some areas for development", overallScore);
        } else if (overallScore >= MAYBE_FLOOR) {
            return new Recommendation(HiringDecision.MAYBE, ConfidenceLevel.MEDIUM,
                    "Candidate shows potential but has significant gaps", overallScore);
        }
        return new Recommendation(HiringDecision.DONT_HIRE, ConfidenceLevel.HIGH,
                "Candidate does not meet minimum requirements", overallScore);
    }

    private List<String> riskFactors(double skills, double experience, double education) {
        List<String> risks = new ArrayList<>();
        if (skills < 60) {
            risks.add("Significant technical skill gaps");
        }
        if (experience < 50) {
            risks.add("Limited relevant experience");
        }
        if (education < 40) {
            risks.add("Educational background concerns");
        }
        return risks;
    }

    private List<String> strengths(double skills, double experience, double education) {
        List<String> strengths = new ArrayList<>();
        if (skills >= 80) {
            strengths.add("Strong technical skills");
        }
        if (experience >= 80) {
            strengths.add("Extensive relevant experience");
        }
        if (education >= 80) {
            strengths.add("Strong educational background");
        }
        return strengths;
    }

    private ConfidenceLevel decisionConfidence(double overall, double skills, double experience) {
        double variance = Math.max(skills, experience) - Math.min(skills, experience);
        if (variance < 20 && (overall > 80 || overall < 40)) {
            return ConfidenceLevel.HIGH;
        } else if (variance < 30) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    // --------------------------------------------------------------- helpers

    private static double requireScore(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ScoreComputationException(name + " is not a valid score: " + value);
        }
        return value;
    }

    private static double requireWeight(String factor, double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            throw new ScoreComputationException("weight for " + factor + " must be non-negative, got " + weight);
        }
        return weight;
    }

    private static String lower(String text) {
        return text != null ? text.toLowerCase() : "";
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
