package dev.hirematch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.hirematch.model.AnalysisReport;
import dev.hirematch.model.CandidateProfile;
import dev.hirematch.model.JobPosting;
import dev.hirematch.model.ResumeAnalysis;
import dev.hirematch.service.CandidateAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a candidate profile and a job description from disk, analyzes them and prints the report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisRunner {

    private static final String SEPARATOR = "========================================";

    private final CandidateAnalysisService candidateAnalysisService;
    private final ObjectMapper objectMapper;

    @Value("${analysis.candidate-file:}")
    private String candidateFile;

    @Value("${analysis.job-file:}")
    private String jobFile;

    @Value("${analysis.resume-analysis-file:}")
    private String resumeAnalysisFile;

    private PrintStream out = System.out;

    /**
     * Runs one analysis from the configured files.
     *
     * @return the report that was printed
     */
    public AnalysisReport execute() {
        log.info(SEPARATOR);
        log.info("Hire Match Analysis Starting");
        log.info(SEPARATOR);

        String candidateText = readText("analysis.candidate-file", candidateFile);
        String jobText = readText("analysis.job-file", jobFile);
        ResumeAnalysis resumeAnalysis = readResumeAnalysis();

        CandidateProfile candidate = CandidateProfile.from(candidateText, resumeAnalysis);
        JobPosting job = JobPosting.of(jobText);

        AnalysisReport report = candidateAnalysisService.analyze(candidate, job, resumeAnalysis, null);

        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize analysis report", e);
        }

        log.info(SEPARATOR);
        log.info("Recommendation: {} (score: {})",
                report.overall().recommendation().decision().getLabel(), report.overall().overallScore());
        log.info(SEPARATOR);
        return report;
    }

    private String readText(String property, String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalStateException("Property '" + property + "' is not set");
        }
        try {
            return Files.readString(Path.of(location), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {} from {}", property, location, e);
            throw new IllegalStateException("Could not read " + location, e);
        }
    }

    private ResumeAnalysis readResumeAnalysis() {
        if (resumeAnalysisFile == null || resumeAnalysisFile.isBlank()) {
            return null;
        }
        try {
            ResumeAnalysis analysis = objectMapper.readValue(Path.of(resumeAnalysisFile).toFile(), ResumeAnalysis.class);
            log.info("Loaded structured resume fields from {}", resumeAnalysisFile);
            return analysis;
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it matches the expected structure.", resumeAnalysisFile, e);
            throw new IllegalStateException("Could not load resume analysis", e);
        }
    }
}
