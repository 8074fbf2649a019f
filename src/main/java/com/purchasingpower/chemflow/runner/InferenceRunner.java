package com.purchasingpower.chemflow.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chemflow.config.InferenceProperties;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.inference.InferenceOptions;
import com.purchasingpower.chemflow.inference.RelationshipInferenceEngine;
import com.purchasingpower.chemflow.report.InferenceReport;
import com.purchasingpower.chemflow.source.EntrySource;
import com.purchasingpower.chemflow.source.JsonFileEntrySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one inference pass over {@code app.inference.input-file} at startup.
 * Does nothing when no input file is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InferenceRunner implements CommandLineRunner {

    private final RelationshipInferenceEngine engine;
    private final InferenceProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) {
        String inputFile = properties.getInputFile();
        if (inputFile == null || inputFile.isBlank()) {
            log.info("No app.inference.input-file configured, runner idle");
            return;
        }

        EntrySource source = new JsonFileEntrySource(Path.of(inputFile.trim()), objectMapper);
        log.info("Running inference over {}", source.describe());

        List<CalculationEntry> entries = source.load();
        InferenceReport report = engine.run(entries, InferenceOptions.fromProperties(properties));

        log.info("Inference report:\n{}", toJson(report));
        if (!report.isSuccess()) {
            log.warn("⚠️  Run finished with {} failed edges and {} failed entry nodes",
                    report.getEdgesFailed().size(), report.getEntryNodesFailed());
        }
    }

    private String toJson(InferenceReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize report: {}", e.getMessage());
            return report.toString();
        }
    }
}
