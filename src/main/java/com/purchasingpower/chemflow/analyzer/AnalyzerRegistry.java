package com.purchasingpower.chemflow.analyzer;

import com.google.common.base.Preconditions;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds every {@link RelationshipAnalyzer} and runs them over one population.
 *
 * <p>Spring injects all analyzer beans. They run in name order so the candidate
 * stream is reproducible across runs and JVMs.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class AnalyzerRegistry {

    private final Map<String, RelationshipAnalyzer> analyzers;

    public AnalyzerRegistry(List<RelationshipAnalyzer> analyzers) {
        Preconditions.checkNotNull(analyzers, "Analyzers cannot be null");

        Map<String, RelationshipAnalyzer> byName = new LinkedHashMap<>();
        analyzers.stream()
                .sorted(Comparator.comparing(RelationshipAnalyzer::name))
                .forEach(analyzer -> {
                    RelationshipAnalyzer previous = byName.putIfAbsent(analyzer.name(), analyzer);
                    Preconditions.checkArgument(previous == null,
                            "Duplicate analyzer name '%s'", analyzer.name());
                });
        this.analyzers = byName;

        log.info("Registered {} relationship analyzers: {}", byName.size(), byName.keySet());
    }

    public Set<String> names() {
        return analyzers.keySet();
    }

    public List<RelationshipAnalyzer> analyzers() {
        return List.copyOf(analyzers.values());
    }

    /**
     * Run every enabled analyzer over the scoped population.
     *
     * @param population validated entry population
     * @param scope      cluster/element restriction
     * @param disabled   analyzer names to skip; unknown names are rejected
     * @return candidates in analyzer-name order
     */
    public List<RelationshipCandidate> runAll(List<CalculationEntry> population, AnalysisScope scope, Set<String> disabled) {
        for (String name : disabled) {
            Preconditions.checkArgument(analyzers.containsKey(name),
                    "Unknown analyzer '%s', known analyzers: %s", name, analyzers.keySet());
        }

        List<CalculationEntry> scoped = scope.apply(population);
        List<RelationshipCandidate> candidates = new ArrayList<>();

        for (RelationshipAnalyzer analyzer : analyzers.values()) {
            if (disabled.contains(analyzer.name())) {
                log.debug("Analyzer {} disabled, skipping", analyzer.name());
                continue;
            }
            List<RelationshipCandidate> produced = analyzer.analyze(scoped, scope);
            log.info("Analyzer {} produced {} {} candidates from {} entries",
                    analyzer.name(), produced.size(), analyzer.kind(), scoped.size());
            candidates.addAll(produced);
        }
        return candidates;
    }
}
