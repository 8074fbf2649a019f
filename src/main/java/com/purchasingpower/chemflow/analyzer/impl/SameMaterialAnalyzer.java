package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.analyzer.RelationshipAnalyzer;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links the same material computed in different clusters.
 *
 * <p>For each formula, the first entry of every cluster is its representative;
 * every pair of representatives is linked in first-seen cluster order.
 */
@Component
public class SameMaterialAnalyzer implements RelationshipAnalyzer {

    static final double CONFIDENCE = 0.8;

    @Override
    public String name() {
        return "same-material";
    }

    @Override
    public RelationshipKind kind() {
        return RelationshipKind.SAME_MATERIAL;
    }

    @Override
    public List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope) {
        // formula -> cluster -> representative
        Map<String, Map<String, CalculationEntry>> representatives = new LinkedHashMap<>();
        for (CalculationEntry entry : population) {
            if (entry.hasFormula() && entry.isClustered()) {
                representatives.computeIfAbsent(entry.formula(), k -> new LinkedHashMap<>())
                        .putIfAbsent(entry.clusterKey(), entry);
            }
        }

        List<RelationshipCandidate> candidates = new ArrayList<>();
        representatives.forEach((formula, byCluster) -> {
            List<CalculationEntry> reps = List.copyOf(byCluster.values());
            for (int i = 0; i < reps.size(); i++) {
                for (int j = i + 1; j < reps.size(); j++) {
                    CalculationEntry from = reps.get(i);
                    CalculationEntry to = reps.get(j);
                    candidates.add(RelationshipCandidate.builder()
                            .fromId(from.id())
                            .toId(to.id())
                            .kind(RelationshipKind.SAME_MATERIAL)
                            .confidence(CONFIDENCE)
                            .reasoning(String.format("%s computed in clusters %s and %s",
                                    formula, from.clusterKey(), to.clusterKey()))
                            .attributes(Map.of("formula", formula))
                            .build());
                }
            }
        });
        return candidates;
    }
}
