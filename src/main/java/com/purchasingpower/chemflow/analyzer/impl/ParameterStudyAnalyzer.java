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
 * Chains repeated calculations of one material inside one cluster: same formula,
 * same calculation type, presumably with varied parameters. Chains follow input order.
 */
@Component
public class ParameterStudyAnalyzer implements RelationshipAnalyzer {

    static final double CONFIDENCE = 0.6;

    private record StudyKey(String clusterKey, String formula, String type) {
    }

    @Override
    public String name() {
        return "parameter-study";
    }

    @Override
    public RelationshipKind kind() {
        return RelationshipKind.PARAMETER_STUDY;
    }

    @Override
    public List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope) {
        Map<StudyKey, List<CalculationEntry>> studies = new LinkedHashMap<>();
        for (CalculationEntry entry : population) {
            if (!entry.isClustered() || !entry.hasFormula()) {
                continue;
            }
            studies.computeIfAbsent(new StudyKey(entry.clusterKey(), entry.formula(), entry.type()),
                    k -> new ArrayList<>()).add(entry);
        }

        List<RelationshipCandidate> candidates = new ArrayList<>();
        studies.forEach((key, members) -> {
            for (int i = 0; i + 1 < members.size(); i++) {
                candidates.add(RelationshipCandidate.builder()
                        .fromId(members.get(i).id())
                        .toId(members.get(i + 1).id())
                        .kind(RelationshipKind.PARAMETER_STUDY)
                        .confidence(CONFIDENCE)
                        .clusterKey(key.clusterKey())
                        .reasoning(String.format("Step %d of %d in a %s parameter study of %s",
                                i + 1, members.size(), key.type(), key.formula()))
                        .attributes(Map.of("formula", key.formula(), "step_number", i + 1))
                        .build());
            }
        });
        return candidates;
    }
}
