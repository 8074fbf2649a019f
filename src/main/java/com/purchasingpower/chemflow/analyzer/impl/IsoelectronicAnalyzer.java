package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Links different neutral species with the same total electron count
 * (e.g. N2 and CO, both 14 electrons).
 */
@Component
public class IsoelectronicAnalyzer extends AbstractFormulaAnalyzer {

    static final double CONFIDENCE = 0.7;

    @Override
    public String name() {
        return "isoelectronic";
    }

    @Override
    public RelationshipKind kind() {
        return RelationshipKind.ISOELECTRONIC;
    }

    @Override
    public List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope) {
        Map<Integer, List<ParsedEntry>> byElectrons = new TreeMap<>();
        for (ParsedEntry p : parseAll(population)) {
            byElectrons.computeIfAbsent(p.formula().electronCount(), k -> new ArrayList<>()).add(p);
        }

        List<RelationshipCandidate> candidates = new ArrayList<>();
        byElectrons.forEach((electrons, members) -> {
            List<ParsedEntry> ordered = members.stream()
                    .sorted(Comparator.comparing(ParsedEntry::formulaText).thenComparing(ParsedEntry::id))
                    .toList();

            for (int i = 0; i + 1 < ordered.size(); i++) {
                ParsedEntry from = ordered.get(i);
                ParsedEntry to = ordered.get(i + 1);
                if (from.formulaText().equals(to.formulaText())) {
                    continue;
                }
                candidates.add(RelationshipCandidate.builder()
                        .fromId(from.id())
                        .toId(to.id())
                        .kind(RelationshipKind.ISOELECTRONIC)
                        .confidence(CONFIDENCE)
                        .clusterKey(sharedClusterKey(from.entry(), to.entry()))
                        .reasoning(String.format("%s and %s are isoelectronic (%d electrons)",
                                from.formulaText(), to.formulaText(), electrons))
                        .attributes(Map.of("electron_count", electrons))
                        .build());
            }
        });
        return candidates;
    }
}
