package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.analyzer.chemistry.PeriodicGroup;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Links systems built from elements of the same periodic group, walking down the
 * group by atomic number (e.g. Li3 -> Na3, Cl8 -> Br8).
 *
 * <p>Within each group, entries are ordered by the lightest group element they
 * contain, then by formula and id; consecutive entries with different formulas
 * are linked. An entry containing elements of two groups takes part in both.
 */
@Component
public class PeriodicTrendAnalyzer extends AbstractFormulaAnalyzer {

    static final double CONFIDENCE = 0.9;

    @Override
    public String name() {
        return "periodic-trend";
    }

    @Override
    public RelationshipKind kind() {
        return RelationshipKind.PERIODIC_TREND;
    }

    @Override
    public List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope) {
        List<ParsedEntry> parsed = parseAll(population);
        List<RelationshipCandidate> candidates = new ArrayList<>();

        for (PeriodicGroup group : PeriodicGroup.values()) {
            List<ParsedEntry> members = parsed.stream()
                    .filter(p -> group.leadingAtomicNumber(p.formula()).isPresent())
                    .sorted(Comparator
                            .comparingInt((ParsedEntry p) -> group.leadingAtomicNumber(p.formula()).getAsInt())
                            .thenComparing(ParsedEntry::formulaText)
                            .thenComparing(ParsedEntry::id))
                    .toList();

            for (int i = 0; i + 1 < members.size(); i++) {
                ParsedEntry from = members.get(i);
                ParsedEntry to = members.get(i + 1);
                if (from.formulaText().equals(to.formulaText())) {
                    continue;
                }
                candidates.add(RelationshipCandidate.builder()
                        .fromId(from.id())
                        .toId(to.id())
                        .kind(RelationshipKind.PERIODIC_TREND)
                        .confidence(CONFIDENCE)
                        .clusterKey(sharedClusterKey(from.entry(), to.entry()))
                        .reasoning(String.format("Both %s and %s are %s, ordered down the group",
                                from.formulaText(), to.formulaText(), group.getLabel().replace('_', ' ')))
                        .attributes(Map.of("group", group.getLabel()))
                        .build());
            }
        }
        return candidates;
    }
}
