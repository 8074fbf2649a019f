package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.analyzer.chemistry.ElementFamily;
import com.purchasingpower.chemflow.config.InferenceProperties;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Links atomic clusters of increasing size (Au2 -> Au4 -> Au8).
 *
 * <p>Entries are keyed by the primary element of their formula and by total atom
 * count. For every pair of consecutive sizes the first entry seen at each size is
 * linked, smaller to larger. Three tiers, strongest first:
 * <ul>
 *   <li>same element ({@value #SAME_ELEMENT_CONFIDENCE})</li>
 *   <li>same element family ({@value #FAMILY_CONFIDENCE})</li>
 *   <li>global size progression across elements ({@value #GLOBAL_CONFIDENCE}), opt-in</li>
 * </ul>
 * When two tiers propose the same pair, edge de-duplication keeps the strongest.
 */
@Component
public class ClusterSizeSeriesAnalyzer extends AbstractFormulaAnalyzer {

    static final double SAME_ELEMENT_CONFIDENCE = 0.95;
    static final double FAMILY_CONFIDENCE = 0.85;
    static final double GLOBAL_CONFIDENCE = 0.75;

    private final boolean includeGlobalSeries;

    @Autowired
    public ClusterSizeSeriesAnalyzer(InferenceProperties properties) {
        this(properties.isGlobalSizeSeries());
    }

    public ClusterSizeSeriesAnalyzer(boolean includeGlobalSeries) {
        this.includeGlobalSeries = includeGlobalSeries;
    }

    @Override
    public String name() {
        return "cluster-size-series";
    }

    @Override
    public RelationshipKind kind() {
        return RelationshipKind.CLUSTER_SIZE_SERIES;
    }

    @Override
    public List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope) {
        List<ParsedEntry> parsed = parseAll(population);
        List<RelationshipCandidate> candidates = new ArrayList<>();

        // same element
        Map<String, TreeMap<Integer, ParsedEntry>> byElement = index(parsed, p -> Optional.of(p.formula().primaryElement()));
        byElement.forEach((element, sizes) ->
                link(sizes, SAME_ELEMENT_CONFIDENCE, "same_element", "element", element, candidates));

        // element family
        Map<String, TreeMap<Integer, ParsedEntry>> byFamily = index(parsed,
                p -> ElementFamily.of(p.formula().primaryElement()).map(ElementFamily::getLabel));
        byFamily.forEach((family, sizes) ->
                link(sizes, FAMILY_CONFIDENCE, "element_family", "element_family", family, candidates));

        if (includeGlobalSeries) {
            Map<String, TreeMap<Integer, ParsedEntry>> global = index(parsed, p -> Optional.of("all"));
            global.forEach((all, sizes) ->
                    link(sizes, GLOBAL_CONFIDENCE, "global_size", null, null, candidates));
        }
        return candidates;
    }

    /**
     * Group key to (size to first entry seen at that size). Keys keep first-seen order.
     */
    private Map<String, TreeMap<Integer, ParsedEntry>> index(List<ParsedEntry> parsed,
                                                             Function<ParsedEntry, Optional<String>> keyOf) {
        Map<String, TreeMap<Integer, ParsedEntry>> index = new LinkedHashMap<>();
        for (ParsedEntry p : parsed) {
            keyOf.apply(p).ifPresent(key -> index
                    .computeIfAbsent(key, k -> new TreeMap<>())
                    .putIfAbsent(p.formula().totalAtoms(), p));
        }
        return index;
    }

    private void link(TreeMap<Integer, ParsedEntry> sizes, double confidence, String seriesType,
                      String groupAttribute, String groupValue, List<RelationshipCandidate> out) {
        if (sizes.size() < 2) {
            return;
        }
        List<Map.Entry<Integer, ParsedEntry>> ordered = new ArrayList<>(sizes.entrySet());
        for (int i = 0; i + 1 < ordered.size(); i++) {
            ParsedEntry smaller = ordered.get(i).getValue();
            ParsedEntry larger = ordered.get(i + 1).getValue();
            int smallerSize = ordered.get(i).getKey();
            int largerSize = ordered.get(i + 1).getKey();

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("series_type", seriesType);
            if (groupAttribute != null) {
                attributes.put(groupAttribute, groupValue);
            }
            attributes.put("smaller_size", smallerSize);
            attributes.put("larger_size", largerSize);

            out.add(RelationshipCandidate.builder()
                    .fromId(smaller.id())
                    .toId(larger.id())
                    .kind(RelationshipKind.CLUSTER_SIZE_SERIES)
                    .confidence(confidence)
                    .clusterKey(sharedClusterKey(smaller.entry(), larger.entry()))
                    .reasoning(String.format("Cluster size series (%s): %s (%d atoms) -> %s (%d atoms)",
                            seriesType, smaller.formulaText(), smallerSize, larger.formulaText(), largerSize))
                    .attributes(attributes)
                    .build());
        }
    }
}
