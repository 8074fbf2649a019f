package com.purchasingpower.chemflow.inference;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.Confidence;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Decides the relationship between two stage-adjacent entries of one cluster.
 *
 * <p>Kinds are decided by an ordered rule list, first match wins:
 * <ol>
 *   <li>{@code PROVIDES_STRUCTURE} - structural step feeding an electronic-structure step</li>
 *   <li>{@code PROVIDES_ELECTRONIC_STRUCTURE} - electronic-structure step feeding a property step</li>
 *   <li>{@code PROVIDES_INPUT_DATA} - output files of the first meet input files of the second</li>
 *   <li>{@code SIMILAR_CALCULATION} - identical calculation types</li>
 * </ol>
 * Pairs with no matching rule fall back to {@code WORKFLOW_STEP}, the weakest kind.
 *
 * <p>Confidence is additive evidence clamped to [0, 1]. The weights below are
 * tunable heuristics with no calibration behind them; the score is a relative
 * evidence strength, not a probability.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class PairwiseRelationshipClassifier {

    public static final double BASE_CONFIDENCE = 0.5;
    public static final double FORMULA_MATCH_BONUS = 0.3;
    public static final double FILE_HANDOFF_BONUS = 0.2;
    public static final double STAGE_COMPATIBILITY_BONUS = 0.2;

    private record KindRule(BiPredicate<CalculationEntry, CalculationEntry> predicate, RelationshipKind kind) {
    }

    private static final List<KindRule> KIND_RULES = List.of(
            new KindRule((a, b) -> StageBand.STRUCTURE.matches(a.type()) && StageBand.ELECTRONIC.matches(b.type()),
                    RelationshipKind.PROVIDES_STRUCTURE),
            new KindRule((a, b) -> StageBand.ELECTRONIC.matches(a.type()) && StageBand.PROPERTY.matches(b.type()),
                    RelationshipKind.PROVIDES_ELECTRONIC_STRUCTURE),
            new KindRule(PairwiseRelationshipClassifier::isFileHandoff,
                    RelationshipKind.PROVIDES_INPUT_DATA),
            new KindRule((a, b) -> a.type().equals(b.type()),
                    RelationshipKind.SIMILAR_CALCULATION)
    );

    /**
     * Classify the ordered pair {@code (from, to)}.
     *
     * @param from       entry that runs earlier after stage sorting
     * @param to         entry directly after {@code from}
     * @param clusterKey cluster both entries belong to
     */
    public RelationshipCandidate classify(CalculationEntry from, CalculationEntry to, String clusterKey) {
        RelationshipKind kind = decideKind(from, to);
        double confidence = score(from, to);

        return RelationshipCandidate.builder()
                .fromId(from.id())
                .toId(to.id())
                .kind(kind)
                .confidence(confidence)
                .clusterKey(clusterKey)
                .reasoning(explain(from, to, kind, clusterKey))
                .build();
    }

    public RelationshipKind decideKind(CalculationEntry from, CalculationEntry to) {
        for (KindRule rule : KIND_RULES) {
            if (rule.predicate().test(from, to)) {
                return rule.kind();
            }
        }
        log.debug("No lexical or file cue between {} and {}, using WORKFLOW_STEP", from.id(), to.id());
        return RelationshipKind.WORKFLOW_STEP;
    }

    /**
     * Additive evidence score, clamped to [0, 1] and rounded by {@link Confidence#clamp}.
     */
    public double score(CalculationEntry from, CalculationEntry to) {
        double confidence = BASE_CONFIDENCE;

        if (from.hasFormula() && from.formula().equals(to.formula())) {
            confidence += FORMULA_MATCH_BONUS;
        }
        if (isFileHandoff(from, to)) {
            confidence += FILE_HANDOFF_BONUS;
        }
        if (StageBand.of(from.type()).isCompatibleWith(StageBand.of(to.type()))) {
            confidence += STAGE_COMPATIBILITY_BONUS;
        }
        return Confidence.clamp(confidence);
    }

    private static boolean isFileHandoff(CalculationEntry from, CalculationEntry to) {
        return from.hasOutputFiles() && to.hasInputFiles();
    }

    private static String explain(CalculationEntry from, CalculationEntry to, RelationshipKind kind, String clusterKey) {
        return String.format("%s (%s) -> %s (%s) in cluster %s: %s",
                from.type(), StageBand.of(from.type()), to.type(), StageBand.of(to.type()), clusterKey, kind);
    }
}
