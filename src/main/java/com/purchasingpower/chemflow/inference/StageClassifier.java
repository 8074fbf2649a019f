package com.purchasingpower.chemflow.inference;

import com.purchasingpower.chemflow.core.CalculationEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns each entry an execution-stage priority (lower runs earlier).
 *
 * <p>The priority is the band priority of the entry type, shifted by the file
 * evidence: input files without outputs look like an early step (-5), outputs
 * without inputs like a final step (+5). Priorities form a total preorder;
 * sorting is stable, so equal priorities keep their input order.
 *
 * <p><b>Thread Safety:</b> stateless, safe for concurrent use.
 *
 * @since 1.0.0
 */
@Component
public class StageClassifier {

    static final int EARLY_STEP_ADJUSTMENT = -5;
    static final int FINAL_STEP_ADJUSTMENT = 5;

    public StageBand band(CalculationEntry entry) {
        return StageBand.of(entry.type());
    }

    public int priority(CalculationEntry entry) {
        int priority = band(entry).getPriority();

        if (entry.hasInputFiles() && !entry.hasOutputFiles()) {
            priority += EARLY_STEP_ADJUSTMENT;
        } else if (entry.hasOutputFiles() && !entry.hasInputFiles()) {
            priority += FINAL_STEP_ADJUSTMENT;
        }
        return priority;
    }

    /**
     * Stable sort of one cluster by stage priority. The input list is not modified.
     */
    public List<CalculationEntry> sortByStage(List<CalculationEntry> entries) {
        List<CalculationEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(this::priority));
        return sorted;
    }
}
