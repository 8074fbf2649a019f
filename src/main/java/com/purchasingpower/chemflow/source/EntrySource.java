package com.purchasingpower.chemflow.source;

import com.purchasingpower.chemflow.core.CalculationEntry;

import java.util.List;

/**
 * Supplies the entry population for one inference run.
 */
public interface EntrySource {

    /**
     * @return entries in source order
     */
    List<CalculationEntry> load();

    /**
     * Short label used in logs.
     */
    String describe();
}
