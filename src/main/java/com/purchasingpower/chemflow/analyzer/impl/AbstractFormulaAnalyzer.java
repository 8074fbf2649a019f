package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.RelationshipAnalyzer;
import com.purchasingpower.chemflow.analyzer.chemistry.ChemicalFormula;
import com.purchasingpower.chemflow.analyzer.chemistry.FormulaParser;
import com.purchasingpower.chemflow.core.CalculationEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for analyzers that reason over parsed chemical formulas.
 * Entries whose formula is missing or unparseable are ignored.
 */
abstract class AbstractFormulaAnalyzer implements RelationshipAnalyzer {

    /**
     * An entry paired with its parsed formula.
     */
    protected record ParsedEntry(CalculationEntry entry, ChemicalFormula formula) {

        String id() {
            return entry.id();
        }

        String formulaText() {
            return formula.text();
        }
    }

    protected List<ParsedEntry> parseAll(List<CalculationEntry> population) {
        List<ParsedEntry> parsed = new ArrayList<>();
        for (CalculationEntry entry : population) {
            Optional<ChemicalFormula> formula = FormulaParser.parse(entry.formula());
            formula.ifPresent(f -> parsed.add(new ParsedEntry(entry, f)));
        }
        return parsed;
    }

    /**
     * Cluster key shared by both entries, empty when they come from different clusters.
     */
    protected static String sharedClusterKey(CalculationEntry a, CalculationEntry b) {
        return a.clusterKey().equals(b.clusterKey()) ? a.clusterKey() : "";
    }
}
