package com.purchasingpower.chemflow.analyzer.chemistry;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses flat formulas such as {@code Au4}, {@code NaCl} or {@code C6H6}.
 *
 * <p>Only element-count tokens are understood. Formulas with brackets, charges,
 * unknown symbols or any other leftover characters are treated as unparseable
 * and yield {@link Optional#empty()}.
 */
public final class FormulaParser {

    private static final Pattern TOKEN = Pattern.compile("([A-Z][a-z]?)(\\d*)");
    private static final int MAX_COUNT_DIGITS = 6;

    private FormulaParser() {
    }

    public static Optional<ChemicalFormula> parse(String formula) {
        if (formula == null || formula.isBlank()) {
            return Optional.empty();
        }
        String text = formula.trim();
        Matcher matcher = TOKEN.matcher(text);
        Map<String, Integer> counts = new LinkedHashMap<>();
        int position = 0;

        while (matcher.find()) {
            if (matcher.start() != position) {
                return Optional.empty();
            }
            String element = matcher.group(1);
            if (!PeriodicTable.isElement(element)) {
                return Optional.empty();
            }
            String digits = matcher.group(2);
            if (digits.length() > MAX_COUNT_DIGITS) {
                return Optional.empty();
            }
            int count = digits.isEmpty() ? 1 : Integer.parseInt(digits);
            if (count == 0) {
                return Optional.empty();
            }
            counts.merge(element, count, Integer::sum);
            position = matcher.end();
        }

        if (position != text.length() || counts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ChemicalFormula(text, ImmutableMap.copyOf(counts)));
    }

    /**
     * Whether the formula contains the element (parsed, so {@code C} does not match {@code Cl}).
     */
    public static boolean containsElement(String formula, String element) {
        return parse(formula).map(f -> f.contains(element)).orElse(false);
    }
}
