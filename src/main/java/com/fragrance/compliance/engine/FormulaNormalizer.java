package com.fragrance.compliance.engine;

import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.NormalizedEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts formula lines into concentrations in the finished product.
 * <p>
 * Amount-based lines are first expressed as % of the concentrate (amount / total amount),
 * percentage-based lines are taken as given; both are then scaled by the finished dosage.
 */
public class FormulaNormalizer {

    public List<NormalizedEntry> normalize(List<FormulaEntry> formula, double finishedDosage) {
        double totalAmount = totalAmount(formula);
        double dosageFactor = finishedDosage / 100.0;

        List<NormalizedEntry> normalized = new ArrayList<>(formula.size());
        for (FormulaEntry entry : formula) {
            double concentration;
            if (entry instanceof FormulaEntry.ByAmount byAmount) {
                concentration = totalAmount > 0
                        ? (byAmount.getAmount() / totalAmount) * 100.0 * dosageFactor
                        : 0.0;
            } else if (entry instanceof FormulaEntry.ByConcentration byConcentration) {
                concentration = byConcentration.getConcentration() * dosageFactor;
            } else {
                throw new IllegalArgumentException("Unsupported formula entry type: " + entry.getClass().getName());
            }
            String name = entry.getName() == null ? FormulaEntry.UNKNOWN_NAME : entry.getName();
            normalized.add(new NormalizedEntry(name, entry.getCas(), entry.getSku(), concentration));
        }
        return normalized;
    }

    // Summed smallest first so the total does not depend on formula order
    private double totalAmount(List<FormulaEntry> formula) {
        double[] amounts = formula.stream()
                .filter(FormulaEntry.ByAmount.class::isInstance)
                .mapToDouble(e -> ((FormulaEntry.ByAmount) e).getAmount())
                .sorted()
                .toArray();
        double total = 0.0;
        for (double amount : amounts) {
            total += amount;
        }
        return total;
    }
}
