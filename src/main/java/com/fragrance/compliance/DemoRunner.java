package com.fragrance.compliance;

import com.fragrance.compliance.domain.ComplianceResult;
import com.fragrance.compliance.domain.FormulaEntry;
import com.fragrance.compliance.domain.StandardResult;
import com.fragrance.compliance.service.ComplianceService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "compliance.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final ComplianceService service;

    public DemoRunner(ComplianceService service) {
        this.service = service;
    }

    @Override
    public void run(String... args) throws Exception {
        System.out.println("=== STARTING IFRA COMPLIANCE DEMO (CATEGORY 4, 51ST AMENDMENT) ===");

        // 1. Stress formula, given in grams
        List<FormulaEntry> formula = Arrays.asList(
                // Specification only
                FormulaEntry.ofAmount("Linalool Synthetic from PerfumersWorld", 10.0),
                // Phototoxic oil, counted in the sum of ratios
                FormulaEntry.ofAmount("Lemon Essential Oil from PerfumersWorld", 5.0),
                // Phototoxic oil, FCF grade -> exempt from the sum of ratios
                FormulaEntry.ofAmount("Bergamot FCF oil Sicilian from PerfumersWorld", 15.0),
                // Group restriction (Rose Ketones)
                FormulaEntry.ofAmount("Alpha Damascone from PerfumersWorld", 0.1),
                FormulaEntry.ofAmount("Beta Damascone from PerfumersWorld", 0.15),
                // Schiff base, resolved into its parent aldehyde
                FormulaEntry.ofAmount("Aurantiol - Methyl Anthranilate Schiffs Base from PerfumersWorld", 2.0),
                // Sensitizer set deliberately high
                FormulaEntry.ofAmount("Hydroxycitronellal from PerfumersWorld", 3.0),
                // Missing from the database
                FormulaEntry.ofAmount("Mystery Material X (Not in DB)", 1.0),
                // Partial composition (< 90%)
                FormulaEntry.ofAmount("Lavandin absolute from PerfumersWorld", 2.0),
                FormulaEntry.ofAmount("Phenyl Ethyl Alcohol (PEA) from PerfumersWorld", 13.65)
        );

        // 2. Pure concentrate, then eau de parfum
        try {
            print(service.checkCompliance(formula, 100.0));
            print(service.checkCompliance(formula, 20.0));
        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    private void print(ComplianceResult result) {
        System.out.println("\nFinished Dosage: " + result.getFinishedDosage() + "%");
        System.out.println("Overall: " + (result.isCompliant() ? "PASS" : "FAIL"));
        System.out.println("Critical Component: " + result.getCriticalComponent());
        System.out.printf("Max Safe Dosage: %.4f%%\n", result.getMaxSafeDosage());

        if (!result.getUnresolvedMaterials().isEmpty()) {
            System.out.println("Not in database: " + result.getUnresolvedMaterials());
        }
        result.getDataIntegrityWarnings().forEach(w -> System.out.println("Integrity: " + w));

        System.out.println("\n--- STANDARDS ---");
        result.getResults().stream()
                .sorted(Comparator.comparingDouble(StandardResult::getRatio).reversed())
                .forEach(r -> System.out.printf("%s %-32s %10.6f  limit %-20s ratio %.2f\n",
                        r.isPass() ? "OK  " : "FAIL", r.getStandardName(), r.getConcentration(),
                        r.getLimitDisplay(), r.getRatio()));

        System.out.printf("Phototoxicity sum of ratios: %.4f (%s)\n",
                result.getPhototoxicity().getSumOfRatios(), result.getPhototoxicity().isPass() ? "PASS" : "FAIL");
    }
}
