/* (C)2026 */
package com.ammann.valuation.gate;

import com.ammann.valuation.enumeration.GateKind;
import com.ammann.valuation.pass.PassDefinition;
import com.ammann.valuation.pass.PassRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs consistency, industry, value and quality gates in that order.
 *
 * <p>Every gate runs so the diagnostics are complete; the first blocking gate decides the hint.
 */
@ApplicationScoped
public class ValidationGateChain {

    private static final Logger LOG = Logger.getLogger(ValidationGateChain.class);

    private final List<ValidationGate> gates;
    private final PassRegistry registry;

    @Inject
    public ValidationGateChain(
            PassRegistry registry,
            @ConfigProperty(name = "valuation.gate.consistency.tolerance", defaultValue = "0.01")
                    double consistencyTolerance,
            @ConfigProperty(name = "valuation.gate.quality.pass-threshold", defaultValue = "70")
                    double qualityThreshold) {
        this(registry, List.of(
                new ConsistencyGate(consistencyTolerance),
                new IndustryGate(),
                new ValueGate(),
                new QualityGate(qualityThreshold)));
    }

    ValidationGateChain(PassRegistry registry, List<ValidationGate> gates) {
        this.registry = registry;
        this.gates = List.copyOf(gates);
    }

    public GateChainResult run(GateContext context) {
        List<GateResult> results = new ArrayList<>();
        GateResult firstBlocking = null;
        for (ValidationGate gate : gates) {
            GateResult result = gate.evaluate(context);
            results.add(result);
            if (result.blocking() && firstBlocking == null) {
                firstBlocking = result;
            }
        }

        if (firstBlocking == null) {
            LOG.infof("All %d gates passed for '%s'", results.size(), context.document().companyName());
            return new GateChainResult(results, null, null);
        }
        String hint = hintFor(firstBlocking, context);
        LOG.warnf("Finalization of '%s' blocked by %s gate: %s",
                context.document().companyName(), firstBlocking.gate().wireName(), hint);
        return new GateChainResult(results, firstBlocking.gate(), hint);
    }

    String hintFor(GateResult blocking, GateContext context) {
        if (blocking.gate() == GateKind.INDUSTRY) {
            Set<String> sections = blocking.errors().stream()
                    .map(GateIssue::field)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return "Re-run " + describePasses(sections)
                    + " to remove content from another industry, then regenerate the report";
        }
        if (blocking.gate() == GateKind.QUALITY) {
            Set<String> shortSections = shortSections(context);
            if (!shortSections.isEmpty()) {
                return "Re-run the narrative passes below minimum length: " + describePasses(shortSections)
                        + ", then regenerate the report";
            }
            return "Re-run from pass 1 (" + registry.get(1).key()
                    + ") to refresh financial extraction and resolve the data integrity findings";
        }
        if (blocking.gate() == GateKind.CONSISTENCY && !blocking.errors().isEmpty()
                && blocking.errors().stream()
                        .allMatch(issue -> GateIssue.NARRATIVE_VALUE_MISMATCH.equals(issue.code()))) {
            Set<String> sections = blocking.errors().stream()
                    .map(GateIssue::field)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return "Re-run " + describePasses(sections)
                    + " to restate the calculated figures, then regenerate the report";
        }
        return "Re-run from pass 1 (" + registry.get(1).key()
                + ") to refresh financial extraction, then regenerate the report";
    }

    private Set<String> shortSections(GateContext context) {
        Set<String> result = new LinkedHashSet<>();
        Map<String, String> sections = context.document().sections();
        context.minimumWords().forEach((key, minimum) -> {
            String text = sections.get(key);
            if (text == null || QualityGate.wordCount(text) < minimum) {
                result.add(key);
            }
        });
        return result;
    }

    private String describePasses(Set<String> sectionKeys) {
        List<String> described = new ArrayList<>();
        for (String key : sectionKeys) {
            described.add(registry.passForSection(key)
                    .map(ValidationGateChain::describe)
                    .orElse("the pass writing '" + key + "'"));
        }
        return String.join(", ", described);
    }

    private static String describe(PassDefinition pass) {
        return "pass " + pass.number() + " (" + pass.key() + ")";
    }
}
