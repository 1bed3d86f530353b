package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Verdict of the syntactic relevance check. Violations are machine-parseable tags such as
 * {@code DISCONNECTED: 1 premise(s) not connected to conclusion - remove premises: P1}.
 */
public record ValidationResult(@JsonProperty("isValid") boolean valid,
                               List<String> violatedConstraints,
                               List<RelevanceLink> links) {

    public ValidationResult {
        violatedConstraints = List.copyOf(violatedConstraints);
        links = List.copyOf(links);
    }

    static ValidationResult fail(String violation) {
        return new ValidationResult(false, List.of(violation), List.of());
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    public enum Flow {
        /** The premise shares an atomic formula with the conclusion. */
        DIRECT,
        /** The premise reaches the conclusion only through other premises. */
        MEDIATED
    }

    /** How premise number {@code premise} (1-based) is tied to the conclusion. */
    public record RelevanceLink(int premise, List<String> sharedAtoms, Flow flow, double strength) {
        public RelevanceLink {
            sharedAtoms = List.copyOf(sharedAtoms);
        }
    }
}
