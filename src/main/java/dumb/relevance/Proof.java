package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** A numbered derivation of {@code conclusion}; each step cites the earlier steps it was derived from. */
public record Proof(List<Step> steps, @JsonProperty("isValid") boolean valid, LogicSystem system,
                    List<Formula> premises, Formula conclusion) {

    public Proof {
        steps = List.copyOf(steps);
        requireNonNull(system);
        premises = List.copyOf(premises);
        requireNonNull(conclusion);
    }

    public int length() {
        return steps.size();
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public String toString() {
        return steps.stream().map(Step::toString).collect(Collectors.joining("\n"));
    }

    public record Step(int stepNumber, Formula formula, String rule, List<Integer> justification, String explanation) {
        public Step {
            requireNonNull(formula);
            requireNonNull(rule);
            justification = List.copyOf(justification);
        }

        @Override
        public String toString() {
            var cited = justification.isEmpty() ? "" : " " + justification;
            return stepNumber + ". " + formula.text() + "  (" + rule + cited + ")";
        }
    }
}
