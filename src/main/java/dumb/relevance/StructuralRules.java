package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static dumb.relevance.Log.debug;

/**
 * Contraction and exchange are admissible in every system of the hierarchy; weakening never is. A formula may
 * only join the premise set if it is a premise, a conjunct of one, or follows by modus ponens from an
 * implication whose antecedent and consequent share an atomic formula.
 */
public class StructuralRules {

    public List<Violation> checkStructuralRules(List<Formula> original, List<Formula> derived, LogicSystem system) {
        var violations = new ArrayList<Violation>();
        for (var f : derived) {
            if (!derivable(f, original))
                violations.add(new Violation(Rule.WEAKENING,
                        "Weakening rule violated: premise \"" + f.text() + "\" adds irrelevant content", f));
        }
        if (!canContract(derived, system))
            violations.add(new Violation(Rule.CONTRACTION, "System " + system + " does not admit contraction", null));
        return violations;
    }

    static boolean derivable(Formula target, List<Formula> premises) {
        if (Formula.contains(premises, target)) return true;
        for (var p : premises) {
            if (p.is(Connective.AND) && (Formula.same(p.arg(0), target) || Formula.same(p.arg(1), target)))
                return true;
        }
        for (var p : premises) {
            if (!(p instanceof Formula.Compound c) || !c.op.implication() || !Formula.same(p.arg(1), target)) continue;
            var antecedent = p.arg(0);
            if (Formula.contains(premises, antecedent) && Formula.sharesAtom(antecedent, p.arg(1)))
                return true;
        }
        return false;
    }

    /** Contraction: a premise may be used again. */
    public List<Formula> applyContraction(List<Formula> premises, Formula target) {
        var contracted = new ArrayList<>(premises);
        contracted.add(target);
        return contracted;
    }

    /** Whether {@code reordered} is a permutation of {@code premises}, comparing formulas by their text. */
    public boolean isExchangeValid(List<Formula> premises, List<Formula> reordered) {
        if (premises.size() != reordered.size()) return false;
        var remaining = new ArrayList<>(reordered);
        for (var p : premises) {
            var i = indexOf(remaining, p);
            if (i < 0) return false;
            remaining.remove(i);
        }
        return true;
    }

    private static int indexOf(List<Formula> formulas, Formula f) {
        for (var i = 0; i < formulas.size(); i++)
            if (Formula.same(formulas.get(i), f)) return i;
        return -1;
    }

    public Check validateInferenceStep(List<Formula> premises, Formula conclusion, String rule, LogicSystem system) {
        var violations = new ArrayList<Violation>();
        if (premises.stream().noneMatch(p -> Formula.sharesAtom(p, conclusion))) {
            violations.add(new Violation(Rule.WEAKENING,
                    "Conclusion does not share atomic formulas with premises (relevance violation)", conclusion));
            if (system == LogicSystem.B)
                violations.add(new Violation(Rule.WEAKENING,
                        "System B requires minimal relevance - inference too strong", conclusion));
        }
        if (!violations.isEmpty()) debug("Step by " + rule + " to " + conclusion + " rejected in " + system.id());
        return violations.isEmpty() ? Check.OK : new Check(false, violations, null);
    }

    public static boolean canContract(List<Formula> premises, LogicSystem system) {
        return true;
    }

    public static boolean canWeaken(List<Formula> original, List<Formula> additional, LogicSystem system) {
        return false;
    }

    public static boolean canExchange(List<Formula> premises, LogicSystem system) {
        return true;
    }

    public enum Rule {
        CONTRACTION, WEAKENING, EXCHANGE
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Violation(Rule rule, String description, @Nullable Formula formula) {
    }

    /** Outcome of a step or proof check. {@code step} is the 1-based index of the offending step, if any. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Check(boolean valid, List<Violation> violations, @Nullable Integer step) {
        static final Check OK = new Check(true, List.of(), null);

        public Check {
            violations = List.copyOf(violations);
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }

    /** Replays a linear proof, admitting each step only if it is relevant to and derivable from what precedes it. */
    public static class ProofValidator {
        private final StructuralRules rules;

        public ProofValidator() {
            this(new StructuralRules());
        }

        public ProofValidator(StructuralRules rules) {
            this.rules = rules;
        }

        public Check validateProof(List<Formula> premises, Formula conclusion, List<Proof.Step> steps, LogicSystem system) {
            var available = new ArrayList<>(premises);
            for (var i = 0; i < steps.size(); i++) {
                var step = steps.get(i);

                var stepCheck = rules.validateInferenceStep(available, step.formula(), step.rule(), system);
                if (!stepCheck.valid())
                    return new Check(false, stepCheck.violations(), i + 1);

                var weakening = rules.checkStructuralRules(available, List.of(step.formula()), system);
                if (!weakening.isEmpty())
                    return new Check(false, weakening, i + 1);

                available = new ArrayList<>(rules.applyContraction(available, step.formula()));
            }

            if (!Formula.contains(available, conclusion))
                return new Check(false, List.of(new Violation(Rule.WEAKENING,
                        "Proof does not derive the target conclusion", conclusion)), null);

            return Check.OK;
        }
    }
}
