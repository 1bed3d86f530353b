package dumb.relevance;

import dumb.relevance.StructuralRules.ProofValidator;
import dumb.relevance.StructuralRules.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralRulesTest extends AbstractTest {

    private final StructuralRules rules = new StructuralRules();

    private Proof.Step step(int n, String text, String rule) {
        return new Proof.Step(n, formula(text), rule, List.of(), "");
    }

    @Test
    void weakeningIsFlagged() {
        var original = formulas("P(x) ∧ Q(x)", "P(x) -> (P(x) ∧ S(x))", "P(x)");
        var derived = formulas("Q(x)", "P(x) ∧ S(x)", "T(x)");
        var violations = rules.checkStructuralRules(original, derived, LogicSystem.R);
        assertEquals(1, violations.size());
        var v = violations.get(0);
        assertEquals(Rule.WEAKENING, v.rule());
        assertEquals("T(x)", v.formula().text());
        assertEquals("Weakening rule violated: premise \"T(x)\" adds irrelevant content", v.description());
    }

    @Test
    void modusPonensNeedsASharedAtom() {
        var premises = formulas("bird(x)", "bird(x) -> fly(x)");
        assertFalse(StructuralRules.derivable(formula("fly(x)"), premises));
        assertTrue(StructuralRules.derivable(formula("fly(x)"), formulas("bird(x)", "bird(x) -> (bird(x) ∧ fly(x))", "bird(x) ∧ fly(x)")));
        assertTrue(StructuralRules.derivable(formula("bird(x) ∧ bird(x)"), formulas("bird(x)", "bird(x) -> (bird(x) ∧ bird(x))")));
    }

    @Test
    void linearImplicationStepIsNotWeakening() {
        var premises = formulas("bird(x)", "bird(x) ⊸ (bird(x) ∧ fly(x))");
        assertTrue(StructuralRules.derivable(formula("bird(x) ∧ fly(x)"), premises));
        assertTrue(rules.checkStructuralRules(premises, formulas("bird(x) ∧ fly(x)"), LogicSystem.R).isEmpty());

        var validator = new ProofValidator();
        var steps = List.of(
                step(1, "bird(x)", ProofEngine.PREMISE),
                step(2, "bird(x) ⊸ (bird(x) ∧ fly(x))", ProofEngine.PREMISE),
                step(3, "bird(x) ∧ fly(x)", "Modus Ponens"));
        assertTrue(validator.validateProof(premises, formula("bird(x) ∧ fly(x)"), steps, LogicSystem.B).valid());
    }

    @Test
    void contractionAndExchangeAlwaysAllowed() {
        var premises = formulas("P(x)", "Q(x)");
        for (var s : LogicSystem.hierarchy()) {
            assertTrue(StructuralRules.canContract(premises, s));
            assertTrue(StructuralRules.canExchange(premises, s));
            assertFalse(StructuralRules.canWeaken(premises, formulas("S(x)"), s));
        }

        var contracted = rules.applyContraction(premises, premises.get(0));
        assertEquals(List.of("P(x)", "Q(x)", "P(x)"), contracted.stream().map(Formula::text).toList());
        assertEquals(2, premises.size());

        assertTrue(rules.isExchangeValid(premises, formulas("Q(x)", "P(x)")));
        assertFalse(rules.isExchangeValid(premises, formulas("Q(x)", "Q(x)")));
        assertFalse(rules.isExchangeValid(premises, formulas("Q(x)")));
    }

    @Test
    void irrelevantStepIsRejected() {
        var premises = formulas("P(x)");
        var r = rules.validateInferenceStep(premises, formula("Q(y)"), ProofEngine.MODUS_PONENS, LogicSystem.R);
        assertFalse(r.valid());
        assertEquals(List.of("Conclusion does not share atomic formulas with premises (relevance violation)"),
                r.violations().stream().map(StructuralRules.Violation::description).toList());

        var inB = rules.validateInferenceStep(premises, formula("Q(y)"), ProofEngine.MODUS_PONENS, LogicSystem.B);
        assertEquals(2, inB.violations().size());
        assertEquals("System B requires minimal relevance - inference too strong", inB.violations().get(1).description());

        assertTrue(rules.validateInferenceStep(premises, formula("P(x) ∧ P(x)"), ProofEngine.CONJUNCTION_INTRODUCTION, LogicSystem.B).valid());
    }

    @Test
    void proofIsReplayedStepByStep() {
        var validator = new ProofValidator();
        var premises = formulas("P(x) ∧ Q(x)", "Q(x) -> (Q(x) ∧ S(x))");
        var conclusion = formula("Q(x) ∧ S(x)");
        var steps = List.of(
                step(1, "P(x) ∧ Q(x)", ProofEngine.PREMISE),
                step(2, "Q(x)", "Conjunction Elimination"),
                step(3, "Q(x) -> (Q(x) ∧ S(x))", ProofEngine.PREMISE),
                step(4, "Q(x) ∧ S(x)", "Modus Ponens"));
        var r = validator.validateProof(premises, conclusion, steps, LogicSystem.R);
        assertTrue(r.valid(), r.violations().toString());
        assertNull(r.step());
    }

    @Test
    void firstBadStepIsReported() {
        var validator = new ProofValidator();
        var premises = formulas("P(x)", "P(x) -> Q(x)");
        var steps = List.of(
                step(1, "P(x)", ProofEngine.PREMISE),
                step(2, "P(x) ∧ S(x)", "Conjunction Introduction"),
                step(3, "Q(x)", "Modus Ponens"));
        var r = validator.validateProof(premises, formula("Q(x)"), steps, LogicSystem.R);
        assertFalse(r.valid());
        assertEquals(Integer.valueOf(2), r.step());
        assertEquals(Rule.WEAKENING, r.violations().get(0).rule());
    }

    @Test
    void proofMustReachTheConclusion() {
        var validator = new ProofValidator();
        var premises = formulas("P(x) ∧ Q(x)");
        var steps = List.of(step(1, "P(x)", "Conjunction Elimination"));
        var r = validator.validateProof(premises, formula("Q(x)"), steps, LogicSystem.T);
        assertFalse(r.valid());
        assertNull(r.step());
        assertEquals("Proof does not derive the target conclusion", r.violations().get(0).description());
        assertFalse(r.toJson().has("step"));
    }
}
