package dumb.relevance;

import dumb.relevance.ValidationResult.Flow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelevanceValidatorTest extends AbstractTest {

    private final RelevanceValidator validator = new RelevanceValidator();

    @Test
    void identicalPremiseIsCircular() {
        var r = validator.validate(formulas("mammal(dolphin)"), formula("mammal(dolphin)"));
        assertFalse(r.valid());
        assertEquals(List.of("CIRCULAR REASONING: Premise 1 is identical to conclusion - indicates missing explicit premises"),
                r.violatedConstraints());
    }

    @Test
    void conclusionAsConjunctIsCircular() {
        var r = validator.validate(formulas("P(x)", "P(x) ∧ Q(x)"), formula("Q(x)"));
        assertFalse(r.valid());
        assertEquals(List.of("CIRCULAR REASONING: Premise 2 contains conclusion as conjunct - indicates missing explicit premises"),
                r.violatedConstraints());
    }

    @Test
    void missingBridgeIsDisconnected() {
        var r = validator.validate(formulas("bird(x)"), formula("fly(x)"));
        assertFalse(r.valid());
        assertEquals(List.of("DISCONNECTED: 1 premise(s) not connected to conclusion - remove premises: P1"),
                r.violatedConstraints());
    }

    @Test
    void everyUnrelatedPremiseIsNamed() {
        var r = validator.validate(formulas("P(a)", "Q(b)"), formula("R(c)"));
        assertFalse(r.valid());
        assertEquals(List.of("DISCONNECTED: 2 premise(s) not connected to conclusion - remove premises: P1, P2"),
                r.violatedConstraints());
    }

    @Test
    void bridgedArgumentIsValid() {
        var r = validator.validate(formulas("bird(x)", "bird(x) -> fly(x)"), formula("fly(x)"));
        assertTrue(r.valid());
        assertTrue(r.violatedConstraints().isEmpty());

        assertEquals(2, r.links().size());
        var viaBridge = r.links().get(0);
        assertEquals(1, viaBridge.premise());
        assertEquals(Flow.MEDIATED, viaBridge.flow());
        assertEquals(0.0, viaBridge.strength());
        var direct = r.links().get(1);
        assertEquals(Flow.DIRECT, direct.flow());
        assertEquals(List.of("fly(x)"), direct.sharedAtoms());
        assertEquals(1.0, direct.strength());
    }

    @Test
    void connectivityIsTransitive() {
        var premises = formulas("A(x)", "A(x) -> B(x)", "B(x) -> C(x)", "D(y)");
        assertEquals(Set.of(0, 1, 2), RelevanceValidator.conclusionComponent(premises, formula("C(x)")));

        var r = validator.validate(premises, formula("C(x)"));
        assertEquals(List.of("DISCONNECTED: 1 premise(s) not connected to conclusion - remove premises: P4"),
                r.violatedConstraints());
    }

    @Test
    void sameFormulaByTextRegardlessOfId() {
        var built = f.atomic("mammal", Term.constant("dolphin"));
        var r = validator.validate(List.of(built), formula("mammal(dolphin)"));
        assertTrue(r.violatedConstraints().get(0).startsWith("CIRCULAR REASONING"));
    }

    @Test
    void emptyPremises() {
        var r = validator.validate(List.of(), formula("P(x)"));
        assertFalse(r.valid());
        assertEquals(List.of(RelevanceValidator.EMPTY_PREMISES), r.violatedConstraints());
    }

    @Test
    void quantifierScopesMustMatch() {
        var r = validator.validate(formulas("∀x(P(x))"), formula("∃x(P(x))"));
        assertFalse(r.valid());
        assertEquals(List.of("Premise 1 has incompatible quantifier variable binding with conclusion"), r.violatedConstraints());

        var nested = validator.validate(formulas("Q(a) -> ∀y(P(y))"), formula("∀x(P(x)) ∧ Q(a)"));
        assertEquals(List.of("Premise 1 has incompatible quantifier variable binding with conclusion"), nested.violatedConstraints());

        var same = validator.validate(formulas("∀x(P(x) -> Q(x))"), formula("∀x(Q(x))"));
        assertTrue(same.valid(), same.violatedConstraints().toString());
    }

    @Test
    void scopesAreCollectedAtAnyDepth() {
        var scopes = RelevanceValidator.scopes(formula("P(a) -> ∀x(∃y(loves(x, y)))"));
        assertEquals(List.of(new RelevanceValidator.Scope(Connective.FORALL, "x"), new RelevanceValidator.Scope(Connective.EXISTS, "y")),
                scopes);
    }

    @Test
    void distributionDependsOnTheSystem() {
        var premises = formulas("P(x) ∧ (Q(x) ∨ S(x))");
        var conclusion = formula("(P(x) ∧ Q(x)) ∨ (P(x) ∧ S(x))");

        assertTrue(validator.validate(premises, conclusion, LogicSystem.R).valid());
        assertTrue(validator.validate(premises, conclusion).valid());

        for (var weaker : List.of(LogicSystem.B, LogicSystem.T, LogicSystem.E)) {
            var r = validator.validate(premises, conclusion, weaker);
            assertFalse(r.valid());
            assertEquals(List.of("DISTRIBUTION: Premise 1 requires the distribution law, which system "
                    + weaker + " does not provide"), r.violatedConstraints());
        }
    }

    @Test
    void resultSerializesWithIsValid() {
        var json = validator.validate(formulas("bird(x)"), formula("fly(x)")).toJson();
        assertFalse(json.get("isValid").asBoolean());
        assertEquals(1, json.get("violatedConstraints").size());
    }
}
