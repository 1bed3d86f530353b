package dumb.relevance;

import dumb.relevance.Model.TernaryRelation;
import dumb.relevance.Model.Triple;
import dumb.relevance.Semantics.Evaluator;
import dumb.relevance.Semantics.FrameConditionChecker;
import dumb.relevance.Semantics.RelevanceModelBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticsTest extends AbstractTest {

    private final Evaluator evaluator = new Evaluator();

    /** Two-world R model with P true at w0 only and Q true at both. */
    private Model model() {
        return RelevanceModelBuilder.createModel(LogicSystem.R, 2).withAssignments(Map.of(
                "w0", Map.of("P", true, "Q", true),
                "w1", Map.of("P", false, "Q", true)));
    }

    @Test
    void builtModelShape() {
        var m = RelevanceModelBuilder.createModel(LogicSystem.T, 3);
        assertEquals(List.of("w0", "w1", "w2"), m.worlds().stream().map(World::id).toList());
        assertEquals("w0", m.distinguished());
        assertEquals("w1", m.conjugate(m.world("w0")).id());
        assertEquals("w0", m.conjugate(m.world("w2")).id());
        assertEquals("Relevance model for system relevance_T with 3 worlds", m.description());
        assertTrue(m.relates(m.world("w0"), m.world("w2"), m.world("w2")));
        assertFalse(m.relates(m.world("w2"), m.world("w0"), m.world("w2")));
        assertThrows(IllegalArgumentException.class, () -> RelevanceModelBuilder.createModel(LogicSystem.B, 0));
    }

    @ParameterizedTest
    @EnumSource(LogicSystem.class)
    void builtModelsSatisfyTheirOwnFrameConditions(LogicSystem system) {
        for (var n = 1; n <= 4; n++) {
            var m = RelevanceModelBuilder.createModel(system, n);
            assertTrue(FrameConditionChecker.validateFrameConditions(m, system), system + " with " + n + " worlds");
        }
    }

    @Test
    void weakModelFailsStrongerConditions() {
        var b = RelevanceModelBuilder.createModel(LogicSystem.B, 3);
        assertFalse(FrameConditionChecker.validateFrameConditions(b, LogicSystem.T));
        assertEquals(List.of("reflexivity"),
                FrameConditionChecker.violations(b, RelevanceSystem.of(LogicSystem.T).frameConditions()));

        var t = RelevanceModelBuilder.createModel(LogicSystem.T, 3);
        assertEquals(List.of("commutativity"),
                FrameConditionChecker.violations(t, RelevanceSystem.of(LogicSystem.E).frameConditions()));
    }

    @Test
    void associativityIsChecked() {
        var worlds = List.of(new World("a"), new World("b"), new World("c"));
        var relation = new TernaryRelation(Set.of(new Triple("a", "a", "b"), new Triple("b", "a", "c")));
        var m = new Model(worlds, relation, "a", Map.of("a", "a", "b", "b", "c", "c"),
                RelevanceSystem.of(LogicSystem.E).frameConditions(), "hand built");
        assertTrue(FrameConditionChecker.violations(m, RelevanceSystem.of(LogicSystem.E).frameConditions()).contains("associativity"));
    }

    @Test
    void atomsAndNegation() {
        var m = model();
        var w0 = m.world("w0");
        assertTrue(evaluator.evaluate(formula("P(x)"), w0, m));
        // ¬P at w0 is read at the conjugate w1, where P fails
        assertTrue(evaluator.evaluate(formula("¬P(x)"), w0, m));
        assertTrue(evaluator.evaluate(formula("P(x) ∧ ¬P(x)"), w0, m));
        assertFalse(evaluator.evaluate(formula("¬Q(x)"), w0, m));
        assertFalse(evaluator.evaluate(formula("P(x)"), m.world("w1"), m));
    }

    @Test
    void implicationFollowsTheRelation() {
        var m = model();
        assertTrue(evaluator.satisfies(m, formula("P(x) -> P(x)")));
        assertTrue(evaluator.satisfies(m, formula("P(x) -> Q(x)")));
        assertFalse(evaluator.satisfies(m, formula("Q(x) -> P(x)")));
        assertFalse(evaluator.satisfies(m, formula("Q(x) <-> P(x)")));
        assertTrue(evaluator.satisfies(m, formula("Q(x) ⊸ Q(x)")));
    }

    @Test
    void multiplicatives() {
        var m = model();
        var w0 = m.world("w0");
        var w1 = m.world("w1");
        assertTrue(evaluator.evaluate(formula("P(x) ⊗ Q(x)"), w0, m));
        assertTrue(evaluator.evaluate(formula("P(x) ⊗ Q(x)"), w1, m));
        assertFalse(evaluator.evaluate(formula("P(x) ⊗ P(x)"), w1, m));
        assertTrue(evaluator.evaluate(formula("I"), w0, m));
        assertFalse(evaluator.evaluate(formula("I"), w1, m));
        assertFalse(evaluator.evaluate(formula("⊥"), w0, m));
        assertTrue(evaluator.evaluate(formula("Q(x) ⅋ P(x)"), w1, m));
    }

    @Test
    void quantifiersReadTheBodyInPlace() {
        var m = model();
        assertTrue(evaluator.satisfies(m, formula("∀x(P(x))")));
        assertFalse(evaluator.evaluate(formula("∃x(P(x))"), m.world("w1"), m));
    }

    @Test
    void modelRejectsUnknownWorlds() {
        var worlds = List.of(new World("a"));
        var relation = new TernaryRelation(Set.of());
        var frame = RelevanceSystem.of(LogicSystem.B).frameConditions();
        assertThrows(IllegalArgumentException.class, () -> new Model(worlds, relation, "z", Map.of("a", "a"), frame, ""));
        assertThrows(IllegalArgumentException.class, () -> new Model(worlds, relation, "a", Map.of("a", "q"), frame, ""));
    }
}
