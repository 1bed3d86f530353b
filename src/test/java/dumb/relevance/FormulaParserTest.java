package dumb.relevance;

import dumb.relevance.FormulaParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaParserTest extends AbstractTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "P(x) -> Q(x)                 ; (P(x) → Q(x))",
            "P(x) → Q(x)                  ; (P(x) → Q(x))",
            "~P(x) & Q(x)                 ; (¬P(x) ∧ Q(x))",
            "!P(x) || Q(x)                ; (¬P(x) ∨ Q(x))",
            "P(x) <-> Q(x)                ; (P(x) ↔ Q(x))",
            "P(x) * Q(x) -o R(x)          ; ((P(x) ⊗ Q(x)) ⊸ R(x))",
            "P(x) ⅋ Q(x)                  ; (P(x) ⅋ Q(x))",
            "A -> B -> C                  ; (A → (B → C))",
            "A & B | C                    ; ((A ∧ B) ∨ C)",
            "A | B & C                    ; (A ∨ (B ∧ C))",
            "A & B & C                    ; ((A ∧ B) ∧ C)",
            "forall x. P(x) -> Q(x)       ; ∀x((P(x) → Q(x)))",
            "∀x(P(x)) -> Q(a)             ; (∀x(P(x)) → Q(a))",
            "exists y. loves(y, john)     ; ∃y(loves(y, john))",
            "I ⊗ ⊥                        ; (I ⊗ ⊥)"
    })
    void readsNotationIntoCanonicalText(String input, String canonical) {
        assertEquals(canonical, formula(input).text());
    }

    @Test
    void canonicalTextReadsBackToItself() {
        var g = formula("∀x((human(x) ∧ ¬dead(x)) → (mortal(x) ∨ I))");
        assertEquals(g.text(), formula(g.text()).text());
    }

    @Test
    void termKinds() {
        var a = (Formula.Atomic) formula("loves(x, ?lover, mary, father(z))");
        assertInstanceOf(Term.Var.class, a.terms.get(0));
        assertInstanceOf(Term.Var.class, a.terms.get(1));
        assertEquals("lover", a.terms.get(1).name());
        assertInstanceOf(Term.Const.class, a.terms.get(2));
        assertInstanceOf(Term.Fn.class, a.terms.get(3));
        assertEquals("loves(x, lover, mary, father(z))", a.text());
    }

    @Test
    void quantifiedNamesAreVariables() {
        var g = (Formula.Compound) formula("∀person(mortal(person))");
        assertEquals("person", g.bound);
        var body = (Formula.Atomic) g.arg(0);
        assertInstanceOf(Term.Var.class, body.terms.get(0));

        var outside = (Formula.Atomic) formula("mortal(person)");
        assertInstanceOf(Term.Const.class, outside.terms.get(0));
    }

    @Test
    void propositionalAtoms() {
        var g = formula("rain -> wet");
        assertTrue(g.is(Connective.IMPLIES));
        assertTrue(g.variables().isEmpty());
        assertEquals("rain", g.arg(0).text());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "P(x", "P(x) ->", "(P(x) ∧ Q(x)", "P(x) Q(x)", "∀(P(x))", "?p(x)", "P(x,)"})
    void rejectsMalformedInput(String input) {
        assertThrows(ParseException.class, () -> FormulaParser.parse(input, f));
    }

    @Test
    void parseErrorsCarryPosition() {
        var e = assertThrows(ParseException.class, () -> FormulaParser.parse("P(x) -> ", f));
        assertEquals(1, e.line());
        assertTrue(e.col() > 0);
        assertTrue(e.getMessage().contains("at line 1"), e.getMessage());
    }
}
