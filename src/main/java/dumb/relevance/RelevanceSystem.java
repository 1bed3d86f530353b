package dumb.relevance;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Axiomatic view of one logic of the hierarchy. Each system inherits the theorems of the one below it:
 * {@link B} ⊂ {@link T} ⊂ {@link E} ⊂ {@link R}.
 */
public abstract class RelevanceSystem {

    public static RelevanceSystem of(LogicSystem system) {
        return switch (system) {
            case B -> new B();
            case T -> new T();
            case E -> new E();
            case R -> new R();
        };
    }

    public static RelevanceSystem create(String name) {
        return of(LogicSystem.parse(name));
    }

    public abstract LogicSystem system();

    public abstract Axioms axioms();

    public abstract FrameConditions frameConditions();

    public abstract boolean isTheoremValid(Formula f);

    /** Some premise must contain an atomic formula identical (predicate and arity) to one of the conclusion's. */
    public boolean validateInference(List<Formula> premises, Formula conclusion) {
        return premises.stream().anyMatch(p -> Formula.sharesAtom(p, conclusion));
    }

    public boolean isStrongerThan(RelevanceSystem other) {
        return LogicSystem.isStronger(system(), other.system());
    }

    @Override
    public String toString() {
        return system().id();
    }

    private static boolean implication(Formula f) {
        return f.is(Connective.IMPLIES);
    }

    /**
     * A∧(B∨C) distributed into (A∧B)∨(A∧C), or the same two formulas in the factoring direction.
     */
    public static boolean distributes(Formula from, Formula to) {
        return distributed(from, to) || distributed(to, from);
    }

    private static boolean distributed(Formula product, Formula sum) {
        if (!product.is(Connective.AND) || !product.arg(1).is(Connective.OR) || !sum.is(Connective.OR)) return false;
        var a = product.arg(0);
        var b = product.arg(1).arg(0);
        var c = product.arg(1).arg(1);
        var left = sum.arg(0);
        var right = sum.arg(1);
        return left.is(Connective.AND) && right.is(Connective.AND)
                && Formula.same(left.arg(0), a) && Formula.same(left.arg(1), b)
                && Formula.same(right.arg(0), a) && Formula.same(right.arg(1), c);
    }

    public record Axioms(boolean selfImplication, boolean distribution, boolean contraction,
                         boolean basicRelevance, boolean entailmentAxioms) {
        public JsonNode toJson() {
            return Json.node(this);
        }
    }

    public record FrameConditions(boolean minimal, boolean reflexivity, boolean commutativity, boolean associativity,
                                  boolean distributivity, boolean contraction, boolean basicRelevance) {
        public JsonNode toJson() {
            return Json.node(this);
        }
    }

    /** Basic relevance logic: only A → A. */
    public static class B extends RelevanceSystem {
        @Override
        public LogicSystem system() {
            return LogicSystem.B;
        }

        @Override
        public Axioms axioms() {
            return new Axioms(true, false, false, true, false);
        }

        @Override
        public FrameConditions frameConditions() {
            return new FrameConditions(true, false, false, false, false, false, true);
        }

        @Override
        public boolean isTheoremValid(Formula f) {
            return implication(f) && Formula.same(f.arg(0), f.arg(1));
        }
    }

    /** Adds contraction, A → (A ∧ A). */
    public static class T extends B {
        @Override
        public LogicSystem system() {
            return LogicSystem.T;
        }

        @Override
        public Axioms axioms() {
            return new Axioms(true, false, true, true, false);
        }

        @Override
        public FrameConditions frameConditions() {
            return new FrameConditions(false, true, false, false, false, true, true);
        }

        @Override
        public boolean isTheoremValid(Formula f) {
            if (super.isTheoremValid(f)) return true;
            if (!implication(f) || !f.arg(1).is(Connective.AND)) return false;
            var a = f.arg(0);
            var conj = f.arg(1);
            return Formula.same(a, conj.arg(0)) && Formula.same(a, conj.arg(1));
        }
    }

    /** Entailment: commutative and associative frames plus the entailment axioms, but no distribution. */
    public static class E extends T {
        @Override
        public LogicSystem system() {
            return LogicSystem.E;
        }

        @Override
        public Axioms axioms() {
            return new Axioms(true, false, true, true, true);
        }

        @Override
        public FrameConditions frameConditions() {
            return new FrameConditions(false, true, true, true, false, true, true);
        }

        @Override
        public boolean isTheoremValid(Formula f) {
            if (super.isTheoremValid(f)) return true;
            if (!implication(f)) return false;
            var a = f.arg(0);
            var b = f.arg(1);
            // (A ∧ B) → A and (A ∧ B) → B
            if (a.is(Connective.AND) && (Formula.same(a.arg(0), b) || Formula.same(a.arg(1), b))) return true;
            // A → (A ∨ B) and B → (A ∨ B)
            if (b.is(Connective.OR) && (Formula.same(b.arg(0), a) || Formula.same(b.arg(1), a))) return true;
            // ¬¬A → A
            return a.is(Connective.NOT) && a.arg(0).is(Connective.NOT) && Formula.same(a.arg(0).arg(0), b);
        }
    }

    /** The strongest system: everything in E plus distribution of ∧ over ∨. */
    public static class R extends E {
        @Override
        public LogicSystem system() {
            return LogicSystem.R;
        }

        @Override
        public Axioms axioms() {
            return new Axioms(true, true, true, true, true);
        }

        @Override
        public FrameConditions frameConditions() {
            return new FrameConditions(false, true, true, true, true, true, true);
        }

        @Override
        public boolean isTheoremValid(Formula f) {
            return super.isTheoremValid(f) || (implication(f) && distributed(f.arg(0), f.arg(1)));
        }
    }
}
