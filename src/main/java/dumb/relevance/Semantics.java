package dumb.relevance;

import dumb.relevance.Formula.Atomic;
import dumb.relevance.Formula.Compound;
import dumb.relevance.Model.TernaryRelation;
import dumb.relevance.Model.Triple;
import dumb.relevance.RelevanceSystem.FrameConditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ternary relational (Routley–Meyer) semantics: formula evaluation, frame-condition checking and
 * construction of a model for each system.
 */
public class Semantics {

    public static final String WORLD_PREFIX = "w";

    public static class Evaluator {

        public boolean evaluate(Formula f, World w, Model m) {
            if (f instanceof Atomic a) return w.valueOf(a.predicate);
            var c = (Compound) f;
            return switch (c.op) {
                case AND -> evaluate(c.arg(0), w, m) && evaluate(c.arg(1), w, m);
                case OR -> evaluate(c.arg(0), w, m) || evaluate(c.arg(1), w, m);
                case NOT -> !evaluate(c.arg(0), m.conjugate(w), m);
                case IMPLIES, LOLLIPOP -> implication(c.arg(0), c.arg(1), w, m);
                case IFF -> implication(c.arg(0), c.arg(1), w, m) && implication(c.arg(1), c.arg(0), w, m);
                case TIMES -> fusion(c.arg(0), false, c.arg(1), false, w, m);
                case PAR -> !fusion(c.arg(0), true, c.arg(1), true, w, m);
                case ONE -> w.id().equals(m.distinguished());
                case BOTTOM -> false;
                // assignments are propositional, so the body is read at the same world
                case FORALL, EXISTS -> evaluate(c.arg(0), w, m);
            };
        }

        /** For every b, c with R(w, b, c): b ⊩ antecedent implies c ⊩ consequent. */
        private boolean implication(Formula antecedent, Formula consequent, World w, Model m) {
            for (var b : m.worlds())
                for (var c : m.worlds())
                    if (m.relates(w, b, c) && evaluate(antecedent, b, m) && !evaluate(consequent, c, m))
                        return false;
            return true;
        }

        /**
         * Some b, c with R(b, c, w) where b ⊩ left and c ⊩ right. A negated side is evaluated as its relevant
         * negation, which is how ⅋ reads as ¬(¬A ⊗ ¬B).
         */
        private boolean fusion(Formula left, boolean negateLeft, Formula right, boolean negateRight, World w, Model m) {
            for (var b : m.worlds())
                for (var c : m.worlds())
                    if (m.relates(b, c, w) && holds(left, negateLeft, b, m) && holds(right, negateRight, c, m))
                        return true;
            return false;
        }

        private boolean holds(Formula f, boolean negated, World w, Model m) {
            return negated ? !evaluate(f, m.conjugate(w), m) : evaluate(f, w, m);
        }

        /** The formula holds at the distinguished world. */
        public boolean satisfies(Model m, Formula f) {
            return evaluate(f, m.distinguishedWorld(), m);
        }
    }

    public static class FrameConditionChecker {

        public static boolean validateFrameConditions(Model m, LogicSystem system) {
            return violations(m, RelevanceSystem.of(system).frameConditions()).isEmpty();
        }

        /** Names of the required conditions the model's relation fails. */
        public static List<String> violations(Model m, FrameConditions required) {
            var failed = new ArrayList<String>();
            var worlds = m.worlds();
            var base = m.distinguishedWorld();

            if (required.reflexivity() && !worlds.stream().allMatch(a -> m.relates(base, a, a)))
                failed.add("reflexivity");

            if (required.commutativity() && !commutative(m))
                failed.add("commutativity");

            if (required.contraction() && !worlds.stream().allMatch(a -> m.relates(a, a, a)))
                failed.add("contraction");

            if (required.associativity() && !associative(m))
                failed.add("associativity");

            // ∧ and ∨ are evaluated pointwise, so every frame distributes

            return failed;
        }

        private static boolean commutative(Model m) {
            for (var a : m.worlds())
                for (var b : m.worlds())
                    for (var c : m.worlds())
                        if (m.relates(a, b, c) != m.relates(b, a, c)) return false;
            return true;
        }

        /** R²(ab)cd implies R²a(bc)d: some x with R(a,b,x) and R(x,c,d) needs some y with R(b,c,y) and R(a,y,d). */
        private static boolean associative(Model m) {
            var worlds = m.worlds();
            for (var a : worlds)
                for (var b : worlds)
                    for (var x : worlds) {
                        if (!m.relates(a, b, x)) continue;
                        for (var c : worlds)
                            for (var d : worlds) {
                                if (!m.relates(x, c, d)) continue;
                                var regrouped = worlds.stream().anyMatch(y -> m.relates(b, c, y) && m.relates(a, y, d));
                                if (!regrouped) return false;
                            }
                    }
            return true;
        }
    }

    public static class RelevanceModelBuilder {

        public static Model createModel(LogicSystem system, int worldCount) {
            if (worldCount < 1) throw new IllegalArgumentException("A model needs at least one world");
            var frame = RelevanceSystem.of(system).frameConditions();

            var worlds = new ArrayList<World>(worldCount);
            for (var i = 0; i < worldCount; i++) worlds.add(new World(WORLD_PREFIX + i));

            var conjugation = new LinkedHashMap<String, String>();
            for (var i = 0; i < worldCount; i++)
                conjugation.put(worlds.get(i).id(), worlds.get((i + 1) % worldCount).id());

            var triples = switch (system) {
                case B -> identity(worlds);
                case T -> withBase(worlds);
                case E, R -> monoid(worlds);
            };

            return new Model(worlds, new TernaryRelation(triples), worlds.get(0).id(), conjugation, frame,
                    "Relevance model for system " + system.id() + " with " + worldCount + " worlds");
        }

        /** R(a, a, a) only. */
        private static Set<Triple> identity(List<World> worlds) {
            var t = new LinkedHashSet<Triple>();
            for (var w : worlds) t.add(new Triple(w.id(), w.id(), w.id()));
            return t;
        }

        /** Identity plus R(w0, a, a). */
        private static Set<Triple> withBase(List<World> worlds) {
            var t = identity(worlds);
            var base = worlds.get(0).id();
            for (var w : worlds) t.add(new Triple(base, w.id(), w.id()));
            return t;
        }

        /**
         * R(a, b, c) iff c = a·b in the partial commutative monoid where w0 is the unit, every world is
         * idempotent and the product of two distinct other worlds is undefined.
         */
        private static Set<Triple> monoid(List<World> worlds) {
            var t = withBase(worlds);
            var base = worlds.get(0).id();
            for (var w : worlds) t.add(new Triple(w.id(), base, w.id()));
            return t;
        }
    }
}
