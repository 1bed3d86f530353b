package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable formula tree. Two formulas are the same formula iff their canonical {@link #text()} is equal;
 * the identifier and the annotation never take part in comparisons.
 */
sealed public interface Formula permits Formula.Atomic, Formula.Compound {

    static String print(Formula f) {
        if (f instanceof Atomic a) {
            return a.terms.isEmpty() ? a.predicate
                    : a.terms.stream().map(Term::text).collect(Collectors.joining(", ", a.predicate + "(", ")"));
        }
        var c = (Compound) f;
        return switch (c.op) {
            case ONE, BOTTOM -> c.op.symbol;
            case NOT -> c.op.symbol + c.arg(0).text();
            case FORALL, EXISTS -> c.op.symbol + c.bound + "(" + c.arg(0).text() + ")";
            case AND, OR, IMPLIES, IFF, TIMES, LOLLIPOP, PAR ->
                    "(" + c.arg(0).text() + " " + c.op.symbol + " " + c.arg(1).text() + ")";
        };
    }

    static boolean same(Formula x, Formula y) {
        return x.text().equals(y.text());
    }

    static boolean contains(Iterable<? extends Formula> formulas, Formula f) {
        for (var x : formulas)
            if (same(x, f)) return true;
        return false;
    }

    static List<Atomic> atoms(Formula f) {
        var atoms = new ArrayList<Atomic>();
        collectAtoms(f, atoms);
        return atoms;
    }

    private static void collectAtoms(Formula f, List<Atomic> atoms) {
        if (f instanceof Atomic a) atoms.add(a);
        else f.args().forEach(sub -> collectAtoms(sub, atoms));
    }

    /** Same predicate symbol with the same number of arguments. */
    static boolean atomsIdentical(Atomic x, Atomic y) {
        return x.predicate.equals(y.predicate) && x.terms.size() == y.terms.size();
    }

    static boolean sharesAtom(Formula x, Formula y) {
        var ys = atoms(y);
        return atoms(x).stream().anyMatch(a -> ys.stream().anyMatch(b -> atomsIdentical(a, b)));
    }

    static List<Atomic> sharedAtoms(Formula x, Formula y) {
        var ys = atoms(y);
        var seen = new LinkedHashSet<String>();
        var shared = new ArrayList<Atomic>();
        for (var a : atoms(x))
            if (ys.stream().anyMatch(b -> atomsIdentical(a, b)) && seen.add(a.text()))
                shared.add(a);
        return shared;
    }

    static Set<String> sharedVariables(Formula x, Formula y) {
        var shared = new LinkedHashSet<>(x.variables());
        shared.retainAll(y.variables());
        return shared;
    }

    static Set<String> sharedPredicates(Formula x, Formula y) {
        var shared = new LinkedHashSet<>(x.predicates());
        shared.retainAll(y.predicates());
        return shared;
    }

    /** Content sharing in the sense of the proof rules: an identical atomic formula or a common variable. */
    static boolean shareContent(Formula x, Formula y) {
        return sharesAtom(x, y) || !sharedVariables(x, y).isEmpty();
    }

    static int complexity(Formula f) {
        return 1 + f.args().stream().mapToInt(Formula::complexity).sum();
    }

    static Set<String> freeVariables(Formula f) {
        if (f instanceof Atomic a) return a.variables;
        var c = (Compound) f;
        var free = new LinkedHashSet<String>();
        c.args.forEach(sub -> free.addAll(freeVariables(sub)));
        if (c.op.quantifier()) free.remove(c.bound);
        return Collections.unmodifiableSet(free);
    }

    static Set<String> constants(Formula f) {
        var constants = new LinkedHashSet<String>();
        for (var a : atoms(f))
            a.terms.forEach(t -> constants.addAll(t.constants()));
        return constants;
    }

    /** Canonical texts of f and all of its subformulas. */
    static Set<String> subformulas(Formula f) {
        var texts = new LinkedHashSet<String>();
        collectSubformulas(f, texts);
        return texts;
    }

    private static void collectSubformulas(Formula f, Set<String> texts) {
        if (texts.add(f.text()))
            f.args().forEach(sub -> collectSubformulas(sub, texts));
    }

    String id();

    @Nullable
    String note();

    Set<String> variables();

    Set<String> predicates();

    String text();

    List<Formula> args();

    default boolean is(Connective op) {
        return this instanceof Compound c && c.op == op;
    }

    default Formula arg(int index) {
        return args().get(index);
    }

    JsonNode toJson();

    final class Atomic implements Formula {
        public final String id;
        public final String predicate;
        public final List<Term> terms;
        @Nullable
        public final String note;
        private final Set<String> variables;
        private final Set<String> predicates;
        private final String text;

        Atomic(String id, String predicate, List<Term> terms, @Nullable String note) {
            this.id = requireNonNull(id);
            this.predicate = requireNonNull(predicate);
            if (predicate.isBlank()) throw new IllegalArgumentException("Predicate name must not be blank");
            this.terms = List.copyOf(terms);
            this.note = note;
            var vars = new LinkedHashSet<String>();
            this.terms.forEach(t -> vars.addAll(t.vars()));
            this.variables = Collections.unmodifiableSet(vars);
            this.predicates = Set.of(predicate);
            this.text = print(this);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public @Nullable String note() {
            return note;
        }

        @Override
        public Set<String> variables() {
            return variables;
        }

        @Override
        public Set<String> predicates() {
            return predicates;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public List<Formula> args() {
            return List.of();
        }

        public int arity() {
            return terms.size();
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            var json = Json.node()
                    .put("id", id)
                    .put("type", "atomic")
                    .put("text", text)
                    .put("predicate", predicate);
            if (note != null) json.put("note", note);
            return json;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Formula f && text.equals(f.text()));
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    final class Compound implements Formula {
        public final String id;
        public final Connective op;
        public final List<Formula> args;
        @Nullable
        public final String bound;
        @Nullable
        public final String note;
        private final Set<String> variables;
        private final Set<String> predicates;
        private final String text;

        Compound(String id, Connective op, List<Formula> args, @Nullable String bound, @Nullable String note) {
            this.id = requireNonNull(id);
            this.op = requireNonNull(op);
            this.args = List.copyOf(args);
            if (this.args.size() != op.arity)
                throw new IllegalArgumentException(op + " takes " + op.arity + " subformula(s), got " + this.args.size());
            if (op.quantifier() == (bound == null))
                throw new IllegalArgumentException(op.quantifier() ? op + " requires a bound variable" : op + " cannot bind a variable");
            this.bound = bound;
            this.note = note;

            var vars = new LinkedHashSet<String>();
            var preds = new LinkedHashSet<String>();
            this.args.forEach(sub -> {
                vars.addAll(sub.variables());
                preds.addAll(sub.predicates());
            });
            if (bound != null) vars.add(bound);
            if (op == Connective.ONE || op == Connective.BOTTOM) preds.add(op.symbol);
            this.variables = Collections.unmodifiableSet(vars);
            this.predicates = Collections.unmodifiableSet(preds);
            this.text = print(this);
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public @Nullable String note() {
            return note;
        }

        @Override
        public Set<String> variables() {
            return variables;
        }

        @Override
        public Set<String> predicates() {
            return predicates;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public List<Formula> args() {
            return args;
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            var json = Json.node()
                    .put("id", id)
                    .put("type", "compound")
                    .put("text", text)
                    .put("operator", op.name().toLowerCase());
            if (bound != null) json.put("bound", bound);
            if (note != null) json.put("note", note);
            return json;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Formula f && text.equals(f.text()));
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
