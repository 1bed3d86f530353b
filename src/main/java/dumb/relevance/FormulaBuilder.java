package dumb.relevance;

import dumb.relevance.Formula.Atomic;
import dumb.relevance.Formula.Compound;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session formula arena. Owns the identifier counter so independent sessions number their formulas
 * identically and never observe each other's allocations.
 */
public class FormulaBuilder {

    public static final String ID_PREFIX = "formula_";

    private final AtomicLong idCounter = new AtomicLong(0);

    public String nextId() {
        return ID_PREFIX + idCounter.incrementAndGet();
    }

    public long allocated() {
        return idCounter.get();
    }

    public void reset() {
        idCounter.set(0);
    }

    public Atomic atomic(String predicate, Term... terms) {
        return atomic(predicate, List.of(terms), null);
    }

    public Atomic atomic(String predicate, List<Term> terms, @Nullable String note) {
        return new Atomic(nextId(), predicate, terms, note);
    }

    public Compound compound(Connective op, List<Formula> args, @Nullable String bound, @Nullable String note) {
        return new Compound(nextId(), op, args, bound, note);
    }

    public Compound and(Formula left, Formula right) {
        return binary(Connective.AND, left, right);
    }

    public Compound or(Formula left, Formula right) {
        return binary(Connective.OR, left, right);
    }

    public Compound not(Formula f) {
        return compound(Connective.NOT, List.of(f), null, null);
    }

    public Compound implies(Formula antecedent, Formula consequent) {
        return binary(Connective.IMPLIES, antecedent, consequent);
    }

    public Compound iff(Formula left, Formula right) {
        return binary(Connective.IFF, left, right);
    }

    public Compound times(Formula left, Formula right) {
        return binary(Connective.TIMES, left, right);
    }

    public Compound lollipop(Formula antecedent, Formula consequent) {
        return binary(Connective.LOLLIPOP, antecedent, consequent);
    }

    public Compound par(Formula left, Formula right) {
        return binary(Connective.PAR, left, right);
    }

    public Compound one() {
        return compound(Connective.ONE, List.of(), null, null);
    }

    public Compound bottom() {
        return compound(Connective.BOTTOM, List.of(), null, null);
    }

    public Compound forall(String var, Formula body) {
        return compound(Connective.FORALL, List.of(body), var, null);
    }

    public Compound exists(String var, Formula body) {
        return compound(Connective.EXISTS, List.of(body), var, null);
    }

    public Compound binary(Connective op, Formula left, Formula right) {
        return compound(op, List.of(left, right), null, null);
    }

    /** Rebuilds f with the operator and children of the original, so the copy gets a fresh id. */
    public Formula annotate(Formula f, String note) {
        if (f instanceof Atomic a) return atomic(a.predicate, a.terms, note);
        var c = (Compound) f;
        return compound(c.op, c.args, c.bound, note);
    }

    /**
     * Replaces the free occurrences of {@code var} in f by {@code value}. Subtrees in which a quantifier
     * rebinds {@code var} are left untouched.
     */
    public Formula substitute(Formula f, String var, Term value) {
        if (!f.variables().contains(var)) return f;
        if (f instanceof Atomic a)
            return atomic(a.predicate, a.terms.stream().map(t -> t.subst(var, value)).toList(), a.note);
        var c = (Compound) f;
        if (c.op.quantifier() && var.equals(c.bound)) return c;
        return compound(c.op, c.args.stream().map(sub -> substitute(sub, var, value)).toList(), c.bound, c.note);
    }
}
