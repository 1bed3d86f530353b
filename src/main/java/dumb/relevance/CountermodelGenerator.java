package dumb.relevance;

import dumb.relevance.Formula.Atomic;
import dumb.relevance.Formula.Compound;
import dumb.relevance.Model.Triple;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.relevance.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Looks for a model in which every premise holds and the conclusion fails. Truth assignments are enumerated
 * in binary order, so the same argument always yields the same countermodel. An empty result only means none
 * was found within the configured bounds.
 */
public class CountermodelGenerator {

    static final String SIMPLE = "Simple counterexample showing lack of relevance";
    static final String NONE_FOUND = "No counterexample found - the argument appears to be valid.";
    private static final int MAX_BITS = 62;

    private final Configuration config;
    private final Semantics.Evaluator evaluator = new Semantics.Evaluator();

    public CountermodelGenerator(Configuration config) {
        this.config = requireNonNull(config);
    }

    public Optional<Countermodel> generate(Argument argument) {
        return generate(argument.premises(), argument.conclusion());
    }

    public Optional<Countermodel> generate(List<Formula> premises, Formula conclusion) {
        var symbols = symbols(premises, conclusion);
        var maxWorlds = symbols.size() >= 31 ? config.countermodelMaxWorlds()
                : (int) Math.min(config.countermodelMaxWorlds(), 1L << symbols.size());

        for (var worldCount = 2; worldCount <= maxWorlds; worldCount++) {
            var candidates = candidates(worldCount * symbols.size());
            for (long i = 0; i < candidates; i++) {
                var worlds = new ArrayList<World>(worldCount);
                for (var w = 0; w < worldCount; w++)
                    worlds.add(new World(Semantics.WORLD_PREFIX + w, assignment(symbols, w, i)));
                var frame = new LocalFrame(worlds, symbols);
                var falsifying = frame.falsifying(premises, conclusion);
                if (falsifying != null)
                    return Optional.of(new Countermodel(worlds, frame.relation(), falsifying.id(),
                            "Model with " + worldCount + " worlds"));
            }
        }
        debug("No countermodel within " + maxWorlds + " worlds for " + premises + " ⊢ " + conclusion);
        return Optional.empty();
    }

    /** Variables then predicates of each premise, then of the conclusion, without repeats. */
    static List<String> symbols(List<Formula> premises, Formula conclusion) {
        var symbols = new LinkedHashSet<String>();
        for (var p : premises) {
            symbols.addAll(p.variables());
            symbols.addAll(p.predicates());
        }
        symbols.addAll(conclusion.variables());
        symbols.addAll(conclusion.predicates());
        return List.copyOf(symbols);
    }

    private long candidates(int bits) {
        return bits >= MAX_BITS ? config.assignmentLimit() : Math.min(1L << bits, config.assignmentLimit());
    }

    /** Truth values of world {@code world}, read from its slice of the bits of {@code index}. */
    private static Map<String, Boolean> assignment(List<String> symbols, int world, long index) {
        var values = new LinkedHashMap<String, Boolean>();
        for (var s = 0; s < symbols.size(); s++) {
            var bit = world * symbols.size() + s;
            values.put(symbols.get(s), bit < MAX_BITS && (index & (1L << bit)) != 0);
        }
        return values;
    }

    /**
     * When premise and conclusion share neither variables nor predicates, the single world making everything
     * in the premise true and everything in the conclusion false refutes the inference.
     */
    public Optional<Countermodel> generateSimpleCounterexample(Formula premise, Formula conclusion) {
        if (!Formula.sharedVariables(premise, conclusion).isEmpty() || !Formula.sharedPredicates(premise, conclusion).isEmpty())
            return Optional.empty();
        var values = new LinkedHashMap<String, Boolean>();
        premise.variables().forEach(v -> values.put(v, true));
        premise.predicates().forEach(p -> values.put(p, true));
        conclusion.variables().forEach(v -> values.put(v, false));
        conclusion.predicates().forEach(p -> values.put(p, false));
        var world = new World(Semantics.WORLD_PREFIX + 0, values);
        return Optional.of(new Countermodel(List.of(world), List.of(), world.id(), SIMPLE));
    }

    public String explain(Countermodel model, List<Formula> premises, Formula conclusion) {
        var frame = new LocalFrame(model.worlds(), symbols(premises, conclusion));
        var w = frame.falsifying(premises, conclusion);
        if (w == null) return NONE_FOUND;

        var lines = new ArrayList<String>();
        lines.add("In world " + w.id() + ":");
        lines.add("  All premises are true:");
        for (var i = 0; i < premises.size(); i++)
            lines.add("    Premise " + (i + 1) + ": " + premises.get(i).text() + " = " + frame.eval(premises.get(i), w));
        lines.add("  But conclusion is false:");
        lines.add("    Conclusion: " + conclusion.text() + " = " + frame.eval(conclusion, w));
        lines.add("  Variable assignments:");
        w.assignments().forEach((k, v) -> lines.add("    " + k + " = " + v));
        return String.join("\n", lines);
    }

    /**
     * Countermodel in the ternary semantics of {@code system}: a model from
     * {@link Semantics.RelevanceModelBuilder} whose distinguished world satisfies every premise and not the
     * conclusion. Atomic formulas are assigned per predicate name.
     */
    public Optional<Model> searchTernary(List<Formula> premises, Formula conclusion, LogicSystem system) {
        var predicates = new LinkedHashSet<String>();
        premises.forEach(p -> Formula.atoms(p).forEach(a -> predicates.add(a.predicate)));
        Formula.atoms(conclusion).forEach(a -> predicates.add(a.predicate));
        var names = List.copyOf(predicates);

        for (var worldCount = 2; worldCount <= config.ternaryMaxWorlds(); worldCount++) {
            var base = Semantics.RelevanceModelBuilder.createModel(system, worldCount);
            var candidates = candidates(worldCount * names.size());
            for (long i = 0; i < candidates; i++) {
                var assignments = new LinkedHashMap<String, Map<String, Boolean>>();
                for (var w = 0; w < worldCount; w++)
                    assignments.put(base.worlds().get(w).id(), assignment(names, w, i));
                var model = base.withAssignments(assignments);
                if (premises.stream().allMatch(p -> evaluator.satisfies(model, p)) && !evaluator.satisfies(model, conclusion))
                    return Optional.of(model);
            }
        }
        debug("No " + system.id() + " countermodel within " + config.ternaryMaxWorlds() + " worlds");
        return Optional.empty();
    }

    /**
     * World-local evaluation: classical connectives at each world, and relevant implication through the
     * relation that holds between three worlds iff some symbol is true in all of them and none is false in
     * any. Implication between formulas without a common atomic formula is false.
     */
    private static final class LocalFrame {
        private final List<World> worlds;
        private final Set<String> full = new HashSet<>();

        LocalFrame(List<World> worlds, List<String> symbols) {
            this.worlds = worlds;
            for (var w : worlds)
                if (!symbols.isEmpty() && symbols.stream().allMatch(w::valueOf)) full.add(w.id());
        }

        boolean relates(World x, World y, World z) {
            return full.contains(x.id()) && full.contains(y.id()) && full.contains(z.id());
        }

        List<Triple> relation() {
            var triples = new ArrayList<Triple>();
            for (var x : worlds)
                for (var y : worlds)
                    for (var z : worlds)
                        if (relates(x, y, z)) triples.add(new Triple(x.id(), y.id(), z.id()));
            return triples;
        }

        @Nullable
        World falsifying(List<Formula> premises, Formula conclusion) {
            for (var w : worlds)
                if (premises.stream().allMatch(p -> eval(p, w)) && !eval(conclusion, w)) return w;
            return null;
        }

        boolean eval(Formula f, World w) {
            if (f instanceof Atomic a) return w.valueOf(a.predicate);
            var c = (Compound) f;
            return switch (c.op) {
                case AND, TIMES -> eval(c.arg(0), w) && eval(c.arg(1), w);
                case OR, PAR -> eval(c.arg(0), w) || eval(c.arg(1), w);
                case NOT -> !eval(c.arg(0), w);
                case IMPLIES, LOLLIPOP -> relevantImplication(c.arg(0), c.arg(1), w);
                case IFF -> relevantImplication(c.arg(0), c.arg(1), w) && relevantImplication(c.arg(1), c.arg(0), w);
                case ONE -> true;
                case BOTTOM -> false;
                case FORALL -> worlds.stream().allMatch(v -> eval(c.arg(0), v));
                case EXISTS -> worlds.stream().anyMatch(v -> eval(c.arg(0), v));
            };
        }

        private boolean relevantImplication(Formula antecedent, Formula consequent, World w) {
            if (!Formula.sharesAtom(antecedent, consequent)) return false;
            if (!eval(antecedent, w)) return true;
            for (var y : worlds)
                for (var z : worlds)
                    if (relates(w, y, z) && eval(antecedent, y) && !eval(consequent, z)) return false;
            return true;
        }
    }
}
