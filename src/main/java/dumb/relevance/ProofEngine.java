package dumb.relevance;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dumb.relevance.Log.debug;
import static dumb.relevance.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Rule-based proof search. An argument must first pass the relevance score gate and the system's sharing
 * requirement; the search then saturates the premises under the eliminating rules and chains backward from
 * the conclusion through introduction sub-goals.
 */
public class ProofEngine {

    public static final String PREMISE = "Premise";
    public static final String MODUS_PONENS = "modus_ponens";
    public static final String CONJUNCTION_INTRODUCTION = "conjunction_introduction";
    public static final String CONJUNCTION_ELIMINATION = "conjunction_elimination";
    public static final String UNIVERSAL_INSTANTIATION = "universal_instantiation";
    public static final String HYPOTHETICAL_SYLLOGISM = "hypothetical_syllogism";

    static final String NOT_RELEVANT = "Conclusion does not share sufficient variables with premises";
    static final String NO_PROOF = "No valid proof found";
    static final String LONG_PROOF = "Proof is quite long";

    private static final double VARIABLE_WEIGHT = 0.6;
    private static final double PREDICATE_WEIGHT = 0.4;

    private final Map<String, InferenceRule> rules = new LinkedHashMap<>();
    private final FormulaBuilder builder;
    private final Configuration config;
    private final CountermodelGenerator countermodels;

    public ProofEngine(FormulaBuilder builder, Configuration config) {
        this(builder, config, new CountermodelGenerator(config));
    }

    public ProofEngine(FormulaBuilder builder, Configuration config, CountermodelGenerator countermodels) {
        this.builder = requireNonNull(builder);
        this.config = requireNonNull(config);
        this.countermodels = requireNonNull(countermodels);
        initializeRules();
    }

    private void initializeRules() {
        rules.put(MODUS_PONENS, new InferenceRule("Modus Ponens", "From A and A → B, infer B", true, false, (known, target) -> {
            var results = new ArrayList<Derived>();
            for (var imp : known) {
                if (!implication(imp)) continue;
                var antecedent = imp.arg(0);
                var consequent = imp.arg(1);
                if (Formula.contains(known, antecedent) && Formula.shareContent(antecedent, consequent))
                    results.add(new Derived(consequent, List.of(antecedent, imp)));
            }
            return results;
        }));

        rules.put(CONJUNCTION_INTRODUCTION, new InferenceRule("Conjunction Introduction", "From A and B, infer A ∧ B", true, true, (known, target) -> {
            var wanted = Formula.subformulas(target);
            var results = new ArrayList<Derived>();
            for (var a : known)
                for (var b : known) {
                    if (a == b || !wanted.contains("(" + a.text() + " " + Connective.AND.symbol + " " + b.text() + ")")) continue;
                    if (Formula.shareContent(a, b)) results.add(new Derived(builder.and(a, b), List.of(a, b)));
                }
            return results;
        }));

        rules.put(CONJUNCTION_ELIMINATION, new InferenceRule("Conjunction Elimination", "From A ∧ B, infer A (or B)", false, false, (known, target) -> {
            var results = new ArrayList<Derived>();
            for (var f : known)
                if (f.is(Connective.AND)) {
                    results.add(new Derived(f.arg(0), List.of(f)));
                    results.add(new Derived(f.arg(1), List.of(f)));
                }
            return results;
        }));

        rules.put(UNIVERSAL_INSTANTIATION, new InferenceRule("Universal Instantiation", "From ∀x P(x), infer P(a) for any constant a", false, true, (known, target) -> {
            var constants = new LinkedHashSet<String>();
            known.forEach(f -> constants.addAll(Formula.constants(f)));
            constants.addAll(Formula.constants(target));
            var results = new ArrayList<Derived>();
            for (var f : known) {
                if (!(f instanceof Formula.Compound c) || c.op != Connective.FORALL) continue;
                var body = c.arg(0);
                for (var k : constants)
                    results.add(new Derived(builder.substitute(body, c.bound, Term.constant(k)), List.of(f)));
                for (var v : Formula.freeVariables(target))
                    results.add(new Derived(builder.substitute(body, c.bound, Term.var(v)), List.of(f)));
            }
            return results;
        }));

        rules.put(HYPOTHETICAL_SYLLOGISM, new InferenceRule("Hypothetical Syllogism", "From A → B and B → C, infer A → C", true, false, (known, target) -> {
            var results = new ArrayList<Derived>();
            for (var first : known) {
                if (!implication(first)) continue;
                for (var second : known) {
                    if (first == second || !implication(second) || !Formula.same(first.arg(1), second.arg(0))) continue;
                    var a = first.arg(0);
                    var c = second.arg(1);
                    if (Formula.shareContent(a, c))
                        results.add(new Derived(chain(first, second), List.of(first, second)));
                }
            }
            return results;
        }));
    }

    private static boolean implication(Formula f) {
        return f instanceof Formula.Compound c && c.op.implication();
    }

    /** A → C from A → B and B → C; linear if either link is. */
    private Formula chain(Formula first, Formula second) {
        var op = first.is(Connective.LOLLIPOP) || second.is(Connective.LOLLIPOP) ? Connective.LOLLIPOP : Connective.IMPLIES;
        return builder.binary(op, first.arg(0), second.arg(1));
    }

    public List<String> supportedRules() {
        return List.copyOf(rules.keySet());
    }

    public String ruleDescription(String rule) {
        var r = rules.get(rule);
        return r != null ? r.description() : "Rule not found";
    }

    /**
     * Mean over the premises that have any relevance of
     * 0.6 · shared variables / max(|vars|) + 0.4 · shared predicates / max(|preds|).
     */
    public static double relevanceScore(List<Formula> premises, Formula conclusion) {
        var total = 0.0;
        var connected = 0;
        for (var p : premises) {
            var varScore = Formula.sharedVariables(p, conclusion).size()
                    / (double) Math.max(Math.max(p.variables().size(), conclusion.variables().size()), 1);
            var predScore = Formula.sharedPredicates(p, conclusion).size()
                    / (double) Math.max(Math.max(p.predicates().size(), conclusion.predicates().size()), 1);
            var relevance = VARIABLE_WEIGHT * varScore + PREDICATE_WEIGHT * predScore;
            if (relevance > 0) {
                total += relevance;
                connected++;
            }
        }
        return connected > 0 ? total / connected : 0;
    }

    public ProofResult validateArgument(Argument argument) {
        return validateArgument(argument, config.defaultSystem());
    }

    public ProofResult validateArgument(Argument argument, LogicSystem system) {
        var premises = argument.premises();
        var conclusion = argument.conclusion();
        var score = relevanceScore(premises, conclusion);
        var hasRelevance = score > config.relevanceThreshold();

        if (!hasRelevance)
            return failure(argument, hasRelevance, score, NOT_RELEVANT, List.of());

        var logic = RelevanceSystem.of(system);
        if (!logic.validateInference(premises, conclusion))
            return failure(argument, hasRelevance, score,
                    "No premise shares an atomic formula with the conclusion, as " + system.id() + " requires", List.of());

        Proof proof;
        var search = new Search(premises, conclusion);
        try {
            proof = search.run(system);
        } catch (RuntimeException e) {
            error("Error during proof search for " + argument + ": " + e.getMessage(), e);
            return new ProofResult(false, hasRelevance, score, null, null,
                    List.of("Error during proof search: " + e.getMessage()), List.of());
        }

        if (proof == null)
            return failure(argument, hasRelevance, score, NO_PROOF, search.warnings);

        var warnings = new ArrayList<>(search.warnings);
        if (proof.length() > config.longProofWarningSteps()) warnings.add(LONG_PROOF);
        return new ProofResult(true, hasRelevance, score, proof, null, List.of(), warnings);
    }

    private ProofResult failure(Argument argument, boolean hasRelevance, double score, String reason, List<String> warnings) {
        debug("Rejected " + argument + ": " + reason);
        var counterexample = countermodels.generate(argument).orElse(null);
        return new ProofResult(false, hasRelevance, score, null, counterexample, List.of(reason), warnings);
    }

    /** Formula known to hold, with the rule and the known formulas it came from. */
    private record Node(Formula formula, String rule, List<Node> from) {
    }

    /**
     * Outcome of a sub-goal. A failed attempt carries {@code low}, the shallowest depth of an open goal its
     * failure relied on: {@link #SETTLED} when it relied on none, {@link #BOUNDED} when a search limit cut it.
     */
    private record Attempt(@Nullable Node node, int low) {
        static final int SETTLED = Integer.MAX_VALUE;
        static final int BOUNDED = -1;
        static final Attempt FAILED = new Attempt(null, SETTLED);
    }

    private final class Search {
        private final List<Formula> premises;
        private final Formula goal;
        private final Map<String, Node> known = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();
        private boolean exhausted;

        // valid until the known formulas change
        private final Set<String> failed = new HashSet<>();
        private final LinkedHashMap<String, Integer> pending = new LinkedHashMap<>();
        private final Map<String, Map<String, Derived>> oneStep = new HashMap<>();
        @Nullable
        private List<Formula> snapshot;
        private int epoch;

        Search(List<Formula> premises, Formula goal) {
            this.premises = premises;
            this.goal = goal;
            for (var p : premises) known.putIfAbsent(p.text(), new Node(p, PREMISE, List.of()));
        }

        @Nullable
        Proof run(LogicSystem system) {
            saturate();
            var node = prove(goal, 0, new HashMap<>()).node();
            if (exhausted)
                warnings.add("Proof search stopped after " + config.proofMaxFormulas() + " formulas");
            return node == null ? null : new Proof(linearize(node), true, system, premises, goal);
        }

        private List<Formula> formulas() {
            if (snapshot == null) snapshot = known.values().stream().map(Node::formula).toList();
            return snapshot;
        }

        private boolean learn(Formula f, String rule, List<Formula> from) {
            if (known.containsKey(f.text())) return false;
            if (known.size() >= config.proofMaxFormulas()) {
                exhausted = true;
                return false;
            }
            known.put(f.text(), new Node(f, rule, from.stream().map(x -> known.get(x.text())).toList()));
            epoch++;
            failed.clear();
            pending.clear();
            oneStep.clear();
            snapshot = null;
            return true;
        }

        @Nullable
        private Node conclude(Formula f, String rule, List<Formula> from) {
            learn(f, rule, from);
            return known.get(f.text());
        }

        /** Closes the known formulas under the rules that only take apart what is already there. */
        private void saturate() {
            var eliminating = List.of(CONJUNCTION_ELIMINATION, UNIVERSAL_INSTANTIATION, MODUS_PONENS);
            for (var round = 0; round < config.proofMaxDepth() && !known.containsKey(goal.text()); round++) {
                var grew = false;
                for (var name : eliminating)
                    for (var d : rules.get(name).apply().derive(formulas(), goal))
                        grew |= learn(d.formula(), name, d.from());
                if (!grew) break;
            }
        }

        /** First derivation of {@code g} by a single application of the named rule to what is known. */
        @Nullable
        private Derived derive(String name, Formula g) {
            var rule = rules.get(name);
            if (rule.goalDirected()) {
                for (var d : rule.apply().derive(formulas(), g))
                    if (Formula.same(d.formula(), g)) return d;
                return null;
            }
            return oneStep.computeIfAbsent(name, n -> {
                var byText = new LinkedHashMap<String, Derived>();
                for (var d : rule.apply().derive(formulas(), goal)) byText.putIfAbsent(d.formula().text(), d);
                return byText;
            }).get(g.text());
        }

        /**
         * Backward chaining with a failure table. A goal whose search leaned on a goal still open higher up is
         * held as pending; once that goal fails too, every pending goal beneath it is recorded as failed.
         */
        private Attempt prove(Formula g, int depth, Map<String, Integer> path) {
            var key = g.text();
            var done = known.get(key);
            if (done != null) return new Attempt(done, Attempt.SETTLED);
            if (failed.contains(key)) return Attempt.FAILED;
            var open = path.get(key);
            if (open != null) return new Attempt(null, open);
            var held = pending.get(key);
            if (held != null) return new Attempt(null, held);
            if (depth > config.proofMaxDepth() || exhausted) return new Attempt(null, Attempt.BOUNDED);

            path.put(key, depth);
            var start = epoch;
            var mark = pending.size();
            var low = Attempt.SETTLED;
            try {
                for (var name : rules.keySet()) {
                    var d = derive(name, g);
                    if (d == null) continue;
                    var n = conclude(d.formula(), name, d.from());
                    if (n != null) return new Attempt(n, Attempt.SETTLED);
                }

                if (g.is(Connective.AND) && Formula.shareContent(g.arg(0), g.arg(1))) {
                    var left = prove(g.arg(0), depth + 1, path);
                    var right = left.node() != null ? prove(g.arg(1), depth + 1, path) : left;
                    if (right.node() != null) {
                        var n = conclude(g, CONJUNCTION_INTRODUCTION, List.of(left.node().formula(), right.node().formula()));
                        if (n != null) return new Attempt(n, Attempt.SETTLED);
                    } else low = Math.min(low, right.low());
                }

                for (var imp : formulas()) {
                    if (!implication(imp) || !Formula.same(imp.arg(1), g) || !Formula.shareContent(imp.arg(0), g)) continue;
                    var antecedent = prove(imp.arg(0), depth + 1, path);
                    if (antecedent.node() != null) {
                        var n = conclude(g, MODUS_PONENS, List.of(antecedent.node().formula(), imp));
                        if (n != null) return new Attempt(n, Attempt.SETTLED);
                    } else low = Math.min(low, antecedent.low());
                }

                if (implication(g) && Formula.shareContent(g.arg(0), g.arg(1))) {
                    for (var first : formulas()) {
                        if (!implication(first) || !Formula.same(first.arg(0), g.arg(0))) continue;
                        var link = builder.binary(g.is(Connective.LOLLIPOP) ? Connective.LOLLIPOP : Connective.IMPLIES,
                                first.arg(1), g.arg(1));
                        var second = prove(link, depth + 1, path);
                        if (second.node() != null) {
                            var n = conclude(g, HYPOTHETICAL_SYLLOGISM, List.of(first, second.node().formula()));
                            if (n != null) return new Attempt(n, Attempt.SETTLED);
                        } else low = Math.min(low, second.low());
                    }
                }

                if (exhausted || epoch != start) low = Attempt.BOUNDED;
                var beneath = pendingSince(mark);
                if (low >= depth) {
                    failed.add(key);
                    failed.addAll(beneath);
                    return Attempt.FAILED;
                }
                if (low != Attempt.BOUNDED) {
                    for (var b : beneath) pending.put(b, low);
                    pending.put(key, low);
                }
                return new Attempt(null, low);
            } finally {
                path.remove(key);
            }
        }

        /** Removes and returns the goals that became pending after the first {@code mark} entries. */
        private List<String> pendingSince(int mark) {
            var keys = new ArrayList<>(pending.keySet());
            var tail = List.copyOf(keys.subList(Math.min(mark, keys.size()), keys.size()));
            tail.forEach(pending::remove);
            return tail;
        }

        private List<Proof.Step> linearize(Node root) {
            var order = new ArrayList<Node>();
            var numbers = new LinkedHashMap<String, Integer>();
            collect(root, order, new HashSet<>());
            var steps = new ArrayList<Proof.Step>(order.size());
            for (var n : order) {
                var number = steps.size() + 1;
                numbers.put(n.formula().text(), number);
                var cited = n.from().stream().map(f -> numbers.get(f.formula().text())).toList();
                var premise = n.rule().equals(PREMISE);
                var rule = premise ? PREMISE : rules.get(n.rule()).name();
                steps.add(new Proof.Step(number, n.formula(), rule, premise ? List.of() : cited,
                        premise ? "Given as premise" : "Derived using " + rule));
            }
            return Collections.unmodifiableList(steps);
        }

        private void collect(Node n, List<Node> order, Set<String> seen) {
            if (!seen.add(n.formula().text())) return;
            n.from().forEach(f -> collect(f, order, seen));
            order.add(n);
        }
    }

    @FunctionalInterface
    interface Derivation {
        List<Derived> derive(List<Formula> known, Formula target);
    }

    /** A formula a rule yields, with the formulas it was obtained from. */
    record Derived(Formula formula, List<Formula> from) {
    }

    /**
     * {@code relevanceCheck} marks rules whose inputs must share content (an atomic formula or a variable)
     * with what they produce; those rules enforce it inside {@code apply}. {@code goalDirected} rules read
     * the target, the others derive the same formulas for any target.
     */
    record InferenceRule(String name, String description, boolean relevanceCheck, boolean goalDirected, Derivation apply) {
    }
}
