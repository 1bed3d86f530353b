package dumb.relevance;

import dumb.relevance.ValidationResult.Flow;
import dumb.relevance.ValidationResult.RelevanceLink;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static dumb.relevance.Log.debug;

/**
 * Fast syntactic relevance check. The categories run in order: circularity, connectivity, quantifier
 * scopes, distribution. A circular or disconnected argument stops the check with a single violation.
 */
public class RelevanceValidator {

    public static final String EMPTY_PREMISES = "EMPTY_PREMISES: No valid premises provided";

    public ValidationResult validate(List<Formula> premises, Formula conclusion) {
        return validate(premises, conclusion, LogicSystem.R);
    }

    public ValidationResult validate(Argument argument, LogicSystem system) {
        return validate(argument.premises(), argument.conclusion(), system);
    }

    public ValidationResult validate(List<Formula> premises, Formula conclusion, LogicSystem system) {
        if (premises.isEmpty()) return ValidationResult.fail(EMPTY_PREMISES);

        var circular = circularity(premises, conclusion);
        if (circular != null) {
            debug("Circular argument: " + circular);
            return ValidationResult.fail(circular);
        }

        var component = conclusionComponent(premises, conclusion);
        var disconnected = new ArrayList<Integer>();
        for (var i = 0; i < premises.size(); i++)
            if (!component.contains(i)) disconnected.add(i + 1);
        if (!disconnected.isEmpty()) {
            var tag = "DISCONNECTED: " + disconnected.size() + " premise(s) not connected to conclusion - remove premises: "
                    + disconnected.stream().map(i -> "P" + i).collect(Collectors.joining(", "));
            debug(tag);
            return ValidationResult.fail(tag);
        }

        var violations = new ArrayList<String>();
        violations.addAll(quantifierViolations(premises, conclusion));
        violations.addAll(distributionViolations(premises, conclusion, RelevanceSystem.of(system)));

        return new ValidationResult(violations.isEmpty(), violations, links(premises, conclusion));
    }

    private static @Nullable String circularity(List<Formula> premises, Formula conclusion) {
        for (var i = 0; i < premises.size(); i++) {
            var p = premises.get(i);
            if (Formula.same(p, conclusion))
                return "CIRCULAR REASONING: Premise " + (i + 1) + " is identical to conclusion - indicates missing explicit premises";
            if (p.is(Connective.AND) && (Formula.same(p.arg(0), conclusion) || Formula.same(p.arg(1), conclusion)))
                return "CIRCULAR REASONING: Premise " + (i + 1) + " contains conclusion as conjunct - indicates missing explicit premises";
        }
        return null;
    }

    /**
     * Indices of the premises in the conclusion's connected component, where two formulas are adjacent iff
     * they have a predicate symbol in common.
     */
    static Set<Integer> conclusionComponent(List<Formula> premises, Formula conclusion) {
        var nodes = new ArrayList<Formula>(premises);
        nodes.add(conclusion);
        var root = nodes.size() - 1;
        var seen = new boolean[nodes.size()];
        var stack = new ArrayDeque<Integer>();
        stack.push(root);
        seen[root] = true;
        while (!stack.isEmpty()) {
            var n = stack.pop();
            for (var m = 0; m < nodes.size(); m++) {
                if (seen[m] || Formula.sharedPredicates(nodes.get(n), nodes.get(m)).isEmpty()) continue;
                seen[m] = true;
                stack.push(m);
            }
        }
        var component = new LinkedHashSet<Integer>();
        for (var i = 0; i < premises.size(); i++)
            if (seen[i]) component.add(i);
        return component;
    }

    record Scope(Connective quantifier, String variable) {
    }

    static List<Scope> scopes(Formula f) {
        var scopes = new ArrayList<Scope>();
        collectScopes(f, scopes);
        return scopes;
    }

    private static void collectScopes(Formula f, List<Scope> scopes) {
        if (f instanceof Formula.Compound c && c.op.quantifier())
            scopes.add(new Scope(c.op, c.bound));
        f.args().forEach(sub -> collectScopes(sub, scopes));
    }

    private static List<String> quantifierViolations(List<Formula> premises, Formula conclusion) {
        var available = scopes(conclusion);
        var violations = new ArrayList<String>();
        for (var i = 0; i < premises.size(); i++) {
            if (!available.containsAll(scopes(premises.get(i))))
                violations.add("Premise " + (i + 1) + " has incompatible quantifier variable binding with conclusion");
        }
        return violations;
    }

    private static List<String> distributionViolations(List<Formula> premises, Formula conclusion, RelevanceSystem system) {
        if (system.axioms().distribution()) return List.of();
        var violations = new ArrayList<String>();
        for (var i = 0; i < premises.size(); i++) {
            if (RelevanceSystem.distributes(premises.get(i), conclusion))
                violations.add("DISTRIBUTION: Premise " + (i + 1) + " requires the distribution law, which system "
                        + system.system() + " does not provide");
        }
        return violations;
    }

    private static List<RelevanceLink> links(List<Formula> premises, Formula conclusion) {
        var conclusionAtoms = Formula.atoms(conclusion).stream().map(Formula::text).distinct().count();
        var links = new ArrayList<RelevanceLink>(premises.size());
        for (var i = 0; i < premises.size(); i++) {
            var shared = Formula.sharedAtoms(premises.get(i), conclusion).stream().map(Formula::text).toList();
            var strength = Math.min(1.0, shared.size() / (double) Math.max(conclusionAtoms, 1));
            links.add(new RelevanceLink(i + 1, shared, shared.isEmpty() ? Flow.MEDIATED : Flow.DIRECT, strength));
        }
        return links;
    }
}
