package dumb.relevance;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

sealed public interface Term permits Term.Var, Term.Const, Term.Fn {
    Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}\\p{N}_'\\-]+$");

    static Var var(String name) {
        return new Var(name);
    }

    static Const constant(String name) {
        return new Const(name);
    }

    static Fn fn(String name, Term... args) {
        return new Fn(name, List.of(args));
    }

    private static String checkName(String name) {
        requireNonNull(name);
        if (!NAME_PATTERN.matcher(name).matches())
            throw new IllegalArgumentException("Invalid term name: '" + name + "'");
        return name;
    }

    String name();

    String text();

    /** Names of the variables occurring in this term, in order of first occurrence. */
    Set<String> vars();

    Set<String> constants();

    Term subst(String var, Term value);

    default JsonNode toJson() {
        return Json.node(this);
    }

    record Var(String name) implements Term {
        public Var {
            checkName(name);
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public Set<String> vars() {
            return Set.of(name);
        }

        @Override
        public Set<String> constants() {
            return Set.of();
        }

        @Override
        public Term subst(String var, Term value) {
            return name.equals(var) ? value : this;
        }
    }

    record Const(String name) implements Term {
        public Const {
            checkName(name);
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public Set<String> vars() {
            return Set.of();
        }

        @Override
        public Set<String> constants() {
            return Set.of(name);
        }

        @Override
        public Term subst(String var, Term value) {
            return this;
        }
    }

    record Fn(String name, List<Term> args) implements Term {
        public Fn {
            checkName(name);
            args = List.copyOf(requireNonNull(args));
        }

        @Override
        public String text() {
            return args.stream().map(Term::text).collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public Set<String> vars() {
            var s = new LinkedHashSet<String>();
            args.forEach(a -> s.addAll(a.vars()));
            return s;
        }

        @Override
        public Set<String> constants() {
            var s = new LinkedHashSet<String>();
            args.forEach(a -> s.addAll(a.constants()));
            return s;
        }

        @Override
        public Term subst(String var, Term value) {
            return new Fn(name, args.stream().map(a -> a.subst(var, value)).toList());
        }
    }
}
