package dumb.relevance;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads formulas in the canonical notation ({@code (P(x) → Q(x))}, {@code ∀x(P(x))}, ...) and its ASCII
 * aliases ({@code ~ & | -> <-> * -o forall exists}).
 */
public class FormulaParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final Pattern FREE_VARIABLE = Pattern.compile("[u-z][0-9']*");

    private static final String[] NOT = {"¬", "~", "!"};
    private static final String[] AND = {"∧", "&&", "&", "/\\"};
    private static final String[] TIMES = {"⊗", "*"};
    private static final String[] OR = {"∨", "||", "|", "\\/"};
    private static final String[] PAR = {"⅋"};
    private static final String[] IMPLIES = {"→", "->", "=>"};
    private static final String[] LOLLIPOP = {"⊸", "-o"};
    private static final String[] IFF = {"↔", "<->", "<=>"};

    private final String text;
    private final FormulaBuilder builder;
    private final Deque<String> bound = new ArrayDeque<>();
    private int pos = 0;

    private FormulaParser(String text, FormulaBuilder builder) {
        this.text = text;
        this.builder = builder;
    }

    public static Formula parse(String text, FormulaBuilder builder) throws ParseException {
        var parser = new FormulaParser(text, builder);
        parser.skipWhitespace();
        if (parser.peek() == -1) throw parser.createParseException("Empty formula");
        var f = parser.parseFormula();
        parser.skipWhitespace();
        if (parser.peek() != -1)
            throw parser.createParseException("Unexpected trailing input", "'" + (char) parser.peek() + "'");
        return f;
    }

    private int peek() {
        return pos < text.length() ? text.charAt(pos) : -1;
    }

    private int peek(int ahead) {
        return pos + ahead < text.length() ? text.charAt(pos + ahead) : -1;
    }

    private void consumeChar(char expected) throws ParseException {
        var actual = peek();
        if (actual != expected)
            throw createParseException("Expected '" + expected + "'", actual == -1 ? "EOF" : "'" + (char) actual + "'");
        pos++;
    }

    private void skipWhitespace() {
        while (peek() != -1 && Character.isWhitespace(peek())) pos++;
    }

    private static boolean nameChar(int c) {
        return c != -1 && (Character.isLetterOrDigit(c) || c == '_' || c == '\'');
    }

    /** Consumes the first of the given operator spellings found at the cursor, if any. */
    private boolean accept(String... spellings) {
        skipWhitespace();
        for (var s : spellings) {
            if (!text.startsWith(s, pos)) continue;
            // "-o" must not swallow the start of a name such as "-only"
            if (nameChar(s.charAt(s.length() - 1)) && nameChar(peek(s.length()))) continue;
            pos += s.length();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        skipWhitespace();
        if (text.startsWith(keyword, pos) && !nameChar(peek(keyword.length()))) {
            pos += keyword.length();
            return true;
        }
        return false;
    }

    private Formula parseFormula() throws ParseException {
        var left = parseImplication();
        while (accept(IFF))
            left = builder.iff(left, parseImplication());
        return left;
    }

    private Formula parseImplication() throws ParseException {
        var left = parseDisjunction();
        if (accept(IMPLIES)) return builder.implies(left, parseImplication());
        if (accept(LOLLIPOP)) return builder.lollipop(left, parseImplication());
        return left;
    }

    private Formula parseDisjunction() throws ParseException {
        var left = parseConjunction();
        while (true) {
            if (accept(OR)) left = builder.or(left, parseConjunction());
            else if (accept(PAR)) left = builder.par(left, parseConjunction());
            else return left;
        }
    }

    private Formula parseConjunction() throws ParseException {
        var left = parseUnary();
        while (true) {
            if (accept(AND)) left = builder.and(left, parseUnary());
            else if (accept(TIMES)) left = builder.times(left, parseUnary());
            else return left;
        }
    }

    private Formula parseUnary() throws ParseException {
        if (accept(NOT)) return builder.not(parseUnary());
        if (accept("∀") || acceptKeyword("forall")) return parseQuantified(Connective.FORALL);
        if (accept("∃") || acceptKeyword("exists")) return parseQuantified(Connective.EXISTS);
        return parsePrimary();
    }

    private Formula parseQuantified(Connective q) throws ParseException {
        skipWhitespace();
        var name = parseName("quantifier variable");
        var variable = name.startsWith("?") ? name.substring(1) : name;
        bound.push(variable);
        try {
            // "forall x. body" extends as far right as possible, "∀x(body)" binds like negation
            var body = accept(".") ? parseFormula() : parseUnary();
            return q == Connective.FORALL ? builder.forall(variable, body) : builder.exists(variable, body);
        } finally {
            bound.pop();
        }
    }

    private Formula parsePrimary() throws ParseException {
        skipWhitespace();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing formula");
        if (c == '(') {
            consumeChar('(');
            var f = parseFormula();
            skipWhitespace();
            consumeChar(')');
            return f;
        }
        if (accept("⊥")) return builder.bottom();
        if (c == 'I' && !nameChar(peek(1)) && peek(1) != '(') {
            pos++;
            return builder.one();
        }
        return parseAtomic();
    }

    private Formula parseAtomic() throws ParseException {
        var predicate = parseName("predicate");
        if (predicate.startsWith("?"))
            throw createParseException("Predicate name cannot be a variable", "'" + predicate + "'");
        skipWhitespace();
        return peek() == '(' ? builder.atomic(predicate, parseArguments(), null) : builder.atomic(predicate);
    }

    private List<Term> parseArguments() throws ParseException {
        consumeChar('(');
        var terms = new ArrayList<Term>();
        do {
            terms.add(parseTerm());
            skipWhitespace();
        } while (accept(","));
        consumeChar(')');
        return terms;
    }

    private Term parseTerm() throws ParseException {
        skipWhitespace();
        var name = parseName("term");
        if (name.startsWith("?")) return Term.var(name.substring(1));
        skipWhitespace();
        if (peek() == '(') return new Term.Fn(name, parseArguments());
        return bound.contains(name) || FREE_VARIABLE.matcher(name).matches() ? Term.var(name) : Term.constant(name);
    }

    private String parseName(String what) throws ParseException {
        var start = pos;
        if (peek() == '?') pos++;
        while (nameChar(peek())) pos++;
        var name = text.substring(start, pos);
        if (name.isEmpty() || name.equals("?")) {
            var c = peek();
            throw createParseException("Expected " + what + " name", c == -1 ? "EOF" : "'" + (char) c + "'");
        }
        return name;
    }

    private ParseException createParseException(String message) {
        return createParseException(message, null);
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        var line = 1;
        var col = 0;
        for (var i = 0; i < pos && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        var context = text.substring(Math.max(0, pos - CONTEXT_BUFFER_SIZE), Math.min(pos, text.length()));
        return new ParseException(message + foundInfo, line, col, context);
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
