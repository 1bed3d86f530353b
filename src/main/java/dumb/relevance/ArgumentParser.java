package dumb.relevance;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.relevance.FormulaParser.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static dumb.relevance.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Boundary to whatever turns argument text into formulas. The reasoning core only ever sees the
 * {@link ParsedArgument} this produces.
 */
public interface ArgumentParser {

    ParsedArgument parseArgument(String text) throws ParseException;

    record ParsedStatement(String originalText, Formula formula, List<String> ambiguities, double confidence) {
        public ParsedStatement {
            requireNonNull(originalText);
            requireNonNull(formula);
            ambiguities = List.copyOf(ambiguities);
            if (confidence < 0 || confidence > 1)
                throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
    }

    record ParsedArgument(List<ParsedStatement> premises, ParsedStatement conclusion) {
        public ParsedArgument {
            premises = List.copyOf(premises);
            requireNonNull(conclusion);
        }

        public Argument argument() {
            return new Argument(premises.stream().map(ParsedStatement::formula).toList(), conclusion.formula());
        }

        public List<String> ambiguities() {
            var all = new ArrayList<String>();
            premises.forEach(p -> all.addAll(p.ambiguities()));
            all.addAll(conclusion.ambiguities());
            return all;
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }

    /**
     * One formula per line in {@link FormulaParser} notation. Lines may be labelled {@code Premise 1:} or
     * {@code P1:}; the conclusion is labelled {@code Conclusion:} or introduced by therefore, thus, hence or
     * {@code ∴}, and otherwise is the last line. Lines starting with {@code ;} or {@code #} are comments.
     */
    class Symbolic implements ArgumentParser {
        private static final Pattern PREMISE_LABEL = Pattern.compile("^(?:premise\\s*\\d*|p\\d+)\\s*[:.)]\\s*", Pattern.CASE_INSENSITIVE);
        private static final Pattern CONCLUSION_LABEL = Pattern.compile("^(?:conclusion\\s*:|c\\s*:|therefore\\b|thus\\b|hence\\b|∴)\\s*,?\\s*", Pattern.CASE_INSENSITIVE);
        private static final double FREE_VARIABLE_PENALTY = 0.1;

        private final FormulaBuilder builder;

        public Symbolic(FormulaBuilder builder) {
            this.builder = requireNonNull(builder);
        }

        @Override
        public ParsedArgument parseArgument(String text) throws ParseException {
            var lines = text.lines().map(String::strip)
                    .filter(l -> !l.isEmpty() && !l.startsWith(";") && !l.startsWith("#"))
                    .toList();
            if (lines.isEmpty()) throw new ParseException("Argument has no conclusion");

            var premiseLines = new ArrayList<String>();
            String conclusionLine = null;
            for (var line : lines) {
                var m = CONCLUSION_LABEL.matcher(line);
                if (m.find()) {
                    if (conclusionLine != null)
                        throw new ParseException("More than one conclusion: '" + conclusionLine + "' and '" + line + "'");
                    conclusionLine = line.substring(m.end());
                } else {
                    premiseLines.add(PREMISE_LABEL.matcher(line).replaceFirst(""));
                }
            }
            if (conclusionLine == null) conclusionLine = premiseLines.remove(premiseLines.size() - 1);

            var premises = new ArrayList<ParsedStatement>(premiseLines.size());
            for (var line : premiseLines) premises.add(statement(line));
            return new ParsedArgument(premises, statement(conclusionLine));
        }

        public ParsedStatement statement(String line) throws ParseException {
            Formula f;
            try {
                f = FormulaParser.parse(line, builder);
            } catch (ParseException e) {
                warning("Rejected formula '" + line + "': " + e.getMessage());
                throw e;
            }
            var ambiguities = new ArrayList<String>();
            for (var v : Formula.freeVariables(f))
                ambiguities.add("Free variable '" + v + "' is implicitly universal");
            var confidence = Math.max(0.5, 1.0 - FREE_VARIABLE_PENALTY * ambiguities.size());
            return new ParsedStatement(line, f, ambiguities, confidence);
        }
    }
}
