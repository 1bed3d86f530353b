package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.relevance.ArgumentParser.ParsedArgument;
import dumb.relevance.FormulaParser.ParseException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dumb.relevance.Log.error;
import static dumb.relevance.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * One reasoning session: a formula arena plus the validator, proof engine and countermodel generator
 * configured for it.
 */
public class Reasoner {

    public final Configuration config;
    public final FormulaBuilder formulas = new FormulaBuilder();
    public final ArgumentParser parser;
    public final RelevanceValidator validator = new RelevanceValidator();
    public final CountermodelGenerator countermodels;
    public final ProofEngine engine;

    public Reasoner() {
        this(Configuration.load());
    }

    public Reasoner(Configuration config) {
        this.config = requireNonNull(config);
        this.parser = new ArgumentParser.Symbolic(formulas);
        this.countermodels = new CountermodelGenerator(config);
        this.engine = new ProofEngine(formulas, config, countermodels);
    }

    public static void main(String[] args) {
        String file = null;
        LogicSystem system = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-f", "--file" -> file = args[++i];
                    case "-s", "--system" -> system = LogicSystem.parse(args[++i]);
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | IllegalArgumentException e) {
                error(String.format("Error parsing argument for %s: %s", (i > 0 ? args[i - 1] : args[i]), e.getMessage()));
                printUsageAndExit();
            }
        }

        try {
            var text = file != null ? Files.readString(Path.of(file), StandardCharsets.UTF_8)
                    : new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            var r = new Reasoner();
            System.out.println(Json.str(r.reason(text, system != null ? system : r.config.defaultSystem()).toJson()));
        } catch (IOException e) {
            error("Failed to read argument: " + e.getMessage());
            System.exit(1);
        } catch (ParseException e) {
            error("Invalid argument: " + e.getMessage());
            System.exit(2);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-s B|T|E|R] [-f argument.txt]%n", Reasoner.class.getName());
        System.err.println("Reads one formula per line from the file or standard input; the last line is the conclusion.");
        System.exit(1);
    }

    public ParsedArgument parse(String text) throws ParseException {
        return parser.parseArgument(text);
    }

    public ValidationResult validate(String text) throws ParseException {
        return validate(text, config.defaultSystem());
    }

    public ValidationResult validate(String text, LogicSystem system) throws ParseException {
        return validator.validate(parse(text).argument(), system);
    }

    public ProofResult prove(String text, LogicSystem system) throws ParseException {
        return engine.validateArgument(parse(text).argument(), system);
    }

    public Report reason(String text, LogicSystem system) throws ParseException {
        var parsed = parse(text);
        var argument = parsed.argument();
        var validation = validator.validate(argument, system);
        var proof = engine.validateArgument(argument, system);
        var explanation = proof.counterexampleOpt()
                .map(m -> countermodels.explain(m, argument.premises(), argument.conclusion()))
                .orElse(null);
        message("Reasoned in " + system.id() + ": " + argument + " -> " + (validation.valid() && proof.valid() ? "valid" : "invalid"));
        return new Report(system, argument, parsed.ambiguities(), validation, proof, explanation);
    }

    /** Restarts formula numbering; formulas built earlier stay valid but their ids may recur. */
    public void reset() {
        formulas.reset();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Report(LogicSystem system, Argument argument, List<String> ambiguities, ValidationResult validation,
                         ProofResult proof, @Nullable String explanation) {

        public Report {
            ambiguities = List.copyOf(ambiguities);
        }

        public boolean valid() {
            return validation.valid() && proof.valid();
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
