package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofResult(@JsonProperty("isValid") boolean valid,
                          boolean hasRelevance,
                          double relevanceScore,
                          @Nullable Proof proof,
                          @Nullable Countermodel counterexample,
                          List<String> errors,
                          List<String> warnings) {

    public ProofResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public Optional<Proof> proofOpt() {
        return Optional.ofNullable(proof);
    }

    public Optional<Countermodel> counterexampleOpt() {
        return Optional.ofNullable(counterexample);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
