package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Argument(List<Formula> premises, Formula conclusion, @Nullable String context) {

    public Argument {
        premises = List.copyOf(requireNonNull(premises));
        requireNonNull(conclusion);
    }

    public Argument(List<Formula> premises, Formula conclusion) {
        this(premises, conclusion, null);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    @Override
    public String toString() {
        return premises + " ⊢ " + conclusion;
    }
}
