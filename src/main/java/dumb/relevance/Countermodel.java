package dumb.relevance;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.relevance.Model.Triple;

import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/** Worlds in which {@code falsifyingWorld} makes every premise true and the conclusion false. */
public record Countermodel(List<World> worlds, List<Triple> relation, String falsifyingWorld, String description) {

    public Countermodel {
        worlds = List.copyOf(worlds);
        relation = List.copyOf(relation);
        requireNonNull(falsifyingWorld);
        requireNonNull(description);
    }

    public World world(String id) {
        return worlds.stream().filter(w -> w.id().equals(id)).findFirst()
                .orElseThrow(() -> new NoSuchElementException("No world " + id));
    }

    public World falsifying() {
        return world(falsifyingWorld);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
