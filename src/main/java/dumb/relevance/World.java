package dumb.relevance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** A point of a model: its id and the truth value of each predicate (or variable) name there. */
public record World(String id, Map<String, Boolean> assignments) {

    public World {
        requireNonNull(id);
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    public World(String id) {
        this(id, Map.of());
    }

    public boolean valueOf(String name) {
        return assignments.getOrDefault(name, false);
    }

    public World with(Map<String, Boolean> assignments) {
        return new World(id, assignments);
    }

    @Override
    public String toString() {
        return id + assignments;
    }
}
