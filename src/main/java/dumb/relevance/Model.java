package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.relevance.RelevanceSystem.FrameConditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Routley–Meyer model: worlds, ternary accessibility, a distinguished world and the negation conjugation. */
public record Model(List<World> worlds, TernaryRelation relation, String distinguished,
                    Map<String, String> conjugation, FrameConditions frame, String description) {

    public Model {
        worlds = List.copyOf(worlds);
        requireNonNull(relation);
        requireNonNull(distinguished);
        conjugation = Collections.unmodifiableMap(new LinkedHashMap<>(conjugation));
        requireNonNull(frame);
        var ids = worlds.stream().map(World::id).toList();
        if (!ids.contains(distinguished))
            throw new IllegalArgumentException("Distinguished world " + distinguished + " is not a world of the model");
        for (var w : ids)
            if (!ids.contains(conjugation.get(w)))
                throw new IllegalArgumentException("World " + w + " has no conjugate in the model");
    }

    public World world(String id) {
        for (var w : worlds)
            if (w.id().equals(id)) return w;
        throw new NoSuchElementException("No world " + id);
    }

    @JsonIgnore
    public World distinguishedWorld() {
        return world(distinguished);
    }

    public World conjugate(World w) {
        return world(conjugation.get(w.id()));
    }

    public boolean relates(World a, World b, World c) {
        return relation.relates(a.id(), b.id(), c.id());
    }

    /** Same frame, with each world's assignment replaced (worlds missing from the map keep theirs). */
    public Model withAssignments(Map<String, Map<String, Boolean>> assignments) {
        var updated = worlds.stream()
                .map(w -> assignments.containsKey(w.id()) ? w.with(assignments.get(w.id())) : w)
                .toList();
        return new Model(updated, relation, distinguished, conjugation, frame, description);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }

    public record Triple(String a, String b, String c) {
        @Override
        public String toString() {
            return "R(" + a + ", " + b + ", " + c + ")";
        }
    }

    public record TernaryRelation(Set<Triple> triples) {
        public TernaryRelation {
            triples = Collections.unmodifiableSet(new LinkedHashSet<>(triples));
        }

        public boolean relates(String a, String b, String c) {
            return triples.contains(new Triple(a, b, c));
        }

        public int size() {
            return triples.size();
        }
    }
}
