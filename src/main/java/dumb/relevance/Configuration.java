package dumb.relevance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

import static dumb.relevance.Log.message;
import static dumb.relevance.Log.warning;
import static java.util.Objects.requireNonNull;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("defaultSystem") LogicSystem defaultSystem,
        @JsonProperty("relevanceThreshold") double relevanceThreshold,
        @JsonProperty("proofMaxDepth") int proofMaxDepth,
        @JsonProperty("proofMaxFormulas") int proofMaxFormulas,
        @JsonProperty("longProofWarningSteps") int longProofWarningSteps,
        @JsonProperty("countermodelMaxWorlds") int countermodelMaxWorlds,
        @JsonProperty("ternaryMaxWorlds") int ternaryMaxWorlds,
        @JsonProperty("assignmentLimit") int assignmentLimit
) {
    public static final String RESOURCE = "relevance.json";
    static final LogicSystem DEFAULT_SYSTEM = LogicSystem.R;
    static final double DEFAULT_RELEVANCE_THRESHOLD = 0.5;
    static final int DEFAULT_PROOF_MAX_DEPTH = 20;
    static final int DEFAULT_PROOF_MAX_FORMULAS = 2000;
    static final int DEFAULT_LONG_PROOF_WARNING_STEPS = 10;
    static final int DEFAULT_COUNTERMODEL_MAX_WORLDS = 8;
    static final int DEFAULT_TERNARY_MAX_WORLDS = 5;
    static final int DEFAULT_ASSIGNMENT_LIMIT = 1 << 16;

    public Configuration {
        requireNonNull(defaultSystem);
        if (relevanceThreshold < 0 || relevanceThreshold > 1)
            throw new IllegalArgumentException("relevanceThreshold must be within [0, 1]: " + relevanceThreshold);
        if (proofMaxDepth < 1 || proofMaxFormulas < 1 || countermodelMaxWorlds < 2 || ternaryMaxWorlds < 2 || assignmentLimit < 1)
            throw new IllegalArgumentException("Search bounds must be positive (and at least 2 worlds)");
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("defaultSystem") LogicSystem defaultSystem,
            @JsonProperty("relevanceThreshold") Double relevanceThreshold,
            @JsonProperty("proofMaxDepth") Integer proofMaxDepth,
            @JsonProperty("proofMaxFormulas") Integer proofMaxFormulas,
            @JsonProperty("longProofWarningSteps") Integer longProofWarningSteps,
            @JsonProperty("countermodelMaxWorlds") Integer countermodelMaxWorlds,
            @JsonProperty("ternaryMaxWorlds") Integer ternaryMaxWorlds,
            @JsonProperty("assignmentLimit") Integer assignmentLimit
    ) {
        this(
                defaultSystem != null ? defaultSystem : DEFAULT_SYSTEM,
                relevanceThreshold != null ? relevanceThreshold : DEFAULT_RELEVANCE_THRESHOLD,
                proofMaxDepth != null ? proofMaxDepth : DEFAULT_PROOF_MAX_DEPTH,
                proofMaxFormulas != null ? proofMaxFormulas : DEFAULT_PROOF_MAX_FORMULAS,
                longProofWarningSteps != null ? longProofWarningSteps : DEFAULT_LONG_PROOF_WARNING_STEPS,
                countermodelMaxWorlds != null ? countermodelMaxWorlds : DEFAULT_COUNTERMODEL_MAX_WORLDS,
                ternaryMaxWorlds != null ? ternaryMaxWorlds : DEFAULT_TERNARY_MAX_WORLDS,
                assignmentLimit != null ? assignmentLimit : DEFAULT_ASSIGNMENT_LIMIT
        );
    }

    public static Configuration defaults() {
        return new Configuration(DEFAULT_SYSTEM, DEFAULT_RELEVANCE_THRESHOLD, DEFAULT_PROOF_MAX_DEPTH, DEFAULT_PROOF_MAX_FORMULAS,
                DEFAULT_LONG_PROOF_WARNING_STEPS, DEFAULT_COUNTERMODEL_MAX_WORLDS, DEFAULT_TERNARY_MAX_WORLDS, DEFAULT_ASSIGNMENT_LIMIT);
    }

    public static Configuration load() {
        return load(RESOURCE);
    }

    public static Configuration load(String resource) {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                warning("Configuration resource " + resource + " not found, using defaults.");
                return defaults();
            }
            var config = Json.obj(in, Configuration.class);
            message("Loaded configuration from " + resource + ": system " + config.defaultSystem() + ", proof depth " + config.proofMaxDepth());
            return config;
        } catch (IOException | IllegalArgumentException e) {
            warning("Failed to read configuration " + resource + " (" + e.getMessage() + "), using defaults.");
            return defaults();
        }
    }

    public Configuration withDefaultSystem(LogicSystem system) {
        return new Configuration(system, relevanceThreshold, proofMaxDepth, proofMaxFormulas, longProofWarningSteps,
                countermodelMaxWorlds, ternaryMaxWorlds, assignmentLimit);
    }

    public JsonNode toJson() {
        return Json.node(this);
    }
}
