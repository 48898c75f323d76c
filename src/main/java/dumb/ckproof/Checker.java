package dumb.ckproof;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.ckproof.Congruence.MiddleSearch;
import dumb.ckproof.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Runs the structural pass and, only if it found nothing, the derivation check.
 */
public class Checker {
    public static final String CONFIG_RESOURCE = "ckproof.json";
    static final int DEFAULT_MAX_SUBSTITUTIONS = 4096;
    static final long DEFAULT_MAX_SEARCH_STEPS = 1_000_000;
    static final MiddleSearch DEFAULT_MIDDLE_SEARCH = MiddleSearch.EARLIEST_FIRST;
    static final boolean DEFAULT_VERIFY_ONLY = false;

    private static final Logger logger = LoggerFactory.getLogger(Checker.class);

    public final Configuration config;

    public Checker() {
        this(new Configuration());
    }

    public Checker(Configuration config) {
        this.config = requireNonNull(config);
    }

    public Report check(Directory dir) {
        var start = System.nanoTime();
        var diagnostics = new Diagnostics();

        logger.info("Verifying {} definitions, {} axioms and theorems, {} proofs",
                dir.definitionRefs().size(), dir.deductableRefs().size(), dir.proofRefs().size());
        var registry = new Verifier(dir, diagnostics).verify();
        if (diagnostics.errorFound()) {
            logger.info("Verify found {} errors; derivation check skipped", diagnostics.size());
            return report(diagnostics, start);
        }
        if (config.verifyOnly()) {
            logger.info("Verify passed; derivation check disabled");
            return report(diagnostics, start);
        }

        new Derivation(dir, registry, config, diagnostics).proofs();
        logger.info("Check of {} proofs found {} errors", dir.proofRefs().size(), diagnostics.size());
        return report(diagnostics, start);
    }

    private static Report report(Diagnostics diagnostics, long start) {
        return new Report(!diagnostics.errorFound(), diagnostics.errors(), Instant.now(),
                (System.nanoTime() - start) / 1_000_000);
    }

    public record Configuration(
            @JsonProperty("maxSubstitutions") int maxSubstitutions,
            @JsonProperty("maxSearchSteps") long maxSearchSteps,
            @JsonProperty("middleSearch") MiddleSearch middleSearch,
            @JsonProperty("verifyOnly") boolean verifyOnly
    ) {
        public Configuration {
            if (maxSubstitutions < 1)
                throw new IllegalArgumentException("maxSubstitutions must be positive: " + maxSubstitutions);
            if (maxSearchSteps < 1)
                throw new IllegalArgumentException("maxSearchSteps must be positive: " + maxSearchSteps);
            requireNonNull(middleSearch);
        }

        @JsonCreator
        public Configuration(
                @JsonProperty("maxSubstitutions") Integer maxSubstitutions,
                @JsonProperty("maxSearchSteps") Long maxSearchSteps,
                @JsonProperty("middleSearch") MiddleSearch middleSearch,
                @JsonProperty("verifyOnly") Boolean verifyOnly
        ) {
            this(
                    maxSubstitutions != null ? maxSubstitutions : DEFAULT_MAX_SUBSTITUTIONS,
                    maxSearchSteps != null ? maxSearchSteps : DEFAULT_MAX_SEARCH_STEPS,
                    middleSearch != null ? middleSearch : DEFAULT_MIDDLE_SEARCH,
                    verifyOnly != null ? verifyOnly : DEFAULT_VERIFY_ONLY
            );
        }

        public Configuration() {
            this(DEFAULT_MAX_SUBSTITUTIONS, DEFAULT_MAX_SEARCH_STEPS, DEFAULT_MIDDLE_SEARCH, DEFAULT_VERIFY_ONLY);
        }

        public static Configuration fromJson(String json) throws JsonProcessingException {
            return Json.obj(json, Configuration.class);
        }

        /** The {@value CONFIG_RESOURCE} classpath resource, or the defaults when there is none. */
        public static Configuration load() {
            try (var in = Checker.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
                if (in == null) {
                    logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                    return new Configuration();
                }
                return Json.obj(in, Configuration.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
            }
        }
    }

    /** Outcome of one run. */
    public record Report(boolean valid, List<Diagnostic> errors, Instant checkedAt, long elapsedMillis) {
        public Report {
            errors = List.copyOf(errors);
            requireNonNull(checkedAt);
        }

        public boolean has(Diagnostic.Kind kind) {
            return errors.stream().anyMatch(e -> e.kind() == kind);
        }

        public JsonNode toJson() {
            return Json.node(this);
        }
    }
}
