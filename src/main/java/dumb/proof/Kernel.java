package dumb.proof;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.proof.Rules.Soundness;
import dumb.proof.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * Entry point holding the kernel configuration. Stateless apart from that: the rule set is
 * passed to every call, so one kernel serves concurrent verifications against different rule sets.
 */
public class Kernel {

    public static final String CONFIG_RESOURCE = "/kernel.json";
    public static final Soundness DEFAULT_SOUNDNESS = Soundness.WARN;
    public static final int DEFAULT_TABLE_WARN_VARS = 16;

    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    public final Configuration config;

    public Kernel() {
        this(new Configuration());
    }

    public Kernel(Configuration config) {
        this.config = requireNonNull(config);
        logger.info("Kernel configured: soundness={}, tableWarnVars={}", config.soundness(), config.tableWarnVars());
    }

    /** Kernel configured from {@value #CONFIG_RESOURCE} on the classpath, or with defaults when absent. */
    public static Kernel load() {
        return new Kernel(Configuration.load(CONFIG_RESOURCE));
    }

    /** A rule-set builder applying the configured soundness policy. */
    public Rules.Builder rules() {
        return Rules.builder(config.soundness());
    }

    public Verdict verify(Rules rules, Proof proof) {
        return Verifier.verify(rules, proof);
    }

    public Table table(Formula f) {
        warnIfLarge(f);
        return Table.of(f);
    }

    public boolean isTautology(Formula f) {
        warnIfLarge(f);
        return Table.isTautology(f);
    }

    private void warnIfLarge(Formula f) {
        var k = f.vars().size();
        if (k > config.tableWarnVars())
            logger.warn("Truth table of {} has 2^{} rows", f, k);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("soundness") Soundness soundness,
            @JsonProperty("tableWarnVars") int tableWarnVars
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("soundness") Soundness soundness,
                @JsonProperty("tableWarnVars") Integer tableWarnVars
        ) {
            this(
                    soundness != null ? soundness : DEFAULT_SOUNDNESS,
                    tableWarnVars != null ? tableWarnVars : DEFAULT_TABLE_WARN_VARS
            );
        }

        public Configuration() {
            this(DEFAULT_SOUNDNESS, DEFAULT_TABLE_WARN_VARS);
        }

        public Configuration(Soundness soundness, int tableWarnVars) {
            this.soundness = requireNonNull(soundness);
            if (tableWarnVars < 0) throw new IllegalArgumentException("tableWarnVars must be non-negative: " + tableWarnVars);
            this.tableWarnVars = tableWarnVars;
        }

        static Configuration load(String resource) {
            try (var in = Kernel.class.getResourceAsStream(resource)) {
                if (in == null) {
                    logger.info("No {} on the classpath, using default configuration", resource);
                    return new Configuration();
                }
                return Json.obj(in, Configuration.class);
            } catch (IOException e) {
                logger.error("Failed to read configuration {}: {}", resource, e.getMessage(), e);
                return new Configuration();
            }
        }
    }
}
