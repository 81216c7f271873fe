package dumb.proof;

import dumb.proof.Formula.Var;
import dumb.proof.LogicException.Fault;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable set of rules keyed by id. Built once and then only read, so one instance can back
 * any number of concurrent verifications.
 */
public final class Rules {

    private static final Logger logger = LoggerFactory.getLogger(Rules.class);

    private static final Var A = Var.of("A"), B = Var.of("B"), C = Var.of("C");

    private final Map<String, Rule> rules;

    private Rules(Map<String, Rule> rules) {
        this.rules = rules;
    }

    public static Builder builder() {
        return new Builder(Soundness.WARN);
    }

    public static Builder builder(Soundness soundness) {
        return new Builder(soundness);
    }

    /** Modus ponens and Mendelson's three axiom schemes. */
    public static Rules hilbert() {
        return builtin(List.of(
                Rule.of("MP", B, A, A.imp(B)),
                Rule.axiom("AX1", B.imp(A.imp(B))),
                Rule.axiom("AX2", A.imp(B.imp(C)).imp(A.imp(B).imp(A.imp(C)))),
                Rule.axiom("AX3", B.neg().imp(A.neg()).imp(B.neg().imp(A).imp(B)))));
    }

    /** Elimination and introduction rules for ∧, ∨ and ¬¬, modus ponens and reiteration. */
    public static Rules naturalDeduction() {
        return builtin(List.of(
                Rule.of("E∧1", A, A.and(B)),
                Rule.of("E∧2", B, A.and(B)),
                Rule.of("MP", B, A.imp(B), A),
                Rule.of("E¬¬", A, A.neg().neg()),
                Rule.of("I∨1", A.or(B), A),
                Rule.of("I∨2", B.or(A), A),
                Rule.of("I∧", A.and(B), A, B),
                Rule.of("R", A, A)));
    }

    private static Rules builtin(List<Rule> list) {
        var b = builder(Soundness.IGNORE);
        try {
            for (var r : list) b.add(r);
        } catch (LogicException e) {
            throw new IllegalStateException("Built-in rule rejected: " + e.getMessage(), e);
        }
        return b.build();
    }

    @Nullable
    public Rule get(String id) {
        return rules.get(id);
    }

    /**
     * @throws LogicException {@code UNKNOWN_RULE} when no rule has this id
     */
    public Rule rule(String id) throws LogicException {
        var r = rules.get(id);
        if (r == null)
            throw new LogicException(Fault.UNKNOWN_RULE, "Unknown rule: " + id, id, null, null);
        return r;
    }

    public boolean contains(String id) {
        return rules.containsKey(id);
    }

    public Collection<Rule> all() {
        return rules.values();
    }

    public int size() {
        return rules.size();
    }

    /** A builder holding every rule of this set, for declaring more rules on top of it. */
    public Builder extend(Soundness soundness) {
        var b = new Builder(soundness);
        b.rules.putAll(rules);
        return b;
    }

    @Override
    public String toString() {
        return "Rules" + rules.keySet();
    }

    /** How rule declarations are checked against truth-table semantics. */
    public enum Soundness {
        /** Rules are trusted as declared. */
        IGNORE,
        /** Unsound rules are accepted and logged. */
        WARN,
        /** Unsound rules are refused with {@code UNSOUND_RULE}. */
        REJECT
    }

    public static final class Builder {
        private final Soundness soundness;
        private final Map<String, Rule> rules = new LinkedHashMap<>();

        private Builder(Soundness soundness) {
            this.soundness = requireNonNull(soundness);
        }

        /**
         * Declares a rule. A derived rule's proof is verified against the rules declared so far.
         *
         * @throws IllegalArgumentException when the id is already declared
         * @throws LogicException           {@code UNSOUND_RULE} or {@code UNPROVEN_RULE}
         */
        public Builder add(Rule rule) throws LogicException {
            requireNonNull(rule);
            if (rules.containsKey(rule.id()))
                throw new IllegalArgumentException("Duplicate rule id: " + rule.id());
            if (soundness != Soundness.IGNORE && !rule.isSound()) {
                if (soundness == Soundness.REJECT)
                    throw new LogicException(Fault.UNSOUND_RULE, "Rule is not a tautology: " + rule, rule.id(), rule.conclusion(), null);
                logger.warn("Declared rule is not a tautology: {}", rule);
            }
            if (rule.proof() != null) {
                var verdict = Verifier.verify(new Rules(Map.copyOf(rules)), rule.proof());
                if (!verdict.isVerified())
                    throw new LogicException(Fault.UNPROVEN_RULE, "Proof of derived rule " + rule.id() + " does not verify: " + verdict, rule.id(), rule.conclusion(), null);
            }
            rules.put(rule.id(), rule);
            return this;
        }

        public Rules build() {
            return new Rules(Collections.unmodifiableMap(new LinkedHashMap<>(rules)));
        }
    }
}
