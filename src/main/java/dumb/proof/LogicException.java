package dumb.proof;

import org.jetbrains.annotations.Nullable;

/**
 * A typed kernel failure. Carries enough context (rule id, the two formulas that failed to
 * match) for the caller to act on it. The verifier converts these into {@link Verdict.Failed}.
 */
public class LogicException extends Exception {

    public final Fault fault;
    @Nullable
    public final String ruleId;
    @Nullable
    public final Formula pattern, subject;

    public LogicException(Fault fault, String message) {
        this(fault, message, null, null, null);
    }

    public LogicException(Fault fault, String message, @Nullable String ruleId, @Nullable Formula pattern, @Nullable Formula subject) {
        super(message);
        this.fault = fault;
        this.ruleId = ruleId;
        this.pattern = pattern;
        this.subject = subject;
    }

    static LogicException mismatch(Formula pattern, Formula subject) {
        return new LogicException(Fault.UNIFICATION_FAILURE, "Cannot match " + pattern + " against " + subject, null, pattern, subject);
    }

    static LogicException conflict(Formula.Var var, Formula bound, Formula other) {
        return new LogicException(Fault.BINDING_CONFLICT, "Variable " + var + " bound to both " + bound + " and " + other, null, bound, other);
    }

    /** Attributes this failure to a rule, unless it already names one. */
    LogicException inRule(String id) {
        if (ruleId != null) return this;
        var e = new LogicException(fault, "Rule " + id + ": " + getMessage(), id, pattern, subject);
        e.setStackTrace(getStackTrace());
        return e;
    }

    public enum Fault {
        /** The binding does not cover every variable the instantiation needs. */
        MALFORMED_BINDING,
        UNKNOWN_RULE,
        NOT_AN_AXIOM,
        ARITY_MISMATCH,
        UNIFICATION_FAILURE,
        BINDING_CONFLICT,
        DANGLING_REFERENCE,
        GOAL_MISMATCH,
        UNASSIGNED_VARIABLE,
        /** A declared rule is not a tautology and the soundness policy rejects it. */
        UNSOUND_RULE,
        /** A derived rule's proof does not verify. */
        UNPROVEN_RULE
    }
}
