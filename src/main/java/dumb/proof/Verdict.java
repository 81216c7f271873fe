package dumb.proof;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.proof.LogicException.Fault;
import dumb.proof.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of verifying a proof. {@link #established()} holds one entry per checked step, empty
 * where the step's formula is unknown.
 */
sealed public interface Verdict permits Verdict.Verified, Verdict.Partial, Verdict.Failed {

    List<Optional<Formula>> established();

    Status status();

    default boolean isVerified() {
        return status() == Status.VERIFIED;
    }

    default ObjectNode toJson() {
        var json = Json.node().put("status", status().name());
        var steps = json.putArray("established");
        established().forEach(f -> {
            if (f.isPresent()) steps.add(f.get().toString());
            else steps.addNull();
        });
        return json;
    }

    enum Status {VERIFIED, PARTIAL, FAILED}

    /** Every step checked and the last one establishes the goal. */
    record Verified(List<Optional<Formula>> established) implements Verdict {
        public Verified {
            established = List.copyOf(established);
        }

        @Override
        public Status status() {
            return Status.VERIFIED;
        }
    }

    /** No step failed, but at least one is incomplete or depends on an incomplete step. */
    record Partial(List<Optional<Formula>> established) implements Verdict {
        public Partial {
            established = List.copyOf(established);
        }

        @Override
        public Status status() {
            return Status.PARTIAL;
        }
    }

    /**
     * Verification stopped at {@code step}. {@code pattern} and {@code subject} are the two formulas
     * involved in the failure, where there are two.
     */
    record Failed(int step, Fault fault, String message, @Nullable String ruleId,
                  @Nullable Formula pattern, @Nullable Formula subject,
                  List<Optional<Formula>> established) implements Verdict {
        public Failed {
            requireNonNull(fault);
            requireNonNull(message);
            established = List.copyOf(established);
        }

        static Failed of(int step, LogicException e, List<Optional<Formula>> established) {
            return new Failed(step, e.fault, e.getMessage(), e.ruleId, e.pattern, e.subject, established);
        }

        @Override
        public Status status() {
            return Status.FAILED;
        }

        @Override
        public ObjectNode toJson() {
            var json = Verdict.super.toJson()
                    .put("step", step)
                    .put("fault", fault.name())
                    .put("message", message);
            if (ruleId != null) json.put("ruleId", ruleId);
            if (pattern != null) json.put("pattern", pattern.toString());
            if (subject != null) json.put("subject", subject.toString());
            return json;
        }

        @Override
        public String toString() {
            return "FAILED at step " + step + " [" + fault + "] " + message;
        }
    }
}
