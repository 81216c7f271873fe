package dumb.proof;

import dumb.proof.LogicException.Fault;
import dumb.proof.Proof.Step;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Replays a proof step by step against a rule set. Single pass, no backtracking: every binding
 * is either supplied by the step or derived by matching the referenced formulas.
 */
public final class Verifier {

    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private Verifier() {
    }

    public static Verdict verify(Rules rules, Proof proof) {
        var n = proof.steps().size();
        var established = new ArrayList<Optional<Formula>>(n);
        var failed = replay(rules, proof, n, established);
        if (failed != null) return failed;

        var last = established.get(n - 1);
        if (last.isPresent() && !last.get().equals(proof.goal())) {
            var f = new Verdict.Failed(n - 1, Fault.GOAL_MISMATCH,
                    "Last step establishes " + last.get() + " but the goal is " + proof.goal(),
                    null, proof.goal(), last.get(), established);
            logger.debug("{}: {}", proof, f);
            return f;
        }
        Verdict v = proof.isComplete() ? new Verdict.Verified(established) : new Verdict.Partial(established);
        logger.debug("{}: {}", proof, v.status());
        return v;
    }

    /**
     * The smallest proof of the formula established at step {@code index}: only the hypotheses and
     * steps it depends on are kept, and references are renumbered accordingly.
     *
     * @throws LogicException           the failure of a step at or before {@code index}
     * @throws IllegalArgumentException when the formula at {@code index} is not established
     */
    public static Proof subproof(Rules rules, Proof proof, int index) throws LogicException {
        if (index < 0 || index >= proof.steps().size())
            throw new IndexOutOfBoundsException("No step " + index + " in a proof of " + proof.steps().size() + " steps");
        var established = new ArrayList<Optional<Formula>>(index + 1);
        var failed = replay(rules, proof, index + 1, established);
        if (failed != null)
            throw new LogicException(failed.fault(), "Step " + failed.step() + ": " + failed.message(), failed.ruleId(), failed.pattern(), failed.subject());
        var goal = established.get(index)
                .orElseThrow(() -> new IllegalArgumentException("Step " + index + " is not established"));

        var deps = proof.dependencies(index);
        var keptSteps = new TreeSet<>(deps.steps());
        keptSteps.add(index);
        var keptHyps = new TreeSet<>(deps.hypotheses());

        var hypMap = new HashMap<Integer, Integer>();
        var hypotheses = new ArrayList<Formula>();
        for (var k : keptHyps) {
            hypMap.put(k, hypotheses.size());
            hypotheses.add(proof.hypotheses().get(k));
        }
        var stepMap = new HashMap<Integer, Integer>();
        var steps = new ArrayList<Step>();
        for (var i : keptSteps) {
            stepMap.put(i, steps.size());
            var step = proof.steps().get(i);
            if (step instanceof Step.Apply a) {
                var refs = a.refs().stream()
                        .map(r -> Proof.isHyp(r) ? Proof.hyp(hypMap.get(Proof.hypIndex(r))) : stepMap.get(r))
                        .toList();
                step = new Step.Apply(a.ruleId(), refs, a.binding());
            }
            steps.add(step);
        }
        return new Proof(hypotheses, goal, steps);
    }

    /**
     * Checks the first {@code count} steps, appending one entry per step to {@code established}.
     *
     * @return the failure that stopped the replay, or null when all {@code count} steps passed
     */
    @Nullable
    private static Verdict.Failed replay(Rules rules, Proof proof, int count, List<Optional<Formula>> established) {
        for (var i = 0; i < count; i++) {
            var step = proof.steps().get(i);
            try {
                established.add(check(rules, proof, i, step, established));
            } catch (LogicException e) {
                var f = Verdict.Failed.of(i, e, established);
                logger.debug("{}: step {} ({}) failed: {}", proof, i, step, e.getMessage());
                return f;
            }
        }
        return null;
    }

    private static Optional<Formula> check(Rules rules, Proof proof, int index, Step step, List<Optional<Formula>> established) throws LogicException {
        if (step instanceof Step.Axiom ax) {
            var rule = rules.rule(ax.ruleId());
            if (!rule.isAxiom())
                throw new LogicException(Fault.NOT_AN_AXIOM, "Rule " + rule.id() + " has " + rule.arity() + " assumptions and cannot be specialized as an axiom", rule.id(), null, null);
            return Optional.of(rule.apply(ax.binding()));
        }
        if (step instanceof Step.Apply ap) {
            var rule = rules.rule(ap.ruleId());
            var candidates = new ArrayList<Formula>(ap.refs().size());
            var unknown = false;
            for (int ref : ap.refs()) {
                var f = resolve(proof, index, ref, established);
                if (f.isPresent()) candidates.add(f.get());
                else unknown = true;
            }
            if (ap.refs().size() != rule.arity())
                throw new LogicException(Fault.ARITY_MISMATCH,
                        "Rule " + rule.id() + " has " + rule.arity() + " assumptions but step references " + ap.refs().size(), rule.id(), null, null);
            if (unknown) return Optional.empty();
            return Optional.of(rule.apply(candidates, ap.binding()));
        }
        return Optional.empty();
    }

    private static Optional<Formula> resolve(Proof proof, int index, int ref, List<Optional<Formula>> established) throws LogicException {
        if (Proof.isHyp(ref)) {
            var k = Proof.hypIndex(ref);
            if (k >= proof.hypotheses().size())
                throw new LogicException(Fault.DANGLING_REFERENCE,
                        "Step " + index + " references hypothesis " + k + " but the proof has " + proof.hypotheses().size());
            return Optional.of(proof.hypotheses().get(k));
        }
        if (ref >= index)
            throw new LogicException(Fault.DANGLING_REFERENCE,
                    "Step " + index + " references step " + ref + ", which is not established before it");
        return established.get(ref);
    }
}
