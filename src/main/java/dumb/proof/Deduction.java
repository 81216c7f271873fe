package dumb.proof;

import dumb.proof.Formula.Imp;
import dumb.proof.Formula.Var;
import dumb.proof.Proof.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static dumb.proof.Proof.Step.apply;
import static dumb.proof.Proof.Step.axiom;

/**
 * The deduction theorem for {@link Rules#hilbert()}: a proof of {@code G} from hypotheses
 * including {@code H} becomes a proof of {@code H→G} from the others.
 */
public final class Deduction {

    private static final Logger logger = LoggerFactory.getLogger(Deduction.class);

    private static final Var A = Var.of("A"), B = Var.of("B"), C = Var.of("C");

    private static final Rules HILBERT = Rules.hilbert();

    private static final List<String> REQUIRED = List.of("MP", "AX1", "AX2");

    private Deduction() {
    }

    /** Hilbert proof of {@code f→f} without hypotheses. */
    public static Proof selfImplication(Formula f) {
        return Proof.of(f.imp(f), List.of(),
                axiom("AX1", Binding.of(A, f, B, f)),
                axiom("AX1", Binding.of(A, f.imp(f), B, f)),
                axiom("AX2", Binding.of(A, f, B, f.imp(f), C, f)),
                apply("MP", 1, 2),
                apply("MP", 0, 3));
    }

    /**
     * Discharges {@code assumption}: returns a proof of {@code assumption→goal} whose hypotheses
     * are those the original proof uses, minus {@code assumption}.
     *
     * @throws IllegalArgumentException when {@code rules} lacks the Hilbert MP, AX1 or AX2, when
     *                                  {@code proof} does not verify, or when a step needed for the
     *                                  goal applies a rule other than MP
     */
    public static Proof assumptionToImplication(Rules rules, Proof proof, Formula assumption) throws LogicException {
        for (var id : REQUIRED) {
            if (!HILBERT.rule(id).equals(rules.get(id)))
                throw new IllegalArgumentException("Rule set lacks the Hilbert rule " + id);
        }
        var verdict = Verifier.verify(rules, proof);
        if (!verdict.isVerified())
            throw new IllegalArgumentException("Cannot discharge " + assumption + " from an unverified proof: " + verdict);
        var result = discharge(rules, proof, assumption);
        logger.debug("Discharged {} from {}: {} steps", assumption, proof, result.steps().size());
        return result;
    }

    /** {@code proof} verifies and the goal is established by its last step. */
    private static Proof discharge(Rules rules, Proof proof, Formula h) throws LogicException {
        var last = proof.steps().size() - 1;
        var goal = proof.goal();

        if (!usesHypothesis(proof, last, h)) {
            var sub = Verifier.subproof(rules, proof, last);
            var n = sub.steps().size();
            var steps = new ArrayList<>(sub.steps());
            steps.add(axiom("AX1", Binding.of(A, h, B, goal)));
            steps.add(apply("MP", n - 1, n));
            return new Proof(sub.hypotheses(), h.imp(goal), steps);
        }

        if (goal instanceof Imp i && i.right().equals(h))
            return Proof.of(h.imp(goal), List.of(), axiom("AX1", Binding.of(A, i.left(), B, h)));

        if (!(proof.steps().get(last) instanceof Step.Apply mp) || !mp.ruleId().equals("MP"))
            throw new IllegalArgumentException("Cannot discharge " + h + ": step " + last + " of " + proof + " is not modus ponens");

        // MP: X, X→G ⊢ G
        var p1 = lift(rules, proof, mp.refs().get(0), h);
        var p2 = lift(rules, proof, mp.refs().get(1), h);
        var x = ((Imp) p1.goal()).right();
        var mixed = Proof.mix(p1, p2);
        var i1 = p1.steps().size() - 1;
        var i2 = mixed.steps().size() - 1;
        var steps = new ArrayList<>(mixed.steps());
        steps.add(axiom("AX2", Binding.of(A, h, B, x, C, goal)));
        steps.add(apply("MP", i2, i2 + 1));
        steps.add(apply("MP", i1, i2 + 2));
        return new Proof(mixed.hypotheses(), h.imp(goal), steps);
    }

    /** A proof of {@code h→f}, where {@code f} is the formula {@code ref} refers to. */
    private static Proof lift(Rules rules, Proof proof, int ref, Formula h) throws LogicException {
        if (!Proof.isHyp(ref))
            return discharge(rules, Verifier.subproof(rules, proof, ref), h);
        var f = proof.hypotheses().get(Proof.hypIndex(ref));
        if (f.equals(h))
            return selfImplication(h);
        return Proof.of(h.imp(f), List.of(f),
                axiom("AX1", Binding.of(A, h, B, f)),
                apply("MP", Proof.hyp(0), 0));
    }

    private static boolean usesHypothesis(Proof proof, int index, Formula h) {
        return proof.dependencies(index).hypotheses().stream().anyMatch(k -> proof.hypotheses().get(k).equals(h));
    }
}
