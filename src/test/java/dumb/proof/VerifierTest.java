package dumb.proof;

import dumb.proof.LogicException.Fault;
import dumb.proof.Proof.Step;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

import static dumb.proof.Deduction.selfImplication;
import static dumb.proof.Proof.hyp;
import static dumb.proof.Proof.Step.apply;
import static dumb.proof.Proof.Step.axiom;
import static dumb.proof.Proof.Step.incomplete;
import static org.junit.jupiter.api.Assertions.*;

class VerifierTest extends AbstractTest {

    private static final Rules ND = Rules.naturalDeduction();
    private static final Rules HILBERT = Rules.hilbert();

    /** {@code P, P→Q ⊢ Q} and reiteration. */
    private static final Rules MP_ONLY = rules(Rule.of("MP", Q, P, P.imp(Q)), Rule.of("R", P, P));

    private static Rules rules(Rule... rules) {
        var b = Rules.builder(Rules.Soundness.IGNORE);
        try {
            for (var r : rules) b.add(r);
        } catch (LogicException e) {
            throw new IllegalStateException(e);
        }
        return b.build();
    }

    @Test
    void modusPonensFromHypotheses() {
        var proof = Proof.of(B, fs("A", "→ A B"),
                apply("R", hyp(0)),
                apply("MP", 0, hyp(1)));
        assertTrue(proof.isComplete());
        var v = assertVerified(Verifier.verify(MP_ONLY, proof));
        assertEquals(List.of(Optional.of(A), Optional.of(B)), v.established());
    }

    @Test
    void hilbertProvesSelfImplication() {
        var v = assertVerified(Verifier.verify(HILBERT, selfImplication(A)));
        assertEquals(Optional.of(f("→ A A")), v.established().get(4));
        assertVerified(Verifier.verify(HILBERT, selfImplication(f("∧ P ¬ Q"))));
    }

    @Test
    void danglingForwardReference() {
        var proof = Proof.of(B, fs("A", "→ A B"),
                apply("MP", 5, hyp(1)),
                apply("R", hyp(0)));
        var failed = assertFailed(Verifier.verify(MP_ONLY, proof), Fault.DANGLING_REFERENCE, 0);
        assertTrue(failed.established().isEmpty());
    }

    @Test
    void selfReferenceIsDangling() {
        var proof = Proof.of(A, fs("A"),
                apply("R", hyp(0)),
                apply("R", 1));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.DANGLING_REFERENCE, 1);
    }

    @Test
    void missingHypothesisIsDangling() {
        var proof = Proof.of(A, fs("A"), apply("R", hyp(3)));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.DANGLING_REFERENCE, 0);
    }

    @Test
    void conflictingBindingAcrossAssumptions() {
        var proof = Proof.of(C, fs("A", "→ B C"), apply("MP", hyp(0), hyp(1)));
        var failed = assertFailed(Verifier.verify(MP_ONLY, proof), Fault.BINDING_CONFLICT, 0);
        assertEquals("MP", failed.ruleId());
        assertEquals(A, failed.pattern());
        assertEquals(B, failed.subject());
    }

    @Test
    void explicitBindingMustAgreeWithMatching() {
        var proof = Proof.of(B, fs("A", "→ A B"),
                apply("MP", Binding.of(P, C), hyp(0), hyp(1)));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.BINDING_CONFLICT, 0);

        var agreeing = Proof.of(B, fs("A", "→ A B"),
                apply("MP", Binding.of(P, A, Q, B), hyp(0), hyp(1)));
        assertVerified(Verifier.verify(MP_ONLY, agreeing));
    }

    @Test
    void explicitBindingSuppliesConclusionOnlyVariable() {
        var proof = Proof.of(f("∨ A ¬ C"), fs("A"), apply("I∨1", Binding.of(B, f("¬ C")), hyp(0)));
        assertVerified(Verifier.verify(ND, proof));

        var unbound = Proof.of(f("∨ A ¬ C"), fs("A"), apply("I∨1", hyp(0)));
        assertFailed(Verifier.verify(ND, unbound), Fault.MALFORMED_BINDING, 0);
    }

    @Test
    void incompleteStepGivesPartial() {
        var proof = Proof.of(B, fs("A", "→ A B"),
                incomplete(),
                apply("MP", hyp(0), hyp(1)));
        assertFalse(proof.isComplete());
        var v = Verifier.verify(MP_ONLY, proof);
        assertInstanceOf(Verdict.Partial.class, v);
        assertFalse(v.isVerified());
        assertEquals(List.of(Optional.empty(), Optional.of(B)), v.established());
    }

    @Test
    void stepsDependingOnIncompleteStepAreUnknown() {
        var proof = Proof.of(B, fs("→ A B"),
                incomplete(),
                apply("MP", 0, hyp(0)));
        var v = Verifier.verify(MP_ONLY, proof);
        assertEquals(Verdict.Status.PARTIAL, v.status());
        assertEquals(List.of(Optional.empty(), Optional.empty()), v.established());
    }

    @Test
    void failureAfterIncompleteStepStillFails() {
        var proof = Proof.of(B, fs("A"),
                incomplete(),
                apply("Nope", hyp(0)));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.UNKNOWN_RULE, 1);
    }

    @Test
    void knownWrongConclusionFailsEvenWhenPartial() {
        var proof = Proof.of(B, fs("A"),
                incomplete(),
                apply("R", hyp(0)));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.GOAL_MISMATCH, 1);
    }

    @Test
    void goalMismatch() {
        var proof = Proof.of(f("→ B B"), List.of(), axiom("AX1", Binding.of(A, B, B, B)));
        var failed = assertFailed(Verifier.verify(HILBERT, proof), Fault.GOAL_MISMATCH, 0);
        assertEquals(f("→ B B"), failed.pattern());
        assertEquals(f("→ B → B B"), failed.subject());
        assertEquals(1, failed.established().size());
    }

    @Test
    void unknownRule() {
        var proof = Proof.of(A, fs("A"), apply("R", hyp(0)), apply("Missing", 0));
        var failed = assertFailed(Verifier.verify(MP_ONLY, proof), Fault.UNKNOWN_RULE, 1);
        assertEquals("Missing", failed.ruleId());
        assertEquals(List.of(Optional.of(A)), failed.established());
    }

    @Test
    void axiomSpecializationOfRuleWithAssumptions() {
        var proof = Proof.of(B, List.of(), axiom("MP", Binding.of(A, A, B, B)));
        assertFailed(Verifier.verify(HILBERT, proof), Fault.NOT_AN_AXIOM, 0);
    }

    @Test
    void axiomSpecializationMustCoverEveryVariable() {
        var proof = Proof.of(f("→ B → A B"), List.of(), axiom("AX1", Binding.of(B, B)));
        assertFailed(Verifier.verify(HILBERT, proof), Fault.MALFORMED_BINDING, 0);
    }

    @Test
    void arityMismatch() {
        var proof = Proof.of(B, fs("A", "→ A B"), apply("MP", hyp(1)));
        assertFailed(Verifier.verify(MP_ONLY, proof), Fault.ARITY_MISMATCH, 0);
    }

    @Test
    void unificationFailureCarriesSubformulas() {
        var proof = Proof.of(B, fs("A", "∧ A B"), apply("MP", hyp(0), hyp(1)));
        var failed = assertFailed(Verifier.verify(MP_ONLY, proof), Fault.UNIFICATION_FAILURE, 0);
        assertEquals(P.imp(Q), failed.pattern());
        assertEquals(f("∧ A B"), failed.subject());
        assertTrue(failed.message().contains("MP"), failed.message());
    }

    @Test
    void failureStopsVerification() {
        var proof = Proof.of(A, fs("A"),
                apply("MP", hyp(0)),
                apply("Missing", hyp(0)));
        var failed = assertFailed(Verifier.verify(MP_ONLY, proof), Fault.ARITY_MISMATCH, 0);
        assertTrue(failed.established().isEmpty());
    }

    @Test
    void reverificationIsDeterministic() {
        var proof = selfImplication(f("∨ A B"));
        var first = Verifier.verify(HILBERT, proof);
        assertVerified(first);
        for (var i = 0; i < 5; i++)
            assertEquals(first, Verifier.verify(HILBERT, proof));
    }

    @Test
    void concurrentVerificationsShareRules() {
        var verdicts = IntStream.range(0, 64).parallel()
                .mapToObj(i -> Verifier.verify(HILBERT, selfImplication(Formula.var("V" + i))))
                .toList();
        assertTrue(verdicts.stream().allMatch(Verdict::isVerified));
    }

    @Test
    void inputsAreLeftUntouched() {
        var proof = selfImplication(A);
        var copy = new Proof(proof.hypotheses(), proof.goal(), proof.steps());
        Verifier.verify(HILBERT, proof);
        assertEquals(copy, proof);
    }

    @Test
    void verdictJson() {
        var proof = Proof.of(B, fs("A", "∧ A B"), apply("MP", hyp(0), hyp(1)));
        var json = Verifier.verify(MP_ONLY, proof).toJson();
        assertEquals("FAILED", json.get("status").asText());
        assertEquals("UNIFICATION_FAILURE", json.get("fault").asText());
        assertEquals(0, json.get("step").asInt());
        assertEquals("(P→Q)", json.get("pattern").asText());

        var ok = Verifier.verify(HILBERT, selfImplication(A)).toJson();
        assertEquals("VERIFIED", ok.get("status").asText());
        assertEquals("(A→A)", ok.get("established").get(4).asText());
    }

    @Test
    void dependenciesAndSuperfluousHypotheses() {
        var proof = Proof.of(B, fs("C", "A", "→ A B"),
                apply("R", hyp(0)),
                apply("R", hyp(1)),
                apply("MP", 1, hyp(2)));
        assertVerified(Verifier.verify(MP_ONLY, proof));
        var deps = proof.dependencies(2);
        assertEquals(Set.of(1), deps.steps());
        assertEquals(Set.of(1, 2), deps.hypotheses());
        assertEquals(List.of(0), proof.superfluousHypotheses());
    }

    @Test
    void subproofKeepsOnlyWhatTheStepNeeds() throws LogicException {
        var proof = Proof.of(B, fs("C", "A", "→ A B"),
                apply("R", hyp(0)),
                apply("R", hyp(1)),
                apply("MP", 1, hyp(2)));
        var sub = Verifier.subproof(MP_ONLY, proof, 2);
        assertEquals(fs("A", "→ A B"), sub.hypotheses());
        assertEquals(B, sub.goal());
        assertEquals(List.of(apply("R", hyp(0)), apply("MP", 0, hyp(1))), sub.steps());
        assertVerified(Verifier.verify(MP_ONLY, sub));
        assertTrue(sub.superfluousHypotheses().isEmpty());
    }

    @Test
    void subproofOfIntermediateStep() throws LogicException {
        var proof = selfImplication(A);
        var sub = Verifier.subproof(HILBERT, proof, 3);
        assertEquals(f("→ → A → A A → A A"), sub.goal());
        assertEquals(3, sub.steps().size());
        assertVerified(Verifier.verify(HILBERT, sub));
    }

    @Test
    void subproofOfFailingProof() {
        var proof = Proof.of(A, fs("A"), apply("Missing", hyp(0)));
        assertFault(Fault.UNKNOWN_RULE, assertThrows(LogicException.class, () -> Verifier.subproof(MP_ONLY, proof, 0)));
        var partial = Proof.of(A, fs("A"), incomplete());
        assertThrows(IllegalArgumentException.class, () -> Verifier.subproof(MP_ONLY, partial, 0));
    }

    @Test
    void emptyProofIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Proof(List.of(), A, List.<Step>of()));
    }
}
