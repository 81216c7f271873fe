package dumb.proof;

import dumb.proof.Formula.Const;
import dumb.proof.Formula.Var;
import dumb.proof.LogicException.Fault;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Inference rule schema {@code assumptions ⊢ conclusion}. A rule without assumptions is an
 * axiom. A rule that carries a {@link Proof} is a derived rule: the proof shows the conclusion
 * from the assumptions and is checked when the rule is added to a {@link Rules} set.
 */
public record Rule(String id, List<Formula> assumptions, Formula conclusion, @Nullable Proof proof) {

    public Rule {
        requireNonNull(id);
        if (id.isBlank()) throw new IllegalArgumentException("Rule id must not be blank");
        assumptions = List.copyOf(requireNonNull(assumptions));
        requireNonNull(conclusion);
        if (proof != null) {
            if (!proof.hypotheses().equals(assumptions))
                throw new IllegalArgumentException("Proof of rule " + id + " must have the rule's assumptions as hypotheses: " + proof.hypotheses());
            if (!proof.goal().equals(conclusion))
                throw new IllegalArgumentException("Proof of rule " + id + " must have the rule's conclusion as goal: " + proof.goal());
        }
    }

    public Rule(String id, List<Formula> assumptions, Formula conclusion) {
        this(id, assumptions, conclusion, null);
    }

    public static Rule axiom(String id, Formula conclusion) {
        return new Rule(id, List.of(), conclusion);
    }

    public static Rule of(String id, Formula conclusion, Formula... assumptions) {
        return new Rule(id, List.of(assumptions), conclusion);
    }

    /** Derived rule: the hypotheses and goal of {@code proof} become the assumptions and conclusion. */
    public static Rule derived(String id, Proof proof) {
        return new Rule(id, proof.hypotheses(), proof.goal(), proof);
    }

    public boolean isAxiom() {
        return assumptions.isEmpty();
    }

    public boolean isDerived() {
        return proof != null;
    }

    public int arity() {
        return assumptions.size();
    }

    public Set<Var> assumptionVars() {
        return assumptions.stream().flatMap(a -> a.vars().stream()).collect(Collectors.toUnmodifiableSet());
    }

    /** Variables of the assumptions and the conclusion. */
    public Set<Var> vars() {
        var all = new HashSet<>(assumptionVars());
        all.addAll(conclusion.vars());
        return Set.copyOf(all);
    }

    /**
     * Instantiates the conclusion.
     *
     * @throws LogicException {@code MALFORMED_BINDING} when {@code binding} leaves a variable of the rule unbound
     */
    public Formula apply(Binding binding) throws LogicException {
        var missing = vars().stream().filter(v -> !binding.containsKey(v)).collect(Collectors.toSet());
        if (!missing.isEmpty())
            throw new LogicException(Fault.MALFORMED_BINDING,
                    "Binding " + binding + " leaves " + Table.sortVars(missing) + " unbound in rule " + id, id, conclusion, null);
        return conclusion.subst(binding);
    }

    /**
     * Matches every assumption, in order, against the candidate at the same position, accumulating
     * a single binding across all of them.
     */
    public Binding matchAssumptions(List<Formula> candidates) throws LogicException {
        if (candidates.size() != assumptions.size())
            throw new LogicException(Fault.ARITY_MISMATCH,
                    "Rule " + id + " has " + assumptions.size() + " assumptions but " + candidates.size() + " formulas were given", id, null, null);
        var binding = Binding.EMPTY;
        for (var i = 0; i < assumptions.size(); i++) {
            try {
                binding = Logic.Unifier.unify(assumptions.get(i), candidates.get(i), binding);
            } catch (LogicException e) {
                throw e.inRule(id);
            }
        }
        return binding;
    }

    /**
     * Matches {@code candidates}, merges the result with {@code explicit} and instantiates the
     * conclusion. {@code explicit} supplies variables occurring only in the conclusion and must agree
     * with everything matching derived.
     */
    public Formula apply(List<Formula> candidates, Binding explicit) throws LogicException {
        var derived = matchAssumptions(candidates);
        Binding merged;
        try {
            merged = derived.merge(explicit);
        } catch (LogicException e) {
            throw e.inRule(id);
        }
        return apply(merged);
    }

    /** Whether {@code (T∧a1∧…∧an)→c} is a tautology. */
    public boolean isSound() {
        Formula premise = Const.TRUE;
        for (var a : assumptions) premise = premise.and(a);
        return Table.isTautology(premise.imp(conclusion));
    }

    /** The rule with {@code binding} applied to every assumption and the conclusion. */
    public Rule specialize(Binding binding) {
        return new Rule(id + " specialized", assumptions.stream().map(a -> a.subst(binding)).toList(), conclusion.subst(binding));
    }

    /** Whether this rule is an instance of {@code general} under one consistent binding. */
    public boolean isSpecializationOf(Rule general) {
        if (arity() != general.arity()) return false;
        var mine = new ArrayList<>(assumptions);
        mine.add(conclusion);
        var theirs = new ArrayList<>(general.assumptions);
        theirs.add(general.conclusion);
        var binding = Binding.EMPTY;
        try {
            for (var i = 0; i < mine.size(); i++)
                binding = Logic.Unifier.unify(theirs.get(i), mine.get(i), binding);
            return true;
        } catch (LogicException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return id + ": " + assumptions.stream().map(Formula::toString).collect(Collectors.joining(", ")) + " ⊢ " + conclusion;
    }
}
