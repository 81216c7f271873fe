package dumb.proof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.util.Objects.requireNonNull;

/**
 * A proof of {@code goal} from {@code hypotheses}: an ordered list of steps, each establishing
 * one formula. Rule applications reference earlier steps by index; hypothesis {@code k} is
 * referenced by the reserved negative index {@link #hyp(int) hyp(k)}.
 */
public record Proof(List<Formula> hypotheses, Formula goal, List<Step> steps) {

    public Proof {
        hypotheses = List.copyOf(requireNonNull(hypotheses));
        requireNonNull(goal);
        steps = List.copyOf(requireNonNull(steps));
        if (steps.isEmpty()) throw new IllegalArgumentException("A proof needs at least one step");
    }

    public static Proof of(Formula goal, List<Formula> hypotheses, Step... steps) {
        return new Proof(hypotheses, goal, List.of(steps));
    }

    /** Reference to hypothesis {@code k}. */
    public static int hyp(int k) {
        if (k < 0) throw new IllegalArgumentException("Hypothesis index must be non-negative: " + k);
        return -(k + 1);
    }

    public static boolean isHyp(int ref) {
        return ref < 0;
    }

    /** Hypothesis position addressed by a negative reference. */
    public static int hypIndex(int ref) {
        return -ref - 1;
    }

    public static String refString(int ref) {
        return isHyp(ref) ? "h" + hypIndex(ref) : String.valueOf(ref);
    }

    public boolean isComplete() {
        return steps.stream().noneMatch(Step.Incomplete.class::isInstance);
    }

    /**
     * Steps and hypotheses that step {@code index} transitively depends on, the step itself excluded.
     * References that are out of range or not strictly backwards are ignored here; the verifier
     * reports them.
     */
    public Dependencies dependencies(int index) {
        if (index < 0 || index >= steps.size())
            throw new IndexOutOfBoundsException("No step " + index + " in a proof of " + steps.size() + " steps");
        var stepDeps = new TreeSet<Integer>();
        var hypDeps = new TreeSet<Integer>();
        var todo = new ArrayDeque<Integer>();
        todo.push(index);
        while (!todo.isEmpty()) {
            var i = todo.pop();
            if (!(steps.get(i) instanceof Step.Apply a)) continue;
            for (int ref : a.refs()) {
                if (isHyp(ref)) {
                    if (hypIndex(ref) < hypotheses.size()) hypDeps.add(hypIndex(ref));
                } else if (ref < i && stepDeps.add(ref)) {
                    todo.push(ref);
                }
            }
        }
        return new Dependencies(stepDeps, hypDeps);
    }

    /** Indices of hypotheses that the final step does not depend on. */
    public List<Integer> superfluousHypotheses() {
        var used = dependencies(steps.size() - 1).hypotheses();
        return IntStream.range(0, hypotheses.size()).filter(k -> !used.contains(k)).boxed().toList();
    }

    /**
     * Concatenates two proofs. Hypotheses of {@code first} come first, followed by those of
     * {@code second} that are not already present; the steps of {@code second} follow those of
     * {@code first} with their references shifted. The result proves the goal of {@code second}
     * and keeps every formula of {@code first} established at the same step index.
     */
    public static Proof mix(Proof first, Proof second) {
        var hypotheses = new ArrayList<>(first.hypotheses);
        var hypMap = new int[second.hypotheses.size()];
        for (var k = 0; k < hypMap.length; k++) {
            var h = second.hypotheses.get(k);
            var at = hypotheses.indexOf(h);
            if (at < 0) {
                at = hypotheses.size();
                hypotheses.add(h);
            }
            hypMap[k] = at;
        }
        var offset = first.steps.size();
        var steps = new ArrayList<>(first.steps);
        for (var step : second.steps) {
            if (step instanceof Step.Apply a) {
                var refs = a.refs().stream()
                        .map(r -> isHyp(r) ? hyp(hypMap[hypIndex(r)]) : r + offset)
                        .toList();
                step = new Step.Apply(a.ruleId(), refs, a.binding());
            }
            steps.add(step);
        }
        return new Proof(hypotheses, second.goal, steps);
    }

    @Override
    public String toString() {
        return hypotheses.stream().map(Formula::toString).collect(Collectors.joining(", ")) + " ⊢ " + goal;
    }

    public record Dependencies(Set<Integer> steps, Set<Integer> hypotheses) {
        public Dependencies {
            steps = Set.copyOf(steps);
            hypotheses = Set.copyOf(hypotheses);
        }
    }

    /** One proof step. */
    sealed public interface Step permits Step.Axiom, Step.Apply, Step.Incomplete {

        static Axiom axiom(String ruleId, Binding binding) {
            return new Axiom(ruleId, binding);
        }

        static Apply apply(String ruleId, int... refs) {
            return new Apply(ruleId, IntStream.of(refs).boxed().toList(), Binding.EMPTY);
        }

        static Apply apply(String ruleId, Binding binding, int... refs) {
            return new Apply(ruleId, IntStream.of(refs).boxed().toList(), binding);
        }

        static Incomplete incomplete() {
            return Incomplete.MARKER;
        }

        /** Specialization of an axiom; {@code binding} must cover every variable of the axiom. */
        record Axiom(String ruleId, Binding binding) implements Step {
            public Axiom {
                requireNonNull(ruleId);
                requireNonNull(binding);
            }

            @Override
            public String toString() {
                return "Ax " + ruleId + " " + binding;
            }
        }

        /**
         * Application of a rule to previously established formulas. The optional {@code binding}
         * cross-checks the matched one and supplies variables that occur only in the conclusion.
         */
        record Apply(String ruleId, List<Integer> refs, Binding binding) implements Step {
            public Apply {
                requireNonNull(ruleId);
                refs = List.copyOf(refs);
                binding = binding == null ? Binding.EMPTY : binding;
            }

            @Override
            public String toString() {
                return ruleId + " " + refs.stream().map(Proof::refString).collect(Collectors.joining(", "))
                        + (binding.isEmpty() ? "" : " " + binding);
            }
        }

        /** Placeholder for a step whose formula is not established yet. */
        enum Incomplete implements Step {
            MARKER;

            @Override
            public String toString() {
                return "...";
            }
        }
    }
}
