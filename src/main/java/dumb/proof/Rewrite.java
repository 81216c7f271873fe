package dumb.proof;

import dumb.proof.Formula.Order;
import dumb.proof.Logic.Unifier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Substitution rule {@code head ⇒ body}: any subformula matching {@code head} may be replaced by
 * {@code body} under the matching binding. Positions count subformulas in a traversal
 * {@link Order}, breadth first unless given.
 */
public record Rewrite(Formula head, Formula body) {

    private static final Logger logger = LoggerFactory.getLogger(Rewrite.class);

    public Rewrite {
        requireNonNull(head);
        requireNonNull(body);
        if (!head.vars().containsAll(body.vars()))
            throw new IllegalArgumentException("Variables of " + body + " must occur in " + head);
    }

    /** Whether {@code head→body} is a tautology. */
    public boolean isImp() {
        return Table.isTautology(head.imp(body));
    }

    public boolean isEquiv() {
        return Table.equivalent(head, body);
    }

    /** {@code body ⇒ head}; only defined for equivalences. */
    public Rewrite inverse() {
        if (!isEquiv())
            throw new IllegalStateException(this + " is not an equivalence and has no inverse");
        return new Rewrite(body, head);
    }

    /** One entry per position of {@code value}: the binding of {@code head} there, if it matches. */
    public List<Optional<Binding>> match(Formula value, Order order) {
        var subformulas = value.traverse(order);
        var out = new ArrayList<Optional<Binding>>(subformulas.size());
        for (var sub : subformulas) {
            try {
                out.add(Optional.of(Unifier.unify(head, sub)));
            } catch (LogicException e) {
                out.add(Optional.empty());
            }
        }
        return out;
    }

    public List<Optional<Binding>> match(Formula value) {
        return match(value, Order.BREADTH_FIRST);
    }

    /** {@code value} rewritten at position {@code pos}, or null when {@code head} does not match there. */
    @Nullable
    public Formula apply(Formula value, int pos, Order order) {
        var matches = match(value, order);
        if (pos < 0 || pos >= matches.size())
            throw new IndexOutOfBoundsException("No position " + pos + " in " + value);
        return matches.get(pos).map(b -> value.replaceAt(pos, body.subst(b), order)).orElse(null);
    }

    /** {@code value} rewritten at the first matching position, or null when there is none. */
    @Nullable
    public Formula applyFirst(Formula value, Order order) {
        var matches = match(value, order);
        for (var pos = 0; pos < matches.size(); pos++) {
            var b = matches.get(pos);
            if (b.isPresent()) return value.replaceAt(pos, body.subst(b.get()), order);
        }
        return null;
    }

    @Nullable
    public Formula applyFirst(Formula value) {
        return applyFirst(value, Order.BREADTH_FIRST);
    }

    /**
     * Rewrites until {@code head} matches nowhere. Requires that {@code head} matches no
     * subformula of {@code body}, otherwise the loop need not end.
     */
    public Formula applyAll(Formula value) {
        if (match(body).stream().anyMatch(Optional::isPresent))
            throw new IllegalStateException("Head of " + this + " matches its own body; rewriting may not terminate");
        var current = value;
        for (var next = applyFirst(current); next != null; next = applyFirst(current))
            current = next;
        return current;
    }

    /** Every formula obtained by rewriting {@code value} once, in position order. */
    public List<Formula> applications(Formula value, Order order) {
        var matches = match(value, order);
        var out = new ArrayList<Formula>();
        for (var pos = 0; pos < matches.size(); pos++) {
            var b = matches.get(pos);
            if (b.isPresent()) out.add(value.replaceAt(pos, body.subst(b.get()), order));
        }
        return out;
    }

    public List<Formula> applications(Formula value) {
        return applications(value, Order.BREADTH_FIRST);
    }

    /** Applies every rewrite exhaustively, in list order, until a whole round changes nothing. */
    public static Formula applyList(List<Rewrite> rewrites, Formula value) {
        var result = value;
        Formula previous;
        var rounds = 0;
        do {
            previous = result;
            for (var r : rewrites) result = r.applyAll(result);
            rounds++;
        } while (!result.equals(previous));
        logger.debug("{} rewritten to {} in {} rounds", value, result, rounds);
        return result;
    }

    @Override
    public String toString() {
        return head + " ⇒ " + body;
    }
}
