package dumb.proof;

import dumb.proof.Formula.And;
import dumb.proof.Formula.Binary;
import dumb.proof.Formula.Const;
import dumb.proof.Formula.Imp;
import dumb.proof.Formula.Neg;
import dumb.proof.Formula.Or;
import dumb.proof.Formula.Var;

import java.util.function.UnaryOperator;

public class Logic {

    /**
     * One-directional syntactic matching: only pattern variables bind, the subject is taken
     * literally. Operands of a connective are matched left to right and never swapped.
     */
    public enum Unifier {
        ;

        public static Binding unify(Formula pattern, Formula subject) throws LogicException {
            return unify(pattern, subject, Binding.EMPTY);
        }

        /**
         * Extends {@code bindings} so that {@code pattern.subst(result).equals(subject)}.
         *
         * @throws LogicException {@code UNIFICATION_FAILURE} on a constructor or constant mismatch,
         *                        {@code BINDING_CONFLICT} when a variable is met again with a different subformula
         */
        public static Binding unify(Formula pattern, Formula subject, Binding bindings) throws LogicException {
            if (pattern instanceof Var v)
                return bindings.bind(v, subject);
            if (pattern instanceof Const) {
                if (pattern == subject) return bindings;
                throw LogicException.mismatch(pattern, subject);
            }
            if (pattern instanceof Neg p && subject instanceof Neg s)
                return unify(p.f(), s.f(), bindings);
            if (pattern instanceof Binary p && subject instanceof Binary s && p.getClass() == s.getClass()) {
                var afterLeft = unify(p.left(), s.left(), bindings);
                return unify(p.right(), s.right(), afterLeft);
            }
            throw LogicException.mismatch(pattern, subject);
        }

        public static boolean matches(Formula pattern, Formula subject) {
            try {
                unify(pattern, subject);
                return true;
            } catch (LogicException e) {
                return false;
            }
        }
    }

    /**
     * Semantics-preserving rewrites towards conjunctive normal form. Formulas are never
     * normalised implicitly; these are explicit transformations.
     */
    public enum Normal {
        ;

        /** Removes every double negation. */
        public static Formula simpDoubleNeg(Formula f) {
            if (f instanceof Neg n) {
                if (n.f() instanceof Neg inner) return simpDoubleNeg(inner.f());
                return new Neg(simpDoubleNeg(n.f()));
            }
            return descend(f, Normal::simpDoubleNeg);
        }

        /** Rewrites {@code A→B} as {@code ¬A∨B}. */
        public static Formula subsImp(Formula f) {
            if (f instanceof Imp i)
                return new Or(new Neg(subsImp(i.left())), subsImp(i.right()));
            if (f instanceof Neg n)
                return new Neg(subsImp(n.f()));
            return descend(f, Normal::subsImp);
        }

        /** Negation normal form: negations pushed down to variables and constants by De Morgan. */
        public static Formula pushNeg(Formula f) {
            if (f instanceof Neg n) {
                var g = n.f();
                if (g instanceof Var || g instanceof Const) return n;
                if (g instanceof Neg inner) return pushNeg(inner.f());
                if (g instanceof And a) return new Or(pushNeg(new Neg(a.left())), pushNeg(new Neg(a.right())));
                if (g instanceof Or o) return new And(pushNeg(new Neg(o.left())), pushNeg(new Neg(o.right())));
                if (g instanceof Imp i) return new And(pushNeg(i.left()), pushNeg(new Neg(i.right())));
            }
            return descend(f, Normal::pushNeg);
        }

        /** Distributes disjunction over conjunction until nothing changes. */
        public static Formula distributeOr(Formula f) {
            return fixpoint(f, Normal::distributeOrStep);
        }

        /** Folds constants and negated constants until nothing changes. */
        public static Formula simpConst(Formula f) {
            return fixpoint(f, Normal::simpConstStep);
        }

        public static Formula cnf(Formula f) {
            return simpConst(distributeOr(pushNeg(subsImp(f))));
        }

        private static Formula distributeOrStep(Formula f) {
            if (f instanceof Or o) {
                if (o.left() instanceof And a) {
                    var c = distributeOrStep(o.right());
                    return new And(new Or(distributeOrStep(a.left()), c), new Or(distributeOrStep(a.right()), c));
                }
                if (o.right() instanceof And a) {
                    var c = distributeOrStep(o.left());
                    return new And(new Or(c, distributeOrStep(a.left())), new Or(c, distributeOrStep(a.right())));
                }
            }
            if (f instanceof Neg n) return new Neg(distributeOrStep(n.f()));
            return descend(f, Normal::distributeOrStep);
        }

        private static Formula simpConstStep(Formula f) {
            if (f instanceof Neg n) {
                if (n.f() instanceof Const c) return Const.of(!c.value);
                return new Neg(simpConstStep(n.f()));
            }
            if (f instanceof And a) {
                if (a.left() == Const.FALSE || a.right() == Const.FALSE) return Const.FALSE;
                if (a.left() == Const.TRUE) return simpConstStep(a.right());
                if (a.right() == Const.TRUE) return simpConstStep(a.left());
            } else if (f instanceof Or o) {
                if (o.left() == Const.TRUE || o.right() == Const.TRUE) return Const.TRUE;
                if (o.left() == Const.FALSE) return simpConstStep(o.right());
                if (o.right() == Const.FALSE) return simpConstStep(o.left());
            } else if (f instanceof Imp i) {
                if (i.left() == Const.FALSE || i.right() == Const.TRUE) return Const.TRUE;
                if (i.left() == Const.TRUE) return simpConstStep(i.right());
                if (i.right() == Const.FALSE) return new Neg(simpConstStep(i.left()));
            }
            return descend(f, Normal::simpConstStep);
        }

        /** Applies {@code op} to the operands of a binary node; leaves and negations are returned as is. */
        private static Formula descend(Formula f, UnaryOperator<Formula> op) {
            if (f instanceof Binary b) {
                var l = op.apply(b.left());
                var r = op.apply(b.right());
                return l == b.left() && r == b.right() ? b : b.with(l, r);
            }
            if (f instanceof Neg n) {
                var g = op.apply(n.f());
                return g == n.f() ? n : new Neg(g);
            }
            return f;
        }

        private static Formula fixpoint(Formula f, UnaryOperator<Formula> step) {
            var prev = f;
            var next = step.apply(prev);
            while (!next.equals(prev)) {
                prev = next;
                next = step.apply(prev);
            }
            return next;
        }
    }
}
