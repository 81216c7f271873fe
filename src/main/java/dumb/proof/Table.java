package dumb.proof;

import dumb.proof.Formula.And;
import dumb.proof.Formula.Const;
import dumb.proof.Formula.Imp;
import dumb.proof.Formula.Neg;
import dumb.proof.Formula.Or;
import dumb.proof.Formula.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Truth table of a formula over its free variables.
 * <p>
 * Rows enumerate all 2^k assignments of the k variables, sorted by name; the first variable is
 * the most significant and {@code false} comes before {@code true}. The cost is exponential in k
 * and callers bound k before building a table. Rows are indexed by an {@code int}, so 31 or
 * more variables are rejected with {@link IllegalArgumentException}.
 */
public final class Table {

    public final Formula formula;
    public final List<Var> vars;
    public final List<Row> rows;

    private Table(Formula formula, List<Var> vars, List<Row> rows) {
        this.formula = formula;
        this.vars = vars;
        this.rows = rows;
    }

    public static Table of(Formula f) {
        return of(f, f.vars());
    }

    /** Table of {@code f} over {@code vars}, which must include every free variable of {@code f}. */
    static Table of(Formula f, Set<Var> vars) {
        requireNonNull(f);
        if (!vars.containsAll(f.vars()))
            throw new IllegalArgumentException("Table variables " + vars + " do not cover " + f.vars());
        var sorted = sortVars(vars);
        var k = sorted.size();
        if (k >= Integer.SIZE - 1)
            throw new IllegalArgumentException("Too many variables for a truth table: " + k);
        var rows = new ArrayList<Row>(1 << k);
        for (var i = 0; i < 1 << k; i++) {
            var assignment = new LinkedHashMap<Var, Boolean>(k * 2);
            for (var j = 0; j < k; j++)
                assignment.put(sorted.get(j), ((i >> (k - 1 - j)) & 1) == 1);
            rows.add(new Row(Collections.unmodifiableMap(assignment), eval(f, assignment)));
        }
        return new Table(f, sorted, Collections.unmodifiableList(rows));
    }

    public static List<Var> sortVars(Set<Var> vars) {
        return vars.stream().sorted(Comparator.comparing(Var::name)).toList();
    }

    /**
     * Two-valued evaluation of {@code f} under {@code assignment}.
     *
     * @throws LogicException {@code UNASSIGNED_VARIABLE} when a free variable of {@code f} has no value
     */
    public static boolean evaluate(Formula f, Map<Var, Boolean> assignment) throws LogicException {
        var missing = f.vars().stream().filter(v -> assignment.get(v) == null).collect(Collectors.toSet());
        if (!missing.isEmpty())
            throw new LogicException(LogicException.Fault.UNASSIGNED_VARIABLE,
                    "No value assigned to " + sortVars(missing) + " in " + f, null, f, null);
        return eval(f, assignment);
    }

    public static boolean isTautology(Formula f) {
        return of(f).rows.stream().allMatch(Row::value);
    }

    public static boolean isSatisfiable(Formula f) {
        return of(f).rows.stream().anyMatch(Row::value);
    }

    public static boolean isContradiction(Formula f) {
        return !isSatisfiable(f);
    }

    /** Semantic equivalence, compared over the union of both formulas' variables. */
    public static boolean equivalent(Formula a, Formula b) {
        var vars = new HashSet<>(a.vars());
        vars.addAll(b.vars());
        return of(a, vars).truthList().equals(of(b, vars).truthList());
    }

    private static boolean eval(Formula f, Map<Var, Boolean> assignment) {
        if (f instanceof Var v) return assignment.get(v);
        if (f instanceof Const c) return c.value;
        if (f instanceof Neg n) return !eval(n.f(), assignment);
        if (f instanceof And a) return eval(a.left(), assignment) && eval(a.right(), assignment);
        if (f instanceof Or o) return eval(o.left(), assignment) || eval(o.right(), assignment);
        if (f instanceof Imp i) return !eval(i.left(), assignment) || eval(i.right(), assignment);
        throw new IllegalStateException("Unreachable: " + f);
    }

    /** The value column, one entry per row. */
    public List<Boolean> truthList() {
        return rows.stream().map(Row::value).toList();
    }

    public int size() {
        return rows.size();
    }

    public record Row(Map<Var, Boolean> assignment, boolean value) {
    }
}
