package dumb.proof;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable mapping from variables to formulas. A variable maps to at most one formula:
 * {@link #bind} and {@link #merge} fail with {@link LogicException.Fault#BINDING_CONFLICT}
 * instead of overwriting an existing entry with a different formula.
 */
public final class Binding {

    public static final Binding EMPTY = new Binding(Map.of());

    private final Map<Formula.Var, Formula> map;

    private Binding(Map<Formula.Var, Formula> map) {
        this.map = map;
    }

    public static Binding of(Map<Formula.Var, ? extends Formula> entries) {
        if (entries.isEmpty()) return EMPTY;
        var m = new LinkedHashMap<Formula.Var, Formula>(entries.size());
        entries.forEach((k, v) -> m.put(requireNonNull(k), requireNonNull(v)));
        return new Binding(Collections.unmodifiableMap(m));
    }

    public static Binding of(Formula.Var var, Formula value) {
        return of(Map.of(var, value));
    }

    public static Binding of(Formula.Var v1, Formula f1, Formula.Var v2, Formula f2) {
        return of(Map.of(v1, f1, v2, f2));
    }

    public static Binding of(Formula.Var v1, Formula f1, Formula.Var v2, Formula f2, Formula.Var v3, Formula f3) {
        return of(Map.of(v1, f1, v2, f2, v3, f3));
    }

    @Nullable
    public Formula get(Formula.Var var) {
        return map.get(var);
    }

    public boolean containsKey(Formula.Var var) {
        return map.containsKey(var);
    }

    public Set<Formula.Var> vars() {
        return map.keySet();
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Binding bind(Formula.Var var, Formula value) throws LogicException {
        var existing = map.get(var);
        if (existing != null) {
            if (existing.equals(value)) return this;
            throw LogicException.conflict(var, existing, value);
        }
        var m = new LinkedHashMap<>(map);
        m.put(var, requireNonNull(value));
        return new Binding(Collections.unmodifiableMap(m));
    }

    /** Union of both bindings; they must agree on every shared variable. */
    public Binding merge(Binding other) throws LogicException {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        var result = this;
        for (var e : other.map.entrySet())
            result = result.bind(e.getKey(), e.getValue());
        return result;
    }

    /** Entries of this binding whose variable is in {@code vars}. */
    public Binding restrict(Set<Formula.Var> vars) {
        var m = new LinkedHashMap<Formula.Var, Formula>();
        map.forEach((k, v) -> {
            if (vars.contains(k)) m.put(k, v);
        });
        return of(m);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Binding b && map.equals(b.map));
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.entrySet().stream().map(e -> e.getKey() + "↦" + e.getValue()).collect(Collectors.joining(", ", "{", "}"));
    }
}
