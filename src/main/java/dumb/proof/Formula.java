package dumb.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.proof.util.Json;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Propositional formula: a finite immutable tree over variables, the two truth constants,
 * negation, conjunction, disjunction and implication.
 * <p>
 * Equality is structural and respects operand order: {@code (A∧B)} and {@code (B∧A)} are
 * different trees even though they are semantically equivalent.
 */
sealed public interface Formula permits Formula.Var, Formula.Const, Formula.Neg, Formula.Binary {

    String SYMBOL_NEG = "¬", SYMBOL_AND = "∧", SYMBOL_OR = "∨", SYMBOL_IMP = "→";

    static Var var(String name) {
        return Var.of(name);
    }

    static Formula fromJson(JsonNode json) {
        var type = json.path("type").asText("");
        return switch (type) {
            case "var" -> Var.of(json.path("name").asText());
            case "const" -> {
                var value = json.get("value");
                if (value == null || !value.isBoolean())
                    throw new IllegalArgumentException("Constant needs a boolean 'value' in " + json);
                yield Const.of(value.booleanValue());
            }
            case "neg" -> new Neg(fromJson(json.path("f")));
            case "and" -> new And(fromJson(json.path("left")), fromJson(json.path("right")));
            case "or" -> new Or(fromJson(json.path("left")), fromJson(json.path("right")));
            case "imp" -> new Imp(fromJson(json.path("left")), fromJson(json.path("right")));
            default -> throw new IllegalArgumentException("Unknown formula type '" + type + "' in " + json);
        };
    }

    /** Free variables of the formula. */
    Set<Var> vars();

    Set<Const> consts();

    /**
     * Replaces every bound variable by its image in one pass. Images are not substituted
     * again, so a binding {@code A ↦ (A∧B)} is applied exactly once.
     */
    Formula subst(Binding binding);

    /** Number of nodes in the tree. */
    int weight();

    ObjectNode toJson();

    /** Prefix notation with space-separated tokens, as read by {@link FormulaParser}. */
    String toPolish();

    /** Immediate subformulas, left to right. */
    List<Formula> children();

    /** Every subformula, this one included, in the given order. */
    default List<Formula> traverse(Order order) {
        return paths(this, order).stream().map(this::at).toList();
    }

    /**
     * Replaces the subformula at position {@code pos} of {@link #traverse(Order)} and rebuilds
     * the connectives above it.
     */
    default Formula replaceAt(int pos, Formula replacement, Order order) {
        requireNonNull(replacement);
        var paths = paths(this, order);
        if (pos < 0 || pos >= paths.size())
            throw new IndexOutOfBoundsException("No position " + pos + " in " + this + " of weight " + paths.size());
        return replace(this, paths.get(pos), 0, replacement);
    }

    private Formula at(List<Integer> path) {
        Formula f = this;
        for (int i : path) f = f.children().get(i);
        return f;
    }

    /** Child-index paths from {@code root} to each of its subformulas. */
    private static List<List<Integer>> paths(Formula root, Order order) {
        var out = new ArrayList<List<Integer>>(root.weight());
        var todo = new ArrayDeque<List<Integer>>();
        todo.add(List.of());
        while (!todo.isEmpty()) {
            var path = order == Order.BREADTH_FIRST ? todo.pollFirst() : todo.pollLast();
            out.add(path);
            var n = root.at(path).children().size();
            if (order == Order.BREADTH_FIRST) {
                for (var i = 0; i < n; i++) todo.addLast(child(path, i));
            } else {
                for (var i = n - 1; i >= 0; i--) todo.addLast(child(path, i));
            }
        }
        return out;
    }

    private static List<Integer> child(List<Integer> path, int i) {
        var p = new ArrayList<Integer>(path.size() + 1);
        p.addAll(path);
        p.add(i);
        return p;
    }

    private static Formula replace(Formula f, List<Integer> path, int depth, Formula replacement) {
        if (depth == path.size()) return replacement;
        if (f instanceof Neg n)
            return new Neg(replace(n.f(), path, depth + 1, replacement));
        var b = (Binary) f;
        return path.get(depth) == 0
                ? b.with(replace(b.left(), path, depth + 1, replacement), b.right())
                : b.with(b.left(), replace(b.right(), path, depth + 1, replacement));
    }

    default Neg neg() {
        return new Neg(this);
    }

    default And and(Formula right) {
        return new And(this, right);
    }

    default Or or(Formula right) {
        return new Or(this, right);
    }

    default Imp imp(Formula right) {
        return new Imp(this, right);
    }

    record Var(String name) implements Formula {
        private static final Pattern NAME = Pattern.compile("[A-Z][A-Za-z0-9_]*");
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(64);

        public Var {
            requireNonNull(name);
            if (!NAME.matcher(name).matches())
                throw new IllegalArgumentException("Variable name must start with an uppercase letter followed by letters, digits or '_': " + name);
            if (name.equals(Const.TRUE.toString()) || name.equals(Const.FALSE.toString()))
                throw new IllegalArgumentException("Variable name is reserved for a constant: " + name);
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public Set<Const> consts() {
            return Set.of();
        }

        @Override
        public Formula subst(Binding binding) {
            var image = binding.get(this);
            return image != null ? image : this;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public ObjectNode toJson() {
            return Json.node().put("type", "var").put("name", name);
        }

        @Override
        public String toPolish() {
            return name;
        }

        @Override
        public List<Formula> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    enum Const implements Formula {
        FALSE(false, "F"), TRUE(true, "T");

        public final boolean value;
        private final String symbol;

        Const(boolean value, String symbol) {
            this.value = value;
            this.symbol = symbol;
        }

        public static Const of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public Set<Const> consts() {
            return Set.of(this);
        }

        @Override
        public Formula subst(Binding binding) {
            return this;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public ObjectNode toJson() {
            return Json.node().put("type", "const").put("value", value);
        }

        @Override
        public String toPolish() {
            return symbol;
        }

        @Override
        public List<Formula> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    record Neg(Formula f) implements Formula {
        public Neg {
            requireNonNull(f);
        }

        @Override
        public Set<Var> vars() {
            return f.vars();
        }

        @Override
        public Set<Const> consts() {
            return f.consts();
        }

        @Override
        public Formula subst(Binding binding) {
            var g = f.subst(binding);
            return g == f ? this : new Neg(g);
        }

        @Override
        public int weight() {
            return 1 + f.weight();
        }

        @Override
        public ObjectNode toJson() {
            var json = Json.node().put("type", "neg");
            json.set("f", f.toJson());
            return json;
        }

        @Override
        public String toPolish() {
            return SYMBOL_NEG + " " + f.toPolish();
        }

        @Override
        public List<Formula> children() {
            return List.of(f);
        }

        @Override
        public String toString() {
            return SYMBOL_NEG + f;
        }
    }

    record And(Formula left, Formula right) implements Binary {
        public And {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public And with(Formula left, Formula right) {
            return new And(left, right);
        }

        @Override
        public String symbol() {
            return SYMBOL_AND;
        }

        @Override
        public String toString() {
            return Binary.str(this);
        }
    }

    record Or(Formula left, Formula right) implements Binary {
        public Or {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Or with(Formula left, Formula right) {
            return new Or(left, right);
        }

        @Override
        public String symbol() {
            return SYMBOL_OR;
        }

        @Override
        public String toString() {
            return Binary.str(this);
        }
    }

    record Imp(Formula left, Formula right) implements Binary {
        public Imp {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Imp with(Formula left, Formula right) {
            return new Imp(left, right);
        }

        @Override
        public String symbol() {
            return SYMBOL_IMP;
        }

        @Override
        public String toString() {
            return Binary.str(this);
        }
    }

    /** Shared behaviour of the three binary connectives. */
    sealed interface Binary extends Formula permits And, Or, Imp {
        static String str(Binary b) {
            return "(" + b.left() + b.symbol() + b.right() + ")";
        }

        Formula left();

        Formula right();

        String symbol();

        /** Same connective over new operands. */
        Binary with(Formula left, Formula right);

        @Override
        default Formula subst(Binding binding) {
            var l = left().subst(binding);
            var r = right().subst(binding);
            return l == left() && r == right() ? this : with(l, r);
        }

        @Override
        default Set<Var> vars() {
            return Stream.concat(left().vars().stream(), right().vars().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        default Set<Const> consts() {
            return Stream.concat(left().consts().stream(), right().consts().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        default int weight() {
            return 1 + left().weight() + right().weight();
        }

        @Override
        default ObjectNode toJson() {
            var json = Json.node().put("type", symbolName());
            json.set("left", left().toJson());
            json.set("right", right().toJson());
            return json;
        }

        @Override
        default String toPolish() {
            return symbol() + " " + left().toPolish() + " " + right().toPolish();
        }

        @Override
        default List<Formula> children() {
            return List.of(left(), right());
        }

        private String symbolName() {
            return switch (symbol()) {
                case SYMBOL_AND -> "and";
                case SYMBOL_OR -> "or";
                default -> "imp";
            };
        }
    }

    /** Order in which {@link #traverse(Order)} visits subformulas: parents before children, left before right. */
    enum Order {
        /** Depth first: a subtree is finished before its right sibling. */
        DEPTH_FIRST,
        /** Level by level. */
        BREADTH_FIRST
    }
}
