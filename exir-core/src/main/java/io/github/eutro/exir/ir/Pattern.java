package io.github.eutro.exir.ir;

import io.github.eutro.exir.util.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A destructuring pattern, the left-hand side of a match or the head of a clause.
 * <p>
 * The set of pattern kinds is closed: the only subclasses are the nested classes here,
 * and every consumer goes through {@link #accept(PatternVisitor)} or the abstract
 * structural methods, so adding a kind fails to compile until every consumer handles it.
 * <p>
 * {@link Bind} and {@link Alias} are the only constructs that introduce names.
 */
public abstract class Pattern {
    public enum Kind {
        BIND,
        WILDCARD,
        LIT,
        TUPLE,
        LIST,
        CONS,
        MAP,
        STRUCT,
        ALIAS,
        PIN,
        BITS,
    }

    private Pattern() {
    }

    public abstract Kind kind();

    public abstract <R> R accept(PatternVisitor<R> visitor);

    /**
     * Get the immediate sub-patterns of this pattern.
     *
     * @return The sub-patterns, in a fixed order.
     */
    public abstract List<Pattern> children();

    /**
     * Rebuild this pattern with the given sub-patterns, in the order of {@link #children()}.
     *
     * @param children The new sub-patterns.
     * @return The rebuilt pattern, or this if every child is the same object.
     */
    public final Pattern withChildren(List<Pattern> children) {
        if (Nodes.sameRefs(children(), children)) return this;
        Nodes.checkArity(children, children().size(), this);
        return rebuild(children);
    }

    abstract Pattern rebuild(List<Pattern> children);

    @Override
    public String toString() {
        return IRDisplay.display(this);
    }

    public static final class Bind extends Pattern {
        public final String name;

        public Bind(@NotNull String name) {
            this.name = name;
        }

        @Override
        public Kind kind() {
            return Kind.BIND;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitBind(this);
        }

        @Override
        public List<Pattern> children() {
            return Collections.emptyList();
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return this;
        }

        public Bind withName(String name) {
            return name.equals(this.name) ? this : new Bind(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bind && name.equals(((Bind) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Wildcard extends Pattern {
        public static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
        }

        @Override
        public Kind kind() {
            return Kind.WILDCARD;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitWildcard(this);
        }

        @Override
        public List<Pattern> children() {
            return Collections.emptyList();
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Wildcard;
        }

        @Override
        public int hashCode() {
            return 0x5f;
        }
    }

    public static final class Lit extends Pattern {
        public final Expr.Literal value;

        public Lit(@NotNull Expr.Literal value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.LIT;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitLit(this);
        }

        @Override
        public List<Pattern> children() {
            return Collections.emptyList();
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lit && value.equals(((Lit) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    public static final class Tuple extends Pattern {
        public final List<Pattern> elements;

        public Tuple(List<? extends Pattern> elements) {
            this.elements = Nodes.copy(elements);
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public List<Pattern> children() {
            return elements;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return new Tuple(children);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && elements.equals(((Tuple) o).elements);
        }

        @Override
        public int hashCode() {
            return 31 * elements.hashCode() + 1;
        }
    }

    public static final class ListP extends Pattern {
        public final List<Pattern> elements;

        public ListP(List<? extends Pattern> elements) {
            this.elements = Nodes.copy(elements);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public List<Pattern> children() {
            return elements;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return new ListP(children);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ListP && elements.equals(((ListP) o).elements);
        }

        @Override
        public int hashCode() {
            return 31 * elements.hashCode() + 2;
        }
    }

    /**
     * {@code [head1, head2 | tail]}.
     */
    public static final class Cons extends Pattern {
        public final List<Pattern> heads;
        public final Pattern tail;

        public Cons(List<? extends Pattern> heads, @NotNull Pattern tail) {
            this.heads = Nodes.copy(heads);
            this.tail = tail;
        }

        @Override
        public Kind kind() {
            return Kind.CONS;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitCons(this);
        }

        @Override
        public List<Pattern> children() {
            List<Pattern> children = new ArrayList<>(heads);
            children.add(tail);
            return children;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return new Cons(children.subList(0, heads.size()), children.get(heads.size()));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Cons)) return false;
            Cons cons = (Cons) o;
            return heads.equals(cons.heads) && tail.equals(cons.tail);
        }

        @Override
        public int hashCode() {
            return Objects.hash(heads, tail);
        }
    }

    /**
     * {@code %{key => pattern}}; keys are expressions (literals or pins).
     */
    public static final class MapP extends Pattern {
        public final List<Pair<Expr, Pattern>> entries;

        public MapP(List<Pair<Expr, Pattern>> entries) {
            this.entries = Nodes.copy(entries);
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitMap(this);
        }

        @Override
        public List<Pattern> children() {
            List<Pattern> children = new ArrayList<>(entries.size());
            for (Pair<Expr, Pattern> entry : entries) children.add(entry.right);
            return children;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            List<Pair<Expr, Pattern>> newEntries = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                newEntries.add(entries.get(i).withRight(children.get(i)));
            }
            return new MapP(newEntries);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MapP && entries.equals(((MapP) o).entries);
        }

        @Override
        public int hashCode() {
            return 31 * entries.hashCode() + 3;
        }
    }

    /**
     * {@code %Module{field: pattern}}.
     */
    public static final class StructP extends Pattern {
        public final String module;
        public final List<Pair<String, Pattern>> fields;

        public StructP(@NotNull String module, List<Pair<String, Pattern>> fields) {
            this.module = module;
            this.fields = Nodes.copy(fields);
        }

        @Override
        public Kind kind() {
            return Kind.STRUCT;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitStruct(this);
        }

        @Override
        public List<Pattern> children() {
            List<Pattern> children = new ArrayList<>(fields.size());
            for (Pair<String, Pattern> field : fields) children.add(field.right);
            return children;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            List<Pair<String, Pattern>> newFields = new ArrayList<>(fields.size());
            for (int i = 0; i < fields.size(); i++) {
                newFields.add(fields.get(i).withRight(children.get(i)));
            }
            return new StructP(module, newFields);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StructP)) return false;
            StructP that = (StructP) o;
            return module.equals(that.module) && fields.equals(that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, fields);
        }
    }

    /**
     * {@code name = pattern}: binds {@code name} to the whole value matched by {@code pattern}.
     */
    public static final class Alias extends Pattern {
        public final String name;
        public final Pattern pattern;

        public Alias(@NotNull String name, @NotNull Pattern pattern) {
            this.name = name;
            this.pattern = pattern;
        }

        @Override
        public Kind kind() {
            return Kind.ALIAS;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitAlias(this);
        }

        @Override
        public List<Pattern> children() {
            return Collections.singletonList(pattern);
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return new Alias(name, children.get(0));
        }

        public Alias withName(String name) {
            return name.equals(this.name) ? this : new Alias(name, pattern);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Alias)) return false;
            Alias alias = (Alias) o;
            return name.equals(alias.name) && pattern.equals(alias.pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, pattern);
        }
    }

    /**
     * {@code ^expr}: matches the current value of an expression, binds nothing.
     */
    public static final class Pin extends Pattern {
        public final Expr expr;

        public Pin(@NotNull Expr expr) {
            this.expr = expr;
        }

        @Override
        public Kind kind() {
            return Kind.PIN;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitPin(this);
        }

        @Override
        public List<Pattern> children() {
            return Collections.emptyList();
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pin && expr.equals(((Pin) o).expr);
        }

        @Override
        public int hashCode() {
            return 31 * expr.hashCode() + 4;
        }
    }

    /**
     * {@code <<segment::spec, ...>>}.
     */
    public static final class Bits extends Pattern {
        public final List<Segment> segments;

        public Bits(List<Segment> segments) {
            this.segments = Nodes.copy(segments);
        }

        @Override
        public Kind kind() {
            return Kind.BITS;
        }

        @Override
        public <R> R accept(PatternVisitor<R> visitor) {
            return visitor.visitBits(this);
        }

        @Override
        public List<Pattern> children() {
            List<Pattern> children = new ArrayList<>(segments.size());
            for (Segment segment : segments) children.add(segment.value);
            return children;
        }

        @Override
        Pattern rebuild(List<Pattern> children) {
            List<Segment> newSegments = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i++) {
                Segment segment = segments.get(i);
                newSegments.add(segment.value == children.get(i)
                        ? segment
                        : new Segment(children.get(i), segment.spec));
            }
            return new Bits(newSegments);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bits && segments.equals(((Bits) o).segments);
        }

        @Override
        public int hashCode() {
            return 31 * segments.hashCode() + 5;
        }

        public static final class Segment {
            public final Pattern value;
            /**
             * The size and type modifiers, e.g. {@code binary-size(4)}, or null.
             */
            public final @Nullable String spec;

            public Segment(@NotNull Pattern value, @Nullable String spec) {
                this.value = value;
                this.spec = spec;
            }

            @Override
            public boolean equals(Object o) {
                if (!(o instanceof Segment)) return false;
                Segment segment = (Segment) o;
                return value.equals(segment.value) && Objects.equals(spec, segment.spec);
            }

            @Override
            public int hashCode() {
                return Objects.hash(value, spec);
            }
        }
    }
}
