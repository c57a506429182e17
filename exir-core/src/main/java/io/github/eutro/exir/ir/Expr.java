package io.github.eutro.exir.ir;

import io.github.eutro.exir.ext.Ext;
import io.github.eutro.exir.ext.ExtContainer;
import io.github.eutro.exir.ext.Meta;
import io.github.eutro.exir.util.Pair;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression of the target AST.
 * <p>
 * Expressions are immutable. The set of expression kinds is closed: the only subclasses
 * are the nested classes here. {@link #children()} and {@link #withChildren(List)} are
 * abstract on every kind, so the traversal substrate in {@link Trees} sees the children
 * of every node, and a new kind does not compile until it says what its children are.
 * <p>
 * Every expression carries provenance {@link Meta metadata}, which is excluded from
 * {@link #equals(Object) equality} and preserved by {@link #withChildren(List)}.
 */
public abstract class Expr implements ExtContainer {
    public enum Kind {
        VAR,
        LITERAL,
        TUPLE,
        LIST,
        MAP,
        STRUCT,
        CALL,
        BINARY,
        UNARY,
        MATCH,
        IF,
        CASE,
        COND,
        BLOCK,
        FN,
        COMPREHENSION,
        TRY,
        FIELD,
        PIN,
        RAW,
        DEF,
        MODULE,
    }

    private final Meta meta;

    private Expr(@NotNull Meta meta) {
        this.meta = meta;
    }

    public final Meta meta() {
        return meta;
    }

    @Override
    public final <T> @Nullable T getNullable(Ext<T> ext) {
        return meta.getNullable(ext);
    }

    /**
     * Get a copy of this expression with the given metadata.
     *
     * @param meta The metadata.
     * @return The expression, or this if the metadata is the same.
     */
    @Contract(pure = true)
    public abstract Expr withMeta(@NotNull Meta meta);

    /**
     * Get a copy of this expression with an ext set in its metadata.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     * @return The expression, or this if nothing changed.
     */
    @Contract(pure = true)
    public final <T> Expr withExt(Ext<T> ext, @NotNull T value) {
        return withMeta(meta.with(ext, value));
    }

    public abstract Kind kind();

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * Get the immediate child expressions of this node.
     * <p>
     * Clause guards and bodies are children of the node owning the clauses. Patterns are
     * not expressions, and are not included.
     *
     * @return The children, in a fixed order.
     */
    public abstract List<Expr> children();

    /**
     * Rebuild this node with the given children, in the order of {@link #children()}.
     *
     * @param children The new children.
     * @return The rebuilt node carrying the same metadata, or this if every child is the same object.
     * @throws IllegalArgumentException If the number of children differs.
     */
    @Contract(pure = true)
    public final Expr withChildren(List<Expr> children) {
        List<Expr> old = children();
        if (Nodes.sameRefs(old, children)) return this;
        Nodes.checkArity(children, old.size(), this);
        return rebuild(new Cursor(children));
    }

    abstract Expr rebuild(Cursor children);

    @Override
    public String toString() {
        return IRDisplay.display(this);
    }

    static final class Cursor {
        private final List<Expr> children;
        private int i = 0;

        Cursor(List<Expr> children) {
            this.children = children;
        }

        Expr next() {
            return children.get(i++);
        }

        @Nullable Expr nextIf(@Nullable Expr present) {
            return present == null ? null : next();
        }

        List<Expr> next(int n) {
            List<Expr> list = new ArrayList<>(children.subList(i, i + n));
            i += n;
            return list;
        }

        List<Clause> clauses(List<Clause> clauses) {
            List<Clause> list = new ArrayList<>(clauses.size());
            for (Clause clause : clauses) {
                Expr guard = nextIf(clause.guard);
                Expr body = next();
                list.add(clause.withGuardAndBody(guard, body));
            }
            return list;
        }
    }

    static void addClauses(List<Expr> out, List<Clause> clauses) {
        for (Clause clause : clauses) {
            if (clause.guard != null) out.add(clause.guard);
            out.add(clause.body);
        }
    }

    public static final class Var extends Expr {
        public final String name;

        public Var(Meta meta, @NotNull String name) {
            super(meta);
            this.name = name;
        }

        @Override
        public Var withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Var(meta, name);
        }

        @Override
        public Kind kind() {
            return Kind.VAR;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        Expr rebuild(Cursor children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && name.equals(((Var) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Literal extends Expr {
        public enum LitKind {
            ATOM,
            STRING,
            INTEGER,
            FLOAT,
            BOOLEAN,
            NIL,
        }

        public final LitKind litKind;
        /**
         * A {@link String} for atoms and strings, {@link Long}, {@link Double}, {@link Boolean},
         * or null for nil.
         */
        public final @Nullable Object value;

        public Literal(Meta meta, @NotNull LitKind litKind, @Nullable Object value) {
            super(meta);
            this.litKind = litKind;
            this.value = value;
        }

        public boolean isAtom(String name) {
            return litKind == LitKind.ATOM && name.equals(value);
        }

        @Override
        public Literal withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Literal(meta, litKind, value);
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        Expr rebuild(Cursor children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Literal)) return false;
            Literal literal = (Literal) o;
            return litKind == literal.litKind && Objects.equals(value, literal.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(litKind, value);
        }
    }

    public static final class Tuple extends Expr {
        public final List<Expr> elements;

        public Tuple(Meta meta, List<? extends Expr> elements) {
            super(meta);
            this.elements = Nodes.copy(elements);
        }

        @Override
        public Tuple withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Tuple(meta, elements);
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public List<Expr> children() {
            return elements;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Tuple(meta(), children.next(elements.size()));
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

    public static final class ListExpr extends Expr {
        public final List<Expr> elements;

        public ListExpr(Meta meta, List<? extends Expr> elements) {
            super(meta);
            this.elements = Nodes.copy(elements);
        }

        @Override
        public ListExpr withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new ListExpr(meta, elements);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public List<Expr> children() {
            return elements;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new ListExpr(meta(), children.next(elements.size()));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ListExpr && elements.equals(((ListExpr) o).elements);
        }

        @Override
        public int hashCode() {
            return 31 * elements.hashCode() + 2;
        }
    }

    public static final class MapExpr extends Expr {
        public final List<Pair<Expr, Expr>> entries;

        public MapExpr(Meta meta, List<Pair<Expr, Expr>> entries) {
            super(meta);
            this.entries = Nodes.copy(entries);
        }

        @Override
        public MapExpr withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new MapExpr(meta, entries);
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMap(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(entries.size() * 2);
            for (Pair<Expr, Expr> entry : entries) {
                children.add(entry.left);
                children.add(entry.right);
            }
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            List<Pair<Expr, Expr>> newEntries = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                Expr key = children.next();
                Expr value = children.next();
                newEntries.add(Pair.of(key, value));
            }
            return new MapExpr(meta(), newEntries);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MapExpr && entries.equals(((MapExpr) o).entries);
        }

        @Override
        public int hashCode() {
            return 31 * entries.hashCode() + 3;
        }
    }

    public static final class Struct extends Expr {
        public final String module;
        public final List<Pair<String, Expr>> fields;

        public Struct(Meta meta, @NotNull String module, List<Pair<String, Expr>> fields) {
            super(meta);
            this.module = module;
            this.fields = Nodes.copy(fields);
        }

        @Override
        public Struct withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Struct(meta, module, fields);
        }

        @Override
        public Kind kind() {
            return Kind.STRUCT;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStruct(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(fields.size());
            for (Pair<String, Expr> field : fields) children.add(field.right);
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            List<Pair<String, Expr>> newFields = new ArrayList<>(fields.size());
            for (Pair<String, Expr> field : fields) {
                newFields.add(field.withRight(children.next()));
            }
            return new Struct(meta(), module, newFields);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Struct)) return false;
            Struct struct = (Struct) o;
            return module.equals(struct.module) && fields.equals(struct.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, fields);
        }
    }

    /**
     * A local call {@code name(args)}, or a remote call {@code Module.name(args)} if
     * {@link #module} is present.
     */
    public static final class Call extends Expr {
        public final @Nullable String module;
        public final String function;
        public final List<Expr> args;

        public Call(Meta meta, @Nullable String module, @NotNull String function, List<? extends Expr> args) {
            super(meta);
            this.module = module;
            this.function = function;
            this.args = Nodes.copy(args);
        }

        public boolean isRemote(String module, String function, int arity) {
            return module.equals(this.module) && function.equals(this.function) && args.size() == arity;
        }

        @Override
        public Call withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Call(meta, module, function, args);
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Call(meta(), module, function, children.next(args.size()));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Call)) return false;
            Call call = (Call) o;
            return Objects.equals(module, call.module)
                    && function.equals(call.function)
                    && args.equals(call.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, function, args);
        }
    }

    public static final class Binary extends Expr {
        public final String op;
        public final Expr lhs;
        public final Expr rhs;

        public Binary(Meta meta, @NotNull String op, @NotNull Expr lhs, @NotNull Expr rhs) {
            super(meta);
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        @Override
        public Binary withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Binary(meta, op, lhs, rhs);
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public List<Expr> children() {
            return listOf(lhs, rhs);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Binary(meta(), op, children.next(), children.next());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary binary = (Binary) o;
            return op.equals(binary.op) && lhs.equals(binary.lhs) && rhs.equals(binary.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, lhs, rhs);
        }
    }

    public static final class Unary extends Expr {
        public final String op;
        public final Expr operand;

        public Unary(Meta meta, @NotNull String op, @NotNull Expr operand) {
            super(meta);
            this.op = op;
            this.operand = operand;
        }

        @Override
        public Unary withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Unary(meta, op, operand);
        }

        @Override
        public Kind kind() {
            return Kind.UNARY;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(operand);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Unary(meta(), op, children.next());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary unary = (Unary) o;
            return op.equals(unary.op) && operand.equals(unary.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }
    }

    /**
     * The match operator, {@code pattern = value}.
     */
    public static final class Match extends Expr {
        public final Pattern pattern;
        public final Expr value;

        public Match(Meta meta, @NotNull Pattern pattern, @NotNull Expr value) {
            super(meta);
            this.pattern = pattern;
            this.value = value;
        }

        /**
         * Get the name assigned by this match if it is a direct assignment {@code name = value}.
         *
         * @return The name, or null.
         */
        public @Nullable String assignedName() {
            return pattern instanceof Pattern.Bind ? ((Pattern.Bind) pattern).name : null;
        }

        public Match withPattern(Pattern pattern) {
            return pattern == this.pattern ? this : new Match(meta(), pattern, value);
        }

        @Override
        public Match withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Match(meta, pattern, value);
        }

        @Override
        public Kind kind() {
            return Kind.MATCH;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMatch(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(value);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Match(meta(), pattern, children.next());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Match)) return false;
            Match match = (Match) o;
            return pattern.equals(match.pattern) && value.equals(match.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern, value);
        }
    }

    /**
     * {@code if} or, if {@link #unless} is set, {@code unless}.
     */
    public static final class If extends Expr {
        public final Expr cond;
        public final Expr then;
        public final @Nullable Expr orElse;
        public final boolean unless;

        public If(Meta meta, @NotNull Expr cond, @NotNull Expr then, @Nullable Expr orElse, boolean unless) {
            super(meta);
            this.cond = cond;
            this.then = then;
            this.orElse = orElse;
            this.unless = unless;
        }

        @Override
        public If withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new If(meta, cond, then, orElse, unless);
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<Expr> children() {
            return orElse == null ? listOf(cond, then) : listOf(cond, then, orElse);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new If(meta(), children.next(), children.next(), children.nextIf(orElse), unless);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof If)) return false;
            If that = (If) o;
            return unless == that.unless
                    && cond.equals(that.cond)
                    && then.equals(that.then)
                    && Objects.equals(orElse, that.orElse);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, then, orElse, unless);
        }
    }

    public static final class Case extends Expr {
        public final Expr subject;
        public final List<Clause> clauses;

        public Case(Meta meta, @NotNull Expr subject, List<Clause> clauses) {
            super(meta);
            this.subject = subject;
            this.clauses = Nodes.copy(clauses);
        }

        public Case withClauses(List<Clause> clauses) {
            return Nodes.sameRefs(this.clauses, clauses) ? this : new Case(meta(), subject, clauses);
        }

        @Override
        public Case withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Case(meta, subject, clauses);
        }

        @Override
        public Kind kind() {
            return Kind.CASE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCase(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(subject);
            addClauses(children, clauses);
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Case(meta(), children.next(), children.clauses(clauses));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Case)) return false;
            Case that = (Case) o;
            return subject.equals(that.subject) && clauses.equals(that.clauses);
        }

        @Override
        public int hashCode() {
            return Objects.hash(subject, clauses);
        }
    }

    /**
     * {@code cond do condition -> body end}.
     */
    public static final class Cond extends Expr {
        public final List<Pair<Expr, Expr>> arms;

        public Cond(Meta meta, List<Pair<Expr, Expr>> arms) {
            super(meta);
            this.arms = Nodes.copy(arms);
        }

        @Override
        public Cond withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Cond(meta, arms);
        }

        @Override
        public Kind kind() {
            return Kind.COND;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCond(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(arms.size() * 2);
            for (Pair<Expr, Expr> arm : arms) {
                children.add(arm.left);
                children.add(arm.right);
            }
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            List<Pair<Expr, Expr>> newArms = new ArrayList<>(arms.size());
            for (int i = 0; i < arms.size(); i++) {
                Expr cond = children.next();
                Expr body = children.next();
                newArms.add(Pair.of(cond, body));
            }
            return new Cond(meta(), newArms);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Cond && arms.equals(((Cond) o).arms);
        }

        @Override
        public int hashCode() {
            return 31 * arms.hashCode() + 4;
        }
    }

    /**
     * A sequence of statements, evaluating to the last one, or nil if empty.
     */
    public static final class Block extends Expr {
        public final List<Expr> stmts;

        public Block(Meta meta, List<? extends Expr> stmts) {
            super(meta);
            this.stmts = Nodes.copy(stmts);
        }

        public Block withStmts(List<Expr> stmts) {
            return Nodes.sameRefs(this.stmts, stmts) ? this : new Block(meta(), stmts);
        }

        @Override
        public Block withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Block(meta, stmts);
        }

        @Override
        public Kind kind() {
            return Kind.BLOCK;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public List<Expr> children() {
            return stmts;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Block(meta(), children.next(stmts.size()));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Block && stmts.equals(((Block) o).stmts);
        }

        @Override
        public int hashCode() {
            return 31 * stmts.hashCode() + 5;
        }
    }

    /**
     * An anonymous function, {@code fn clauses end}.
     */
    public static final class Fn extends Expr {
        public final List<Clause> clauses;

        public Fn(Meta meta, List<Clause> clauses) {
            super(meta);
            this.clauses = Nodes.copy(clauses);
        }

        public Fn withClauses(List<Clause> clauses) {
            return Nodes.sameRefs(this.clauses, clauses) ? this : new Fn(meta(), clauses);
        }

        @Override
        public Fn withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Fn(meta, clauses);
        }

        @Override
        public Kind kind() {
            return Kind.FN;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFn(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            addClauses(children, clauses);
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Fn(meta(), children.clauses(clauses));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fn && clauses.equals(((Fn) o).clauses);
        }

        @Override
        public int hashCode() {
            return 31 * clauses.hashCode() + 6;
        }
    }

    /**
     * {@code for pattern <- collection, filter, into: into, do: body}.
     */
    public static final class Comprehension extends Expr {
        public final List<Generator> generators;
        public final List<Expr> filters;
        public final @Nullable Expr into;
        public final Expr body;

        public Comprehension(Meta meta,
                             List<Generator> generators,
                             List<? extends Expr> filters,
                             @Nullable Expr into,
                             @NotNull Expr body) {
            super(meta);
            this.generators = Nodes.copy(generators);
            this.filters = Nodes.copy(filters);
            this.into = into;
            this.body = body;
        }

        @Override
        public Comprehension withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Comprehension(meta, generators, filters, into, body);
        }

        @Override
        public Kind kind() {
            return Kind.COMPREHENSION;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComprehension(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            for (Generator generator : generators) children.add(generator.collection);
            children.addAll(filters);
            if (into != null) children.add(into);
            children.add(body);
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            List<Generator> newGenerators = new ArrayList<>(generators.size());
            for (Generator generator : generators) {
                Expr collection = children.next();
                newGenerators.add(collection == generator.collection
                        ? generator
                        : new Generator(generator.pattern, collection));
            }
            List<Expr> newFilters = children.next(filters.size());
            Expr newInto = children.nextIf(into);
            return new Comprehension(meta(), newGenerators, newFilters, newInto, children.next());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Comprehension)) return false;
            Comprehension that = (Comprehension) o;
            return generators.equals(that.generators)
                    && filters.equals(that.filters)
                    && Objects.equals(into, that.into)
                    && body.equals(that.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(generators, filters, into, body);
        }

        public static final class Generator {
            public final Pattern pattern;
            public final Expr collection;

            public Generator(@NotNull Pattern pattern, @NotNull Expr collection) {
                this.pattern = pattern;
                this.collection = collection;
            }

            @Override
            public boolean equals(Object o) {
                if (!(o instanceof Generator)) return false;
                Generator generator = (Generator) o;
                return pattern.equals(generator.pattern) && collection.equals(generator.collection);
            }

            @Override
            public int hashCode() {
                return Objects.hash(pattern, collection);
            }
        }
    }

    /**
     * {@code try do body rescue ... catch ... else ... after ... end}.
     */
    public static final class Try extends Expr {
        public final Expr body;
        public final List<Clause> rescues;
        public final List<Clause> catches;
        public final List<Clause> elses;
        public final @Nullable Expr after;

        public Try(Meta meta,
                   @NotNull Expr body,
                   List<Clause> rescues,
                   List<Clause> catches,
                   List<Clause> elses,
                   @Nullable Expr after) {
            super(meta);
            this.body = body;
            this.rescues = Nodes.copy(rescues);
            this.catches = Nodes.copy(catches);
            this.elses = Nodes.copy(elses);
            this.after = after;
        }

        public Try withClauses(List<Clause> rescues, List<Clause> catches, List<Clause> elses) {
            if (Nodes.sameRefs(this.rescues, rescues)
                    && Nodes.sameRefs(this.catches, catches)
                    && Nodes.sameRefs(this.elses, elses)) {
                return this;
            }
            return new Try(meta(), body, rescues, catches, elses, after);
        }

        @Override
        public Try withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Try(meta, body, rescues, catches, elses, after);
        }

        @Override
        public Kind kind() {
            return Kind.TRY;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTry(this);
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(body);
            addClauses(children, rescues);
            addClauses(children, catches);
            addClauses(children, elses);
            if (after != null) children.add(after);
            return children;
        }

        @Override
        Expr rebuild(Cursor children) {
            Expr newBody = children.next();
            List<Clause> newRescues = children.clauses(rescues);
            List<Clause> newCatches = children.clauses(catches);
            List<Clause> newElses = children.clauses(elses);
            return new Try(meta(), newBody, newRescues, newCatches, newElses, children.nextIf(after));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Try)) return false;
            Try that = (Try) o;
            return body.equals(that.body)
                    && rescues.equals(that.rescues)
                    && catches.equals(that.catches)
                    && elses.equals(that.elses)
                    && Objects.equals(after, that.after);
        }

        @Override
        public int hashCode() {
            return Objects.hash(body, rescues, catches, elses, after);
        }
    }

    /**
     * {@code target.field}.
     */
    public static final class Field extends Expr {
        public final Expr target;
        public final String field;

        public Field(Meta meta, @NotNull Expr target, @NotNull String field) {
            super(meta);
            this.target = target;
            this.field = field;
        }

        @Override
        public Field withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Field(meta, target, field);
        }

        @Override
        public Kind kind() {
            return Kind.FIELD;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitField(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(target);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Field(meta(), children.next(), field);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Field)) return false;
            Field that = (Field) o;
            return target.equals(that.target) && field.equals(that.field);
        }

        @Override
        public int hashCode() {
            return Objects.hash(target, field);
        }
    }

    public static final class Pin extends Expr {
        public final Expr expr;

        public Pin(Meta meta, @NotNull Expr expr) {
            super(meta);
            this.expr = expr;
        }

        @Override
        public Pin withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Pin(meta, expr);
        }

        @Override
        public Kind kind() {
            return Kind.PIN;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPin(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.singletonList(expr);
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Pin(meta(), children.next());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pin && expr.equals(((Pin) o).expr);
        }

        @Override
        public int hashCode() {
            return 31 * expr.hashCode() + 7;
        }
    }

    /**
     * Target code that the IR does not model, printed verbatim. Passes never look inside.
     */
    public static final class Raw extends Expr {
        public final String code;

        public Raw(Meta meta, @NotNull String code) {
            super(meta);
            this.code = code;
        }

        @Override
        public Raw withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Raw(meta, code);
        }

        @Override
        public Kind kind() {
            return Kind.RAW;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRaw(this);
        }

        @Override
        public List<Expr> children() {
            return Collections.emptyList();
        }

        @Override
        Expr rebuild(Cursor children) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Raw && code.equals(((Raw) o).code);
        }

        @Override
        public int hashCode() {
            return code.hashCode();
        }
    }

    /**
     * A named function definition, {@code def name(params) when guard do body end},
     * or {@code defp} if {@link #isPrivate}.
     */
    public static final class Def extends Expr {
        public final boolean isPrivate;
        public final String name;
        public final List<Pattern> params;
        public final @Nullable Expr guard;
        public final Expr body;

        public Def(Meta meta,
                   boolean isPrivate,
                   @NotNull String name,
                   List<? extends Pattern> params,
                   @Nullable Expr guard,
                   @NotNull Expr body) {
            super(meta);
            this.isPrivate = isPrivate;
            this.name = name;
            this.params = Nodes.copy(params);
            this.guard = guard;
            this.body = body;
        }

        public Def withParams(List<Pattern> params) {
            return Nodes.sameRefs(this.params, params) ? this : new Def(meta(), isPrivate, name, params, guard, body);
        }

        public Def withBody(Expr body) {
            return body == this.body ? this : new Def(meta(), isPrivate, name, params, guard, body);
        }

        @Override
        public Def withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Def(meta, isPrivate, name, params, guard, body);
        }

        @Override
        public Kind kind() {
            return Kind.DEF;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDef(this);
        }

        @Override
        public List<Expr> children() {
            return guard == null ? Collections.singletonList(body) : listOf(guard, body);
        }

        @Override
        Expr rebuild(Cursor children) {
            Expr newGuard = children.nextIf(guard);
            return new Def(meta(), isPrivate, name, params, newGuard, children.next());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Def)) return false;
            Def def = (Def) o;
            return isPrivate == def.isPrivate
                    && name.equals(def.name)
                    && params.equals(def.params)
                    && Objects.equals(guard, def.guard)
                    && body.equals(def.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(isPrivate, name, params, guard, body);
        }
    }

    /**
     * {@code defmodule Name do body end}.
     */
    public static final class Module extends Expr {
        public final String name;
        public final List<Expr> body;

        public Module(Meta meta, @NotNull String name, List<? extends Expr> body) {
            super(meta);
            this.name = name;
            this.body = Nodes.copy(body);
        }

        @Override
        public Module withMeta(@NotNull Meta meta) {
            return meta == meta() ? this : new Module(meta, name, body);
        }

        @Override
        public Kind kind() {
            return Kind.MODULE;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitModule(this);
        }

        @Override
        public List<Expr> children() {
            return body;
        }

        @Override
        Expr rebuild(Cursor children) {
            return new Module(meta(), name, children.next(body.size()));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Module)) return false;
            Module module = (Module) o;
            return name.equals(module.name) && body.equals(module.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, body);
        }
    }

    private static List<Expr> listOf(Expr... exprs) {
        List<Expr> list = new ArrayList<>(exprs.length);
        Collections.addAll(list, exprs);
        return list;
    }
}
