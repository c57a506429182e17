package io.github.eutro.exir.ir;

import io.github.eutro.exir.passes.IRPass;
import io.github.eutro.exir.util.Pair;

import java.util.List;

/**
 * Renders IR as Elixir-like text, for debugging and test failure messages.
 * <p>
 * This is not the printer of the compiler, and its output is not guaranteed to parse.
 */
public class IRDisplay {
    private static final String INDENT = "  ";

    public static String display(Expr expr) {
        Printer printer = new Printer();
        expr.accept(printer);
        return printer.sb.toString();
    }

    public static String display(Pattern pattern) {
        Printer printer = new Printer();
        pattern.accept(printer);
        return printer.sb.toString();
    }

    public static String display(Clause clause) {
        Printer printer = new Printer();
        printer.clause(clause);
        return printer.sb.toString();
    }

    /**
     * A pass which prints the tree to standard error, and returns it unchanged.
     *
     * @param label A label to print before the tree.
     * @return The pass.
     */
    public static IRPass<Expr, Expr> debugDisplay(String label) {
        return expr -> {
            System.err.println("=== " + label + " ===");
            System.err.println(display(expr));
            return expr;
        };
    }

    /**
     * Wrap a pass so that, if it throws, the tree it was running on is attached to the exception.
     *
     * @param label A label for the pass.
     * @param pass  The pass.
     * @return The wrapped pass.
     */
    public static IRPass<Expr, Expr> debugDisplayOnError(String label, IRPass<Expr, Expr> pass) {
        return expr -> {
            try {
                return pass.run(expr);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in " + label + ", running on:\n" + display(expr)));
                throw t;
            }
        };
    }

    private static class Printer implements ExprVisitor<Void>, PatternVisitor<Void> {
        final StringBuilder sb = new StringBuilder();
        int depth = 0;

        void newline() {
            sb.append('\n');
            for (int i = 0; i < depth; i++) sb.append(INDENT);
        }

        void expr(Expr expr) {
            expr.accept(this);
        }

        void operand(Expr expr) {
            if (expr instanceof Expr.Binary || expr instanceof Expr.Match) {
                sb.append('(');
                expr(expr);
                sb.append(')');
            } else {
                expr(expr);
            }
        }

        void commaSep(List<Expr> exprs) {
            for (int i = 0; i < exprs.size(); i++) {
                if (i != 0) sb.append(", ");
                expr(exprs.get(i));
            }
        }

        void patterns(List<Pattern> patterns) {
            for (int i = 0; i < patterns.size(); i++) {
                if (i != 0) sb.append(", ");
                patterns.get(i).accept(this);
            }
        }

        // prints an indented body on its own lines, the caller prints the line after it
        void body(Expr body) {
            depth++;
            for (Expr stmt : IR.stmts(body)) {
                newline();
                expr(stmt);
            }
            depth--;
        }

        void clause(Clause clause) {
            patterns(clause.patterns);
            if (clause.guard != null) {
                sb.append(" when ");
                expr(clause.guard);
            }
            sb.append(" ->");
            body(clause.body);
        }

        void clauses(List<Clause> clauses) {
            depth++;
            for (Clause clause : clauses) {
                newline();
                clause(clause);
            }
            depth--;
        }

        void end() {
            newline();
            sb.append("end");
        }

        @Override
        public Void visitVar(Expr.Var expr) {
            sb.append(expr.name);
            return null;
        }

        @Override
        public Void visitLiteral(Expr.Literal expr) {
            switch (expr.litKind) {
                case ATOM:
                    sb.append(':').append(expr.value);
                    break;
                case STRING:
                    sb.append('"');
                    String s = (String) expr.value;
                    for (int i = 0; i < s.length(); i++) {
                        char c = s.charAt(i);
                        switch (c) {
                            case '"':
                                sb.append("\\\"");
                                break;
                            case '\\':
                                sb.append("\\\\");
                                break;
                            case '\n':
                                sb.append("\\n");
                                break;
                            default:
                                sb.append(c);
                        }
                    }
                    sb.append('"');
                    break;
                case NIL:
                    sb.append("nil");
                    break;
                default:
                    sb.append(expr.value);
            }
            return null;
        }

        @Override
        public Void visitTuple(Expr.Tuple expr) {
            sb.append('{');
            commaSep(expr.elements);
            sb.append('}');
            return null;
        }

        @Override
        public Void visitList(Expr.ListExpr expr) {
            sb.append('[');
            commaSep(expr.elements);
            sb.append(']');
            return null;
        }

        @Override
        public Void visitMap(Expr.MapExpr expr) {
            sb.append("%{");
            for (int i = 0; i < expr.entries.size(); i++) {
                if (i != 0) sb.append(", ");
                Pair<Expr, Expr> entry = expr.entries.get(i);
                expr(entry.left);
                sb.append(" => ");
                expr(entry.right);
            }
            sb.append('}');
            return null;
        }

        @Override
        public Void visitStruct(Expr.Struct expr) {
            sb.append('%').append(expr.module).append('{');
            for (int i = 0; i < expr.fields.size(); i++) {
                if (i != 0) sb.append(", ");
                Pair<String, Expr> field = expr.fields.get(i);
                sb.append(field.left).append(": ");
                expr(field.right);
            }
            sb.append('}');
            return null;
        }

        @Override
        public Void visitCall(Expr.Call expr) {
            if (expr.module != null) sb.append(expr.module).append('.');
            sb.append(expr.function).append('(');
            commaSep(expr.args);
            sb.append(')');
            return null;
        }

        @Override
        public Void visitBinary(Expr.Binary expr) {
            operand(expr.lhs);
            sb.append(' ').append(expr.op).append(' ');
            operand(expr.rhs);
            return null;
        }

        @Override
        public Void visitUnary(Expr.Unary expr) {
            sb.append(expr.op);
            if (Character.isLetter(expr.op.charAt(expr.op.length() - 1))) sb.append(' ');
            operand(expr.operand);
            return null;
        }

        @Override
        public Void visitMatch(Expr.Match expr) {
            expr.pattern.accept(this);
            sb.append(" = ");
            expr(expr.value);
            return null;
        }

        @Override
        public Void visitIf(Expr.If expr) {
            sb.append(expr.unless ? "unless " : "if ");
            expr(expr.cond);
            sb.append(" do");
            body(expr.then);
            if (expr.orElse != null) {
                newline();
                sb.append("else");
                body(expr.orElse);
            }
            end();
            return null;
        }

        @Override
        public Void visitCase(Expr.Case expr) {
            sb.append("case ");
            expr(expr.subject);
            sb.append(" do");
            clauses(expr.clauses);
            end();
            return null;
        }

        @Override
        public Void visitCond(Expr.Cond expr) {
            sb.append("cond do");
            depth++;
            for (Pair<Expr, Expr> arm : expr.arms) {
                newline();
                expr(arm.left);
                sb.append(" ->");
                body(arm.right);
            }
            depth--;
            end();
            return null;
        }

        @Override
        public Void visitBlock(Expr.Block expr) {
            if (expr.stmts.isEmpty()) {
                sb.append("(nil)");
                return null;
            }
            sb.append('(');
            body(expr);
            newline();
            sb.append(')');
            return null;
        }

        @Override
        public Void visitFn(Expr.Fn expr) {
            sb.append("fn");
            if (expr.clauses.size() == 1) {
                sb.append(' ');
                clause(expr.clauses.get(0));
            } else {
                clauses(expr.clauses);
            }
            end();
            return null;
        }

        @Override
        public Void visitComprehension(Expr.Comprehension expr) {
            sb.append("for ");
            boolean first = true;
            for (Expr.Comprehension.Generator generator : expr.generators) {
                if (!first) sb.append(", ");
                first = false;
                generator.pattern.accept(this);
                sb.append(" <- ");
                expr(generator.collection);
            }
            for (Expr filter : expr.filters) {
                sb.append(", ");
                expr(filter);
            }
            if (expr.into != null) {
                sb.append(", into: ");
                expr(expr.into);
            }
            sb.append(" do");
            body(expr.body);
            end();
            return null;
        }

        @Override
        public Void visitTry(Expr.Try expr) {
            sb.append("try do");
            body(expr.body);
            trySection("rescue", expr.rescues);
            trySection("catch", expr.catches);
            trySection("else", expr.elses);
            if (expr.after != null) {
                newline();
                sb.append("after");
                body(expr.after);
            }
            end();
            return null;
        }

        private void trySection(String name, List<Clause> clauses) {
            if (clauses.isEmpty()) return;
            newline();
            sb.append(name);
            clauses(clauses);
        }

        @Override
        public Void visitField(Expr.Field expr) {
            operand(expr.target);
            sb.append('.').append(expr.field);
            return null;
        }

        @Override
        public Void visitPin(Expr.Pin expr) {
            sb.append('^');
            expr(expr.expr);
            return null;
        }

        @Override
        public Void visitRaw(Expr.Raw expr) {
            sb.append(expr.code);
            return null;
        }

        @Override
        public Void visitDef(Expr.Def expr) {
            sb.append(expr.isPrivate ? "defp " : "def ").append(expr.name).append('(');
            patterns(expr.params);
            sb.append(')');
            if (expr.guard != null) {
                sb.append(" when ");
                expr(expr.guard);
            }
            sb.append(" do");
            body(expr.body);
            end();
            return null;
        }

        @Override
        public Void visitModule(Expr.Module expr) {
            sb.append("defmodule ").append(expr.name).append(" do");
            depth++;
            for (Expr stmt : expr.body) {
                newline();
                expr(stmt);
            }
            depth--;
            end();
            return null;
        }

        @Override
        public Void visitBind(Pattern.Bind pattern) {
            sb.append(pattern.name);
            return null;
        }

        @Override
        public Void visitWildcard(Pattern.Wildcard pattern) {
            sb.append('_');
            return null;
        }

        @Override
        public Void visitLit(Pattern.Lit pattern) {
            expr(pattern.value);
            return null;
        }

        @Override
        public Void visitTuple(Pattern.Tuple pattern) {
            sb.append('{');
            patterns(pattern.elements);
            sb.append('}');
            return null;
        }

        @Override
        public Void visitList(Pattern.ListP pattern) {
            sb.append('[');
            patterns(pattern.elements);
            sb.append(']');
            return null;
        }

        @Override
        public Void visitCons(Pattern.Cons pattern) {
            sb.append('[');
            patterns(pattern.heads);
            sb.append(" | ");
            pattern.tail.accept(this);
            sb.append(']');
            return null;
        }

        @Override
        public Void visitMap(Pattern.MapP pattern) {
            sb.append("%{");
            for (int i = 0; i < pattern.entries.size(); i++) {
                if (i != 0) sb.append(", ");
                Pair<Expr, Pattern> entry = pattern.entries.get(i);
                expr(entry.left);
                sb.append(" => ");
                entry.right.accept(this);
            }
            sb.append('}');
            return null;
        }

        @Override
        public Void visitStruct(Pattern.StructP pattern) {
            sb.append('%').append(pattern.module).append('{');
            for (int i = 0; i < pattern.fields.size(); i++) {
                if (i != 0) sb.append(", ");
                Pair<String, Pattern> field = pattern.fields.get(i);
                sb.append(field.left).append(": ");
                field.right.accept(this);
            }
            sb.append('}');
            return null;
        }

        @Override
        public Void visitAlias(Pattern.Alias pattern) {
            pattern.pattern.accept(this);
            sb.append(" = ").append(pattern.name);
            return null;
        }

        @Override
        public Void visitPin(Pattern.Pin pattern) {
            sb.append('^');
            expr(pattern.expr);
            return null;
        }

        @Override
        public Void visitBits(Pattern.Bits pattern) {
            sb.append("<<");
            for (int i = 0; i < pattern.segments.size(); i++) {
                if (i != 0) sb.append(", ");
                Pattern.Bits.Segment segment = pattern.segments.get(i);
                segment.value.accept(this);
                if (segment.spec != null) sb.append("::").append(segment.spec);
            }
            sb.append(">>");
            return null;
        }
    }
}
