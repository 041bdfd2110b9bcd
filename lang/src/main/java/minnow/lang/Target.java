package minnow.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Syntax tree produced by the {@link Transformer}, shaped after the output
 * call-expression language. Literal leaves are shared with {@link Source}.
 */
public sealed interface Target
        permits Target.Program, Target.ExpressionStatement, Target.Call, Target.Identifier,
                NumberLiteral, StringLiteral {

    <R> R accept(Visitor<R> visitor);

    record Program(@NonNull List<Target> body) implements Target {

        public Program {
            body = List.copyOf(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    record ExpressionStatement(@NonNull Target expression) implements Target {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionStatement(this);
        }
    }

    record Call(@NonNull Identifier callee, @NonNull List<Target> args) implements Target {

        public Call {
            args = List.copyOf(args);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Identifier(@NonNull String name) implements Target {

        public Identifier {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("identifier is empty");
            }
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    interface Visitor<R> {
        R visitProgram(Program program);
        R visitExpressionStatement(ExpressionStatement statement);
        R visitCall(Call call);
        R visitIdentifier(Identifier identifier);
        R visitNumberLiteral(NumberLiteral literal);
        R visitStringLiteral(StringLiteral literal);
    }
}
