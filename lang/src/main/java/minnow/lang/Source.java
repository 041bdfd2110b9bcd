package minnow.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Syntax tree produced by the {@link Parser}, shaped after the input call
 * language.
 */
public sealed interface Source permits Source.Program, Source.CallExpression, NumberLiteral, StringLiteral {

    <R> R accept(Visitor<R> visitor);

    record Program(@NonNull List<Source> body) implements Source {

        public Program {
            body = List.copyOf(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    record CallExpression(@NonNull String name, @NonNull List<Source> params) implements Source {

        public CallExpression {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("call name is empty");
            }
            params = List.copyOf(params);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpression(this);
        }
    }

    interface Visitor<R> {
        R visitProgram(Program program);
        R visitCallExpression(CallExpression call);
        R visitNumberLiteral(NumberLiteral literal);
        R visitStringLiteral(StringLiteral literal);
    }
}
