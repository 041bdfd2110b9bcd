package minnow.lang;

import lombok.NonNull;

/**
 * A run of digits, kept as text. Appears unchanged in both trees.
 */
public record NumberLiteral(@NonNull String value) implements Source, Target {

    @Override
    public <R> R accept(Source.Visitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }

    @Override
    public <R> R accept(Target.Visitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
