package minnow.lang;

import lombok.NonNull;

/**
 * Text between double quotes, quotes excluded. No escapes are interpreted.
 */
public record StringLiteral(@NonNull String value) implements Source, Target {

    @Override
    public <R> R accept(Source.Visitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public <R> R accept(Target.Visitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
