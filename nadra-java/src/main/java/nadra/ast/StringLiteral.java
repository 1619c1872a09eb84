package nadra.ast;

import java.util.Objects;

public record StringLiteral(String value) implements AstNode {

    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
