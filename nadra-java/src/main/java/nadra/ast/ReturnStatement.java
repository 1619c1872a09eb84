package nadra.ast;

import java.util.Objects;

public record ReturnStatement(AstNode value) implements AstNode {

    public ReturnStatement {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
