package nadra.ast;

import java.util.Objects;

public record BinaryOperation(
        BinaryOperator operator,
        AstNode left,
        AstNode right
) implements AstNode {

    public BinaryOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOperation(this);
    }
}
