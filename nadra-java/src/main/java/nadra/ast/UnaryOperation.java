package nadra.ast;

import java.util.Objects;

public record UnaryOperation(
        UnaryOperator operator,
        AstNode operand
) implements AstNode {

    public UnaryOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOperation(this);
    }
}
