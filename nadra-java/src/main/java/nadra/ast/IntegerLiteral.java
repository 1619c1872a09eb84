package nadra.ast;

public record IntegerLiteral(long value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }
}
