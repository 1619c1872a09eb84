package nadra.ast;

public record FloatLiteral(double value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFloatLiteral(this);
    }
}
