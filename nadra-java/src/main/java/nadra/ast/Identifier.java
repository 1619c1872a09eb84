package nadra.ast;

import java.util.Objects;

public record Identifier(String name) implements AstNode {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
