package nadra.ast;

import java.util.Objects;

public record UseStatement(String namespace) implements AstNode {

    public UseStatement {
        Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUseStatement(this);
    }
}
