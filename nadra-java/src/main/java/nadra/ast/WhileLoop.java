package nadra.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public record WhileLoop(
        AstNode condition,
        List<AstNode> body
) implements AstNode {

    public WhileLoop {
        Objects.requireNonNull(condition, "condition");
        body = ImmutableList.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhileLoop(this);
    }
}
