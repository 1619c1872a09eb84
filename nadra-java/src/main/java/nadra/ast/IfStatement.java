package nadra.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public record IfStatement(
        AstNode condition,
        List<AstNode> body
) implements AstNode {

    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        body = ImmutableList.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
