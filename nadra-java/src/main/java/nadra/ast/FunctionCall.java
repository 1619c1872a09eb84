package nadra.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public record FunctionCall(
        String name,
        List<AstNode> arguments
) implements AstNode {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
