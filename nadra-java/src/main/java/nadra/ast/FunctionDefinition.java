package nadra.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

public record FunctionDefinition(
        String name,
        String returnType,      // declared name, e.g. "int"
        List<AstNode> parameters,
        List<AstNode> body
) implements AstNode {

    public FunctionDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = ImmutableList.copyOf(parameters);
        body = ImmutableList.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionDefinition(this);
    }
}
