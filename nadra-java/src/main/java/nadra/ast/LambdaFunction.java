package nadra.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Anonymous function. Only the header is parsed today, so {@code body} is always empty.
 */
public record LambdaFunction(
        List<AstNode> parameters,
        List<AstNode> body
) implements AstNode {

    public LambdaFunction {
        parameters = ImmutableList.copyOf(parameters);
        body = ImmutableList.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLambdaFunction(this);
    }
}
