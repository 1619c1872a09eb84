package nadra.ast;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * {@code parent.child}. The child is always name-like: an identifier, a call, or a further access.
 */
public record MemberAccess(
        AstNode parent,
        AstNode child
) implements AstNode {

    public MemberAccess {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        Preconditions.checkArgument(
                child instanceof Identifier || child instanceof FunctionCall || child instanceof MemberAccess,
                "member must be an identifier, call or member access, got %s", child.getClass().getSimpleName());
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
