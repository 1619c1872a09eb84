package nadra.ast;

/**
 * One method per {@link AstNode} variant. Adding a variant means every visitor has to handle it.
 */
public interface AstVisitor<R> {

    R visitIntegerLiteral(IntegerLiteral node);

    R visitFloatLiteral(FloatLiteral node);

    R visitBooleanLiteral(BooleanLiteral node);

    R visitStringLiteral(StringLiteral node);

    R visitIdentifier(Identifier node);

    R visitUnaryOperation(UnaryOperation node);

    R visitBinaryOperation(BinaryOperation node);

    R visitFunctionCall(FunctionCall node);

    R visitMemberAccess(MemberAccess node);

    R visitFunctionDefinition(FunctionDefinition node);

    R visitIfStatement(IfStatement node);

    R visitWhileLoop(WhileLoop node);

    R visitReturnStatement(ReturnStatement node);

    R visitUseStatement(UseStatement node);

    R visitLambdaFunction(LambdaFunction node);
}
