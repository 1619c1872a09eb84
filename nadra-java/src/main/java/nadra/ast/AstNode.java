package nadra.ast;

/**
 * A node of the syntax tree. Nodes are immutable and own their children; the tree
 * never shares a subtree between two parents.
 */
public sealed interface AstNode
        permits IntegerLiteral, FloatLiteral, BooleanLiteral, StringLiteral, Identifier,
        UnaryOperation, BinaryOperation, FunctionCall, MemberAccess,
        FunctionDefinition, IfStatement, WhileLoop, ReturnStatement, UseStatement,
        LambdaFunction {

    <R> R accept(AstVisitor<R> visitor);
}
