package nadra.codegen;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import nadra.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a syntax tree as Python 3 source.
 *
 * Block bodies (function, if, while) are written one statement per line, each line prefixed
 * with {@code indentUnit} repeated once per enclosing block. Parentheses are only added where
 * Python's own operator precedence would group the tree differently.
 */
public final class PythonGenerator implements AstVisitor<String> {

    public static final String DEFAULT_INDENT = "\t";

    // Python binding strength, loosest first
    private static final int LEVEL_ASSIGNMENT = 0;
    private static final int LEVEL_OR = 1;
    private static final int LEVEL_AND = 2;
    private static final int LEVEL_NOT = 3;
    private static final int LEVEL_COMPARISON = 4;
    private static final int LEVEL_ADDITIVE = 5;
    private static final int LEVEL_MULTIPLICATIVE = 6;
    private static final int LEVEL_NEGATE = 7;
    private static final int LEVEL_POWER = 8;
    private static final int LEVEL_ATOM = 9;

    private final String indentUnit;
    private int indent = 0;

    public PythonGenerator() {
        this(DEFAULT_INDENT);
    }

    public PythonGenerator(String indentUnit) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(indentUnit), "indent unit must not be empty");
        Preconditions.checkArgument(indentUnit.isBlank(), "indent unit must be whitespace");
        this.indentUnit = indentUnit;
    }

    public static PythonGenerator withSpaces(int spaces) {
        Preconditions.checkArgument(spaces > 0, "indent width must be positive: %s", spaces);
        return new PythonGenerator(" ".repeat(spaces));
    }

    public String generate(AstNode node) {
        return node.accept(this);
    }

    /** Renders top-level statements one after another, separated by newlines. */
    public String generateProgram(List<AstNode> statements) {
        List<String> out = new ArrayList<>();
        for (AstNode s : statements) {
            out.add(generate(s));
        }
        return String.join("\n", out);
    }

    int indentLevel() {
        return indent;
    }

    // ---------- literals ----------

    @Override
    public String visitIntegerLiteral(IntegerLiteral node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitFloatLiteral(FloatLiteral node) {
        return Double.toString(node.value());
    }

    @Override
    public String visitBooleanLiteral(BooleanLiteral node) {
        return node.value() ? "True" : "False";
    }

    @Override
    public String visitStringLiteral(StringLiteral node) {
        return "\"" + node.value() + "\"";
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    // ---------- operators ----------

    @Override
    public String visitUnaryOperation(UnaryOperation node) {
        int p = precedence(node);
        String operand = wrap(node.operand(), precedence(node.operand()) < p);
        return switch (node.operator()) {
            case NEGATE -> "-" + operand;
            case NOT -> "not " + operand;
        };
    }

    @Override
    public String visitBinaryOperation(BinaryOperation node) {
        BinaryOperator op = node.operator();
        if (op.isAssignment()) {
            return generate(node.left()) + " " + symbol(op) + " " + generate(node.right());
        }

        int p = precedence(node);
        int l = precedence(node.left());
        int r = precedence(node.right());

        // ** groups to the right and comparisons chain, so an equal-strength left operand needs parens
        boolean leftParens = l < p || (l == p && (op == BinaryOperator.EXPONENT || op.isComparison()));
        boolean rightParens = r < p || (r == p && op != BinaryOperator.EXPONENT);

        return wrap(node.left(), leftParens) + " " + symbol(op) + " " + wrap(node.right(), rightParens);
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        List<String> args = new ArrayList<>();
        for (AstNode a : node.arguments()) {
            args.add(generate(a));
        }
        return node.name() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitMemberAccess(MemberAccess node) {
        return generate(node.parent()) + "." + generate(node.child());
    }

    // ---------- statements ----------

    @Override
    public String visitFunctionDefinition(FunctionDefinition node) {
        List<String> params = new ArrayList<>();
        for (AstNode p : node.parameters()) {
            params.add(generate(p));
        }
        return "def " + node.name() + "(" + String.join(", ", params) + "):" + block(node.body());
    }

    @Override
    public String visitIfStatement(IfStatement node) {
        return "if " + generate(node.condition()) + ":" + block(node.body());
    }

    @Override
    public String visitWhileLoop(WhileLoop node) {
        return "while " + generate(node.condition()) + ":" + block(node.body());
    }

    @Override
    public String visitReturnStatement(ReturnStatement node) {
        return "return " + generate(node.value());
    }

    @Override
    public String visitUseStatement(UseStatement node) {
        return "import " + node.namespace();
    }

    @Override
    public String visitLambdaFunction(LambdaFunction node) {
        throw new GenerationException("Lambda functions cannot be translated yet ("
                + node.parameters().size() + " parameter(s), no body)");
    }

    // ---------- helpers ----------

    private String block(List<AstNode> body) {
        StringBuilder sb = new StringBuilder();
        increaseIndent();
        try {
            if (body.isEmpty()) {
                sb.append('\n').append(indentation()).append("pass");
            }
            for (AstNode stmt : body) {
                sb.append('\n').append(indentation()).append(generate(stmt));
            }
        } finally {
            decreaseIndent();
        }
        return sb.toString();
    }

    private String indentation() {
        return indentUnit.repeat(indent);
    }

    void increaseIndent() {
        indent++;
    }

    /** No-op at level zero. */
    void decreaseIndent() {
        indent = Math.max(0, indent - 1);
    }

    private String wrap(AstNode node, boolean parens) {
        String s = generate(node);
        return parens ? "(" + s + ")" : s;
    }

    private static int precedence(AstNode node) {
        if (node instanceof BinaryOperation b) return precedence(b.operator());
        if (node instanceof UnaryOperation u) {
            return u.operator() == UnaryOperator.NOT ? LEVEL_NOT : LEVEL_NEGATE;
        }
        return LEVEL_ATOM;
    }

    private static int precedence(BinaryOperator op) {
        return switch (op) {
            case ASSIGN, ADD_ASSIGN, SUBTRACT_ASSIGN, MULTIPLY_ASSIGN, DIVIDE_ASSIGN, MODULUS_ASSIGN -> LEVEL_ASSIGNMENT;
            case OR -> LEVEL_OR;
            case AND -> LEVEL_AND;
            case EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL -> LEVEL_COMPARISON;
            case ADD, SUBTRACT -> LEVEL_ADDITIVE;
            case MULTIPLY, DIVIDE, MODULUS -> LEVEL_MULTIPLICATIVE;
            case EXPONENT -> LEVEL_POWER;
        };
    }

    static String symbol(BinaryOperator op) {
        return switch (op) {
            case ADD -> "+";
            case SUBTRACT -> "-";
            case MULTIPLY -> "*";
            case DIVIDE -> "/";
            case MODULUS -> "%";
            case EXPONENT -> "**";
            case ASSIGN -> "=";
            case ADD_ASSIGN -> "+=";
            case SUBTRACT_ASSIGN -> "-=";
            case MULTIPLY_ASSIGN -> "*=";
            case DIVIDE_ASSIGN -> "/=";
            case MODULUS_ASSIGN -> "%=";
            case EQUAL -> "==";
            case NOT_EQUAL -> "!=";
            case LESS -> "<";
            case GREATER -> ">";
            case LESS_EQUAL -> "<=";
            case GREATER_EQUAL -> ">=";
            case AND -> "and";
            case OR -> "or";
        };
    }
}
