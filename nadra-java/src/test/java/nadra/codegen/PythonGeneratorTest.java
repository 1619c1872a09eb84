package nadra.codegen;

import nadra.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonGeneratorTest {

    private final PythonGenerator gen = new PythonGenerator();

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static IntegerLiteral num(long n) {
        return new IntegerLiteral(n);
    }

    private static BinaryOperation bin(BinaryOperator op, AstNode l, AstNode r) {
        return new BinaryOperation(op, l, r);
    }

    @Test
    void gen_literals() {
        assertEquals("42", gen.generate(num(42)));
        assertEquals("2.5", gen.generate(new FloatLiteral(2.5)));
        assertEquals("3.0", gen.generate(new FloatLiteral(3.0)));
        assertEquals("True", gen.generate(new BooleanLiteral(true)));
        assertEquals("False", gen.generate(new BooleanLiteral(false)));
        assertEquals("\"hi there\"", gen.generate(new StringLiteral("hi there")));
        assertEquals("\"a\\nb\"", gen.generate(new StringLiteral("a\\nb"))); // no re-escaping
        assertEquals("count", gen.generate(id("count")));
    }

    @Test
    void gen_unary_operations() {
        assertEquals("-x", gen.generate(new UnaryOperation(UnaryOperator.NEGATE, id("x"))));
        assertEquals("not done", gen.generate(new UnaryOperation(UnaryOperator.NOT, id("done"))));
    }

    @Test
    void gen_binary_operation_padding() {
        assertEquals("2 + 3 * 4", gen.generate(bin(BinaryOperator.ADD, num(2), bin(BinaryOperator.MULTIPLY, num(3), num(4)))));
        assertEquals("a - b - c", gen.generate(bin(BinaryOperator.SUBTRACT, bin(BinaryOperator.SUBTRACT, id("a"), id("b")), id("c"))));
        assertEquals("x += 1", gen.generate(bin(BinaryOperator.ADD_ASSIGN, id("x"), num(1))));
    }

    @ParameterizedTest
    @EnumSource(BinaryOperator.class)
    void gen_every_binary_operator_has_a_spelling(BinaryOperator op) {
        String out = gen.generate(bin(op, id("a"), id("b")));
        assertEquals("a " + PythonGenerator.symbol(op) + " b", out);
    }

    @Test
    void gen_operator_spellings() {
        assertEquals("and", PythonGenerator.symbol(BinaryOperator.AND));
        assertEquals("or", PythonGenerator.symbol(BinaryOperator.OR));
        assertEquals("**", PythonGenerator.symbol(BinaryOperator.EXPONENT));
        assertEquals("%=", PythonGenerator.symbol(BinaryOperator.MODULUS_ASSIGN));
        assertEquals("!=", PythonGenerator.symbol(BinaryOperator.NOT_EQUAL));
    }

    @Test
    void gen_parentheses_only_where_python_would_regroup() {
        assertEquals("(a + b) * c", gen.generate(bin(BinaryOperator.MULTIPLY, bin(BinaryOperator.ADD, id("a"), id("b")), id("c"))));
        assertEquals("a - (b - c)", gen.generate(bin(BinaryOperator.SUBTRACT, id("a"), bin(BinaryOperator.SUBTRACT, id("b"), id("c")))));
        assertEquals("-(a + b)", gen.generate(new UnaryOperation(UnaryOperator.NEGATE, bin(BinaryOperator.ADD, id("a"), id("b")))));
        assertEquals("(-2) ** 2", gen.generate(bin(BinaryOperator.EXPONENT, new UnaryOperation(UnaryOperator.NEGATE, num(2)), num(2))));
        assertEquals("(a ** b) ** c", gen.generate(bin(BinaryOperator.EXPONENT, bin(BinaryOperator.EXPONENT, id("a"), id("b")), id("c"))));
        assertEquals("a ** b ** c", gen.generate(bin(BinaryOperator.EXPONENT, id("a"), bin(BinaryOperator.EXPONENT, id("b"), id("c")))));
        assertEquals("(not a) == b", gen.generate(bin(BinaryOperator.EQUAL, new UnaryOperation(UnaryOperator.NOT, id("a")), id("b"))));
        assertEquals("not a == b", gen.generate(new UnaryOperation(UnaryOperator.NOT, bin(BinaryOperator.EQUAL, id("a"), id("b")))));
        assertEquals("(a < b) < c", gen.generate(bin(BinaryOperator.LESS, bin(BinaryOperator.LESS, id("a"), id("b")), id("c"))));
        // && and || sit with + in the source language but bind looser in Python
        assertEquals("x == (y and z)", gen.generate(bin(BinaryOperator.EQUAL, id("x"), bin(BinaryOperator.AND, id("y"), id("z")))));
        assertEquals("a and b or c", gen.generate(bin(BinaryOperator.OR, bin(BinaryOperator.AND, id("a"), id("b")), id("c"))));
        assertEquals("(a or b) and c", gen.generate(bin(BinaryOperator.AND, bin(BinaryOperator.OR, id("a"), id("b")), id("c"))));
    }

    @Test
    void gen_assignment_never_parenthesizes() {
        assertEquals("x = a or b", gen.generate(bin(BinaryOperator.ASSIGN, id("x"), bin(BinaryOperator.OR, id("a"), id("b")))));
        assertEquals("a = b = 1", gen.generate(bin(BinaryOperator.ASSIGN, id("a"), bin(BinaryOperator.ASSIGN, id("b"), num(1)))));
    }

    @Test
    void gen_function_call_and_member_access() {
        assertEquals("print()", gen.generate(new FunctionCall("print", List.of())));
        assertEquals("max(a, b + 1)", gen.generate(new FunctionCall("max", List.of(id("a"), bin(BinaryOperator.ADD, id("b"), num(1))))));
        assertEquals("os.path.join(a)", gen.generate(new MemberAccess(id("os"),
                new MemberAccess(id("path"), new FunctionCall("join", List.of(id("a")))))));
    }

    @Test
    void gen_function_definition_indents_body() {
        var def = new FunctionDefinition("add", "int", List.of(id("a"), id("b")),
                List.of(new ReturnStatement(bin(BinaryOperator.ADD, id("a"), id("b")))));
        assertEquals("def add(a, b):\n\treturn a + b", gen.generate(def));
        assertEquals(0, gen.indentLevel());
    }

    @Test
    void gen_nested_blocks() {
        var def = new FunctionDefinition("fact", "int", List.of(id("n")), List.of(
                new IfStatement(bin(BinaryOperator.EQUAL, id("n"), num(0)), List.of(new ReturnStatement(num(1)))),
                new ReturnStatement(id("n"))));
        assertEquals("""
                def fact(n):
                \tif n == 0:
                \t\treturn 1
                \treturn n""", gen.generate(def));
    }

    @Test
    void gen_while_loop_with_space_indent() {
        var loop = new WhileLoop(bin(BinaryOperator.LESS, id("i"), num(3)), List.of(
                bin(BinaryOperator.ADD_ASSIGN, id("i"), num(1)),
                new FunctionCall("print", List.of(id("i")))));
        assertEquals("while i < 3:\n    i += 1\n    print(i)", PythonGenerator.withSpaces(4).generate(loop));
    }

    @Test
    void gen_empty_block_renders_pass() {
        assertEquals("if x:\n\tpass", gen.generate(new IfStatement(id("x"), List.of())));
        assertEquals("def f():\n\tpass", gen.generate(new FunctionDefinition("f", "void", List.of(), List.of())));
    }

    @Test
    void gen_return_and_use() {
        assertEquals("return x * 2", gen.generate(new ReturnStatement(bin(BinaryOperator.MULTIPLY, id("x"), num(2)))));
        assertEquals("import math", gen.generate(new UseStatement("math")));
    }

    @Test
    void gen_program_joins_statements() {
        assertEquals("import math\nx = 1", gen.generateProgram(List.of(
                new UseStatement("math"), bin(BinaryOperator.ASSIGN, id("x"), num(1)))));
        assertEquals("", gen.generateProgram(List.of()));
    }

    @Test
    void gen_lambda_fails() {
        var lambda = new LambdaFunction(List.of(id("x")), List.of());
        assertThrows(GenerationException.class, () -> gen.generate(lambda));
        // a failure inside a block still leaves the indentation balanced
        var def = new FunctionDefinition("f", "void", List.of(), List.of(lambda));
        assertThrows(GenerationException.class, () -> gen.generate(def));
        assertEquals(0, gen.indentLevel());
    }

    @Test
    void indent_never_goes_below_zero() {
        var g = new PythonGenerator();
        g.decreaseIndent();
        assertEquals(0, g.indentLevel());
        g.increaseIndent();
        g.decreaseIndent();
        g.decreaseIndent();
        assertEquals(0, g.indentLevel());
    }

    @Test
    void indent_unit_must_be_whitespace() {
        assertThrows(IllegalArgumentException.class, () -> new PythonGenerator(""));
        assertThrows(IllegalArgumentException.class, () -> new PythonGenerator("ab"));
        assertThrows(IllegalArgumentException.class, () -> PythonGenerator.withSpaces(0));
    }
}
