package nadra;

import nadra.ast.AstNode;
import nadra.codegen.PythonGenerator;
import nadra.lexer.Lexer;
import nadra.lexer.TokenStream;
import nadra.parser.Parser;

import java.util.List;

/**
 * Nadra to Python in one call: scan, parse, then render every top-level statement.
 * The first error from any stage is thrown as a {@link NadraException} subtype.
 */
public final class Transpiler {

    private final String indentUnit;

    public Transpiler() {
        this(PythonGenerator.DEFAULT_INDENT);
    }

    public Transpiler(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public static TokenStream tokenize(String source) {
        return Lexer.tokenize(source);
    }

    public static List<AstNode> parse(TokenStream tokens) {
        return Parser.parse(tokens);
    }

    public String generate(AstNode node) {
        return new PythonGenerator(indentUnit).generate(node);
    }

    public String transpile(String source) {
        List<AstNode> program = parse(tokenize(source));
        return new PythonGenerator(indentUnit).generateProgram(program);
    }
}
