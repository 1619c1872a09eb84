package nadra.parser;

import nadra.ast.*;
import nadra.lexer.LiteralValue;
import nadra.lexer.Token;
import nadra.lexer.TokenStream;
import nadra.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser. Each expression rule handles one precedence level and
 * asks the next tighter rule for its operands.
 */
public final class Parser {
    private final TokenStream tokens;
    private Token previous; // last token taken by match()

    public Parser(TokenStream tokens) {
        this.tokens = tokens;
    }

    public static List<AstNode> parse(TokenStream tokens) {
        return new Parser(tokens).parseProgram();
    }

    // ---------- entry ----------
    public List<AstNode> parseProgram() {
        List<AstNode> statements = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            statements.add(parseStatement());
        }
        return statements;
    }

    // ---------- statements ----------
    AstNode parseStatement() {
        return switch (peek().type()) {
            case DEF -> parseFunctionDefinition();
            case IF -> parseIf();
            case USE -> parseUse();
            case WHILE -> parseWhile();
            case RETURN -> parseReturn();
            default -> parseAssignment();
        };
    }

    private FunctionDefinition parseFunctionDefinition() {
        consume(TokenType.DEF);
        Token name = consume(TokenType.IDENTIFIER);

        consume(TokenType.LPAREN);
        List<AstNode> params = parseParamsOpt();
        consume(TokenType.RPAREN);

        consume(TokenType.ARROW);
        Token returnType = consume(TokenType.IDENTIFIER);

        List<AstNode> body = parseBody(TokenType.ENDDEF);
        return new FunctionDefinition(name.lexeme(), returnType.lexeme(), params, body);
    }

    private List<AstNode> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<AstNode> ps = new ArrayList<>();
        do {
            ps.add(parseUnary());
        } while (match(TokenType.COMMA));
        return ps;
    }

    private IfStatement parseIf() {
        consume(TokenType.IF);
        AstNode cond = parseExpression();
        consume(TokenType.THEN);
        return new IfStatement(cond, parseBody(TokenType.ENDIF));
    }

    private WhileLoop parseWhile() {
        consume(TokenType.WHILE);
        AstNode cond = parseExpression();
        consume(TokenType.DO);
        return new WhileLoop(cond, parseBody(TokenType.DONE));
    }

    private UseStatement parseUse() {
        consume(TokenType.USE);
        return new UseStatement(consume(TokenType.IDENTIFIER).lexeme());
    }

    private ReturnStatement parseReturn() {
        consume(TokenType.RETURN);
        return new ReturnStatement(parseExpression());
    }

    /** Statements up to {@code terminator}, which is consumed. */
    private List<AstNode> parseBody(TokenType terminator) {
        List<AstNode> body = new ArrayList<>();
        while (!check(terminator)) {
            if (check(TokenType.EOF)) throw expected(terminator, peek());
            body.add(parseStatement());
        }
        consume(terminator);
        return body;
    }

    // ---------- expressions (precedence climbing) ----------
    AstNode parseExpression() { return parseEquality(); }

    /** Assignment is statement-level only; operands, arguments and conditions never contain one. */
    private AstNode parseAssignment() {
        AstNode left = parseEquality();
        if (peek().type().precedence() == TokenType.Precedence.ASSIGNMENT) {
            Token op = tokens.take();
            AstNode right = parseAssignment(); // right-assoc

            if (!(left instanceof Identifier || left instanceof MemberAccess)) {
                throw error(op, "Invalid assignment target");
            }
            return new BinaryOperation(BinaryOperator.fromToken(op.type()), left, right);
        }
        return left;
    }

    private AstNode parseEquality() {
        AstNode e = parseAdditive();
        while (peek().type().precedence() == TokenType.Precedence.EQUALITY) {
            Token op = tokens.take();
            AstNode r = parseAdditive();
            e = new BinaryOperation(BinaryOperator.fromToken(op.type()), e, r);
        }
        return e;
    }

    private AstNode parseAdditive() {
        AstNode e = parseMultiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS, TokenType.AND, TokenType.OR)) {
            Token op = previous;
            AstNode r = parseMultiplicative();
            e = new BinaryOperation(BinaryOperator.fromToken(op.type()), e, r);
        }
        return e;
    }

    private AstNode parseMultiplicative() {
        AstNode e = parseExponent();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous;
            AstNode r = parseExponent();
            e = new BinaryOperation(BinaryOperator.fromToken(op.type()), e, r);
        }
        return e;
    }

    private AstNode parseExponent() {
        AstNode e = parseUnary();
        while (match(TokenType.STAR_STAR)) {
            AstNode r = parseUnary();
            e = new BinaryOperation(BinaryOperator.EXPONENT, e, r);
        }
        return e;
    }

    private AstNode parseUnary() {
        if (match(TokenType.MINUS, TokenType.BANG)) {
            UnaryOperator op = UnaryOperator.fromToken(previous.type());
            if (check(TokenType.EOF)) throw error(peek(), "Expected an operand after '" + previous.lexeme() + "'");
            return new UnaryOperation(op, parseUnary());
        }
        return parsePrimary();
    }

    private AstNode parsePrimary() {
        Token t = peek();
        return switch (t.type()) {
            case INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL -> literal(tokens.take());
            case TRUE -> {
                tokens.take();
                yield new BooleanLiteral(true);
            }
            case FALSE -> {
                tokens.take();
                yield new BooleanLiteral(false);
            }
            case IDENTIFIER -> parseIdentifier();
            case LPAREN -> isLambdaHeader() ? parseLambda() : parseParenthesized();
            case EOF -> throw error(t, "Unexpected end of input: expected an expression");
            default -> throw error(t, "Unexpected token " + t.type() + ", expected an expression");
        };
    }

    private AstNode literal(Token t) {
        LiteralValue v = t.value();
        if (v instanceof LiteralValue.IntValue i) return new IntegerLiteral(i.value());
        if (v instanceof LiteralValue.FloatValue f) return new FloatLiteral(f.value());
        if (v instanceof LiteralValue.StringValue s) return new StringLiteral(s.value());
        throw error(t, "Literal token carries no value");
    }

    /** IDENT, IDENT(args...) or IDENT.member; calls may be followed by a member too. */
    private AstNode parseIdentifier() {
        Token name = consume(TokenType.IDENTIFIER);
        AstNode node = new Identifier(name.lexeme());

        if (match(TokenType.LPAREN)) {
            List<AstNode> args = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                do { args.add(parseExpression()); } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN);
            node = new FunctionCall(name.lexeme(), args);
        }

        if (match(TokenType.DOT)) {
            if (!check(TokenType.IDENTIFIER)) throw expected(TokenType.IDENTIFIER, peek());
            node = new MemberAccess(node, parseIdentifier());
        }
        return node;
    }

    private AstNode parseParenthesized() {
        consume(TokenType.LPAREN);
        AstNode e = parseExpression();
        consume(TokenType.RPAREN);
        return e;
    }

    // TODO: parse the lambda body once its block syntax is settled; only the header is accepted now
    private LambdaFunction parseLambda() {
        consume(TokenType.LPAREN);
        List<AstNode> params = parseParamsOpt();
        consume(TokenType.RPAREN);
        consume(TokenType.ARROW);
        return new LambdaFunction(params, List.of());
    }

    /** True when the '(' in front closes on a ')' that is directly followed by '->'. */
    private boolean isLambdaHeader() {
        int depth = 0;
        for (int i = 0; ; i++) {
            TokenType t = tokens.peek(i).type();
            if (t == TokenType.EOF) return false;
            if (t == TokenType.LPAREN) depth++;
            else if (t == TokenType.RPAREN && --depth == 0) {
                return tokens.peek(i + 1).is(TokenType.ARROW);
            }
        }
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) {
                previous = tokens.take();
                return true;
            }
        }
        return false;
    }

    /** Requires the next token to be of kind {@code t} and takes it. */
    private Token consume(TokenType t) {
        if (check(t)) return tokens.take();
        throw expected(t, peek());
    }

    private boolean check(TokenType t) {
        return peek().is(t);
    }

    private Token peek() { return tokens.peek(); }

    private ParserException expected(TokenType t, Token found) {
        if (found.is(TokenType.EOF)) {
            return error(found, "Unexpected end of input: expected " + t);
        }
        return error(found, "Expected " + t + " but found " + found.type());
    }

    private static ParserException error(Token at, String msg) {
        return new ParserException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }
}
