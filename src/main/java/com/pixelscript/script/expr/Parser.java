package com.pixelscript.script.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.pixelscript.script.expr.Expr.Binary;
import com.pixelscript.script.expr.Expr.Call;
import com.pixelscript.script.expr.Expr.Comparison;
import com.pixelscript.script.expr.Expr.Literal;
import com.pixelscript.script.expr.Expr.Logical;
import com.pixelscript.script.expr.Expr.Unary;
import com.pixelscript.script.expr.Expr.Variable;

/**
 * Recursive-descent parser for the placeholder and condition grammar:
 *
 * <pre>
 * expression → or
 * or         → and ( "or" and )*
 * and        → not ( "and" not )*
 * not        → "not" not | comparison
 * comparison → term ( ( "==" | "!=" | "<" | "<=" | ">" | ">=" ) term )*
 * term       → factor ( ( "+" | "-" ) factor )*
 * factor     → unary ( ( "*" | "/" | "%" ) unary )*
 * unary      → ( "-" | "+" ) unary | power
 * power      → call ( "**" unary )?
 * call       → IDENTIFIER "(" arguments? ")" | primary
 * primary    → NUMBER | STRING | IDENTIFIER | "(" expression ")"
 * </pre>
 *
 * There is no member access, indexing or assignment, so nothing parsed here can
 * reach past the values and the function table handed to the interpreter.
 */
public class Parser {

    /** Names that never resolve, even if a variable with that name is bound. */
    private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "import", "exec", "eval", "compile", "open", "file",
            "os", "sys", "subprocess", "globals", "locals",
            "getattr", "setattr", "delattr", "lambda"
    )));

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public static Expr.ExprInterface parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public static boolean isReserved(String identifier) {
        String lower = identifier.toLowerCase(Locale.ROOT);
        return RESERVED.contains(lower) || lower.startsWith("__") || lower.endsWith("__");
    }

    public Expr.ExprInterface parse() {
        if (isAtEnd()) throw error(peek(), "Empty expression.");
        Expr.ExprInterface expr = expression();
        if (check(TokenType.DOT)) throw attributeAccess();
        if (!isAtEnd()) throw error(peek(), "Unexpected " + peek().lexeme + " after expression.");
        return expr;
    }

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = not();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Unary(op, not());
        }
        return comparison();
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface first = term();
        if (!checkComparison()) return first;

        List<Expr.ExprInterface> operands = new ArrayList<>();
        List<Token> operators = new ArrayList<>();
        operands.add(first);
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            operators.add(previous());
            operands.add(term());
        }
        return new Comparison(operands, operators);
    }

    private boolean checkComparison() {
        return check(TokenType.EQUAL_EQUAL) || check(TokenType.BANG_EQUAL)
                || check(TokenType.GREATER) || check(TokenType.GREATER_EQUAL)
                || check(TokenType.LESS) || check(TokenType.LESS_EQUAL);
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return power();
    }

    // '**' binds tighter than a unary on its left and is right-associative: -2**2 == -4, 2**3**2 == 512
    private Expr.ExprInterface power() {
        Expr.ExprInterface expr = call();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface call() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            Token name = advance();
            guardIdentifier(name);
            advance(); // '('
            List<Expr.ExprInterface> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    if (arguments.size() >= 16) {
                        throw error(peek(), "Too many arguments (max 16).");
                    }
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
            return guardMember(new Call(name, arguments));
        }
        return guardMember(primary());
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.NUMBER)) return new Literal(Value.number((double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            guardIdentifier(name);
            return new Variable(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (check(TokenType.DOT)) throw attributeAccess();
        throw error(peek(), "Expect expression.");
    }

    private Expr.ExprInterface guardMember(Expr.ExprInterface expr) {
        if (check(TokenType.DOT)) throw attributeAccess();
        if (check(TokenType.LEFT_PAREN)) throw error(peek(), "Only named functions can be called.");
        return expr;
    }

    private void guardIdentifier(Token name) {
        if (isReserved(name.lexeme)) {
            throw new SecurityRejectionException("Reserved name '" + name.lexeme + "' is not allowed in expressions");
        }
    }

    private SecurityRejectionException attributeAccess() {
        return new SecurityRejectionException("Attribute access is not allowed in expressions");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ExpressionException error(Token token, String message) {
        return new ExpressionException("[col " + (token.position + 1) + "] " + message);
    }
}
