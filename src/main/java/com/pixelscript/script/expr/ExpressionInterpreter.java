package com.pixelscript.script.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.pixelscript.script.expr.Expr.Binary;
import com.pixelscript.script.expr.Expr.Call;
import com.pixelscript.script.expr.Expr.Comparison;
import com.pixelscript.script.expr.Expr.ExprVisitor;
import com.pixelscript.script.expr.Expr.Literal;
import com.pixelscript.script.expr.Expr.Logical;
import com.pixelscript.script.expr.Expr.Unary;
import com.pixelscript.script.expr.Expr.Variable;

/**
 * Tree-walking evaluator over a fixed variable snapshot.
 *
 * In bare-word mode (used for conditions) an unbound identifier evaluates to
 * its own text, so {@code mode == dark} compares strings once the bound
 * names have been substituted.
 */
public class ExpressionInterpreter implements ExprVisitor<Value> {

    private final Map<String, Value> variables;
    private final boolean bareWords;

    public ExpressionInterpreter(Map<String, Value> variables, boolean bareWords) {
        this.variables = (variables == null) ? Collections.emptyMap() : variables;
        this.bareWords = bareWords;
    }

    public Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        Value v = variables.get(name);
        if (v != null) return v;

        Value constant = MathFunctions.constant(name);
        if (constant != null) return constant;

        if (bareWords) return Value.string(name);
        throw new ExpressionException("Undefined name '" + name + "'");
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS: {
                if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() + right.asNumber());
            }
            case MINUS:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumber(left, right, expr.operator);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumber(left, right, expr.operator);
                if (right.asNumber() == 0) throw new ExpressionException("Division by zero");
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT: {
                requireNumber(left, right, expr.operator);
                double a = left.asNumber();
                double b = right.asNumber();
                if (b == 0) throw new ExpressionException("Modulo by zero");
                // result takes the sign of the divisor: -1 % 3 == 2
                return Value.number(a - b * Math.floor(a / b));
            }
            case DOUBLE_STAR: {
                requireNumber(left, right, expr.operator);
                double r = Math.pow(left.asNumber(), right.asNumber());
                if (Double.isNaN(r) || Double.isInfinite(r)) {
                    throw new ExpressionException("Power result out of range");
                }
                return Value.number(r);
            }
            default:
                throw new ExpressionException("Unsupported binary operator: " + op);
        }
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case MINUS:
                requireNumber(right, expr.operator);
                return Value.number(-right.asNumber());
            case PLUS:
                requireNumber(right, expr.operator);
                return Value.number(right.asNumber());
            default:
                throw new ExpressionException("Unsupported unary operator: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    @Override
    public Value visitComparisonExpr(Comparison expr) {
        Value left = eval(expr.operands.get(0));
        for (int i = 0; i < expr.operators.size(); i++) {
            Value right = eval(expr.operands.get(i + 1));
            if (!compare(expr.operators.get(i), left, right)) {
                return Value.bool(false);
            }
            left = right;
        }
        return Value.bool(true);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        MathFunctions.BuiltinFunction fn = MathFunctions.function(expr.name.lexeme);
        if (fn == null) {
            throw new ExpressionException("Unknown function '" + expr.name.lexeme + "'");
        }
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface arg : expr.arguments) {
            args.add(eval(arg));
        }
        return fn.call(args);
    }

    private boolean compare(Token operator, Value left, Value right) {
        switch (operator.type) {
            case EQUAL_EQUAL:
                return isEqual(left, right);
            case BANG_EQUAL:
                return !isEqual(left, right);
            default:
                break;
        }

        if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
            throw new ExpressionException("Operator '" + operator.lexeme + "' needs numbers, got "
                    + left + " and " + right);
        }
        double a = left.asNumber();
        double b = right.asNumber();
        switch (operator.type) {
            case LESS: return a < b;
            case LESS_EQUAL: return a <= b;
            case GREATER: return a > b;
            case GREATER_EQUAL: return a >= b;
            default:
                throw new ExpressionException("Unsupported comparison: " + operator.lexeme);
        }
    }

    /** Numeric when both sides are numeric, otherwise by rendered text. */
    static boolean isEqual(Value left, Value right) {
        boolean leftText = left.getType() == Value.Type.STRING;
        boolean rightText = right.getType() == Value.Type.STRING;
        if (!leftText && !rightText) {
            return left.asNumber() == right.asNumber();
        }
        return left.toText().equals(right.toText());
    }

    private void requireNumber(Value v, Token operator) {
        if (v.getType() == Value.Type.STRING) {
            throw new ExpressionException("Operand of '" + operator.lexeme + "' must be a number, got " + v);
        }
    }

    private void requireNumber(Value left, Value right, Token operator) {
        if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
            throw new ExpressionException("Unsupported operand types for '" + operator.lexeme + "': "
                    + left.getType() + ", " + right.getType());
        }
    }
}
