package org.kestrel.runtime;

import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.frontend.parser.ast.*;

/**
 * Evaluates expressions against an {@link EvalEnvironment}. Statements are not executed.
 * <p>
 * Integer operands use 64-bit integer arithmetic with {@code long} overflow semantics.
 * If either operand is a float the operation is carried out in floating point.
 * Comparisons and the logical operators produce the integers 1 and 0.
 * Anything else raises an {@link EvaluationException}.
 */
public class Evaluator implements ExpressionVisitor<Value> {

    private final EvalEnvironment environment;

    /**
     * @param environment The bindings used to resolve identifiers.
     */
    public Evaluator(EvalEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Evaluates an expression.
     * @param expression The expression.
     * @return The resulting value.
     * @throws EvaluationException if the expression cannot be evaluated.
     */
    public Value evaluate(ExpressionNode expression) {
        Value value = expression.accept(this);
        if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
            CompilerLogger.trace("Evaluator: " + expression + " => " + value.inspect());
        }
        return value;
    }

    @Override
    public Value visitIdentifier(IdentifierNode node) {
        return environment.get(node.name())
                .orElseThrow(() -> new EvaluationException("identifier not found: " + node.name()));
    }

    @Override
    public Value visitIntegerLiteral(IntegerLiteralNode node) {
        return new IntegerValue(node.value());
    }

    @Override
    public Value visitFloatLiteral(FloatLiteralNode node) {
        return new FloatValue(node.value());
    }

    @Override
    public Value visitStringLiteral(StringLiteralNode node) {
        return new StringValue(node.value());
    }

    @Override
    public Value visitBooleanLiteral(BooleanLiteralNode node) {
        return IntegerValue.of(node.value());
    }

    @Override
    public Value visitNilLiteral(NilLiteralNode node) {
        return NullValue.INSTANCE;
    }

    @Override
    public Value visitVoidLiteral(VoidLiteralNode node) {
        return NullValue.INSTANCE;
    }

    @Override
    public Value visitPrefixExpression(PrefixExpressionNode node) {
        Value operand = node.operand().accept(this);
        String operator = node.operator();
        if (operand instanceof IntegerValue i) {
            if ("-".equals(operator)) return new IntegerValue(-i.value());
            if ("+".equals(operator)) return i;
        } else if (operand instanceof FloatValue f) {
            if ("-".equals(operator)) return new FloatValue(-f.value());
            if ("+".equals(operator)) return f;
        }
        throw new EvaluationException("unknown operator: " + operator + operand.type());
    }

    @Override
    public Value visitInfixExpression(InfixExpressionNode node) {
        Value left = node.left().accept(this);
        Value right = node.right().accept(this);
        String operator = node.operator();

        if (left instanceof IntegerValue l && right instanceof IntegerValue r) {
            return integerInfix(operator, l.value(), r.value());
        }
        if (isNumeric(left) && isNumeric(right)) {
            return floatInfix(left, operator, right);
        }
        if (left instanceof StringValue l && right instanceof StringValue r && "+".equals(operator)) {
            return new StringValue(l.value() + r.value());
        }
        if ("==".equals(operator)) {
            return IntegerValue.of(left.equals(right));
        }
        if ("!=".equals(operator)) {
            return IntegerValue.of(!left.equals(right));
        }
        throw unknownOperator(left, operator, right);
    }

    /**
     * Evaluates the operand and reports the name of its type as a string.
     * The operand may be any expression, including another {@code typeof}.
     */
    @Override
    public Value visitTypeOfExpression(TypeOfExpressionNode node) {
        Value operand = node.operand().accept(this);
        return new StringValue(operand.type().displayName());
    }

    private Value integerInfix(String operator, long left, long right) {
        switch (operator) {
            case "+": return new IntegerValue(left + right);
            case "-": return new IntegerValue(left - right);
            case "*": return new IntegerValue(left * right);
            case "/":
                if (right == 0) throw new EvaluationException("division by zero");
                return new IntegerValue(left / right);
            case "%":
                if (right == 0) throw new EvaluationException("division by zero");
                return new IntegerValue(left % right);
            case "<": return IntegerValue.of(left < right);
            case ">": return IntegerValue.of(left > right);
            case "<=": return IntegerValue.of(left <= right);
            case ">=": return IntegerValue.of(left >= right);
            case "==": return IntegerValue.of(left == right);
            case "!=": return IntegerValue.of(left != right);
            case "&&": return IntegerValue.of(left != 0 && right != 0);
            case "||": return IntegerValue.of(left != 0 || right != 0);
            default:
                throw new EvaluationException("unknown operator: " + Type.INT + " " + operator + " " + Type.INT);
        }
    }

    private Value floatInfix(Value leftValue, String operator, Value rightValue) {
        double left = toDouble(leftValue);
        double right = toDouble(rightValue);
        switch (operator) {
            case "+": return new FloatValue(left + right);
            case "-": return new FloatValue(left - right);
            case "*": return new FloatValue(left * right);
            case "/": return new FloatValue(left / right);
            case "%": return new FloatValue(left % right);
            case "<": return IntegerValue.of(left < right);
            case ">": return IntegerValue.of(left > right);
            case "<=": return IntegerValue.of(left <= right);
            case ">=": return IntegerValue.of(left >= right);
            case "==": return IntegerValue.of(left == right);
            case "!=": return IntegerValue.of(left != right);
            default:
                throw unknownOperator(leftValue, operator, rightValue);
        }
    }

    private static boolean isNumeric(Value value) {
        return value instanceof IntegerValue || value instanceof FloatValue;
    }

    private static double toDouble(Value value) {
        if (value instanceof IntegerValue i) {
            return i.value();
        }
        return ((FloatValue) value).value();
    }

    private static EvaluationException unknownOperator(Value left, String operator, Value right) {
        return new EvaluationException("unknown operator: " + left.type() + " " + operator + " " + right.type());
    }
}
