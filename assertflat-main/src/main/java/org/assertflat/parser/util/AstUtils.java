/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.assertflat.parser.util;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

public class AstUtils {

    private static final Map<String, BinaryExpr.Operator> OPERATOR_MAP = Map.ofEntries(
            Map.entry("==", BinaryExpr.Operator.EQUALS),
            Map.entry("!=", BinaryExpr.Operator.NOT_EQUALS),
            Map.entry("<", BinaryExpr.Operator.LESS),
            Map.entry(">", BinaryExpr.Operator.GREATER),
            Map.entry("<=", BinaryExpr.Operator.LESS_EQUALS),
            Map.entry(">=", BinaryExpr.Operator.GREATER_EQUALS),
            Map.entry("&&", BinaryExpr.Operator.AND),
            Map.entry("||", BinaryExpr.Operator.OR),
            Map.entry("+", BinaryExpr.Operator.PLUS),
            Map.entry("-", BinaryExpr.Operator.MINUS)
    );

    private static final Set<UnaryExpr.Operator> INCREMENTS = Set.of(
            UnaryExpr.Operator.PREFIX_INCREMENT,
            UnaryExpr.Operator.PREFIX_DECREMENT,
            UnaryExpr.Operator.POSTFIX_INCREMENT,
            UnaryExpr.Operator.POSTFIX_DECREMENT
    );

    private AstUtils() {
    }

    public static BinaryExpr.Operator getBinaryExprOperator(String operatorText) {
        BinaryExpr.Operator operator = OPERATOR_MAP.get(operatorText);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operatorText);
        }
        return operator;
    }

    /**
     * Builds {@code left operator right}, parenthesizing either operand when its own precedence would
     * otherwise bind it differently.
     */
    public static BinaryExpr binary(Expression left, String operatorText, Expression right) {
        BinaryExpr.Operator operator = getBinaryExprOperator(operatorText);
        int precedence = precedenceOf(operator);
        Expression leftOperand = left instanceof BinaryExpr
                ? parenthesizeBelow(left, precedence, false)
                : asOperand(left);
        Expression rightOperand = right instanceof BinaryExpr
                ? parenthesizeBelow(right, precedence, true)
                : asOperand(right);
        return new BinaryExpr(leftOperand, rightOperand, operator);
    }

    private static Expression parenthesizeBelow(Expression operand, int precedence, boolean rightHand) {
        int operandPrecedence = precedenceOf(((BinaryExpr) operand).getOperator());
        boolean needsParentheses = rightHand ? operandPrecedence <= precedence : operandPrecedence < precedence;
        return needsParentheses ? new EnclosedExpr(operand) : operand;
    }

    private static int precedenceOf(BinaryExpr.Operator operator) {
        switch (operator) {
            case OR:
                return 1;
            case AND:
                return 2;
            case BINARY_OR:
                return 3;
            case XOR:
                return 4;
            case BINARY_AND:
                return 5;
            case EQUALS:
            case NOT_EQUALS:
                return 6;
            case LESS:
            case GREATER:
            case LESS_EQUALS:
            case GREATER_EQUALS:
                return 7;
            case LEFT_SHIFT:
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return 8;
            case PLUS:
            case MINUS:
                return 9;
            default:
                return 10;
        }
    }

    public static String getStringFromLiteral(String value) {
        value = value.trim();
        String result = value.replaceAll("_", "");
        char lastChar = result.charAt(result.length() - 1);
        if (!Character.isDigit(lastChar)) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * True for an int or long literal, possibly parenthesized, whose value is {@code expected}.
     * Underscores and the {@code L} suffix are ignored; hex and octal spellings never match.
     */
    public static boolean isIntegerLiteral(Expression expression, long expected) {
        Expression unwrapped = unwrapEnclosed(expression);
        if (!(unwrapped instanceof IntegerLiteralExpr) && !(unwrapped instanceof LongLiteralExpr)) {
            return false;
        }
        String digits = getStringFromLiteral(((LiteralExpr) unwrapped).toString());
        if (digits.length() > 1 && digits.startsWith("0")) {
            return false;
        }
        try {
            return Long.parseLong(digits) == expected;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static Expression unwrapEnclosed(Expression expression) {
        Expression current = expression;
        while (current instanceof EnclosedExpr) {
            current = ((EnclosedExpr) current).getInner();
        }
        return current;
    }

    /**
     * Names, field accesses over such names, {@code this} and literals can be evaluated twice
     * without observable difference.
     */
    public static boolean isSideEffectFree(Expression expression) {
        Expression unwrapped = unwrapEnclosed(expression);
        if (unwrapped instanceof NameExpr || unwrapped instanceof ThisExpr || unwrapped instanceof SuperExpr
                || unwrapped instanceof LiteralExpr || unwrapped instanceof ClassExpr) {
            return true;
        }
        if (unwrapped instanceof FieldAccessExpr) {
            return isSideEffectFree(((FieldAccessExpr) unwrapped).getScope());
        }
        return false;
    }

    /**
     * Whether the expression, taken from a parsed tree, may be moved into a lambda body: no simple name
     * in it is assigned, incremented or decremented anywhere in the enclosing member. Locals assigned
     * once after their declaration are rejected too. A detached expression has nothing to check.
     */
    public static boolean isCapturable(Expression expression) {
        Optional<Node> member = expression.findAncestor(BodyDeclaration.class).map(Node.class::cast);
        if (member.isEmpty()) {
            return true;
        }
        return expression.findAll(NameExpr.class).stream()
                .map(NameExpr::getNameAsString)
                .noneMatch(name -> isReassigned(name, member.get()));
    }

    private static boolean isReassigned(String name, Node scope) {
        return scope.findAll(AssignExpr.class).stream().anyMatch(assign -> isName(assign.getTarget(), name))
                || scope.findAll(UnaryExpr.class).stream()
                        .anyMatch(unary -> INCREMENTS.contains(unary.getOperator()) && isName(unary.getExpression(), name));
    }

    private static boolean isName(Expression expression, String name) {
        Expression unwrapped = unwrapEnclosed(expression);
        return unwrapped instanceof NameExpr && ((NameExpr) unwrapped).getNameAsString().equals(name);
    }

    /**
     * Wraps the expression in parentheses when it is to be used as an operand of a binary, relational
     * or logical operator.
     */
    public static Expression asOperand(Expression expression) {
        if (expression.isBinaryExpr() || expression.isConditionalExpr() || expression.isAssignExpr()
                || expression.isLambdaExpr() || expression.isInstanceOfExpr() || expression.isCastExpr()
                || expression.isSwitchExpr()) {
            return new EnclosedExpr(expression);
        }
        return expression;
    }

    /**
     * Wraps the expression in parentheses when it is to be used as the receiver of a method call or
     * field access.
     */
    public static Expression asScope(Expression expression) {
        if (expression instanceof NameExpr || expression instanceof FieldAccessExpr
                || expression instanceof MethodCallExpr || expression instanceof ArrayAccessExpr
                || expression instanceof ThisExpr || expression instanceof SuperExpr
                || expression instanceof EnclosedExpr || expression instanceof ClassExpr
                || expression instanceof ObjectCreationExpr || expression.isStringLiteralExpr()) {
            return expression;
        }
        return new EnclosedExpr(expression);
    }
}
