/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.processing.expression;

import curvefit.processing.exceptions.ExpressionParseException;
import curvefit.processing.exceptions.RecursiveDefinitionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser of formulas of one variable <code>x</code>.
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := primary ('^' unary)?
 * primary    := number | identifier | function '(' expression (',' expression)* ')' | '(' expression ')'
 * </pre>
 * Identifiers are <code>x</code>, the constants <code>pi</code> and <code>e</code>, parameter names and names of other user functions.
 * A user function is inlined: its formula is parsed with the same parameter names, as if it were written between parentheses.
 * @author Jean Ollion
 */
public class ExpressionParser {
    public static final String VARIABLE = "x";
    public static final Set<String> RESERVED_NAMES;
    static {
        Set<String> reserved = new HashSet<>();
        reserved.add(VARIABLE);
        reserved.add("pi");
        reserved.add("e");
        for (BasicFunction f : BasicFunction.values()) reserved.add(f.symbol);
        RESERVED_NAMES = Collections.unmodifiableSet(reserved);
    }
    final List<String> parameterNames;
    final Function<String, String> userFunctionFormula;

    /**
     *
     * @param parameterNames names of the parameters, in the order of the parameter vector
     * @param userFunctionFormula returns the formula of a user function from its name, or null if no such function exists. May be null
     */
    public ExpressionParser(List<String> parameterNames, Function<String, String> userFunctionFormula) {
        this.parameterNames = new ArrayList<>(parameterNames);
        this.userFunctionFormula = userFunctionFormula==null ? n -> null : userFunctionFormula;
    }

    public static boolean isValidIdentifier(String name) {
        if (name==null || name.isEmpty()) return false;
        if (!Character.isLetter(name.charAt(0)) && name.charAt(0)!='_') return false;
        for (int i = 1; i<name.length(); ++i) if (!Character.isLetterOrDigit(name.charAt(i)) && name.charAt(i)!='_') return false;
        return true;
    }

    /**
     * @param functionName name of the function defined by {@param formula}, used to detect recursive definitions. May be null
     * @param formula formula to parse
     * @return parsed expression
     * @throws ExpressionParseException in case of syntax error, unknown identifier or invalid parameter name
     * @throws RecursiveDefinitionException if {@param formula} references {@param functionName}, directly or through other user functions
     */
    public Expression parse(String functionName, String formula) {
        for (String p : parameterNames) {
            if (!isValidIdentifier(p)) throw new ExpressionParseException("Invalid parameter name: \""+p+"\"", formula, -1);
            if (RESERVED_NAMES.contains(p)) throw new ExpressionParseException("Parameter name: \""+p+"\" is reserved", formula, -1);
        }
        List<String> stack = new ArrayList<>();
        if (functionName!=null) stack.add(functionName);
        return parse(formula, stack);
    }

    Expression parse(String formula, List<String> stack) {
        if (formula==null || formula.trim().isEmpty()) throw new ExpressionParseException("Empty formula", String.valueOf(formula), -1);
        Parser parser = new Parser(formula, stack);
        Expression res = parser.parseExpression();
        parser.skipWhiteSpaces();
        if (parser.pos < formula.length()) throw new ExpressionParseException("Unexpected character '"+formula.charAt(parser.pos)+"'", formula, parser.pos);
        return res;
    }

    private class Parser {
        final String formula;
        final List<String> stack;
        int pos = 0;

        Parser(String formula, List<String> stack) {
            this.formula = formula;
            this.stack = stack;
        }

        void skipWhiteSpaces() {
            while (pos<formula.length() && Character.isWhitespace(formula.charAt(pos))) ++pos;
        }

        boolean consume(char c) {
            skipWhiteSpaces();
            if (pos<formula.length() && formula.charAt(pos)==c) {
                ++pos;
                return true;
            }
            return false;
        }

        ExpressionParseException error(String message) {
            return new ExpressionParseException(message, formula, pos);
        }

        Expression parseExpression() {
            Expression res = parseTerm();
            while (true) {
                if (consume('+')) res = new Expression.BinaryOperation('+', res, parseTerm());
                else if (consume('-')) res = new Expression.BinaryOperation('-', res, parseTerm());
                else return res;
            }
        }

        Expression parseTerm() {
            Expression res = parseUnary();
            while (true) {
                if (consume('*')) res = new Expression.BinaryOperation('*', res, parseUnary());
                else if (consume('/')) res = new Expression.BinaryOperation('/', res, parseUnary());
                else return res;
            }
        }

        Expression parseUnary() {
            if (consume('-')) return new Expression.Negation(parseUnary());
            if (consume('+')) return parseUnary();
            return parsePower();
        }

        Expression parsePower() {
            Expression base = parsePrimary();
            if (consume('^')) return new Expression.BinaryOperation('^', base, parseUnary()); // right associative
            return base;
        }

        Expression parsePrimary() {
            skipWhiteSpaces();
            if (pos>=formula.length()) throw error("Unexpected end of formula");
            char c = formula.charAt(pos);
            if (c=='(') {
                ++pos;
                Expression res = parseExpression();
                if (!consume(')')) throw error("Missing closing parenthesis");
                return res;
            }
            if (Character.isDigit(c) || c=='.') return parseNumber();
            if (Character.isLetter(c) || c=='_') return parseIdentifier();
            throw error("Unexpected character '"+c+"'");
        }

        Expression parseNumber() {
            int start = pos;
            while (pos<formula.length() && (Character.isDigit(formula.charAt(pos)) || formula.charAt(pos)=='.')) ++pos;
            if (pos<formula.length() && (formula.charAt(pos)=='e' || formula.charAt(pos)=='E')) { // exponent only if followed by digits
                int exp = pos + 1;
                if (exp<formula.length() && (formula.charAt(exp)=='+' || formula.charAt(exp)=='-')) ++exp;
                if (exp<formula.length() && Character.isDigit(formula.charAt(exp))) {
                    pos = exp;
                    while (pos<formula.length() && Character.isDigit(formula.charAt(pos))) ++pos;
                }
            }
            String number = formula.substring(start, pos);
            try {
                return new Expression.Number(Double.parseDouble(number));
            } catch (NumberFormatException e) {
                throw new ExpressionParseException("Invalid number \""+number+"\"", formula, start);
            }
        }

        Expression parseIdentifier() {
            int start = pos;
            while (pos<formula.length() && (Character.isLetterOrDigit(formula.charAt(pos)) || formula.charAt(pos)=='_')) ++pos;
            String name = formula.substring(start, pos);
            BasicFunction function = BasicFunction.get(name);
            if (function!=null) {
                if (!consume('(')) throw error("Missing argument list for function "+name);
                List<Expression> args = new ArrayList<>();
                args.add(parseExpression());
                while (consume(',')) args.add(parseExpression());
                if (!consume(')')) throw error("Missing closing parenthesis");
                if (args.size()!=function.getArity()) throw new ExpressionParseException("Function "+name+" expects "+function.getArity()+" argument(s), got "+args.size(), formula, start);
                return new Expression.FunctionCall(function, args.toArray(new Expression[0]));
            }
            if (VARIABLE.equals(name)) return new Expression.Variable();
            if ("pi".equals(name)) return new Expression.Number(Math.PI);
            if ("e".equals(name)) return new Expression.Number(Math.E);
            int paramIdx = parameterNames.indexOf(name);
            if (paramIdx>=0) return new Expression.Parameter(name, paramIdx);
            if (stack.contains(name)) {
                List<String> path = new ArrayList<>(stack);
                path.add(name);
                throw new RecursiveDefinitionException(stack.get(0), String.join(" -> ", path));
            }
            String userFormula = userFunctionFormula.apply(name);
            if (userFormula!=null) {
                List<String> newStack = new ArrayList<>(stack);
                newStack.add(name);
                return ExpressionParser.this.parse(userFormula, newStack);
            }
            throw new ExpressionParseException("Unknown identifier \""+name+"\" (parameters: "+ parameterNames.stream().collect(Collectors.joining(", "))+")", formula, start);
        }
    }

    @Override
    public String toString() {
        return "ExpressionParser with parameters: "+Arrays.toString(parameterNames.toArray());
    }
}
