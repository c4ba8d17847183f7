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

import java.util.Arrays;

/**
 * Node of a parsed formula, evaluated for a value of the variable <code>x</code> and a parameter vector
 * @author Jean Ollion
 */
public interface Expression {
    double evaluate(double x, double[] parameters);

    class Number implements Expression {
        final double value;
        public Number(double value) {
            this.value = value;
        }
        @Override
        public double evaluate(double x, double[] parameters) {
            return value;
        }
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    class Variable implements Expression {
        @Override
        public double evaluate(double x, double[] parameters) {
            return x;
        }
        @Override
        public String toString() {
            return "x";
        }
    }

    class Parameter implements Expression {
        final String name;
        final int index;
        public Parameter(String name, int index) {
            this.name = name;
            this.index = index;
        }
        @Override
        public double evaluate(double x, double[] parameters) {
            return parameters[index];
        }
        @Override
        public String toString() {
            return name;
        }
    }

    class Negation implements Expression {
        final Expression operand;
        public Negation(Expression operand) {
            this.operand = operand;
        }
        @Override
        public double evaluate(double x, double[] parameters) {
            return -operand.evaluate(x, parameters);
        }
        @Override
        public String toString() {
            return "-("+operand+")";
        }
    }

    class BinaryOperation implements Expression {
        final char operator;
        final Expression left, right;
        public BinaryOperation(char operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }
        @Override
        public double evaluate(double x, double[] parameters) {
            double l = left.evaluate(x, parameters);
            double r = right.evaluate(x, parameters);
            switch (operator) {
                case '+': return l + r;
                case '-': return l - r;
                case '*': return l * r;
                case '/': return l / r;
                case '^': return Math.pow(l, r);
                default: throw new IllegalStateException("Unknown operator: "+operator);
            }
        }
        @Override
        public String toString() {
            return "("+left+operator+right+")";
        }
    }

    class FunctionCall implements Expression {
        final BasicFunction function;
        final Expression[] arguments;
        public FunctionCall(BasicFunction function, Expression... arguments) {
            this.function = function;
            this.arguments = arguments;
        }
        @Override
        public double evaluate(double x, double[] parameters) {
            double[] args = new double[arguments.length];
            for (int i = 0; i<args.length; ++i) args[i] = arguments[i].evaluate(x, parameters);
            return function.apply(args);
        }
        @Override
        public String toString() {
            return function.symbol+Arrays.toString(arguments).replace('[', '(').replace(']', ')');
        }
    }
}
