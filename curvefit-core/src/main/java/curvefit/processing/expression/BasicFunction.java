package curvefit.processing.expression;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Mathematical functions available in formulas
 * @author Jean Ollion
 */
public enum BasicFunction {
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    ASIN("asin", Math::asin),
    ACOS("acos", Math::acos),
    ATAN("atan", Math::atan),
    SINH("sinh", Math::sinh),
    COSH("cosh", Math::cosh),
    TANH("tanh", Math::tanh),
    EXP("exp", Math::exp),
    LN("ln", Math::log),
    LOG("log", Math::log10),
    LOG10("log10", Math::log10),
    LOG2("log2", v -> Math.log(v) / Math.log(2)),
    SQRT("sqrt", Math::sqrt),
    ABS("abs", Math::abs),
    SIGN("sign", Math::signum),
    FLOOR("floor", Math::floor),
    CEIL("ceil", Math::ceil),
    MIN("min", Math::min),
    MAX("max", Math::max),
    POW("pow", Math::pow);

    public final String symbol;
    final DoubleUnaryOperator unary;
    final DoubleBinaryOperator binary;

    BasicFunction(String symbol, DoubleUnaryOperator unary) {
        this.symbol = symbol;
        this.unary = unary;
        this.binary = null;
    }

    BasicFunction(String symbol, DoubleBinaryOperator binary) {
        this.symbol = symbol;
        this.unary = null;
        this.binary = binary;
    }

    public int getArity() {
        return unary!=null ? 1 : 2;
    }

    public double apply(double... args) {
        return unary!=null ? unary.applyAsDouble(args[0]) : binary.applyAsDouble(args[0], args[1]);
    }

    public static BasicFunction get(String symbol) {
        for (BasicFunction f : values()) if (f.symbol.equals(symbol)) return f;
        return null;
    }
}
