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

import curvefit.processing.fit_function.FitFunctionNumericalGradient;

/**
 * Fit function defined by a parsed formula. Partial derivatives are computed by finite differences
 * @author Jean Ollion
 */
public class ExpressionFunction extends FitFunctionNumericalGradient {
    final String formula;
    final Expression expression;
    final int nParameters;

    public ExpressionFunction(String formula, Expression expression, int nParameters) {
        this.formula = formula;
        this.expression = expression;
        this.nParameters = nParameters;
    }

    public String getFormula() {
        return formula;
    }

    @Override
    public int getNParameters() {
        return nParameters;
    }

    @Override
    public double val(double x, double[] a) {
        return expression.evaluate(x, a);
    }

    @Override
    public String toString() {
        return formula;
    }
}
