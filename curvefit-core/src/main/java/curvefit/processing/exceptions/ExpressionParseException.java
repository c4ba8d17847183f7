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
package curvefit.processing.exceptions;

/**
 * Syntax error in the formula of a user-defined function
 */
public class ExpressionParseException extends ModelException {
    final int position;
    public ExpressionParseException(String message, String expression, int position) {
        super(message + (position>=0 ? " at position "+position : "") + " in: "+expression);
        this.position = position;
    }

    /**
     * @return index of the offending character in the expression, or -1 if not applicable
     */
    public int getPosition() {
        return position;
    }
}
