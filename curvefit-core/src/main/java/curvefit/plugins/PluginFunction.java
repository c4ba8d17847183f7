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
package curvefit.plugins;

import curvefit.processing.exceptions.ModelException;
import curvefit.processing.fit_function.FitFunction;
import curvefit.processing.fit_function.FitFunctionNumericalGradient;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.file.Path;

/**
 * Fit function backed by the static methods of a plugin class.
 * When the plugin has no jacobian method, partial derivatives are approximated by finite differences
 * @author Jean Ollion
 */
public class PluginFunction implements FitFunction {
    final String name;
    final Path path;
    final int nParameters;
    final Method eval, jacobian;

    public PluginFunction(String name, Path path, int nParameters, Method eval, Method jacobian) {
        this.name = name;
        this.path = path;
        this.nParameters = nParameters;
        this.eval = eval;
        this.jacobian = jacobian;
    }

    public String getName() {
        return name;
    }

    /**
     * @return canonical path of the plugin file
     */
    public Path getPath() {
        return path;
    }

    @Override
    public int getNParameters() {
        return nParameters;
    }

    @Override
    public double val(double x, double[] a) {
        return (Double)invoke(eval, x, a);
    }

    @Override
    public double grad(double x, double[] a, int k) {
        if (jacobian==null) return FitFunctionNumericalGradient.centralDifference(this, x, a, k);
        return jacobian(x, a)[k];
    }

    @Override
    public double[] jacobian(double x, double[] a) {
        if (jacobian==null) return FitFunction.super.jacobian(x, a);
        double[] res = (double[])invoke(jacobian, x, a);
        if (res==null || res.length!=nParameters) throw new ModelException("Plugin "+name+": jacobian should return "+nParameters+" values");
        return res;
    }

    @Override
    public boolean hasAnalyticGradient() {
        return jacobian!=null;
    }

    private Object invoke(Method method, double x, double[] a) {
        try {
            return method.invoke(null, x, a);
        } catch (InvocationTargetException e) {
            throw new ModelException("Plugin "+name+": error while calling "+method.getName(), e.getCause());
        } catch (IllegalAccessException e) {
            throw new ModelException("Plugin "+name+": cannot call "+method.getName(), e);
        }
    }

    @Override
    public String toString() {
        return "Plugin "+name+" ("+path+")";
    }
}
