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
package curvefit.models;

import curvefit.data_structure.Dataset;
import curvefit.processing.fit_function.FitFunction;
import curvefit.processing.fit_function.PreInitializedEstimator;
import curvefit.processing.fit_function.StartPointEstimator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Definition of a fit model: a parametric function with named parameters, its jacobian and an initial-guess heuristic.
 * Built-in models, user-defined formulas and plugins are all exposed through this single class, they only differ by
 * their {@link Category} and the underlying {@link FitFunction}.
 * <p>
 * Immutable: modifiers return a new instance.
 * @author Jean Ollion
 */
public class FitModel {
    public enum Category {BUILT_IN, USER_DEFINED, PLUGIN}
    final String name;
    final Category category;
    final List<ModelParameter> parameters;
    final FitFunction function;
    final StartPointEstimator estimator;
    final String formula;
    final boolean jacobianAvailable;

    /**
     *
     * @param name name of the model
     * @param category category
     * @param parameterNames parameter names, in the order of the parameter vector of {@param function}
     * @param function evaluator and jacobian
     * @param estimator initial-guess heuristic, may be null
     * @param formula formula (for display and persistence), may be null
     * @param jacobianAvailable false if {@param function} can neither compute nor approximate its jacobian for gradient-based optimization
     */
    public FitModel(String name, Category category, List<String> parameterNames, FitFunction function, StartPointEstimator estimator, String formula, boolean jacobianAvailable) {
        this(name, category, parameterNames.stream().map(ModelParameter::new).collect(Collectors.toList()), function, estimator, formula, jacobianAvailable, true);
    }

    private FitModel(String name, Category category, List<ModelParameter> parameters, FitFunction function, StartPointEstimator estimator, String formula, boolean jacobianAvailable, boolean check) {
        if (name==null || name.isEmpty()) throw new IllegalArgumentException("Model name is required");
        if (check && parameters.size()!=function.getNParameters()) throw new IllegalArgumentException("Model "+name+": "+parameters.size()+" parameter names for a function of "+function.getNParameters()+" parameters");
        this.name = name;
        this.category = category;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.function = function;
        this.estimator = estimator;
        this.formula = formula;
        this.jacobianAvailable = jacobianAvailable;
    }

    public String getName() {
        return name;
    }

    public Category getCategory() {
        return category;
    }

    public String getFormula() {
        return formula==null ? function.toString() : formula;
    }

    public FitFunction getFunction() {
        return function;
    }

    public StartPointEstimator getEstimator() {
        return estimator;
    }

    public int getNParameters() {
        return parameters.size();
    }

    public List<ModelParameter> getParameters() {
        return parameters;
    }

    public List<String> parameterNames() {
        return parameters.stream().map(ModelParameter::getName).collect(Collectors.toList());
    }

    public int getParameterIndex(String parameterName) {
        for (int i = 0; i<parameters.size(); ++i) if (parameters.get(i).getName().equals(parameterName)) return i;
        throw new IllegalArgumentException("Model "+name+" has no parameter named: "+parameterName);
    }

    public ModelParameter getParameter(String parameterName) {
        return parameters.get(getParameterIndex(parameterName));
    }

    public double evaluate(double x, double[] params) {
        return function.val(x, params);
    }

    /**
     * @return partial derivatives at {@param x}, analytic or approximated
     */
    public double[] jacobian(double x, double[] params) {
        return function.jacobian(x, params);
    }

    public boolean hasAnalyticJacobian() {
        return function.hasAnalyticGradient();
    }

    /**
     * @return whether the jacobian can be used by gradient-based optimizers
     */
    public boolean isJacobianAvailable() {
        return jacobianAvailable;
    }

    /**
     * Initial parameters: explicit initial values of parameters, other values are estimated from {@param data}
     */
    public double[] initialGuess(Dataset data) {
        double[] init = parameters.stream().mapToDouble(ModelParameter::getInitialValue).toArray();
        return new PreInitializedEstimator(init, estimator).initializeFit(data);
    }

    public int[] getFixedIndices() {
        return IntStream.range(0, parameters.size()).filter(i -> parameters.get(i).isFixed()).toArray();
    }

    public int getNFreeParameters() {
        return (int)parameters.stream().filter(p -> !p.isFixed()).count();
    }

    /**
     * @return minimal number of observations required to fit this model
     */
    public int minPoints() {
        return getNFreeParameters();
    }

    /**
     * @return lower bounds of parameters, null if no parameter is bounded
     */
    public double[] getLowerBounds() {
        if (parameters.stream().noneMatch(ModelParameter::isBounded)) return null;
        return parameters.stream().mapToDouble(ModelParameter::getLowerBound).toArray();
    }

    /**
     * @return upper bounds of parameters, null if no parameter is bounded
     */
    public double[] getUpperBounds() {
        if (parameters.stream().noneMatch(ModelParameter::isBounded)) return null;
        return parameters.stream().mapToDouble(ModelParameter::getUpperBound).toArray();
    }

    // modifiers

    public FitModel withParameter(String parameterName, UnaryOperator<ModelParameter> modifier) {
        int idx = getParameterIndex(parameterName);
        List<ModelParameter> params = new ArrayList<>(parameters);
        params.set(idx, modifier.apply(params.get(idx)));
        return new FitModel(name, category, params, function, estimator, formula, jacobianAvailable, false);
    }

    /**
     * @param values initial values, one per parameter. NaN values are estimated from data
     */
    public FitModel withInitialGuesses(double... values) {
        if (values.length!=parameters.size()) throw new IllegalArgumentException("Model "+name+" expects "+parameters.size()+" initial values, got: "+values.length);
        List<ModelParameter> params = IntStream.range(0, values.length).mapToObj(i -> parameters.get(i).withInitialValue(values[i])).collect(Collectors.toList());
        return new FitModel(name, category, params, function, estimator, formula, jacobianAvailable, false);
    }

    public FitModel withInitialGuess(String parameterName, double value) {
        return withParameter(parameterName, p -> p.withInitialValue(value));
    }

    /**
     * Holds parameter {@param parameterName} at {@param value} during the fit
     */
    public FitModel withFixed(String parameterName, double value) {
        return withParameter(parameterName, p -> p.withInitialValue(value).withFixed(true));
    }

    public FitModel withBounds(String parameterName, double lowerBound, double upperBound) {
        return withParameter(parameterName, p -> p.withBounds(lowerBound, upperBound));
    }

    public FitModel withEstimator(StartPointEstimator estimator) {
        return new FitModel(name, category, parameters, function, estimator, formula, jacobianAvailable, false);
    }

    public double[] getInitialValues() {
        return parameters.stream().mapToDouble(ModelParameter::getInitialValue).toArray();
    }

    @Override
    public String toString() {
        return name + " ("+category+"): " + getFormula() + " parameters: " + Arrays.toString(parameterNames().toArray());
    }
}
