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

import curvefit.plugins.PluginLoader;
import curvefit.processing.exceptions.ExpressionParseException;
import curvefit.processing.exceptions.ModelException;
import curvefit.processing.exceptions.NameCollisionException;
import curvefit.processing.expression.BasicFunction;
import curvefit.processing.expression.Expression;
import curvefit.processing.expression.ExpressionFunction;
import curvefit.processing.expression.ExpressionParser;
import curvefit.processing.fit_function.Boltzmann;
import curvefit.processing.fit_function.Constant;
import curvefit.processing.fit_function.Exponential;
import curvefit.processing.fit_function.ExponentialEstimator;
import curvefit.processing.fit_function.GaussianAmplitude;
import curvefit.processing.fit_function.GaussianAmplitudeEstimator;
import curvefit.processing.fit_function.GaussianPeak;
import curvefit.processing.fit_function.LinearSlope;
import curvefit.processing.fit_function.LinearSlopeEstimator;
import curvefit.processing.fit_function.Logistic;
import curvefit.processing.fit_function.LorentzianPeak;
import curvefit.processing.fit_function.MultipleIdenticalEstimator;
import curvefit.processing.fit_function.MultipleIdenticalFitFunction;
import curvefit.processing.fit_function.PeakFunction;
import curvefit.processing.fit_function.Polynomial;
import curvefit.processing.fit_function.PolynomialEstimator;
import curvefit.processing.fit_function.SigmoidEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Registry of fit models: built-in models, user-defined formulas and plugins.
 * <p>
 * Built-in models are created by the static factories of this class. User functions and plugins are registered
 * on a catalog instance. Initial guesses of built-in and plugin models can be restored from fit model files.
 * @author Jean Ollion
 */
public class ModelCatalog {
    public static final Logger logger = LoggerFactory.getLogger(ModelCatalog.class);
    public static final String LINE = "Line", LINEAR_SLOPE = "LinearSlope", POLYNOMIAL = "Polynomial",
            EXP_DECAY_1 = "ExpDecay1", EXP_DECAY_2 = "ExpDecay2", EXP_DECAY_3 = "ExpDecay3", EXP_GROWTH = "ExpGrowth",
            BOLTZMANN = "Boltzmann", LOGISTIC = "Logistic", GAUSS_AMP = "GaussAmp", GAUSS = "Gauss", LORENTZ = "Lorentz";
    public static final List<String> BUILT_IN_NAMES = Collections.unmodifiableList(Arrays.asList(LINE, LINEAR_SLOPE, POLYNOMIAL, EXP_DECAY_1, EXP_DECAY_2, EXP_DECAY_3, EXP_GROWTH, BOLTZMANN, LOGISTIC, GAUSS_AMP, GAUSS, LORENTZ));
    public static final int MAX_POLYNOMIAL_ORDER = 9;
    public static final int DEFAULT_POLYNOMIAL_ORDER = 2;
    final Map<String, FitModel> userFunctions = Collections.synchronizedMap(new TreeMap<>());
    final Map<String, FitModel> plugins = Collections.synchronizedMap(new TreeMap<>());
    final Map<String, List<ModelParameter>> storedParameters = Collections.synchronizedMap(new TreeMap<>());

    // built-in models

    public static FitModel line() {
        return new FitModel(LINE, FitModel.Category.BUILT_IN, Arrays.asList("A", "B"), new Polynomial(1), new PolynomialEstimator(1), "A+B*x", true);
    }

    public static FitModel linearSlope() {
        return new FitModel(LINEAR_SLOPE, FitModel.Category.BUILT_IN, Collections.singletonList("A"), new LinearSlope(), new LinearSlopeEstimator(), "A*x", true);
    }

    /**
     * @param order order of the polynomial, clamped to [1; {@value #MAX_POLYNOMIAL_ORDER}]
     */
    public static FitModel polynomial(int order) {
        int o = Math.max(1, Math.min(MAX_POLYNOMIAL_ORDER, order));
        if (o!=order) logger.debug("polynomial order {} clamped to {}", order, o);
        List<String> names = IntStream.rangeClosed(0, o).mapToObj(i -> "a"+i).collect(Collectors.toList());
        String formula = IntStream.rangeClosed(0, o).mapToObj(i -> i==0 ? "a0" : (i==1 ? "a1*x" : "a"+i+"*x^"+i)).collect(Collectors.joining("+"));
        return new FitModel(POLYNOMIAL, FitModel.Category.BUILT_IN, names, new Polynomial(o), new PolynomialEstimator(o), formula, true);
    }

    /**
     * @param nTerms number of exponential terms, in [1; 3]
     */
    public static FitModel expDecay(int nTerms) {
        if (nTerms<1 || nTerms>3) throw new IllegalArgumentException("Exponential decay has 1 to 3 terms");
        return exponential("ExpDecay"+nTerms, nTerms, false);
    }

    public static FitModel expGrowth() {
        return exponential(EXP_GROWTH, 1, true);
    }

    private static FitModel exponential(String name, int nTerms, boolean growth) {
        List<String> names = new ArrayList<>();
        List<String> terms = new ArrayList<>();
        for (int i = 1; i<=nTerms; ++i) {
            names.add("A"+i);
            names.add("t"+i);
            terms.add("A"+i+"*exp("+(growth?"":"-")+"x/t"+i+")");
        }
        names.add("y0");
        terms.add("y0");
        return new FitModel(name, FitModel.Category.BUILT_IN, names, new Exponential(nTerms, growth), new ExponentialEstimator(nTerms, growth), String.join("+", terms), true);
    }

    public static FitModel boltzmann() {
        return new FitModel(BOLTZMANN, FitModel.Category.BUILT_IN, Arrays.asList("A1", "A2", "x0", "dx"), new Boltzmann(), new SigmoidEstimator(false), "(A1-A2)/(1+exp((x-x0)/dx))+A2", true);
    }

    public static FitModel logistic() {
        return new FitModel(LOGISTIC, FitModel.Category.BUILT_IN, Arrays.asList("A1", "A2", "x0", "p"), new Logistic(), new SigmoidEstimator(true), "(A1-A2)/(1+(x/x0)^p)+A2", true);
    }

    public static FitModel gaussAmp() {
        return new FitModel(GAUSS_AMP, FitModel.Category.BUILT_IN, Arrays.asList("y0", "xc", "w", "A"), new GaussianAmplitude(), new GaussianAmplitudeEstimator(), "y0+A*exp(-(x-xc)^2/(2*w^2))", true);
    }

    /**
     * Sum of {@param nPeaks} gaussian peaks plus an offset. Parameters: A1, xc1, w1, ..., An, xcn, wn, y0
     */
    public static FitModel gauss(int nPeaks) {
        return peaks(GAUSS, nPeaks, new GaussianPeak(), i -> "sqrt(2/pi)*A"+i+"/w"+i+"*exp(-2*((x-xc"+i+")/w"+i+")^2)");
    }

    /**
     * Sum of {@param nPeaks} lorentzian peaks plus an offset. Parameters: A1, xc1, w1, ..., An, xcn, wn, y0
     */
    public static FitModel lorentz(int nPeaks) {
        return peaks(LORENTZ, nPeaks, new LorentzianPeak(), i -> "2*A"+i+"/pi*w"+i+"/(4*(x-xc"+i+")^2+w"+i+"^2)");
    }

    private static FitModel peaks(String name, int nPeaks, PeakFunction peak, IntFunction<String> term) {
        if (nPeaks<1) throw new IllegalArgumentException("At least one peak is required");
        List<String> names = new ArrayList<>();
        List<String> terms = new ArrayList<>();
        terms.add("y0");
        for (int i = 1; i<=nPeaks; ++i) {
            names.add("A"+i);
            names.add("xc"+i);
            names.add("w"+i);
            terms.add(term.apply(i));
        }
        names.add("y0");
        MultipleIdenticalFitFunction function = new MultipleIdenticalFitFunction(nPeaks, peak, new Constant());
        return new FitModel(name, FitModel.Category.BUILT_IN, names, function, new MultipleIdenticalEstimator(peak, nPeaks, null, null), String.join("+", terms), true);
    }

    /**
     * @return built-in model with default settings (polynomial of order {@value #DEFAULT_POLYNOMIAL_ORDER}, single peak), null if {@param name} is not a built-in model
     */
    public static FitModel getBuiltIn(String name) {
        if (name==null) return null;
        switch (name) {
            case LINE: return line();
            case LINEAR_SLOPE: return linearSlope();
            case POLYNOMIAL: return polynomial(DEFAULT_POLYNOMIAL_ORDER);
            case EXP_DECAY_1: return expDecay(1);
            case EXP_DECAY_2: return expDecay(2);
            case EXP_DECAY_3: return expDecay(3);
            case EXP_GROWTH: return expGrowth();
            case BOLTZMANN: return boltzmann();
            case LOGISTIC: return logistic();
            case GAUSS_AMP: return gaussAmp();
            case GAUSS: return gauss(1);
            case LORENTZ: return lorentz(1);
            default: return null;
        }
    }

    /**
     * @return whether {@param name} is the name of a built-in model or of a basic function (case insensitive)
     */
    public static boolean isReservedName(String name) {
        if (BUILT_IN_NAMES.stream().anyMatch(n -> n.equalsIgnoreCase(name))) return true;
        if (Arrays.stream(BasicFunction.values()).anyMatch(f -> f.symbol.equalsIgnoreCase(name))) return true;
        return ExpressionParser.RESERVED_NAMES.contains(name);
    }

    // user functions

    public FitModel registerUserFunction(String name, String formula, String... parameterNames) {
        return registerUserFunction(name, formula, Arrays.asList(parameterNames));
    }

    /**
     * Registers a user-defined model. Names of other user functions found in {@param formula} are replaced by their formula.
     * Registering an existing name replaces the previous definition.
     * @param name name of the function
     * @param formula formula of the function of <code>x</code>
     * @param parameterNames names of the parameters used in {@param formula}
     * @return registered model
     * @throws NameCollisionException if {@param name} is the name of a built-in model or a basic function
     * @throws ExpressionParseException if {@param formula} is invalid, references unknown identifiers or if no parameter is given
     * @throws curvefit.processing.exceptions.RecursiveDefinitionException if {@param formula} references {@param name}, directly or through other user functions
     */
    public FitModel registerUserFunction(String name, String formula, List<String> parameterNames) {
        if (!ExpressionParser.isValidIdentifier(name)) throw new ExpressionParseException("Invalid function name: \""+name+"\"", String.valueOf(formula), -1);
        if (isReservedName(name)) throw new NameCollisionException(name);
        if (parameterNames==null || parameterNames.isEmpty()) throw new ExpressionParseException("No parameters given for function "+name, String.valueOf(formula), -1);
        Set<String> unique = new HashSet<>(parameterNames);
        if (unique.size()!=parameterNames.size()) throw new ExpressionParseException("Duplicate parameter names: "+parameterNames, String.valueOf(formula), -1);
        ExpressionParser parser = new ExpressionParser(parameterNames, this::getUserFunctionFormula);
        Expression expression = parser.parse(name, formula);
        FitModel model = new FitModel(name, FitModel.Category.USER_DEFINED, parameterNames, new ExpressionFunction(formula, expression, parameterNames.size()), null, formula, true);
        if (userFunctions.put(name, model)!=null) logger.info("user function {} replaced: {}", name, formula);
        else logger.info("user function {} registered: {}", name, formula);
        return model;
    }

    String getUserFunctionFormula(String name) {
        FitModel m = userFunctions.get(name);
        return m==null ? null : m.getFormula();
    }

    public FitModel removeUserFunction(String name) {
        return userFunctions.remove(name);
    }

    public List<FitModel> getUserFunctions() {
        synchronized (userFunctions) {
            return new ArrayList<>(userFunctions.values());
        }
    }

    // plugins

    /**
     * Loads a plugin and registers it in this catalog
     * @see PluginLoader#loadPlugin(Path)
     */
    public FitModel loadPlugin(Path path) {
        FitModel model = PluginLoader.loadPlugin(path);
        if (isReservedName(model.getName())) throw new NameCollisionException(model.getName());
        plugins.put(model.getName(), model);
        return model;
    }

    public List<FitModel> getPlugins() {
        synchronized (plugins) {
            return new ArrayList<>(plugins.values());
        }
    }

    // lookup

    /**
     * @return model named {@param name}, looked up among user functions, plugins and built-in models, with stored parameter settings applied
     * @throws ModelException if no such model exists
     */
    public FitModel getModel(String name) {
        FitModel m = userFunctions.get(name);
        if (m==null) m = plugins.get(name);
        if (m==null) m = getBuiltIn(name);
        if (m==null) throw new ModelException("Unknown model: "+name);
        return applyStoredParameters(m);
    }

    /**
     * Applies parameter settings restored from fit model files to a model of the same name and number of parameters
     */
    public FitModel applyStoredParameters(FitModel model) {
        List<ModelParameter> stored = storedParameters.get(model.getName());
        if (stored==null || stored.size()!=model.getNParameters()) return model;
        return new FitModelIO.ModelDescription(model.getName(), model.getCategory(), null, stored, null).applyParameters(model);
    }

    public List<String> getModelNames() {
        List<String> res = new ArrayList<>(BUILT_IN_NAMES);
        synchronized (plugins) {
            res.addAll(plugins.keySet());
        }
        synchronized (userFunctions) {
            res.addAll(userFunctions.keySet());
        }
        return res;
    }

    // fit model files

    public void saveModel(FitModel model, Path folder) throws IOException {
        Files.createDirectories(folder);
        FitModelIO.save(model, folder.resolve(model.getName()+FitModelIO.EXTENSION));
    }

    /**
     * Loads a fit model file: registers user functions and plugins, stores parameter settings of built-in and plugin models
     * @return loaded model
     */
    public FitModel loadModel(Path file) throws IOException {
        return load(FitModelIO.load(file));
    }

    private FitModel load(FitModelIO.ModelDescription desc) {
        switch (desc.getCategory()) {
            case USER_DEFINED: {
                FitModel model = registerUserFunction(desc.getName(), desc.getFormula(), desc.getParameters().stream().map(ModelParameter::getName).collect(Collectors.toList()));
                model = desc.applyParameters(model);
                userFunctions.put(model.getName(), model);
                return model;
            }
            case PLUGIN: {
                if (desc.getPluginPath()!=null) loadPlugin(desc.getPluginPath());
                storedParameters.put(desc.getName(), desc.getParameters());
                return getModel(desc.getName());
            }
            case BUILT_IN:
            default: {
                if (getBuiltIn(desc.getName())==null) throw new ModelException("Unknown built-in model: "+desc.getName());
                storedParameters.put(desc.getName(), desc.getParameters());
                return getModel(desc.getName());
            }
        }
    }

    /**
     * Loads all fit model files of {@param folder}. User functions may reference each other whatever the file order.
     * Files that cannot be loaded are reported and skipped
     * @return loaded models
     */
    public List<FitModel> loadModels(Path folder) throws IOException {
        List<FitModelIO.ModelDescription> descriptions = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, "*"+FitModelIO.EXTENSION)) {
            List<Path> sorted = new ArrayList<>();
            files.forEach(sorted::add);
            Collections.sort(sorted);
            for (Path f : sorted) {
                try {
                    descriptions.add(FitModelIO.load(f));
                } catch (IOException e) {
                    logger.warn("could not read fit model file: "+f, e);
                }
            }
        }
        List<FitModel> res = new ArrayList<>();
        // user functions referencing functions not yet loaded are retried while some progress is made
        boolean progress = true;
        Map<FitModelIO.ModelDescription, ModelException> errors = new LinkedHashMap<>();
        while (progress && !descriptions.isEmpty()) {
            progress = false;
            errors.clear();
            Iterator<FitModelIO.ModelDescription> it = descriptions.iterator();
            while (it.hasNext()) {
                FitModelIO.ModelDescription desc = it.next();
                try {
                    res.add(load(desc));
                    it.remove();
                    progress = true;
                } catch (ModelException e) {
                    errors.put(desc, e);
                }
            }
        }
        errors.forEach((desc, e) -> logger.warn("could not load model: "+desc.getName(), e));
        logger.info("{} models loaded from {}", res.size(), folder);
        return res;
    }
}
