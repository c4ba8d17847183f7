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

import curvefit.models.FitModel;
import curvefit.processing.exceptions.ModelException;
import curvefit.processing.exceptions.PluginFileNotFoundException;
import curvefit.processing.exceptions.PluginLoadException;
import curvefit.processing.fit_function.StartPointEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Loads fit models from plugin jars.
 * <p>
 * A plugin jar holds a class exposing the following public static members:
 * <pre>
 * String name()                                   optional, defaults to the file name
 * String[] parameters()                           required
 * double eval(double x, double[] p)               required
 * double[] jacobian(double x, double[] p)         optional
 * boolean NUMERIC_JACOBIAN                        optional, allows gradient-based optimization with an approximated jacobian
 * double[] initialGuess(double[] x, double[] y)   optional
 * </pre>
 * The class is named by the {@value #PLUGIN_CLASS_ATTRIBUTE} attribute of the jar manifest, or found by scanning the jar for a class with an <code>eval</code> method.
 * Loaded models are cached by canonical path for the lifetime of the process.
 * @author Jean Ollion
 */
public class PluginLoader {
    public static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);
    public static final String PLUGIN_CLASS_ATTRIBUTE = "Fit-Plugin-Class";
    public static final String NUMERIC_JACOBIAN_FIELD = "NUMERIC_JACOBIAN";
    private static final Map<Path, FitModel> CACHE = new ConcurrentHashMap<>();

    /**
     *
     * @param path plugin jar
     * @return model of the plugin
     * @throws PluginFileNotFoundException if {@param path} does not exist
     * @throws PluginLoadException if the plugin cannot be loaded or lacks a required member
     */
    public static FitModel loadPlugin(Path path) {
        if (path==null || !Files.isRegularFile(path)) throw new PluginFileNotFoundException(String.valueOf(path));
        Path canonical;
        try {
            canonical = path.toRealPath();
        } catch (IOException e) {
            throw new PluginLoadException(path.toString(), e);
        }
        return CACHE.computeIfAbsent(canonical, PluginLoader::load);
    }

    private static FitModel load(Path path) {
        URLClassLoader cl;
        try {
            cl = new URLClassLoader(new URL[]{path.toUri().toURL()}, PluginLoader.class.getClassLoader());
        } catch (MalformedURLException e) {
            throw new PluginLoadException(path.toString(), e);
        }
        return load(path, cl);
    }

    /**
     * Reads the plugin of {@param path} through {@param cl}. The class loader stays open on success, as the plugin methods are bound to it, and is closed on failure.
     */
    static FitModel load(Path path, URLClassLoader cl) {
        try {
            return readPlugin(path, cl);
        } catch (RuntimeException | LinkageError e) {
            try {
                cl.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private static FitModel readPlugin(Path path, ClassLoader cl) {
        Class<?> pluginClass;
        try {
            pluginClass = findPluginClass(path, cl);
        } catch (IOException | ClassNotFoundException | LinkageError e) {
            throw new PluginLoadException(path.toString(), e);
        }
        Method eval = getStaticMethod(pluginClass, "eval", double.class, double.class, double[].class);
        if (eval==null) throw new PluginLoadException(path.toString(), "missing method: static double eval(double, double[])");
        Method parameters = getStaticMethod(pluginClass, "parameters", String[].class);
        if (parameters==null) throw new PluginLoadException(path.toString(), "missing method: static String[] parameters()");
        Method nameMethod = getStaticMethod(pluginClass, "name", String.class);
        Method jacobian = getStaticMethod(pluginClass, "jacobian", double[].class, double.class, double[].class);
        Method initialGuess = getStaticMethod(pluginClass, "initialGuess", double[].class, double[].class, double[].class);
        String[] parameterNames;
        String name;
        boolean numericJacobian;
        try {
            parameterNames = (String[])parameters.invoke(null);
            name = nameMethod==null ? null : (String)nameMethod.invoke(null);
            numericJacobian = getNumericJacobianFlag(pluginClass);
        } catch (InvocationTargetException e) {
            throw new PluginLoadException(path.toString(), e.getCause());
        } catch (IllegalAccessException e) {
            throw new PluginLoadException(path.toString(), e);
        }
        if (parameterNames==null || parameterNames.length==0) throw new PluginLoadException(path.toString(), "no parameters");
        if (name==null || name.isEmpty()) {
            name = path.getFileName().toString();
            if (name.endsWith(".jar")) name = name.substring(0, name.length()-4);
        }
        PluginFunction function = new PluginFunction(name, path, parameterNames.length, eval, jacobian);
        StartPointEstimator estimator = initialGuess==null ? null : data -> {
            try {
                return (double[])initialGuess.invoke(null, data.getX(), data.getY());
            } catch (InvocationTargetException e) {
                throw new ModelException("Plugin "+path.getFileName()+": error while calling initialGuess", e.getCause());
            } catch (IllegalAccessException e) {
                throw new ModelException("Plugin "+path.getFileName()+": cannot call initialGuess", e);
            }
        };
        logger.info("loaded plugin: {} from class: {} (parameters: {}, jacobian: {})", name, pluginClass.getName(), Arrays.toString(parameterNames), jacobian!=null ? "analytic" : (numericJacobian ? "numeric" : "none"));
        return new FitModel(name, FitModel.Category.PLUGIN, Arrays.asList(parameterNames), function, estimator, name, jacobian!=null || numericJacobian);
    }

    private static Class<?> findPluginClass(Path path, ClassLoader cl) throws IOException, ClassNotFoundException {
        try (JarFile jarFile = new JarFile(path.toFile())) {
            Manifest manifest = jarFile.getManifest();
            if (manifest!=null) {
                String className = manifest.getMainAttributes().getValue(new Attributes.Name(PLUGIN_CLASS_ATTRIBUTE));
                if (className!=null) return cl.loadClass(className.trim());
            }
            List<String> candidates = new ArrayList<>();
            Enumeration<JarEntry> e = jarFile.entries();
            while (e.hasMoreElements()) {
                JarEntry je = e.nextElement();
                if(je.isDirectory() || !je.getName().endsWith(".class") || je.getName().contains("$")) continue;
                // -6 because of .class
                String className = je.getName().replace('/', '.');
                candidates.add(className.substring(0, className.length()-6));
            }
            for (String className : candidates) {
                Class<?> c = cl.loadClass(className);
                if (getStaticMethod(c, "eval", double.class, double.class, double[].class)!=null) return c;
            }
        }
        throw new ClassNotFoundException("no class with a static eval(double, double[]) method in jar");
    }

    private static Method getStaticMethod(Class<?> c, String name, Class<?> returnType, Class<?>... parameterTypes) {
        try {
            Method m = c.getMethod(name, parameterTypes);
            if (!Modifier.isStatic(m.getModifiers()) || !returnType.equals(m.getReturnType())) return null;
            return m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static boolean getNumericJacobianFlag(Class<?> c) throws IllegalAccessException {
        try {
            Field f = c.getField(NUMERIC_JACOBIAN_FIELD);
            if (!Modifier.isStatic(f.getModifiers()) || !boolean.class.equals(f.getType())) return false;
            return f.getBoolean(null);
        } catch (NoSuchFieldException e) {
            return false;
        }
    }
}
