package curvefit.plugins;

import curvefit.data_structure.Dataset;
import curvefit.dummy_plugins.DummyLinePlugin;
import curvefit.dummy_plugins.DummyNoEvalPlugin;
import curvefit.dummy_plugins.DummyNumericSquarePlugin;
import curvefit.dummy_plugins.DummySquarePlugin;
import curvefit.models.FitModel;
import curvefit.models.ModelCatalog;
import curvefit.processing.exceptions.NameCollisionException;
import curvefit.processing.exceptions.PluginFileNotFoundException;
import curvefit.processing.exceptions.PluginLoadException;
import curvefit.processing.exceptions.PluginMissingSymbolException;
import curvefit.processing.fit.CurveFitter;
import curvefit.processing.fit.FitConfig;
import curvefit.processing.fit.FitResult;
import curvefit.processing.optimizer.FitAlgorithm;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.Assert.*;

public class PluginLoaderTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    /**
     * Packs the compiled class {@param pluginClass} in a jar whose manifest designates it as plugin class
     */
    Path createPlugin(String fileName, Class<?> pluginClass) throws IOException {
        Path jar = testFolder.getRoot().toPath().resolve(fileName);
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        manifest.getMainAttributes().put(new Attributes.Name(PluginLoader.PLUGIN_CLASS_ATTRIBUTE), pluginClass.getName());
        String entry = pluginClass.getName().replace('.', '/') + ".class";
        try (OutputStream os = Files.newOutputStream(jar); JarOutputStream jos = new JarOutputStream(os, manifest);
             InputStream classBytes = pluginClass.getClassLoader().getResourceAsStream(entry)) {
            assertNotNull("compiled class not found: "+entry, classBytes);
            jos.putNextEntry(new JarEntry(entry));
            jos.write(classBytes.readAllBytes());
            jos.closeEntry();
        }
        return jar;
    }

    @Test
    public void loadPluginWithJacobian() throws IOException {
        FitModel model = PluginLoader.loadPlugin(createPlugin("line.jar", DummyLinePlugin.class));
        assertEquals("DummyLine", model.getName());
        assertEquals(FitModel.Category.PLUGIN, model.getCategory());
        assertEquals(Arrays.asList("a", "b"), model.parameterNames());
        assertTrue(model.isJacobianAvailable());
        assertTrue(model.hasAnalyticJacobian());
        assertEquals(7, model.evaluate(3, new double[]{1, 2}), 0);
        assertArrayEquals(new double[]{1, 3}, model.jacobian(3, new double[]{1, 2}), 0);
        Dataset data = new Dataset("d", new double[]{0, 1, 2}, new double[]{1, 3, 5});
        assertArrayEquals(new double[]{0, 1}, model.initialGuess(data), 0);
        FitResult res = new CurveFitter().fit(data, model, new FitConfig().setWriteParametersToLog(false));
        assertEquals(1, res.getParameter("a"), 1e-6);
        assertEquals(2, res.getParameter("b"), 1e-6);
    }

    @Test
    public void pluginsAreCached() throws IOException {
        Path jar = createPlugin("cached.jar", DummyLinePlugin.class);
        assertSame(PluginLoader.loadPlugin(jar), PluginLoader.loadPlugin(jar));
    }

    @Test
    public void pluginWithoutJacobian() throws IOException {
        FitModel model = PluginLoader.loadPlugin(createPlugin("square.jar", DummySquarePlugin.class));
        assertEquals("name defaults to file name", "square", model.getName());
        assertFalse(model.isJacobianAvailable());
        Dataset data = new Dataset("d", new double[]{1, 2, 3}, new double[]{3, 12, 27});
        try {
            new CurveFitter().fit(data, model, new FitConfig().setWriteParametersToLog(false));
            fail("Levenberg-Marquardt requires a jacobian");
        } catch (PluginMissingSymbolException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("jacobian"));
        }
        FitResult res = new CurveFitter().fit(data, model, new FitConfig().setAlgorithm(FitAlgorithm.SIMPLEX).setWriteParametersToLog(false));
        assertEquals(3, res.getParameter("a"), 1e-3);
    }

    @Test
    public void pluginWithNumericJacobian() throws IOException {
        FitModel model = PluginLoader.loadPlugin(createPlugin("numeric.jar", DummyNumericSquarePlugin.class));
        assertTrue(model.isJacobianAvailable());
        assertFalse(model.hasAnalyticJacobian());
        assertEquals(4, model.jacobian(2, new double[]{1})[0], 1e-6);
        Dataset data = new Dataset("d", new double[]{1, 2, 3}, new double[]{3, 12, 27});
        FitResult res = new CurveFitter().fit(data, model, new FitConfig().setWriteParametersToLog(false));
        assertEquals(3, res.getParameter("a"), 1e-6);
    }

    @Test(expected = PluginFileNotFoundException.class)
    public void missingFile() {
        PluginLoader.loadPlugin(testFolder.getRoot().toPath().resolve("missing.jar"));
    }

    @Test
    public void missingEval() throws IOException {
        try {
            PluginLoader.loadPlugin(createPlugin("noeval.jar", DummyNoEvalPlugin.class));
            fail("plugin without eval should be rejected");
        } catch (PluginLoadException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("eval"));
        }
    }

    static class TrackingClassLoader extends URLClassLoader {
        boolean closed;

        TrackingClassLoader(Path jar) throws IOException {
            super(new URL[]{jar.toUri().toURL()}, PluginLoaderTest.class.getClassLoader());
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    @Test
    public void classLoaderIsClosedOnFailure() throws IOException {
        Path noEval = createPlugin("noeval2.jar", DummyNoEvalPlugin.class);
        TrackingClassLoader cl = new TrackingClassLoader(noEval);
        try {
            PluginLoader.load(noEval, cl);
            fail("plugin without eval should be rejected");
        } catch (PluginLoadException e) {
            assertTrue(cl.closed);
        }

        Path invalid = testFolder.newFile("invalid2.jar").toPath();
        Files.write(invalid, new byte[]{1, 2, 3});
        TrackingClassLoader invalidCl = new TrackingClassLoader(invalid);
        try {
            PluginLoader.load(invalid, invalidCl);
            fail("invalid jar should be rejected");
        } catch (PluginLoadException e) {
            assertTrue(invalidCl.closed);
        }

        Path line = createPlugin("line2.jar", DummyLinePlugin.class);
        TrackingClassLoader lineCl = new TrackingClassLoader(line);
        FitModel model = PluginLoader.load(line, lineCl);
        assertFalse(lineCl.closed);
        assertEquals(7, model.evaluate(3, new double[]{1, 2}), 0);
        lineCl.close();
    }

    @Test
    public void notAJar() throws IOException {
        Path file = testFolder.newFile("invalid.jar").toPath();
        Files.write(file, new byte[]{1, 2, 3});
        try {
            PluginLoader.loadPlugin(file);
            fail("invalid jar should be rejected");
        } catch (PluginLoadException e) {
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void catalogRegistersPlugins() throws IOException {
        ModelCatalog catalog = new ModelCatalog();
        FitModel model = catalog.loadPlugin(createPlugin("catalog.jar", DummyLinePlugin.class));
        assertSame(model, catalog.getModel("DummyLine"));
        assertTrue(catalog.getModelNames().contains("DummyLine"));
        assertEquals(1, catalog.getPlugins().size());
    }

    @Test(expected = NameCollisionException.class)
    public void pluginNameCollision() throws IOException {
        new ModelCatalog().loadPlugin(createPlugin("Gauss.jar", DummySquarePlugin.class));
    }
}
