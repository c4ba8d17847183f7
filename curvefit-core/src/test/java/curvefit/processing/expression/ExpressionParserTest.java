package curvefit.processing.expression;

import curvefit.processing.exceptions.ExpressionParseException;
import curvefit.processing.exceptions.RecursiveDefinitionException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ExpressionParserTest {
    static double eval(String formula, double x, String[] names, double... params) {
        return new ExpressionParser(Arrays.asList(names), null).parse(null, formula).evaluate(x, params);
    }

    @Test
    public void precedence() {
        String[] none = new String[0];
        assertEquals(7, eval("1+2*3", 0, none), 0);
        assertEquals(9, eval("(1+2)*3", 0, none), 0);
        assertEquals(-4, eval("-2^2", 0, none), 0);
        assertEquals(512, eval("2^3^2", 0, none), 0);
        assertEquals(0.5, eval("2^-1", 0, none), 0);
        assertEquals(1, eval("8/4/2", 0, none), 0);
        assertEquals(2.5e-3, eval("2.5e-3", 0, none), 0);
    }

    @Test
    public void variableAndParameters() {
        String[] names = {"A", "B"};
        assertEquals(7, eval("A + B*x", 2, names, 1, 3), 0);
        assertEquals(Math.PI * 2, eval("pi*x", 2, names, 0, 0), 1e-12);
        assertEquals(Math.E, eval("exp(1)", 0, names, 0, 0), 1e-12);
    }

    @Test
    public void functions() {
        String[] none = new String[0];
        assertEquals(2, eval("log(100)", 0, none), 1e-12);
        assertEquals(1, eval("ln(e)", 0, none), 1e-12);
        assertEquals(3, eval("max(1, 3)", 0, none), 0);
        assertEquals(1, eval("sin(pi/2)", 0, none), 1e-12);
        assertEquals(4, eval("sqrt(abs(-16))", 0, none), 0);
    }

    @Test
    public void userFunctionsAreInlined() {
        Map<String, String> functions = new HashMap<>();
        functions.put("f1", "a*x");
        functions.put("f2", "f1 + 1");
        ExpressionParser parser = new ExpressionParser(Collections.singletonList("a"), functions::get);
        Expression e = parser.parse("f3", "2*f2");
        assertEquals(2 * (3 * 4 + 1), e.evaluate(4, new double[]{3}), 0);
    }

    @Test
    public void directRecursion() {
        Map<String, String> functions = new HashMap<>();
        ExpressionParser parser = new ExpressionParser(Collections.singletonList("a"), functions::get);
        try {
            parser.parse("f", "a*f");
            fail("recursive definition should be rejected");
        } catch (RecursiveDefinitionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("f -> f"));
        }
    }

    @Test
    public void transitiveRecursion() {
        Map<String, String> functions = new HashMap<>();
        functions.put("g", "2*h");
        functions.put("h", "f+1");
        ExpressionParser parser = new ExpressionParser(Collections.singletonList("a"), functions::get);
        try {
            parser.parse("f", "a*g");
            fail("recursive definition should be rejected");
        } catch (RecursiveDefinitionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("f -> g -> h -> f"));
        }
    }

    @Test
    public void syntaxErrors() {
        ExpressionParser parser = new ExpressionParser(Collections.singletonList("a"), null);
        for (String formula : new String[]{"", "a*", "(a+x", "a x", "sin x", "max(1)", "unknown*x", "a+#"}) {
            try {
                parser.parse(null, formula);
                fail("formula should be rejected: "+formula);
            } catch (ExpressionParseException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    @Test
    public void errorPosition() {
        ExpressionParser parser = new ExpressionParser(Collections.singletonList("a"), null);
        try {
            parser.parse(null, "a+b");
            fail();
        } catch (ExpressionParseException e) {
            assertEquals(2, e.getPosition());
        }
    }

    @Test(expected = ExpressionParseException.class)
    public void reservedParameterName() {
        new ExpressionParser(Arrays.asList("a", "x"), null).parse(null, "a*x");
    }

    @Test(expected = ExpressionParseException.class)
    public void invalidParameterName() {
        new ExpressionParser(Collections.singletonList("1a"), null).parse(null, "x");
    }

    @Test
    public void identifiers() {
        assertTrue(ExpressionParser.isValidIdentifier("A_1"));
        assertFalse(ExpressionParser.isValidIdentifier("1A"));
        assertFalse(ExpressionParser.isValidIdentifier("a-b"));
        assertTrue(ExpressionParser.RESERVED_NAMES.contains("sin"));
    }
}
