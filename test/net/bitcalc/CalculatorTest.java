package net.bitcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.Arrays;
import net.bitcalc.api.CalculatorException;
import net.bitcalc.api.Result;
import net.bitcalc.expr.EvaluationException;
import net.bitcalc.parser.LexerException;
import net.bitcalc.parser.ParsingException;
import org.json.JSONObject;
import org.junit.Test;

public class CalculatorTest {

    @Test
    public void parseReturnsTreeAndValue() {
        Calculator calc = new Calculator();
        Result<Calculation> res = calc.parse("3+4*2");
        assertTrue(res.isSuccess());
        assertNull(res.getError());
        Calculation c = res.getValue();
        assertEquals(BigInteger.valueOf(11), c.getValue());
        assertEquals("(3 + (4 * 2))", c.getTree().toString());
        assertEquals("3+4*2", c.getExpression());
        assertNull(c.getPostfix());
        assertSame(c, calc.getLastCalculation());
        assertEquals(c.render(), Calculator.render(c.getTree()));
    }

    @Test
    public void failuresAreReportedAsResults() {
        Calculator calc = new Calculator();
        Calculation ok = calc.parse("~5").getValue();

        Result<Calculation> res = calc.parse("1-2");
        assertFalse(res.isSuccess());
        assertTrue(res.getError() instanceof ParsingException);
        assertEquals("Error parsing expression '1-2': An internal parser " +
                     "error has occurred.", res.getError().formatDiagnostic());

        res = calc.parse("10/4");
        assertTrue(res.getError() instanceof EvaluationException);
        assertEquals("Error evaluating expression '10/4': Quotient of " +
                     "10 / 4 is not an integer",
                     res.getError().formatDiagnostic());

        res = calc.parse("3 $ 4");
        assertTrue(res.getError() instanceof LexerException);
        assertEquals("Error parsing expression '3 $ 4': Encountered " +
                     "invalid token '$' at 2",
                     res.getError().formatDiagnostic());

        assertSame(ok, calc.getLastCalculation());
    }

    @Test(expected = IllegalStateException.class)
    public void valueOfFailureIsUnavailable() {
        new Calculator().parse("(3+4").getValue();
    }

    @Test
    public void orThrowRethrowsFailure() {
        Result<Calculation> res = new Calculator().parse("3+4)");
        try {
            res.orThrow();
            fail("Expected ParsingException");
        } catch (CalculatorException exc) {
            assertSame(res.getError(), exc);
            assertEquals("Mismatched parentheses", exc.getMessage());
        }
    }

    @Test
    public void calculateThrows() throws CalculatorException {
        Calculator calc = new Calculator();
        assertEquals(BigInteger.valueOf(2), calc.calculate("8>>2").getValue());
        try {
            calc.calculate("1 << -1");
            fail("Expected EvaluationException");
        } catch (EvaluationException exc) {
            assertEquals("1 << -1", exc.getExpression());
        }
    }

    @Test
    public void postfixIsOptional() {
        Calculator calc = new Calculator(true);
        assertTrue(calc.isGeneratingPostfix());
        Calculation c = calc.parse("(3+4)*2").getValue();
        assertEquals(Arrays.asList("3", "4", "+", "2", "*"), c.getPostfix());
        assertEquals("3 4 + 2 *", c.formatPostfix());
        calc.setGeneratePostfix(false);
        assertNull(calc.parse("1").getValue().formatPostfix());
    }

    @Test
    public void calculationAsJSON() {
        Calculation c = new Calculator(true).parse("~5").getValue();
        JSONObject json = new JSONObject(c.toJSON().toString());
        assertEquals("~5", json.getString("expression"));
        assertEquals(-6, json.getInt("value"));
        assertEquals("unary", json.getJSONObject("tree").getString("type"));
        assertEquals("~", json.getJSONArray("postfix").getString(1));

        json = new Calculator().parse("1").getValue().toJSON();
        assertFalse(json.has("postfix"));
    }

    private static String chain(int terms) {
        StringBuilder sb = new StringBuilder("1");
        for (int i = 1; i < terms; i++) sb.append("+1");
        return sb.toString();
    }

    @Test(timeout = 5000)
    public void longChainsParseInLinearTime() {
        Result<Calculation> res = new Calculator().parse(chain(4000));
        assertTrue(res.isSuccess());
        assertEquals(BigInteger.valueOf(4000), res.getValue().getValue());
    }

    @Test(timeout = 10000)
    public void deepTreesDoNotOverflowWhileParsing() {
        Calculator calc = new Calculator(true);
        Result<Calculation> res = calc.parse(chain(50000));
        assertTrue(res.isSuccess());
        assertEquals(BigInteger.valueOf(50000), res.getValue().getValue());
        assertEquals(99999, res.getValue().getPostfix().size());
    }

}
