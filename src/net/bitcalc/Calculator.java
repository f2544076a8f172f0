package net.bitcalc;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import net.bitcalc.api.CalculatorException;
import net.bitcalc.api.Result;
import net.bitcalc.expr.Expression;
import net.bitcalc.parser.Lexer;
import net.bitcalc.parser.Parser;
import net.bitcalc.parser.Token;

public class Calculator {

    private static final Logger LOGGER = Logger.getLogger("Calculator");

    private final Parser parser;
    private boolean generatePostfix;
    private Calculation lastCalculation;

    public Calculator(boolean generatePostfix) {
        this.parser = new Parser();
        this.generatePostfix = generatePostfix;
    }
    public Calculator() {
        this(false);
    }

    public boolean isGeneratingPostfix() {
        return generatePostfix;
    }
    public void setGeneratePostfix(boolean g) {
        generatePostfix = g;
    }

    public Calculation getLastCalculation() {
        return lastCalculation;
    }

    public Calculation calculate(String expression)
            throws CalculatorException {
        List<Token> tokens = new Lexer(expression).lex();
        List<String> postfix = (generatePostfix) ?
            new ArrayList<String>() : null;
        Expression tree = parser.parse(expression, tokens, postfix);
        Calculation ret = new Calculation(expression, tree, postfix);
        lastCalculation = ret;
        return ret;
    }

    public Result<Calculation> parse(String expression) {
        try {
            return Result.success(calculate(expression));
        } catch (CalculatorException exc) {
            LOGGER.fine(exc.formatDiagnostic());
            return Result.failure(exc);
        }
    }

    public static String render(Expression tree) {
        return tree.render();
    }

}
