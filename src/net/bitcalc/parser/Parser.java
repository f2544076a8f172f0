package net.bitcalc.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.bitcalc.expr.BinaryExpression;
import net.bitcalc.expr.BinaryOperator;
import net.bitcalc.expr.EvaluationException;
import net.bitcalc.expr.Expression;
import net.bitcalc.expr.NumericExpression;
import net.bitcalc.expr.UnaryExpression;
import net.bitcalc.expr.UnaryOperator;

public class Parser {

    public enum Arity { UNARY, BINARY }

    private static final Logger LOGGER = Logger.getLogger("Parser");

    public Expression parse(String source) throws LexerException,
            ParsingException, EvaluationException {
        return parse(source, new Lexer(source).lex(), null);
    }

    public Expression parse(String source, List<Token> tokens)
            throws ParsingException, EvaluationException {
        return parse(source, tokens, null);
    }

    public Expression parse(String source, List<Token> tokens,
                            List<String> postfix)
            throws ParsingException, EvaluationException {
        List<Expression> tree = new ArrayList<Expression>();
        List<Token> stack = new ArrayList<Token>();
        for (Token tok : tokens) {
            switch (tok.getKind()) {
                case INTEGER:
                    tree.add(new NumericExpression(tok.toInteger()));
                    if (postfix != null) postfix.add(tok.getContent());
                    break;
                case LPAREN:
                    stack.add(tok);
                    break;
                case RPAREN:
                    boolean found = false;
                    while (! stack.isEmpty()) {
                        Token top = pop(stack);
                        if (top.getKind() == TokenKind.LPAREN) {
                            found = true;
                            break;
                        }
                        reduce(source, tree, top, postfix);
                    }
                    if (! found)
                        throw new ParsingException(source,
                                                   "Mismatched parentheses");
                    break;
                default:
                    PrecedenceTable.Entry incoming = precedence(source, tok);
                    while (! stack.isEmpty()) {
                        Token top = peek(stack);
                        if (top.getKind() == TokenKind.LPAREN ||
                            ! PrecedenceTable.shouldPopBefore(
                                precedence(source, top), incoming))
                            break;
                        reduce(source, tree, pop(stack), postfix);
                    }
                    stack.add(tok);
                    break;
            }
        }
        while (! stack.isEmpty()) {
            Token top = pop(stack);
            if (top.getKind() == TokenKind.LPAREN ||
                    top.getKind() == TokenKind.RPAREN)
                throw new ParsingException(source, "Mismatched parentheses");
            reduce(source, tree, top, postfix);
        }
        if (tree.size() != 1) {
            LOGGER.fine("Parse of '" + source + "' ended with " +
                        tree.size() + " operands");
            throw new ParsingException(source,
                "An internal parser error has occurred.");
        }
        return tree.get(0);
    }

    public static Arity arityFor(TokenKind op, int available) {
        if (available >= 2 && op != TokenKind.NOT) return Arity.BINARY;
        return Arity.UNARY;
    }

    protected void reduce(String source, List<Expression> tree, Token op,
                          List<String> postfix)
            throws ParsingException, EvaluationException {
        if (tree.isEmpty())
            throw new ParsingException(source, "Missing operand for " +
                "operator '" + op.getContent() + "' at " +
                op.getPosition().getCharacterIndex());
        Expression result;
        switch (arityFor(op.getKind(), tree.size())) {
            case BINARY:
                Expression second = tree.remove(tree.size() - 1);
                Expression first = tree.remove(tree.size() - 1);
                BinaryOperator bop = BinaryOperator.forKind(op.getKind());
                if (bop == null)
                    throw new ParsingException(source, "Operator '" +
                        op.getContent() + "' cannot be used as a binary " +
                        "operator");
                try {
                    result = BinaryExpression.create(first, bop, second);
                } catch (EvaluationException exc) {
                    throw exc.withExpression(source);
                }
                break;
            case UNARY:
                UnaryOperator uop = UnaryOperator.forKind(op.getKind());
                if (uop == null)
                    throw new ParsingException(source, "Operator '" +
                        op.getContent() + "' cannot be used as a unary " +
                        "operator");
                result = new UnaryExpression(uop,
                                             tree.remove(tree.size() - 1));
                break;
            default:
                throw new AssertionError("Unhandled arity");
        }
        // toString() walks the whole subtree.
        if (LOGGER.isLoggable(Level.FINER))
            LOGGER.finer("Reduced " + op.getContent() + " to " + result);
        if (postfix != null) postfix.add(op.getContent());
        tree.add(result);
    }

    protected PrecedenceTable.Entry precedence(String source, Token op)
            throws ParsingException {
        PrecedenceTable.Entry ret = PrecedenceTable.lookup(op.getKind());
        if (ret == null)
            throw new ParsingException(source, "Invalid operator '" +
                op.getContent() + "' given.");
        return ret;
    }

    private static Token peek(List<Token> stack) {
        return stack.get(stack.size() - 1);
    }

    private static Token pop(List<Token> stack) {
        return stack.remove(stack.size() - 1);
    }

}
