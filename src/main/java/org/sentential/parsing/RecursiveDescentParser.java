package org.sentential.parsing;

import org.sentential.ast.Expression;
import org.sentential.ast.operands.Variable;
import org.sentential.ast.operators.*;
import org.sentential.errors.ParserError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * <implication>::=<disjunction>[<implies><implication>]
 * <disjunction>::=<conjunction>{<or><conjunction>}
 * <conjunction>::=<factor>{<and><factor>}
 * <factor>::=<variable>|<not><factor>|(<implication>)
 *
 * Malformed input never throws: the parser repairs what it can, records a {@link ParserError}
 * and always returns a tree.
 */
public class RecursiveDescentParser {

    private static final Logger log = LoggerFactory.getLogger( RecursiveDescentParser.class );

    private final Lexer lexer;
    private int symbol;
    // stands in for an operand that is missing from a malformed expression
    private final char missingVariable;
    private Expression root;
    private final Set<ParserError> errors;

    public RecursiveDescentParser(Lexer lexer, char missingVariable) {
        this.lexer  = lexer;
        this.missingVariable = missingVariable;
        this.symbol = Lexer.NONE;
        // don't reset parse errors
        this.errors = new LinkedHashSet<ParserError>();
    }

    public Expression parse() {
        symbol = lexer.nextSymbol();
        implication();
        if(symbol != Lexer.EOF){
            // unbalanced parens
            if(symbol == Lexer.RIGHT){
                addError(ParserErrors.MissingLeftParen.toError());
            }
            else{
                addError(ParserErrors.MalFormedExpression.toError());
            }
        }
        return root;
    }

    public Set<ParserError> getErrors(){
        return Collections.unmodifiableSet(this.errors);
    }

    public boolean hasErrors(){
        return this.errors.size() > 0;
    }

    private void implication() {
        disjunction();
        // right associative: p ⇒ q ⇒ r is p ⇒ (q ⇒ r)
        if (symbol == Lexer.IMPLIES) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            implication();
            root = new Implication(left, root);
        }
    }

    private void disjunction() {
        conjunction();
        while (symbol == Lexer.OR) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            conjunction();
            root = new Disjunction(left, root);
        }
    }

    private void conjunction() {
        factor();
        while (symbol == Lexer.AND) {
            Expression left = root;
            symbol = lexer.nextSymbol();
            factor();
            root = new Conjunction(left, root);
        }
    }

    private void factor() {
        switch (symbol){
            case Lexer.VARIABLE:
                root = new Variable(lexer.toString().charAt(0));
                symbol = lexer.nextSymbol();
                break;

            case Lexer.NOT:
                symbol = lexer.nextSymbol();
                factor();
                root = new Negation(root);
                break;

            case Lexer.LEFT:
                symbol = lexer.nextSymbol();
                implication();
                if(symbol == Lexer.EOF){
                    // missing parentheses, ignore, thus inserting one or more at the end
                    addError(ParserErrors.MissingRightParen.toError());
                    break;
                }
                if(symbol != Lexer.RIGHT){
                    addError(ParserErrors.MissingRightParen.toError());
                    break;
                }
                symbol = lexer.nextSymbol();
                break;

            case Lexer.UNKNOWN:
                addError(ParserErrors.UnknownToken.toError(lexer.toString()));
                root = new Variable(this.missingVariable);
                symbol = lexer.nextSymbol();
                break;

            default:
                // operand missing, leave the operator in place for the caller
                root = new Variable(this.missingVariable);
                addError(ParserErrors.MalFormedExpression.toError());
        }
    }

    private void addError(ParserError error) {
        log.debug("{} at '{}'", error.getMessage(), lexer);
        errors.add(error);
    }
}
