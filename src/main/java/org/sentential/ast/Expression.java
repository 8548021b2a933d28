package org.sentential.ast;

import org.sentential.Bindings;
import org.sentential.Evaluation;

import java.util.Set;

/**
 * A node of an immutable propositional formula.
 *
 * <expression>::=<variable>|<not><expression>|(<expression><operator><expression>)
 * <operator>::='∨'|'∧'|'⇒'
 * <not>::='¬'
 */
public interface Expression {

    /**
     * Evaluates this formula, left to right, stopping at the first unbound variable.
     */
    public Evaluation evaluate(Bindings bindings);

    /**
     * Adds every variable label of this formula to {@code variables}, left to right.
     */
    public void collectVariables(Set<Character> variables);

    /**
     * Fully parenthesized infix form, see {@link org.sentential.Printer} for the canonical one.
     */
    public String print();
}
