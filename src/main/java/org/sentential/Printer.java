package org.sentential;

import org.sentential.ast.Expression;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders formulas in canonical infix form, e.g. {@code p ⇒ ¬(q ∨ r)}.
 */
public final class Printer {

    // whole-string match only: strips the first and last character when they are '(' and ')'
    private static final Pattern OUTER_PARENS = Pattern.compile("\\((.*?)\\)");

    private Printer() {
    }

    public static String render(Expression expression) {
        return removeOuterParens(expression.print());
    }

    static String removeOuterParens(String s) {
        Matcher m = OUTER_PARENS.matcher(s);
        if (m.matches()) {
            return m.group(1);
        }
        return s;
    }
}
