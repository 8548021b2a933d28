package org.sentential.ast.operators;

import org.sentential.ast.Expression;

/**
 * Logical AND, printed with "∨". Parsed back from "∨", "&" and "and".
 */
public final class Conjunction extends BinaryOperator {
	public static final String SYMBOL = "∨";

	public Conjunction(Expression left, Expression right){
		super(left, right);
	}

	@Override
	public String getSymbol() {
		return SYMBOL;
	}

	@Override
	protected boolean combine(boolean l, boolean r) {
		return l && r;
	}
}
