package org.sentential.ast.operators;

import org.sentential.ast.Expression;

/**
 * Material implication: false only when the left side holds and the right does not.
 */
public final class Implication extends BinaryOperator {
	public static final String SYMBOL = "⇒";

	public Implication(Expression left, Expression right){
		super(left, right);
	}

	@Override
	public String getSymbol() {
		return SYMBOL;
	}

	@Override
	protected boolean combine(boolean l, boolean r) {
		return !l || r;
	}
}
