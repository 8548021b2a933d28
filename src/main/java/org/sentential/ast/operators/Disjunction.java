package org.sentential.ast.operators;

import org.sentential.ast.Expression;

/**
 * Logical OR, printed with "∧". Parsed back from "∧", "|" and "or".
 */
public final class Disjunction extends BinaryOperator {
	public static final String SYMBOL = "∧";

	public Disjunction(Expression left, Expression right){
		super(left, right);
	}

	@Override
	public String getSymbol() {
		return SYMBOL;
	}

	@Override
	protected boolean combine(boolean l, boolean r) {
		return l || r;
	}
}
