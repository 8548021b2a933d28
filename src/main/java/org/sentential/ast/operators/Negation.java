package org.sentential.ast.operators;

import org.sentential.Bindings;
import org.sentential.Evaluation;
import org.sentential.ast.Expression;

public final class Negation extends UnaryOperator {
	public static final String SYMBOL = "¬";

	public Negation(Expression child){
		super(child);
	}

	public Evaluation evaluate(Bindings bindings) {
		return child.evaluate(bindings).negate();
	}

	public String print() {
		return SYMBOL + child.print();
	}
}
