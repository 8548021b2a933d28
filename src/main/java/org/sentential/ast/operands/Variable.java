package org.sentential.ast.operands;

import org.sentential.Bindings;
import org.sentential.Evaluation;
import org.sentential.Printer;
import org.sentential.ast.Expression;
import org.sentential.errors.BindingError;

import java.util.Set;

public final class Variable implements Expression {
	private final char label;

	public Variable(char label) {
		this.label = label;
	}

	public char getLabel() {
		return label;
	}

	public Evaluation evaluate(Bindings bindings) {
		Boolean value = bindings.get(label);
		if (value == null) {
			return Evaluation.failure(new BindingError(label));
		}
		return Evaluation.of(value);
	}

	public void collectVariables(Set<Character> variables) {
		variables.add(label);
	}

	public String print() {
		return String.valueOf(label);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Variable && ((Variable) o).label == label;
	}

	@Override
	public int hashCode() {
		return Character.hashCode(label);
	}

	@Override
	public String toString(){
		return Printer.render(this);
	}
}
