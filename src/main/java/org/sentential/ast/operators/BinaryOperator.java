package org.sentential.ast.operators;

import com.google.common.base.Preconditions;
import org.sentential.Bindings;
import org.sentential.Evaluation;
import org.sentential.Printer;
import org.sentential.ast.Expression;

import java.util.Set;

/**
 * Both operands are always evaluated, left first; the left error wins when both fail.
 */
public abstract class BinaryOperator implements Expression {
	protected final Expression left, right;

    BinaryOperator(Expression left, Expression right){
        this.left = Preconditions.checkNotNull(left, "left");
        this.right = Preconditions.checkNotNull(right, "right");
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public abstract String getSymbol();

    protected abstract boolean combine(boolean l, boolean r);

    public Evaluation evaluate(Bindings bindings) {
        Evaluation l = left.evaluate(bindings);
        Evaluation r = right.evaluate(bindings);
        if (l.isFailure()) {
            return l;
        }
        if (r.isFailure()) {
            return r;
        }
        return Evaluation.of(combine(l.getValue(), r.getValue()));
    }

    public void collectVariables(Set<Character> variables) {
        left.collectVariables(variables);
        right.collectVariables(variables);
    }

    public String print() {
        return String.format("(%s %s %s)", left.print(), getSymbol(), right.print());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        BinaryOperator other = (BinaryOperator) o;
        return other.left.equals(left) && other.right.equals(right);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getClass().hashCode() + left.hashCode()) + right.hashCode();
    }

	@Override
	public String toString(){
		return Printer.render(this);
	}
}
