package org.sentential.ast.operators;

import com.google.common.base.Preconditions;
import org.sentential.Printer;
import org.sentential.ast.Expression;

import java.util.Set;

public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        this.child = Preconditions.checkNotNull(child, "child");
    }

    public Expression getChild() {
        return child;
    }

    public void collectVariables(Set<Character> variables) {
        child.collectVariables(variables);
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && ((UnaryOperator) o).child.equals(child);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + child.hashCode();
    }

    @Override
    public String toString(){
        return Printer.render(this);
    }
}
