package org.sentential;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.sentential.ast.Expression;

import java.util.List;

/**
 * A formula together with its evaluation under every binding of its variables.
 */
public final class TruthTable {

    private static final String SEPARATOR = " | ";

    private final Expression expression;
    private final List<Character> variables;
    private final List<Row> rows;

    private TruthTable(Expression expression, List<Character> variables, List<Row> rows) {
        this.expression = expression;
        this.variables = variables;
        this.rows = rows;
    }

    public static TruthTable of(Expression expression) {
        Preconditions.checkNotNull(expression, "expression");
        ImmutableList.Builder<Row> rows = ImmutableList.builder();
        for (Bindings bindings : TruthTables.truthTable(expression)) {
            rows.add(new Row(bindings, expression.evaluate(bindings)));
        }
        return new TruthTable(expression, ImmutableList.copyOf(TruthTables.varNames(expression)), rows.build());
    }

    public Expression getExpression() {
        return expression;
    }

    public List<Character> getVariables() {
        return variables;
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<Boolean> getResults() {
        ImmutableList.Builder<Boolean> results = ImmutableList.builder();
        for (Row row : rows) {
            results.add(row.getResult());
        }
        return results.build();
    }

    public boolean isTautology() {
        return !getResults().contains(false);
    }

    public boolean isContradiction() {
        return !getResults().contains(true);
    }

    /**
     * Plain text rendering, one line per row:
     * <pre>
     * p | q | p ⇒ q
     * T | F | F
     * </pre>
     */
    public String format() {
        String formula = Printer.render(expression);
        StringBuilder sb = new StringBuilder();
        for (Character variable : variables) {
            sb.append(variable).append(SEPARATOR);
        }
        sb.append(formula).append('\n');
        for (Row row : rows) {
            for (Character variable : variables) {
                sb.append(cell(row.getBindings().get(variable))).append(SEPARATOR);
            }
            sb.append(cell(row.getResult())).append('\n');
        }
        return sb.toString();
    }

    private static String cell(boolean value) {
        return value ? "T" : "F";
    }

    @Override
    public String toString() {
        return format();
    }

    public static final class Row {

        private final Bindings bindings;
        private final Evaluation evaluation;

        Row(Bindings bindings, Evaluation evaluation) {
            this.bindings = bindings;
            this.evaluation = evaluation;
        }

        public Bindings getBindings() {
            return bindings;
        }

        public Evaluation getEvaluation() {
            return evaluation;
        }

        /**
         * Rows cover every variable, so evaluation cannot fail.
         */
        public boolean getResult() {
            return evaluation.getValue();
        }
    }
}
