package org.sentential;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.sentential.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Variable discovery and exhaustive enumeration of bindings.
 */
public final class TruthTables {

    private static final Logger log = LoggerFactory.getLogger( TruthTables.class );

    // 2^20 rows
    static final int LARGE_TABLE_VARIABLES = 20;

    private static final List<Boolean> TRUE_FALSE = ImmutableList.of(true, false);

    private TruthTables() {
    }

    /**
     * The distinct variable labels of a formula, in the order they first appear from left to right.
     */
    public static Set<Character> varNames(Expression expression) {
        Set<Character> names = new LinkedHashSet<Character>();
        expression.collectVariables(names);
        return ImmutableSet.copyOf(names);
    }

    /**
     * Every assignment of {@code n} booleans. The first position changes slowest, the last alternates,
     * and {@code true} comes before {@code false}: for n = 2 the rows are TT, TF, FT, FF.
     *
     * @return 2^n rows of length n; a single empty row when n is 0
     */
    public static List<List<Boolean>> combinations(int n) {
        Preconditions.checkArgument(n >= 0, "Variable count must not be negative: %s", n);
        if (n == 0) {
            return ImmutableList.<List<Boolean>>of(ImmutableList.<Boolean>of());
        }
        if (n > LARGE_TABLE_VARIABLES) {
            log.warn(String.format("Enumerating %d variables produces %d rows", n, 1L << n));
        }

        List<List<Boolean>> rows = new ArrayList<List<Boolean>>();
        for (Boolean value : TRUE_FALSE) {
            rows.add(ImmutableList.of(value));
        }
        for (int i = 1; i < n; i++) {
            List<List<Boolean>> next = new ArrayList<List<Boolean>>(rows.size() * 2);
            for (List<Boolean> row : rows) {
                for (Boolean value : TRUE_FALSE) {
                    next.add(ImmutableList.<Boolean>builder().addAll(row).add(value).build());
                }
            }
            rows = next;
        }
        return ImmutableList.copyOf(rows);
    }

    /**
     * One binding per row of the formula's truth table, in {@link #combinations(int)} order.
     */
    public static List<Bindings> truthTable(Expression expression) {
        List<Character> names = ImmutableList.copyOf(varNames(expression));
        log.debug("Building truth table over {} variables {}", names.size(), names);

        ImmutableList.Builder<Bindings> table = ImmutableList.builder();
        for (List<Boolean> values : combinations(names.size())) {
            table.add(Bindings.zip(names, values));
        }
        return table.build();
    }
}
