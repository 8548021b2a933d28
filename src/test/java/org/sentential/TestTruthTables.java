package org.sentential;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.sentential.ast.Expression;
import org.sentential.ast.operands.Variable;
import org.sentential.ast.operators.Conjunction;
import org.sentential.ast.operators.Disjunction;
import org.sentential.ast.operators.Implication;
import org.sentential.ast.operators.Negation;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;

public class TestTruthTables {

    private static final Variable P = new Variable('p');
    private static final Variable Q = new Variable('q');
    private static final Variable R = new Variable('r');

    private static final Expression MIXED = new Implication(
            new Conjunction(R, new Negation(P)),
            new Disjunction(Q, new Implication(P, R)));

    @Test
    public void collectsDistinctVariables() {
        assertEquals(ImmutableSet.of('p', 'q'), TruthTables.varNames(new Implication(P, new Negation(Q))));
        assertEquals(ImmutableSet.of('p'), TruthTables.varNames(new Conjunction(P, new Negation(P))));
    }

    @Test
    public void variablesFollowFirstAppearance() {
        Assert.assertArrayEquals(new Object[]{'r', 'p', 'q'}, TruthTables.varNames(MIXED).toArray());
        assertEquals(TruthTables.varNames(MIXED), TruthTables.varNames(MIXED));
        Assert.assertArrayEquals(TruthTables.varNames(MIXED).toArray(), TruthTables.varNames(MIXED).toArray());
    }

    @Test
    public void enumeratesInCountingOrder() {
        assertEquals(ImmutableList.of(
                ImmutableList.of(true),
                ImmutableList.of(false)), TruthTables.combinations(1));
        assertEquals(ImmutableList.of(
                ImmutableList.of(true, true),
                ImmutableList.of(true, false),
                ImmutableList.of(false, true),
                ImmutableList.of(false, false)), TruthTables.combinations(2));
        List<List<Boolean>> three = TruthTables.combinations(3);
        assertEquals(ImmutableList.of(true, true, true), three.get(0));
        assertEquals(ImmutableList.of(true, true, false), three.get(1));
        assertEquals(ImmutableList.of(false, true, true), three.get(4));
        assertEquals(ImmutableList.of(false, false, false), three.get(7));
    }

    @Test
    public void enumeratesEveryAssignmentOnce() {
        for (int n = 1; n <= 8; n++) {
            List<List<Boolean>> rows = TruthTables.combinations(n);
            assertEquals(1 << n, rows.size());
            Set<List<Boolean>> distinct = new HashSet<List<Boolean>>();
            for (List<Boolean> row : rows) {
                assertEquals(n, row.size());
                distinct.add(row);
            }
            assertEquals(rows.size(), distinct.size());
        }
    }

    @Test
    public void zeroVariablesGiveOneEmptyRow() {
        List<List<Boolean>> rows = TruthTables.combinations(0);
        assertEquals(1, rows.size());
        assertTrue(rows.get(0).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeCount() {
        TruthTables.combinations(-1);
    }

    @Test
    public void buildsOneBindingPerRow() {
        List<Bindings> table = TruthTables.truthTable(new Implication(P, Q));
        assertEquals(4, table.size());
        assertEquals(Bindings.builder().bind('p', true).bind('q', true).build(), table.get(0));
        assertEquals(Bindings.builder().bind('p', true).bind('q', false).build(), table.get(1));
        assertEquals(Bindings.builder().bind('p', false).bind('q', true).build(), table.get(2));
        assertEquals(Bindings.builder().bind('p', false).bind('q', false).build(), table.get(3));
    }

    @Test
    public void everyRowEvaluates() {
        List<Bindings> table = TruthTables.truthTable(MIXED);
        assertEquals(8, table.size());
        for (Bindings bindings : table) {
            assertTrue(MIXED.evaluate(bindings).isSuccess());
        }
    }

    @Test
    public void pairsRowsWithResults() {
        TruthTable table = TruthTable.of(new Implication(P, Q));
        assertEquals(ImmutableList.of('p', 'q'), table.getVariables());
        assertEquals(ImmutableList.of(true, false, true, true), table.getResults());
        assertFalse(table.isTautology());
        assertFalse(table.isContradiction());

        assertTrue(TruthTable.of(new Implication(P, P)).isTautology());
        assertTrue(TruthTable.of(new Conjunction(P, new Negation(P))).isContradiction());
    }

    @Test
    public void formatsTable() {
        String expected = "p | q | p ⇒ q\n"
                + "T | T | T\n"
                + "T | F | F\n"
                + "F | T | T\n"
                + "F | F | T\n";
        assertEquals(expected, TruthTable.of(new Implication(P, Q)).format());
    }
}
