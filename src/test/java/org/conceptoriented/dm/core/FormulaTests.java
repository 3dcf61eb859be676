package org.conceptoriented.dm.core;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class FormulaTests {

    @Test
    public void parseTest() throws DmError
    {
    	FormulaResolver resolver = new FormulaResolver("([HP] + [ Weight ]) / [HP]");

    	// Each field is a dependency once, in the order of occurrence
    	assertEquals(Arrays.asList("HP", "Weight"), resolver.getDependencies());
    	assertEquals("([HP] + [ Weight ]) / [HP]", resolver.getFormula());

    	assertEquals(3.0, (Double) resolver.resolve(new Object[] {10.0, 20.0}, 0), 1e-9);
    	assertEquals(3.0, (Double) resolver.resolve(new Object[] {10, "20"}, 0), 1e-9); // Numbers in any form

    	FormulaResolver constant = new FormulaResolver("2 * 3");
    	assertTrue(constant.getDependencies().isEmpty());
    	assertEquals(6.0, (Double) constant.resolve(new Object[0], 0), 1e-9);
    }

    @Test
    public void missingValuesTest() throws DmError
    {
    	FormulaResolver resolver = new FormulaResolver("[A] / [B]");

    	assertTrue(((Double) resolver.resolve(new Object[] {null, 2.0}, 0)).isNaN());
    	assertTrue(((Double) resolver.resolve(new Object[] {"x", 2.0}, 0)).isNaN());
    	assertTrue(((Double) resolver.resolve(new Object[] {1.0, 0.0}, 0)).isNaN()); // Division by zero
    }

    @Test
    public void errorsTest()
    {
    	try {
    		new FormulaResolver("([A] + 1");
    		fail("Wrong syntax");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.FORMULA_ERROR, e.code);
    	}

    	try {
    		new FormulaResolver("[A] + unknown");
    		fail("Unknown variable");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.FORMULA_ERROR, e.code);
    	}

    	try {
    		new FormulaResolver(" ");
    		fail("Empty formula");
    	}
    	catch(DmError e) {
    		assertEquals(DmErrorCode.FORMULA_ERROR, e.code);
    	}
    }

    @Test
    public void calculatedFieldReplayTest() throws DmError
    {
    	Snapshot root = CarsData.create();
    	Snapshot power = root.calculateVariable(ColumnDefinition.measure("Power"), "[HP] * 0.7457");

    	// The formula is replayed on a filtered root
    	Snapshot japan = root.select((row, index) -> "Japan".equals(row.get("Origin")));
    	Snapshot replayed = PropagationGraph.replayPath(power, root, japan);

    	assertEquals(2, replayed.getRowCount());
    	assertNull(replayed.getFieldSpace().getColumn("Power").getValue(0));
    	assertEquals(88 * 0.7457, (Double) replayed.getFieldSpace().getColumn("Power").getValue(4), 1e-9);
    	assertTrue(power.getDerivations().get(0).toJson().contains("[HP] * 0.7457"));
    }
}
