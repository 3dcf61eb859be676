package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.objecthunter.exp4j.Expression;
import net.objecthunter.exp4j.ExpressionBuilder;
import net.objecthunter.exp4j.ValidationResult;

/**
 * Resolver defined by an arithmetic formula with field names in square brackets, for example, <code>2 * [HP] / [Weight]</code>.
 *
 * The formula is parsed once: every bracketed name becomes a dependency and is replaced by a native exp4j variable.
 * Null or non-numeric parameter values produce NaN.
 */
public class FormulaResolver implements VariableResolver {

	private static final Pattern FIELD_PATTERN = Pattern.compile("\\[(.*?)\\]", Pattern.DOTALL);

	private final String formula;
	public String getFormula() {
		return this.formula;
	}

	// Field names in the order of their first occurrence
	private final List<String> dependencies = new ArrayList<String>();
	public List<String> getDependencies() {
		return Collections.unmodifiableList(this.dependencies);
	}

	private final Expression expression;

	@Override
	public Object resolve(Object[] values, int row) {
		for(int i=0; i<values.length; i++) {
			Double value = Column.toDouble(values[i]);
			this.expression.setVariable(paramName(i), value != null ? value : Double.NaN);
		}
		try {
			return this.expression.evaluate();
		}
		catch(ArithmeticException e) { // Division by zero
			return Double.NaN;
		}
	}

	private static String paramName(int i) {
		return "__p__" + i;
	}

	// Replace all occurrences of field names by variable names
	private String transformFormula() {
		StringBuffer buf = new StringBuffer();
		Matcher matcher = FIELD_PATTERN.matcher(this.formula);
		while(matcher.find()) {
			String name = matcher.group(1).trim();
			int paramNo = this.dependencies.indexOf(name);
			if(paramNo < 0) {
				this.dependencies.add(name);
				paramNo = this.dependencies.size() - 1;
			}
			matcher.appendReplacement(buf, paramName(paramNo));
		}
		matcher.appendTail(buf);
		return buf.toString();
	}

	@Override
	public String toString() {
		return this.formula;
	}

	public FormulaResolver(String formula) throws DmError {
		if(formula == null || formula.trim().isEmpty()) {
			throw new DmError(DmErrorCode.FORMULA_ERROR, "Formula error. ", "Formula is empty. ");
		}
		this.formula = formula;

		String transformedFormula = this.transformFormula();

		Set<String> vars = new HashSet<String>();
		for(int i=0; i<this.dependencies.size(); i++) {
			vars.add(paramName(i));
		}

		Expression exp;
		try {
			exp = new ExpressionBuilder(transformedFormula).variables(vars).build();
		}
		catch(IllegalArgumentException e) {
			throw new DmError(DmErrorCode.FORMULA_ERROR, "Formula error. ", e.getMessage());
		}

		// Validation requires variables to be set
		for(String var : vars) {
			exp.setVariable(var, 1.0);
		}
		ValidationResult res = exp.validate();
		if(!res.isValid()) {
			throw new DmError(DmErrorCode.FORMULA_ERROR, "Formula error. ", res.getErrors() != null && res.getErrors().size() > 0 ? res.getErrors().get(0) : "");
		}

		this.expression = exp;
	}
}
