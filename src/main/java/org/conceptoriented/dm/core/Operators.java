package org.conceptoriented.dm.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functional form of the operators.
 *
 * Operators created here can be stored, passed around and composed. A composed pipeline is attached to its input as one child
 * with the concatenated derivations, and the intermediate snapshots are disposed.
 */
public class Operators {
	private static final Logger logger = LoggerFactory.getLogger(Operators.class);

	public static Operator select(RowPredicate predicate) {
		return select(predicate, FilteringMode.NORMAL);
	}
	public static Operator select(RowPredicate predicate, FilteringMode mode) {
		return input -> {
			checkMode(mode, "select");
			return input.select(predicate, mode);
		};
	}

	public static Operator project(List<String> patterns) {
		return project(patterns, FilteringMode.NORMAL);
	}
	public static Operator project(List<String> patterns, FilteringMode mode) {
		return input -> {
			checkMode(mode, "project");
			return input.project(patterns, mode);
		};
	}

	public static Operator groupBy(List<String> dimensionNames) {
		return groupBy(dimensionNames, Collections.<String, String>emptyMap());
	}
	public static Operator groupBy(List<String> dimensionNames, Map<String, String> reducers) {
		return input -> input.groupBy(dimensionNames, reducers);
	}

	public static Operator bin(String measureName, BinConfig config) {
		return input -> input.bin(measureName, config);
	}

	public static Operator calculateVariable(ColumnDefinition definition, List<String> dependencies, VariableResolver resolver) {
		return input -> input.calculateVariable(definition, dependencies, resolver);
	}
	public static Operator calculateVariable(ColumnDefinition definition, String formula) {
		return input -> input.calculateVariable(definition, formula);
	}

	private static void checkMode(FilteringMode mode, String operator) throws DmError {
		if(mode == FilteringMode.ALL) {
			logger.warn("Filtering mode ALL is not allowed in functional {}", operator);
			throw new DmError(DmErrorCode.INVALID_FILTERING_MODE, "Error applying " + operator + ". ", "Filtering mode ALL cannot be used in a composed operator. ");
		}
	}

	//
	// Composition
	//

	public static Operator compose(Operator... operators) {
		return compose(Arrays.asList(operators));
	}

	/**
	 * Operator which applies the operators in sequence and leaves one child of the input with all their derivations.
	 */
	public static Operator compose(List<Operator> operators) {
		return input -> {
			List<Snapshot> produced = new ArrayList<Snapshot>();
			List<Derivation> derivations = new ArrayList<Derivation>();

			Snapshot current = input;
			try {
				for(Operator operator : operators) {
					current = operator.apply(current);
					if(current == input || produced.contains(current)) continue; // Operator returned an existing snapshot
					produced.add(current);
					derivations.addAll(current.getDerivations());
				}
			}
			catch(DmError | RuntimeException e) {
				logger.debug("Composed operator failed on {}, disposing {} produced snapshots", input, produced.size());
				produced.forEach(Snapshot::dispose);
				throw e;
			}
			if(produced.isEmpty()) return input;

			Snapshot result = produced.get(produced.size()-1);
			for(int i=0; i<produced.size()-1; i++) {
				produced.get(i).dispose();
			}
			result.addParent(input, derivations);

			logger.debug("Composed {} operators into {} derivations on {}", operators.size(), derivations.size(), input);
			return result;
		};
	}
}
