package org.javai.mathast;

import org.javai.mathast.ast.Span;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.Operator;

/**
 * An entry on the processor's operator stack.
 * <p>
 * Only {@link Pending} entries are reduced by precedence or draining; the two
 * group markers bound those reductions and remember how deep the node stack
 * was when the group opened, so a group never consumes nodes from outside it.
 */
sealed interface StackEntry {

	/**
	 * A unary or binary operator waiting for its operands.
	 */
	record Pending(Operator operator, Span span) implements StackEntry {
	}

	/**
	 * An opening parenthesis.
	 */
	record OpenParens(Span span, int nodeDepth) implements StackEntry {
	}

	/**
	 * The start of a function's argument list, carrying the function itself.
	 *
	 * @param operator the function being called
	 * @param span the function symbol and its opening parenthesis
	 * @param nodeDepth node stack size when the call opened
	 * @param remainingOperands arguments still expected, counting the one being read
	 */
	record FunctionCall(FunctionOperator operator, Span span, int nodeDepth, int remainingOperands)
			implements StackEntry {

		int completedOperands() {
			return operator.arity() - remainingOperands;
		}

		FunctionCall withOperandCompleted() {
			return new FunctionCall(operator, span, nodeDepth, remainingOperands - 1);
		}
	}
}
