/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.timewarp;

import java.util.List;

/**
 * A node of a parsed expression tree. Trees are built once by {@link ExpressionParser} and walked against the live
 * variables every time they are evaluated.
 *
 * @author WLD-PJ
 * @version 1.0
 * @since 1.0
 */
public interface Expression {
	/**
	 * Walks this node
	 *
	 * @param evaluator Supplies variables, builtins and randomness
	 * @return The scalar result
	 * @throws ExpressionException If the node cannot be evaluated
	 */
	Value evaluate (ExpressionEvaluator evaluator);

	/** Binary operators, lowest precedence first */
	static enum Operator {
		OR,
		AND,
		EQUAL,
		NOT_EQUAL,
		LESS,
		LESS_EQUAL,
		GREATER,
		GREATER_EQUAL,
		ADD,
		SUBTRACT,
		MULTIPLY,
		DIVIDE,
		MODULO,
		POWER
	}

	/** A number or string literal */
	final class Literal implements Expression {
		final Value value;

		Literal (Value value) {
			this.value = value;
		}

		public Value evaluate (ExpressionEvaluator evaluator) {
			return value;
		}
	}

	/** A variable reference, bare (<code>X</code>) or delimited (<code>*X*</code>) */
	final class Variable implements Expression {
		final String name;

		Variable (String name) {
			this.name = VariableStore.key (name);
		}

		public Value evaluate (ExpressionEvaluator evaluator) {
			Value value = evaluator.variables ().get (name);
			return value != null ? value : Value.ZERO;
		}
	}

	/** <code>NAME(args)</code>, an array element when NAME holds an array, otherwise a builtin function */
	final class Call implements Expression {
		final String name;
		final List<Expression> arguments;

		Call (String name, List<Expression> arguments) {
			this.name = VariableStore.key (name);
			this.arguments = arguments;
		}

		public Value evaluate (ExpressionEvaluator evaluator) {
			SparseArray array = evaluator.variables ().getArray (name);
			if (array != null) {
				int[] indices = new int[arguments.size ()];
				for (int i = 0; i < indices.length; ++i)
					indices[i] = (int) ExpressionEvaluator.number (arguments.get (i).evaluate (evaluator));

				Value element = array.get (indices);
				return element != null ? element : Value.ZERO;
			}

			return evaluator.callBuiltin (name, arguments);
		}
	}

	/** <code>-x</code>, <code>+x</code> and <code>NOT x</code> */
	final class Unary implements Expression {
		final boolean not;
		final boolean negate;
		final Expression operand;

		Unary (boolean not, boolean negate, Expression operand) {
			this.not = not;
			this.negate = negate;
			this.operand = operand;
		}

		public Value evaluate (ExpressionEvaluator evaluator) {
			Value value = operand.evaluate (evaluator);
			if (not)
				return Value.of (!value.isTrue ());

			double number = ExpressionEvaluator.number (value);
			return new Value (negate ? -number : number);
		}
	}

	/** Two operands joined by an {@link Operator} */
	final class Binary implements Expression {
		final Operator operator;
		final Expression left;
		final Expression right;

		Binary (Operator operator, Expression left, Expression right) {
			this.operator = operator;
			this.left = left;
			this.right = right;
		}

		public Value evaluate (ExpressionEvaluator evaluator) {
			Value a = left.evaluate (evaluator);

			// Logical operators short-circuit
			if (operator == Operator.AND)
				return Value.of (a.isTrue () && right.evaluate (evaluator).isTrue ());
			if (operator == Operator.OR)
				return Value.of (a.isTrue () || right.evaluate (evaluator).isTrue ());

			Value b = right.evaluate (evaluator);

			switch (operator) {
				case EQUAL:
					return Value.of (ExpressionEvaluator.compare (a, b) == 0);
				case NOT_EQUAL:
					return Value.of (ExpressionEvaluator.compare (a, b) != 0);
				case LESS:
					return Value.of (ExpressionEvaluator.compare (a, b) < 0);
				case LESS_EQUAL:
					return Value.of (ExpressionEvaluator.compare (a, b) <= 0);
				case GREATER:
					return Value.of (ExpressionEvaluator.compare (a, b) > 0);
				case GREATER_EQUAL:
					return Value.of (ExpressionEvaluator.compare (a, b) >= 0);
				case ADD:
					// A string on either side joins the textual forms
					if (a.isString () || b.isString ())
						return new Value (a.toText () + b.toText ());
					return new Value (a.toNumber () + b.toNumber ());
				case SUBTRACT:
					return new Value (ExpressionEvaluator.number (a) - ExpressionEvaluator.number (b));
				case MULTIPLY:
					return new Value (ExpressionEvaluator.number (a) * ExpressionEvaluator.number (b));
				case DIVIDE: {
					double divisor = ExpressionEvaluator.number (b);
					if (divisor == 0)
						throw ExpressionException.divisionByZero ();
					return new Value (ExpressionEvaluator.number (a) / divisor);
				}
				case MODULO: {
					double divisor = ExpressionEvaluator.number (b);
					if (divisor == 0)
						throw ExpressionException.divisionByZero ();
					double dividend = ExpressionEvaluator.number (a);
					return new Value (dividend - divisor * Math.floor (dividend / divisor));
				}
				case POWER:
					return new Value (Math.pow (ExpressionEvaluator.number (a), ExpressionEvaluator.number (b)));
				default:
					throw new ExpressionException ("Unsupported operator: " + operator);
			}
		}
	}
}
