package vfa.dataflow;

/**
 * Thrown when an operation combines abstract values of different kinds.
 */
public class TypeMismatchException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final AbstractValue.Kind expected;
	private final AbstractValue.Kind actual;

	public TypeMismatchException(String operation, AbstractValue.Kind expected, AbstractValue.Kind actual) {
		super(String.format("Cannot %s %s with %s", operation, expected, actual));
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * @return The kind of the receiver.
	 */
	public AbstractValue.Kind getExpected() {
		return this.expected;
	}

	/**
	 * @return The kind of the offending operand.
	 */
	public AbstractValue.Kind getActual() {
		return this.actual;
	}
}
