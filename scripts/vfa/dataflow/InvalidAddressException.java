package vfa.dataflow;

/**
 * Thrown when a load or store goes through a value that is not a virtual
 * address.
 */
public class InvalidAddressException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final int address;

	public InvalidAddressException(int address) {
		super(String.format("0x%x is not a virtual address", address));
		this.address = address;
	}

	/**
	 * @return The rejected address.
	 */
	public int getAddress() {
		return this.address;
	}
}
