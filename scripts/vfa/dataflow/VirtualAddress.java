package vfa.dataflow;

/**
 * Encoding of memory-object identifiers as tagged integers.
 *
 * <p>A virtual address keeps the object id in the low {@link #ID_BITS} bits
 * and sets the high byte to {@link #HIGH_TAG}, so it can never be mistaken for
 * a small numeric value.
 */
public final class VirtualAddress {
	/** The tag in the high byte of every virtual address. */
	public static final int HIGH_TAG = 0x7F000000;
	/** The bits that hold the tag. */
	public static final int MASK = 0xFF000000;
	/** The width of the object id field. */
	public static final int ID_BITS = 24;
	/** The largest encodable object id. */
	public static final int MAX_ID = (1 << ID_BITS) - 1;
	/** The reserved id of the null object. */
	public static final int NULL_ID = 0;

	private VirtualAddress() {
	}

	/**
	 * @return The virtual address of the given object.
	 */
	public static int encode(int id) {
		if (id < 0 || id > MAX_ID) {
			throw new IllegalArgumentException(String.format("Object id %d does not fit in %d bits", id, ID_BITS));
		}
		return HIGH_TAG | id;
	}

	/**
	 * @return Whether the given value is a virtual address.
	 */
	public static boolean isVirtual(int value) {
		return (value & MASK) == HIGH_TAG;
	}

	/**
	 * @return The object id of a virtual address.  Other values are returned
	 *         unchanged.
	 */
	public static int decode(int value) {
		if (isVirtual(value)) {
			return value & ~MASK;
		} else {
			return value;
		}
	}

	/**
	 * @return Whether the given value is the address of the null object.
	 */
	public static boolean isNull(int value) {
		return decode(value) == NULL_ID;
	}
}
