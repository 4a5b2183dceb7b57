package vfa.dataflow;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

/**
 * The abstract value of a variable or memory object: either an integer range
 * or a set of addresses, never both.
 */
public final class AbstractValue implements Lattice<AbstractValue> {
	/**
	 * The active variant of an abstract value.
	 */
	public enum Kind {
		INTERVAL,
		ADDRESS,
	}

	private final Kind kind;
	/** Non-null iff kind == INTERVAL. */
	private final Interval interval;
	/** Non-null iff kind == ADDRESS. */
	private final AddressSet address;

	private AbstractValue(Interval interval) {
		this.kind = Kind.INTERVAL;
		this.interval = Objects.requireNonNull(interval);
		this.address = null;
	}

	private AbstractValue(AddressSet address) {
		this.kind = Kind.ADDRESS;
		this.interval = null;
		this.address = Objects.requireNonNull(address);
	}

	/**
	 * @return An interval value [lower, upper].
	 */
	public static AbstractValue createInterval(long lower, long upper) {
		return new AbstractValue(Interval.of(lower, upper));
	}

	/**
	 * @return An interval value holding a copy of the given range.
	 */
	public static AbstractValue createInterval(Interval interval) {
		return new AbstractValue(interval.copy());
	}

	/**
	 * @return The top interval value.
	 */
	public static AbstractValue createInterval() {
		return new AbstractValue(Interval.top());
	}

	/**
	 * @return An address value holding the given addresses.
	 */
	public static AbstractValue createAddress(Collection<Integer> addrs) {
		return new AbstractValue(AddressSet.of(addrs));
	}

	/**
	 * @return An address value holding a copy of the given set.
	 */
	public static AbstractValue createAddress(AddressSet addrs) {
		return new AbstractValue(addrs.copy());
	}

	/**
	 * @return An empty address value.
	 */
	public static AbstractValue createAddress() {
		return new AbstractValue(AddressSet.empty());
	}

	/**
	 * @return The active variant.
	 */
	public Kind getKind() {
		return this.kind;
	}

	/**
	 * @return Whether this is an interval value.
	 */
	public boolean isInterval() {
		return this.kind == Kind.INTERVAL;
	}

	/**
	 * @return Whether this is an address value.
	 */
	public boolean isAddress() {
		return this.kind == Kind.ADDRESS;
	}

	/**
	 * @return The wrapped range.
	 * @throws TypeMismatchException if this is an address value.
	 */
	public Interval getInterval() {
		if (!isInterval()) {
			throw new TypeMismatchException("read", Kind.INTERVAL, this.kind);
		}
		return this.interval;
	}

	/**
	 * @return The wrapped address set.
	 * @throws TypeMismatchException if this is an interval value.
	 */
	public AddressSet getAddress() {
		if (!isAddress()) {
			throw new TypeMismatchException("read", Kind.ADDRESS, this.kind);
		}
		return this.address;
	}

	/**
	 * @return Whether the wrapped range is bottom or the wrapped set is empty.
	 */
	public boolean isBottom() {
		return match(Interval::isBottom, AddressSet::isEmpty);
	}

	/**
	 * Apply one of two functions depending on the active variant.
	 */
	public <R> R match(Function<? super Interval, ? extends R> ifInterval, Function<? super AddressSet, ? extends R> ifAddress) {
		switch (this.kind) {
			case INTERVAL:
				return ifInterval.apply(this.interval);
			case ADDRESS:
				return ifAddress.apply(this.address);
			default:
				throw new IllegalStateException(this.kind.toString());
		}
	}

	/**
	 * @throws TypeMismatchException unless other has the same kind.
	 */
	void checkKind(String operation, AbstractValue other) {
		if (this.kind != other.kind) {
			throw new TypeMismatchException(operation, this.kind, other.kind);
		}
	}

	@Override
	public AbstractValue copy() {
		if (isInterval()) {
			return createInterval(this.interval);
		} else {
			return createAddress(this.address);
		}
	}

	@Override
	public boolean joinInPlace(AbstractValue other) {
		checkKind("join", other);
		return match(
			i -> i.joinInPlace(other.interval),
			a -> a.joinInPlace(other.address));
	}

	@Override
	public boolean meetInPlace(AbstractValue other) {
		checkKind("meet", other);
		return match(
			i -> i.meetInPlace(other.interval),
			a -> a.meetInPlace(other.address));
	}

	@Override
	public boolean contains(AbstractValue other) {
		checkKind("compare", other);
		return match(
			i -> i.contains(other.interval),
			a -> a.contains(other.address));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AbstractValue)) {
			return false;
		}

		var other = (AbstractValue) obj;
		return this.kind == other.kind
			&& Objects.equals(this.interval, other.interval)
			&& Objects.equals(this.address, other.address);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.kind, this.interval, this.address);
	}

	@Override
	public String toString() {
		return match(Interval::toString, AddressSet::toString);
	}
}
