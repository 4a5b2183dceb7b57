package vfa.dataflow;

import java.util.Collection;

/**
 * A lattice with join, meet and a containment order.
 */
public interface Lattice<T extends Lattice<T>> {
	/**
	 * @return A new instance with the same value as this.
	 */
	T copy();

	/**
	 * Calculate the join (least upper bound) of this and other, updating
	 * this instance in-place.
	 *
	 * @return Whether this value changed.
	 */
	boolean joinInPlace(T other);

	/**
	 * Calculate the join (least upper bound) of this and many others,
	 * updating this instance in-place.
	 *
	 * @return Whether this value changed.
	 */
	default boolean joinInPlace(Collection<T> others) {
		var ret = false;
		for (var other : others) {
			ret |= joinInPlace(other);
		}
		return ret;
	}

	/**
	 * @return The join of this and other.
	 */
	default T join(T other) {
		var ret = copy();
		ret.joinInPlace(other);
		return ret;
	}

	/**
	 * @return The join of this and many others.
	 */
	default T join(Collection<T> others) {
		var ret = copy();
		ret.joinInPlace(others);
		return ret;
	}

	/**
	 * Calculate the meet (greatest lower bound) of this and other, updating
	 * this instance in-place.
	 *
	 * @return Whether this value changed.
	 */
	boolean meetInPlace(T other);

	/**
	 * @return The meet of this and other.
	 */
	default T meet(T other) {
		var ret = copy();
		ret.meetInPlace(other);
		return ret;
	}

	/**
	 * @return Whether this value is above other in the lattice (this ⊒ other).
	 */
	boolean contains(T other);
}
