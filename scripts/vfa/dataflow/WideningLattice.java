package vfa.dataflow;

/**
 * A lattice with widening and narrowing operators, for domains with infinite
 * ascending chains.
 */
public interface WideningLattice<T extends WideningLattice<T>> extends Lattice<T> {
	/**
	 * @return The widening of this by other (this ∇ other).
	 */
	T widen(T other);

	/**
	 * @return The narrowing of this by other (this ∆ other).
	 */
	T narrow(T other);
}
