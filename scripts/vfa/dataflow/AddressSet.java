package vfa.dataflow;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The powerset lattice of memory addresses.
 *
 * <p>The universe of objects is fixed before analysis starts, so this lattice
 * has no infinite chains and needs no widening.
 */
public final class AddressSet implements Lattice<AddressSet> {
	private final Set<Integer> addrs;

	private AddressSet(Set<Integer> addrs) {
		this.addrs = addrs;
	}

	/**
	 * @return The empty (bottom) lattice element.
	 */
	public static AddressSet empty() {
		return new AddressSet(new HashSet<>());
	}

	/**
	 * @return A set of the given addresses.
	 */
	public static AddressSet of(Collection<Integer> addrs) {
		return new AddressSet(new HashSet<>(addrs));
	}

	/**
	 * @return A set of the given addresses.
	 */
	public static AddressSet of(int... addrs) {
		var ret = empty();
		for (var addr : addrs) {
			ret.add(addr);
		}
		return ret;
	}

	/**
	 * @return Whether this set is empty.
	 */
	public boolean isEmpty() {
		return this.addrs.isEmpty();
	}

	/**
	 * @return The number of addresses.
	 */
	public int size() {
		return this.addrs.size();
	}

	/**
	 * @return The set of addresses.
	 */
	public Set<Integer> get() {
		return Collections.unmodifiableSet(this.addrs);
	}

	/**
	 * @return Whether the given address is in this set.
	 */
	public boolean containsAddress(int addr) {
		return this.addrs.contains(addr);
	}

	/**
	 * Add an address to this set.
	 *
	 * @return Whether this set changed.
	 */
	public boolean add(int addr) {
		return this.addrs.add(addr);
	}

	@Override
	public AddressSet copy() {
		return new AddressSet(new HashSet<>(this.addrs));
	}

	@Override
	public boolean joinInPlace(AddressSet other) {
		return this.addrs.addAll(other.addrs);
	}

	@Override
	public boolean meetInPlace(AddressSet other) {
		return this.addrs.retainAll(other.addrs);
	}

	@Override
	public boolean contains(AddressSet other) {
		return this.addrs.containsAll(other.addrs);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AddressSet)) {
			return false;
		}

		var other = (AddressSet) obj;
		return this.addrs.equals(other.addrs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.addrs);
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "∅";
		}

		return ImmutableSortedSet.copyOf(this.addrs)
			.stream()
			.map(addr -> String.format("0x%x", addr))
			.collect(Collectors.joining(", ", "{", "}"));
	}
}
