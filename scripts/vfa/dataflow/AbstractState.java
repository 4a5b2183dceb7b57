package vfa.dataflow;

import vfa.Tty;
import vfa.util.Log;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;

/**
 * The abstract state at a program point: the values of variables, and the
 * values stored in memory objects.
 *
 * <p>A missing key means different things to different operations.  Reads
 * ({@link #get}, {@link #load}) treat it as top, {@link #joinInPlace} keeps
 * the value from whichever side has one, and {@link #meetInPlace} treats it
 * as bottom and drops the key.
 *
 * <p>A state owns every value in it.  Values are copied on the way in, so two
 * states never share a mutable range or address set.
 */
public final class AbstractState implements WideningLattice<AbstractState> {
	private final Map<Integer, AbstractValue> varStore;
	private final Map<Integer, AbstractValue> objStore;

	/**
	 * Create an empty state.
	 */
	public AbstractState() {
		this(new HashMap<>(), new HashMap<>());
	}

	private AbstractState(Map<Integer, AbstractValue> varStore, Map<Integer, AbstractValue> objStore) {
		this.varStore = varStore;
		this.objStore = objStore;
	}

	/**
	 * @return A state holding copies of the given variable and object values.
	 */
	public static AbstractState of(Map<Integer, AbstractValue> varStore, Map<Integer, AbstractValue> objStore) {
		return new AbstractState(deepCopy(varStore), deepCopy(objStore));
	}

	private static Map<Integer, AbstractValue> deepCopy(Map<Integer, AbstractValue> map) {
		var ret = new HashMap<Integer, AbstractValue>();
		map.forEach((k, v) -> ret.put(k, v.copy()));
		return ret;
	}

	/**
	 * @return The value of a variable, or top if it has none yet.
	 */
	public AbstractValue get(int varId) {
		var value = this.varStore.get(varId);
		if (value == null) {
			return AbstractValue.createInterval();
		}
		return value;
	}

	/**
	 * Set the value of a variable.
	 */
	public void put(int varId, AbstractValue value) {
		this.varStore.put(varId, value.copy());
	}

	/**
	 * @return Whether the variable holds a range.
	 */
	public boolean hasIntervalVar(int varId) {
		var value = this.varStore.get(varId);
		return value != null && value.isInterval();
	}

	/**
	 * @return Whether the variable holds addresses.
	 */
	public boolean hasAddressVar(int varId) {
		var value = this.varStore.get(varId);
		return value != null && value.isAddress();
	}

	/**
	 * @return Whether the memory object holds a range.
	 */
	public boolean hasIntervalObj(int objId) {
		var value = this.objStore.get(objId);
		return value != null && value.isInterval();
	}

	/**
	 * @return Whether the memory object holds addresses.
	 */
	public boolean hasAddressObj(int objId) {
		var value = this.objStore.get(objId);
		return value != null && value.isAddress();
	}

	/**
	 * @return The variable store.
	 */
	public Map<Integer, AbstractValue> getVarStore() {
		return Collections.unmodifiableMap(this.varStore);
	}

	/**
	 * @return The object store.
	 */
	public Map<Integer, AbstractValue> getObjStore() {
		return Collections.unmodifiableMap(this.objStore);
	}

	private static int checkAddress(int addr) {
		if (!VirtualAddress.isVirtual(addr)) {
			throw new InvalidAddressException(addr);
		}
		return VirtualAddress.decode(addr);
	}

	/**
	 * Write a value to the object at a virtual address.  Writes through the
	 * null object are dropped.
	 *
	 * @throws InvalidAddressException if addr is not a virtual address.
	 */
	public void store(int addr, AbstractValue value) {
		var objId = checkAddress(addr);
		if (objId == VirtualAddress.NULL_ID) {
			Log.debug("Dropping store of %s through the null object", value);
			return;
		}
		this.objStore.put(objId, value.copy());
	}

	/**
	 * @return The value of the object at a virtual address, or top if it has
	 *         none yet.
	 * @throws InvalidAddressException if addr is not a virtual address.
	 */
	public AbstractValue load(int addr) {
		var value = this.objStore.get(checkAddress(addr));
		if (value == null) {
			return AbstractValue.createInterval();
		}
		return value;
	}

	/**
	 * Remove every variable and object.
	 */
	public void clear() {
		this.varStore.clear();
		this.objStore.clear();
	}

	/**
	 * @return The addresses reached by offsetting the pointer variable.
	 *         Non-constant offsets, and offsets that move an address out of
	 *         the int range, return the base addresses unchanged.
	 */
	public AddressSet getGepObjAddrs(int pointer, Interval offset) {
		var value = this.varStore.get(pointer);
		if (value == null || !value.isAddress()) {
			return AddressSet.empty();
		}

		var base = value.getAddress();
		var constant = offset.getIfConstant();
		if (!constant.isPresent()) {
			Log.trace("Offset %s of variable %d is not constant", offset, pointer);
			return base.copy();
		}

		var delta = constant.getAsLong();
		var ret = AddressSet.empty();
		for (var addr : base.get()) {
			if (delta > (long) Integer.MAX_VALUE - addr || delta < (long) Integer.MIN_VALUE - addr) {
				Log.trace("Offset %d of variable %d overflows address 0x%x", delta, pointer, addr);
				return base.copy();
			}
			ret.add((int) (addr + delta));
		}
		return ret;
	}

	/**
	 * @return The addresses reached by a structural access through the pointer
	 *         variable.
	 */
	public <G> AddressSet getGepObjAddrs(int pointer, ObjectModel<G> model, G gep) {
		return getGepObjAddrs(pointer, model.getElementIndex(gep));
	}

	/**
	 * @return A state with only the given variables.  Objects are not kept.
	 */
	public AbstractState sliceState(Collection<Integer> varIds) {
		var ret = new AbstractState();
		for (var varId : varIds) {
			var value = this.varStore.get(varId);
			if (value != null) {
				ret.varStore.put(varId, value.copy());
			}
		}
		return ret;
	}

	private void forEachInterval(Consumer<Interval> action) {
		for (var value : this.varStore.values()) {
			if (value.isInterval()) {
				action.accept(value.getInterval());
			}
		}
		for (var value : this.objStore.values()) {
			if (value.isInterval()) {
				action.accept(value.getInterval());
			}
		}
	}

	/**
	 * @return A copy of this state with every range set to bottom.  Address
	 *         sets are kept as they are.
	 */
	public AbstractState bottom() {
		var ret = copy();
		ret.forEachInterval(Interval::setToBottom);
		return ret;
	}

	/**
	 * @return A copy of this state with every range set to top.  Address sets
	 *         are kept as they are.
	 */
	public AbstractState top() {
		var ret = copy();
		ret.forEachInterval(Interval::setToTop);
		return ret;
	}

	@Override
	public AbstractState copy() {
		return new AbstractState(deepCopy(this.varStore), deepCopy(this.objStore));
	}

	/**
	 * Replace the contents of a store.
	 *
	 * @return Whether the store changed.
	 */
	private static boolean replace(Map<Integer, AbstractValue> store, Map<Integer, AbstractValue> contents) {
		if (store.equals(contents)) {
			return false;
		}
		store.clear();
		store.putAll(contents);
		return true;
	}

	private static Map<Integer, AbstractValue> joinStore(Map<Integer, AbstractValue> ours, Map<Integer, AbstractValue> theirs) {
		var keys = ImmutableSet.copyOf(Sets.union(ours.keySet(), theirs.keySet()));
		var result = new HashMap<Integer, AbstractValue>();
		for (var key : keys) {
			var mine = ours.get(key);
			var other = theirs.get(key);
			if (mine == null) {
				result.put(key, other.copy());
			} else if (other == null) {
				result.put(key, mine);
			} else {
				result.put(key, mine.join(other));
			}
		}
		return result;
	}

	/**
	 * Join another state into this one.  A key known to only one side keeps
	 * that side's value.
	 *
	 * @throws TypeMismatchException if a key holds different kinds of values.
	 */
	@Override
	public boolean joinInPlace(AbstractState other) {
		// Both stores are merged before either is replaced
		var vars = joinStore(this.varStore, other.varStore);
		var objs = joinStore(this.objStore, other.objStore);
		return replace(this.varStore, vars) | replace(this.objStore, objs);
	}

	private static Map<Integer, AbstractValue> meetStore(Map<Integer, AbstractValue> ours, Map<Integer, AbstractValue> theirs) {
		var keys = ImmutableSet.copyOf(ours.keySet());
		var result = new HashMap<Integer, AbstractValue>();
		for (var key : keys) {
			var other = theirs.get(key);
			if (other == null) {
				continue;
			}

			var met = ours.get(key).meet(other);
			if (!met.isBottom()) {
				result.put(key, met);
			}
		}
		return result;
	}

	/**
	 * Meet another state into this one.  Keys missing from other, or whose
	 * meet is empty, are removed.
	 *
	 * @throws TypeMismatchException if a key holds different kinds of values.
	 */
	@Override
	public boolean meetInPlace(AbstractState other) {
		var vars = meetStore(this.varStore, other.varStore);
		var objs = meetStore(this.objStore, other.objStore);
		return replace(this.varStore, vars) | replace(this.objStore, objs);
	}

	private static Map<Integer, AbstractValue> mergeStore(Map<Integer, AbstractValue> ours, Map<Integer, AbstractValue> theirs, BinaryOperator<AbstractValue> op) {
		var result = new HashMap<Integer, AbstractValue>();
		for (var key : Sets.union(ours.keySet(), theirs.keySet())) {
			var mine = ours.get(key);
			var other = theirs.get(key);
			if (mine == null) {
				result.put(key, other.copy());
			} else if (other == null) {
				result.put(key, mine.copy());
			} else {
				result.put(key, op.apply(mine, other));
			}
		}
		return result;
	}

	private static AbstractValue widenValue(AbstractValue mine, AbstractValue other) {
		mine.checkKind("widen", other);
		return mine.match(
			i -> AbstractValue.createInterval(i.widen(other.getInterval())),
			a -> AbstractValue.createAddress(a.join(other.getAddress())));
	}

	private static AbstractValue narrowValue(AbstractValue mine, AbstractValue other) {
		mine.checkKind("narrow", other);
		return mine.match(
			i -> AbstractValue.createInterval(i.narrow(other.getInterval())),
			a -> AbstractValue.createAddress(a.meet(other.getAddress())));
	}

	/**
	 * Widen ranges key by key.  Address sets have finite height, so they are
	 * joined instead.
	 *
	 * @throws TypeMismatchException if a key holds different kinds of values.
	 */
	@Override
	public AbstractState widen(AbstractState other) {
		var ret = new AbstractState(
			mergeStore(this.varStore, other.varStore, AbstractState::widenValue),
			mergeStore(this.objStore, other.objStore, AbstractState::widenValue));
		Log.trace("Widened to %d variables and %d objects", ret.varStore.size(), ret.objStore.size());
		return ret;
	}

	/**
	 * Narrow ranges key by key.  Address sets are met instead.
	 *
	 * @throws TypeMismatchException if a key holds different kinds of values.
	 */
	@Override
	public AbstractState narrow(AbstractState other) {
		var ret = new AbstractState(
			mergeStore(this.varStore, other.varStore, AbstractState::narrowValue),
			mergeStore(this.objStore, other.objStore, AbstractState::narrowValue));
		Log.trace("Narrowed to %d variables and %d objects", ret.varStore.size(), ret.objStore.size());
		return ret;
	}

	private static boolean storeContains(Map<Integer, AbstractValue> ours, Map<Integer, AbstractValue> theirs) {
		for (var entry : theirs.entrySet()) {
			var mine = ours.get(entry.getKey());
			var other = entry.getValue();
			if (mine == null || mine.getKind() != other.getKind() || !mine.contains(other)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return Whether every key of other is bound here to a value containing
	 *         other's value.
	 */
	@Override
	public boolean contains(AbstractState other) {
		return storeContains(this.varStore, other.varStore)
			&& storeContains(this.objStore, other.objStore);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AbstractState)) {
			return false;
		}

		var other = (AbstractState) obj;
		return this.varStore.equals(other.varStore)
			&& this.objStore.equals(other.objStore);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.varStore, this.objStore);
	}

	private static String objectLabel(int objId) {
		if (objId < 0 || objId > VirtualAddress.MAX_ID) {
			return Integer.toString(objId);
		}
		return String.format("%d (0x%x)", objId, VirtualAddress.encode(objId));
	}

	/**
	 * Print this state to the terminal.
	 */
	public void print() {
		toString().lines().forEach(line -> {
			if (line.startsWith(" ")) {
				Tty.print("%s\n", line);
			} else {
				Tty.print("<b>%s</b>\n", line);
			}
		});
	}

	@Override
	public String toString() {
		var builder = new StringBuilder();
		builder.append("Variable to Abstract Value Map:\n");
		ImmutableSortedMap.copyOf(this.varStore)
			.forEach((k, v) -> builder.append(String.format("  %d: %s\n", k, v)));
		builder.append("Address to Abstract Value Map:\n");
		ImmutableSortedMap.copyOf(this.objStore)
			.forEach((k, v) -> builder.append(String.format("  %s: %s\n", objectLabel(k), v)));
		return builder.toString();
	}
}
