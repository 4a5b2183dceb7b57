package vfa.dataflow;

/**
 * Structural queries answered by the IR/object model.
 *
 * @param <G>
 *            The IR's handle for a structural (field or element) access.
 */
public interface ObjectModel<G> {
	/**
	 * @return The element index selected by a structural access.
	 */
	Interval getElementIndex(G gep);

	/**
	 * @return The byte offset selected by a structural access.
	 */
	Interval getByteOffset(G gep);

	/**
	 * @return The size in bytes of a stack or heap allocation.
	 */
	long getAllocationByteSize(int objId);
}
