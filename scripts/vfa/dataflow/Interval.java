package vfa.dataflow;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * The abstract domain for integer ranges.
 */
public final class Interval implements WideningLattice<Interval> {
	// Represents the closed range
	//
	//     [lower, upper]
	//
	// over ℤ ∪ {-∞, +∞}.  A lower bound of Long.MIN_VALUE stands for -∞ and
	// an upper bound of Long.MAX_VALUE stands for +∞, so min/max on the raw
	// bounds already treat unbounded sides correctly.
	//
	// Any pair with lower > upper is the empty set (bottom).  The canonical
	// bottom is [1, 0].
	private static final long NEG_INF = Long.MIN_VALUE;
	private static final long POS_INF = Long.MAX_VALUE;

	private long lower;
	private long upper;

	private Interval(long lower, long upper) {
		this.lower = lower;
		this.upper = upper;
	}

	/**
	 * @return The range [lower, upper].  A pair with lower > upper is bottom.
	 */
	public static Interval of(long lower, long upper) {
		return new Interval(lower, upper);
	}

	/**
	 * @return The range between two optional bounds, where an empty bound is
	 *         unbounded.
	 */
	public static Interval of(OptionalLong lower, OptionalLong upper) {
		return new Interval(lower.orElse(NEG_INF), upper.orElse(POS_INF));
	}

	/**
	 * @return The range [value, value].
	 */
	public static Interval constant(long value) {
		return new Interval(value, value);
	}

	/**
	 * @return The range [lower, +∞].
	 */
	public static Interval atLeast(long lower) {
		return new Interval(lower, POS_INF);
	}

	/**
	 * @return The range [-∞, upper].
	 */
	public static Interval atMost(long upper) {
		return new Interval(NEG_INF, upper);
	}

	/**
	 * @return The top element of this lattice.
	 */
	public static Interval top() {
		return new Interval(NEG_INF, POS_INF);
	}

	/**
	 * @return Whether this is the top lattice element.
	 */
	public boolean isTop() {
		return this.lower == NEG_INF && this.upper == POS_INF;
	}

	/**
	 * @return The bottom element of this lattice.
	 */
	public static Interval bottom() {
		return new Interval(1, 0);
	}

	/**
	 * @return Whether this is the bottom lattice element.
	 */
	public boolean isBottom() {
		return this.lower > this.upper;
	}

	/**
	 * Set this range to top.
	 */
	public void setToTop() {
		this.lower = NEG_INF;
		this.upper = POS_INF;
	}

	/**
	 * Set this range to bottom.
	 */
	public void setToBottom() {
		this.lower = 1;
		this.upper = 0;
	}

	/**
	 * @return The lower bound, or empty if unbounded.
	 */
	public OptionalLong getLower() {
		if (this.lower == NEG_INF) {
			return OptionalLong.empty();
		} else {
			return OptionalLong.of(this.lower);
		}
	}

	/**
	 * @return The upper bound, or empty if unbounded.
	 */
	public OptionalLong getUpper() {
		if (this.upper == POS_INF) {
			return OptionalLong.empty();
		} else {
			return OptionalLong.of(this.upper);
		}
	}

	/**
	 * @return Whether this range holds exactly one number.
	 */
	public boolean isConstant() {
		return this.lower == this.upper
			&& this.lower != NEG_INF
			&& this.upper != POS_INF;
	}

	/**
	 * @return The value of this range, if it is constant.
	 */
	public OptionalLong getIfConstant() {
		if (isConstant()) {
			return OptionalLong.of(this.lower);
		} else {
			return OptionalLong.empty();
		}
	}

	/**
	 * @return Whether this range includes the given number.
	 */
	public boolean contains(long value) {
		return this.lower <= value && value <= this.upper;
	}

	@Override
	public boolean contains(Interval other) {
		if (other.isBottom()) {
			return true;
		} else if (isBottom()) {
			return false;
		}

		return this.lower <= other.lower && this.upper >= other.upper;
	}

	@Override
	public Interval copy() {
		return new Interval(this.lower, this.upper);
	}

	/**
	 * Overwrite this range with another one.
	 *
	 * @return Whether this value changed.
	 */
	private boolean assign(Interval other) {
		var same = equals(other);
		this.lower = other.lower;
		this.upper = other.upper;
		return !same;
	}

	@Override
	public boolean joinInPlace(Interval other) {
		return assign(join(other));
	}

	@Override
	public Interval join(Interval other) {
		if (isBottom()) {
			return other.copy();
		} else if (other.isBottom()) {
			return copy();
		}

		return new Interval(Math.min(this.lower, other.lower), Math.max(this.upper, other.upper));
	}

	@Override
	public boolean meetInPlace(Interval other) {
		return assign(meet(other));
	}

	@Override
	public Interval meet(Interval other) {
		if (isBottom() || other.isBottom()) {
			return bottom();
		}

		var lower = Math.max(this.lower, other.lower);
		var upper = Math.min(this.upper, other.upper);
		if (lower > upper) {
			return bottom();
		}
		return new Interval(lower, upper);
	}

	/**
	 * Standard interval widening.  A bound that moved outward jumps straight to
	 * infinity, so each side can widen at most once.
	 */
	@Override
	public Interval widen(Interval other) {
		if (isBottom()) {
			return other.copy();
		} else if (other.isBottom()) {
			return copy();
		}

		var lower = other.lower < this.lower ? NEG_INF : this.lower;
		var upper = other.upper > this.upper ? POS_INF : this.upper;
		return new Interval(lower, upper);
	}

	/**
	 * Narrowing only refines infinite bounds.  Finite bounds are kept even when
	 * other is tighter.
	 */
	@Override
	public Interval narrow(Interval other) {
		if (isBottom() || other.isBottom()) {
			return bottom();
		}

		var lower = this.lower == NEG_INF ? other.lower : this.lower;
		var upper = this.upper == POS_INF ? other.upper : this.upper;
		if (lower > upper) {
			return bottom();
		}
		return new Interval(lower, upper);
	}

	@Override
	public int hashCode() {
		if (isBottom()) {
			return 0;
		}
		return Objects.hash(this.lower, this.upper);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Interval)) {
			return false;
		}

		var other = (Interval) obj;
		if (isBottom() || other.isBottom()) {
			return isBottom() && other.isBottom();
		}
		return this.lower == other.lower
			&& this.upper == other.upper;
	}

	@Override
	public String toString() {
		if (isBottom()) {
			return "⊥";
		}

		var lower = this.lower == NEG_INF ? "-∞" : Long.toString(this.lower);
		var upper = this.upper == POS_INF ? "+∞" : Long.toString(this.upper);
		return String.format("[%s, %s]", lower, upper);
	}

	private static final boolean CHECK = Interval.class.desiredAssertionStatus();
	private static final long CHECK_MIN = -3;
	private static final long CHECK_MAX = 3;

	/**
	 * All ranges with bounds in [CHECK_MIN, CHECK_MAX], half-infinite and
	 * infinite ranges included.
	 */
	private static Interval[] checkValues() {
		var span = (int) (CHECK_MAX - CHECK_MIN + 2);
		var ret = new Interval[span * span];
		var i = 0;
		for (long l = CHECK_MIN - 1; l <= CHECK_MAX; ++l) {
			for (long u = CHECK_MIN; u <= CHECK_MAX + 1; ++u) {
				var lower = l < CHECK_MIN ? NEG_INF : l;
				var upper = u > CHECK_MAX ? POS_INF : u;
				ret[i++] = new Interval(lower, upper);
			}
		}
		return ret;
	}

	static {
		if (CHECK) {
			var values = checkValues();
			for (var a : values) {
				for (var b : values) {
					var join = a.join(b);
					assert join.contains(a) && join.contains(b);
					assert join.equals(b.join(a));

					var meet = a.meet(b);
					assert a.contains(meet) && b.contains(meet);
					assert meet.equals(b.meet(a));

					var widened = a.widen(b);
					assert widened.contains(join);
					assert widened.widen(b).equals(widened);

					var narrowed = a.narrow(b);
					assert a.contains(narrowed);
				}
			}

			assert top().narrow(of(1, 5)).equals(of(1, 5));
			assert of(1, 10).narrow(of(2, 5)).equals(of(1, 10));
			assert of(1, 5).widen(of(0, 10)).isTop();
			assert of(10, 5).isBottom();
		}
	}
}
