package vfa.dataflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link AbstractValue}.
 */
@RunWith(JUnit4.class)
public class AbstractValueTest {
	@Test
	public void createInterval() {
		var value = AbstractValue.createInterval(1, 5);
		assertThat(value.isInterval()).isTrue();
		assertThat(value.isAddress()).isFalse();
		assertThat(value.getKind()).isEqualTo(AbstractValue.Kind.INTERVAL);
		assertThat(value.getInterval()).isEqualTo(Interval.of(1, 5));
		assertThat(AbstractValue.createInterval().getInterval().isTop()).isTrue();
	}

	@Test
	public void createAddress() {
		var value = AbstractValue.createAddress(List.of(1, 2));
		assertThat(value.isAddress()).isTrue();
		assertThat(value.isInterval()).isFalse();
		assertThat(value.getAddress().get()).containsExactly(1, 2);
		assertThat(AbstractValue.createAddress().getAddress().isEmpty()).isTrue();
	}

	@Test
	public void wrongVariantAccessThrows() {
		var interval = AbstractValue.createInterval(1, 5);
		var e = assertThrows(TypeMismatchException.class, interval::getAddress);
		assertThat(e.getExpected()).isEqualTo(AbstractValue.Kind.ADDRESS);
		assertThat(e.getActual()).isEqualTo(AbstractValue.Kind.INTERVAL);

		var address = AbstractValue.createAddress();
		assertThrows(TypeMismatchException.class, address::getInterval);
	}

	@Test
	public void joinSameKind() {
		var intervals = AbstractValue.createInterval(1, 5).join(AbstractValue.createInterval(3, 10));
		assertThat(intervals.getInterval()).isEqualTo(Interval.of(1, 10));

		var addrs = AbstractValue.createAddress(List.of(1, 2)).join(AbstractValue.createAddress(List.of(2, 3)));
		assertThat(addrs.getAddress().get()).containsExactly(1, 2, 3);
	}

	@Test
	public void meetSameKind() {
		var intervals = AbstractValue.createInterval(1, 10).meet(AbstractValue.createInterval(5, 15));
		assertThat(intervals.getInterval()).isEqualTo(Interval.of(5, 10));

		var addrs = AbstractValue.createAddress(List.of(1, 2, 3)).meet(AbstractValue.createAddress(List.of(2, 3, 4)));
		assertThat(addrs.getAddress().get()).containsExactly(2, 3);
	}

	@Test
	public void mixedKindsThrow() {
		var interval = AbstractValue.createInterval(1, 5);
		var address = AbstractValue.createAddress(List.of(1, 2));
		assertThrows(TypeMismatchException.class, () -> interval.join(address));
		assertThrows(TypeMismatchException.class, () -> interval.meet(address));
		assertThrows(TypeMismatchException.class, () -> address.joinInPlace(interval));
		assertThrows(TypeMismatchException.class, () -> address.contains(interval));
		assertThat(interval.getInterval()).isEqualTo(Interval.of(1, 5));
	}

	@Test
	public void equality() {
		assertThat(AbstractValue.createInterval(1, 5)).isEqualTo(AbstractValue.createInterval(1, 5));
		assertThat(AbstractValue.createInterval(1, 5)).isNotEqualTo(AbstractValue.createInterval(1, 6));
		assertThat(AbstractValue.createAddress(List.of(1, 2))).isEqualTo(AbstractValue.createAddress(List.of(2, 1)));
		assertThat(AbstractValue.createAddress(List.of(1, 2))).isNotEqualTo(AbstractValue.createAddress(List.of(1, 3)));
		assertThat(AbstractValue.createInterval(1, 5)).isNotEqualTo(AbstractValue.createAddress(List.of(1, 2)));
		assertThat(AbstractValue.createInterval(3, 1)).isEqualTo(AbstractValue.createInterval(9, 0));
	}

	@Test
	public void bottomness() {
		assertThat(AbstractValue.createInterval(3, 1).isBottom()).isTrue();
		assertThat(AbstractValue.createAddress().isBottom()).isTrue();
		assertThat(AbstractValue.createInterval(1, 3).isBottom()).isFalse();
		assertThat(AbstractValue.createAddress(List.of(4)).isBottom()).isFalse();
	}

	@Test
	public void copyIsDeep() {
		var original = AbstractValue.createAddress(List.of(1));
		var copy = original.copy();
		copy.getAddress().add(2);
		assertThat(original.getAddress().get()).containsExactly(1);

		var range = AbstractValue.createInterval(1, 5);
		var rangeCopy = range.copy();
		rangeCopy.getInterval().setToTop();
		assertThat(range.getInterval()).isEqualTo(Interval.of(1, 5));
	}

	@Test
	public void factoriesCopyTheirArgument() {
		var interval = Interval.of(1, 5);
		var value = AbstractValue.createInterval(interval);
		interval.setToTop();
		assertThat(value.getInterval()).isEqualTo(Interval.of(1, 5));
	}

	@Test
	public void rendering() {
		assertThat(AbstractValue.createInterval(1, 5).toString()).isEqualTo("[1, 5]");
		assertThat(AbstractValue.createAddress().toString()).isEqualTo("∅");
	}
}
