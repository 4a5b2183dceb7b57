package vfa.dataflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link VirtualAddress}.
 */
@RunWith(JUnit4.class)
public class VirtualAddressTest {
	@Test
	public void encodeAndDecode() {
		var addr = VirtualAddress.encode(123);
		assertThat(addr).isEqualTo(0x7F00007B);
		assertThat(VirtualAddress.isVirtual(addr)).isTrue();
		assertThat(VirtualAddress.decode(addr)).isEqualTo(123);
	}

	@Test
	public void roundTripAcrossIdSpace() {
		int[] ids = {0, 1, 2, 255, 256, 65535, 65536, 1 << 20, VirtualAddress.MAX_ID - 1, VirtualAddress.MAX_ID};
		for (var id : ids) {
			var addr = VirtualAddress.encode(id);
			assertThat(VirtualAddress.isVirtual(addr)).isTrue();
			assertThat(VirtualAddress.decode(addr)).isEqualTo(id);
		}
	}

	@Test
	public void plainNumbersAreNotVirtual() {
		assertThat(VirtualAddress.isVirtual(123)).isFalse();
		assertThat(VirtualAddress.isVirtual(0)).isFalse();
		assertThat(VirtualAddress.isVirtual(-1)).isFalse();
		assertThat(VirtualAddress.isVirtual(0x7E000001)).isFalse();
	}

	@Test
	public void decodingPlainNumberIsIdentity() {
		assertThat(VirtualAddress.decode(123)).isEqualTo(123);
		assertThat(VirtualAddress.decode(-5)).isEqualTo(-5);
	}

	@Test
	public void nullAddress() {
		assertThat(VirtualAddress.isNull(VirtualAddress.encode(VirtualAddress.NULL_ID))).isTrue();
		assertThat(VirtualAddress.isNull(VirtualAddress.encode(1))).isFalse();
	}

	@Test
	public void rejectsIdsOutsideField() {
		assertThrows(IllegalArgumentException.class, () -> VirtualAddress.encode(-1));
		assertThrows(IllegalArgumentException.class, () -> VirtualAddress.encode(VirtualAddress.MAX_ID + 1));
	}

	@Test
	public void tagAndIdFieldAreDisjoint() {
		assertThat(VirtualAddress.HIGH_TAG & VirtualAddress.MAX_ID).isEqualTo(0);
		assertThat(VirtualAddress.MASK & VirtualAddress.MAX_ID).isEqualTo(0);
	}
}
