package io.vena.nodesim;

import java.lang.ref.WeakReference;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RTTest extends AbstractTopologyTest {

	@Test
	void owner_followsMembership() {
		AP ap = new AP(1);
		RT rt = new RT(2);
		assertFalse(rt.hasOwner());
		ap.addMember(rt);
		assertTrue(rt.hasOwner());
		assertSame(ap, rt.owner());
		ap.removeMember(rt);
		assertNull(rt.owner());
	}

	@Test
	void owner_doesNotKeepApAlive() throws InterruptedException {
		RT rt = new RT(1);
		WeakReference<AP> apRef = attachToUnreferencedAp(rt);

		for (int attempt = 0; attempt < 50 && apRef.get() != null; attempt++) {
			System.gc();
			Thread.sleep(20);
		}

		assertNull(apRef.get(), "Terminal's back-reference must not keep its AP reachable");
		assertNull(rt.owner(), "Reclaimed owner reads as no owner");
		assertFalse(rt.hasOwner());
	}

	@Test
	void owner_survivesWhileApIsHeldElsewhere() {
		NodeRegistry holder = new NodeRegistry();
		RT rt = new RT(1);
		Address apAddress = Address.network(1).withHub(1).withAp(1);
		holder.register(apAddress, new AP(2)).addMember(rt);

		System.gc();

		assertSame(holder.lookup(apAddress), rt.owner());
	}

	/**
	 * Keeps the AP out of this test's stack frame so only the terminal's back-reference points at it.
	 */
	private static WeakReference<AP> attachToUnreferencedAp(RT rt) {
		AP ap = new AP(2);
		ap.addMember(rt);
		assertSame(ap, rt.owner());
		return new WeakReference<>(ap);
	}

}
