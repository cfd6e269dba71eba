package io.vena.nodesim;

import java.lang.ref.WeakReference;
import org.jetbrains.annotations.Nullable;

import static io.vena.nodesim.NodeIds.INVALID_ID;

/**
 * A remote terminal: a node that belongs to at most one {@link AP} at a time.
 *
 * <p>
 * The {@link #owner()} link is a weak back-reference used for lookup only.
 * It never keeps the owning AP alive; once nothing else holds the AP, it may
 * be reclaimed, and from then on this terminal reports no owner.
 *
 * <p>
 * The owner is changed only through {@link AP#addMember} and {@link AP#removeMember}.
 */
public final class RT extends Node {
	private @Nullable WeakReference<AP> ownerRef;

	public RT() {
		this(INVALID_ID);
	}

	public RT(int requestedId) {
		super(requestedId);
	}

	@Override
	public String kind() {
		return "RT";
	}

	/**
	 * @return the AP this terminal currently belongs to, or <code>null</code> if it
	 * has none or the AP has been reclaimed.
	 */
	public @Nullable AP owner() {
		WeakReference<AP> ref = ownerRef;
		return (ref == null) ? null : ref.get();
	}

	public boolean hasOwner() {
		return owner() != null;
	}

	void assignOwner(AP newOwner) {
		if (owner() != newOwner) {
			ownerRef = new WeakReference<>(newOwner);
		}
	}

	void clearOwner() {
		ownerRef = null;
	}

	@Override
	@Nullable Node heartbeatParent() {
		return owner();
	}
}
