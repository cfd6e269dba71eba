package io.vena.nodesim;

import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;

import static io.vena.nodesim.NodeIds.INVALID_ID;
import static java.util.Collections.unmodifiableSet;

/**
 * An access point: a node that owns a set of {@link RT remote terminals}.
 *
 * <p>
 * Membership is kept consistent from both sides: after {@link #addMember},
 * the terminal is in {@link #members()} and its {@link RT#owner() owner} is this AP;
 * after {@link #removeMember}, neither holds. Adding a member that is already
 * present, or removing one that is absent, is harmless.
 *
 * <p>
 * Re-parenting a terminal that belongs to another AP depends on the
 * {@link TopologySettings#reparenting() reparenting policy}. Under the default
 * {@link TopologySettings.ReparentingPolicy#LENIENT LENIENT} policy, the old AP keeps
 * the terminal in its member set until it is explicitly removed from there.
 *
 * <p>
 * Not thread-safe. Concurrent callers must serialize all membership changes.
 */
public final class AP extends Node {
	private final Set<RT> members = new LinkedHashSet<>();

	@Getter
	private final TopologySettings settings;

	public AP() {
		this(INVALID_ID);
	}

	public AP(int requestedId) {
		this(requestedId, TopologySettings.DEFAULT);
	}

	public AP(TopologySettings settings) {
		this(INVALID_ID, settings);
	}

	public AP(int requestedId, TopologySettings settings) {
		super(requestedId);
		settings.validate();
		this.settings = settings;
	}

	@Override
	public String kind() {
		return "AP";
	}

	/**
	 * @return a read-only, live view of this AP's terminals
	 */
	public Set<RT> members() {
		return unmodifiableSet(members);
	}

	public boolean hasMember(RT rt) {
		return members.contains(rt);
	}

	public void addMember(RT rt) {
		Associations.attach(this, rt);
	}

	/**
	 * Removes <code>rt</code> from this AP and clears its owner.
	 *
	 * <p>
	 * The owner is cleared even if it was some other AP;
	 * that AP's member set is left as it was.
	 */
	public void removeMember(RT rt) {
		Associations.detach(this, rt);
	}

	//
	// Raw member-set access for Associations
	//

	boolean insertMember(RT rt) {
		return members.add(rt);
	}

	boolean eraseMember(RT rt) {
		return members.remove(rt);
	}
}
