package io.vena.nodesim;

import lombok.Getter;
import lombok.Setter;
import org.jetbrains.annotations.Nullable;

import static io.vena.nodesim.NodeIds.INVALID_ID;

/**
 * An addressable element of the simulated network.
 *
 * <p>
 * A node is identified by an integer {@link #id()} that can be changed at any
 * time and carries no uniqueness guarantee. Nodes use identity semantics for
 * {@link #equals} and {@link #hashCode}, so changing the id of a node never
 * disturbs the sets that contain it.
 *
 * <p>
 * {@link #toString()} returns {@link #describe()}, which is what most callers
 * want for display.
 *
 * @see AP
 * @see RT
 */
public class Node {
	@Getter @Setter
	private int id;

	private final HeartbeatCounter localHeartbeats = new HeartbeatCounter();
	private final HeartbeatCounter childHeartbeats = new HeartbeatCounter();

	/**
	 * Creates a node with a {@link NodeIds#generate() generated} id.
	 */
	public Node() {
		this(INVALID_ID);
	}

	/**
	 * @param requestedId the id to use verbatim, or {@link NodeIds#INVALID_ID}
	 * to have one generated. No other value is checked; negative, zero and
	 * out-of-range ids are all accepted.
	 */
	public Node(int requestedId) {
		this.id = (requestedId == INVALID_ID) ? NodeIds.generate() : requestedId;
	}

	/**
	 * @return the name of this kind of node, as it appears in {@link #describe()}
	 */
	public String kind() {
		return "Node";
	}

	/**
	 * @return <code>kind(id)</code>, for example <code>AP(3)</code>
	 */
	public final String describe() {
		return kind() + "(" + id + ")";
	}

	@Override
	public String toString() {
		return describe();
	}

	//
	// Heartbeat statistics
	//

	/**
	 * Records the outcome of one of this node's own heartbeats, and passes it
	 * on to the {@link #heartbeatParent() parent}'s child statistics.
	 */
	public void recordHeartbeat(boolean success) {
		localHeartbeats.record(success);
		propagateToParent(success);
	}

	/**
	 * Records the outcome of a heartbeat from somewhere beneath this node.
	 */
	public void recordChildHeartbeat(boolean success) {
		childHeartbeats.record(success);
		propagateToParent(success);
	}

	/**
	 * @param reset if true, the counters start again from zero once the snapshot has been taken
	 */
	public HeartbeatStats heartbeatStats(boolean reset) {
		HeartbeatStats result = new HeartbeatStats(localHeartbeats.counts(), childHeartbeats.counts());
		if (reset) {
			localHeartbeats.reset();
			childHeartbeats.reset();
		}
		return result;
	}

	/**
	 * @return the node that aggregates this node's heartbeat statistics, if any
	 */
	@Nullable Node heartbeatParent() {
		return null;
	}

	private void propagateToParent(boolean success) {
		Node parent = heartbeatParent();
		if (parent != null) {
			parent.recordChildHeartbeat(success);
		}
	}
}
