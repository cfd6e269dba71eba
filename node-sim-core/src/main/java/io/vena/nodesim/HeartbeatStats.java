package io.vena.nodesim;

/**
 * Snapshot of a node's heartbeat statistics.
 *
 * @param local heartbeats sent by the node itself
 * @param children heartbeats sent by nodes beneath it, at any depth
 */
public record HeartbeatStats(
	HeartbeatCounts local,
	HeartbeatCounts children
) {
	public static final HeartbeatStats EMPTY = new HeartbeatStats(HeartbeatCounts.ZERO, HeartbeatCounts.ZERO);
}
