package io.vena.nodesim;

/**
 * Immutable heartbeat tally at a point in time.
 */
public record HeartbeatCounts(
	long successes,
	long failures
) {
	public static final HeartbeatCounts ZERO = new HeartbeatCounts(0, 0);

	public long total() {
		return successes + failures;
	}
}
