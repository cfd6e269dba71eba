package io.vena.nodesim;

/**
 * Running tally of heartbeat outcomes. Snapshots are taken with {@link #counts()}.
 */
final class HeartbeatCounter {
	private long successes;
	private long failures;

	void record(boolean success) {
		if (success) {
			successes++;
		} else {
			failures++;
		}
	}

	HeartbeatCounts counts() {
		return new HeartbeatCounts(successes, failures);
	}

	void reset() {
		successes = 0;
		failures = 0;
	}
}
