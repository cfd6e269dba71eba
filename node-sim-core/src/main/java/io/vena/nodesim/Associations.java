package io.vena.nodesim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.nodesim.TopologySettings.ReparentingPolicy.STRICT;

/**
 * The only code that changes {@link AP#members()} or {@link RT#owner()}.
 * Each operation updates both sides before returning.
 */
final class Associations {
	private Associations() { }

	static void attach(AP ap, RT rt) {
		AP previous = rt.owner();
		if (previous != null && previous != ap) {
			if (ap.settings().reparenting() == STRICT) {
				if (previous.eraseMember(rt)) {
					LOGGER.debug("Detached {} from {} before attaching it to {}", rt, previous, ap);
				}
			} else if (previous.hasMember(rt)) {
				LOGGER.warn("{} now belongs to {} but is still a member of {}; remove it from {} first to re-parent cleanly",
					rt, ap, previous, previous);
			}
		}
		if (ap.insertMember(rt)) {
			LOGGER.debug("Added {} to {}", rt, ap);
		}
		rt.assignOwner(ap);
	}

	static void detach(AP ap, RT rt) {
		if (ap.eraseMember(rt)) {
			LOGGER.debug("Removed {} from {}", rt, ap);
		}
		AP previous = rt.owner();
		if (previous != null && previous != ap) {
			LOGGER.debug("Clearing owner {} of {} on removal from {}", previous, rt, ap);
		}
		rt.clearOwner();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Associations.class);
}
