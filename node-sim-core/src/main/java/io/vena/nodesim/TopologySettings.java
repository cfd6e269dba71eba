package io.vena.nodesim;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static io.vena.nodesim.TopologySettings.ReparentingPolicy.LENIENT;

/**
 * Behaviour switches for an {@link AP}'s membership operations.
 */
@Value
@Builder
public class TopologySettings {
	public static final TopologySettings DEFAULT = TopologySettings.builder().build();

	@Default ReparentingPolicy reparenting = LENIENT;

	/**
	 * What {@link AP#addMember} does when the terminal already has a different owner.
	 */
	public enum ReparentingPolicy {
		/**
		 * Take over the owner back-reference, but leave the terminal in the previous
		 * owner's member set. Callers re-parent in two steps: remove from the old
		 * owner, then add to the new one.
		 * <p>
		 * This is the default.
		 */
		LENIENT,

		/**
		 * Remove the terminal from the previous owner's member set before adding it,
		 * so a terminal is only ever a member of its owner.
		 */
		STRICT,
	}

	public void validate() {
		if (reparenting == null) {
			throw new IllegalArgumentException("Reparenting policy must be specified");
		}
	}
}
