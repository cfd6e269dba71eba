package io.vena.nodesim;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Source of automatically assigned {@link Node#id() node ids}.
 *
 * <p>
 * Ids are drawn uniformly from <code>[1, {@link #MAX_ID}]</code> using a single
 * process-wide generator. The generator is created the first time an id is
 * requested, seeded once from {@link SecureRandom}, and then shared by every
 * subsequent call.
 *
 * <p>
 * Nothing here makes ids unique. Two nodes can end up with the same id,
 * whether generated or assigned; callers that need uniqueness must enforce it.
 */
public final class NodeIds {
	/**
	 * Passing this to a node constructor requests an automatically generated id.
	 * It is the only id value with a special meaning.
	 */
	public static final int INVALID_ID = -1;

	public static final int MAX_ID = 1_000_000;

	private NodeIds() { }

	public static int generate() {
		return 1 + Generator.RANDOM.nextInt(MAX_ID);
	}

	/**
	 * Initialization-on-demand holder, so the seed is only collected if an id is ever generated.
	 */
	private static final class Generator {
		static final Random RANDOM = new Random(new SecureRandom().nextLong());
	}
}
