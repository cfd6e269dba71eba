package io.vena.nodesim.exceptions;

import io.vena.nodesim.Address;
import io.vena.nodesim.NodeRegistry;
import lombok.Getter;

/**
 * Thrown by {@link NodeRegistry} operations that require a node to be
 * registered at a given address when none is.
 */
@SuppressWarnings("serial")
public class NonexistentNodeException extends RuntimeException {
	@Getter
	private final Address address;

	public NonexistentNodeException(Address address) {
		super("No node registered at \"" + address + "\"");
		this.address = address;
	}
}
