package io.vena.nodesim;

import io.vena.nodesim.exceptions.NonexistentNodeException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableSet;

/**
 * Table of nodes by {@link Address}.
 *
 * <p>
 * The registry holds strong references to the nodes registered in it, so it
 * can serve as the holder that keeps {@link AP}s alive while their terminals
 * point back at them.
 *
 * <p>
 * Like the rest of the topology, not thread-safe.
 */
public final class NodeRegistry {
	private final Map<Address, Node> nodesByAddress = new LinkedHashMap<>();

	/**
	 * @return <code>node</code>
	 * @throws IllegalArgumentException if another node is already registered at <code>address</code>
	 */
	public <N extends Node> N register(@NonNull Address address, @NonNull N node) {
		Node existing = nodesByAddress.putIfAbsent(address, node);
		if (existing != null) {
			throw new IllegalArgumentException("Address \"" + address + "\" is already registered to " + existing);
		}
		LOGGER.debug("Registered {} at \"{}\"", node, address);
		return node;
	}

	/**
	 * @return the node that was registered at <code>address</code>, or <code>null</code> if there was none
	 */
	public @Nullable Node deregister(@NonNull Address address) {
		Node removed = nodesByAddress.remove(address);
		if (removed != null) {
			LOGGER.debug("Deregistered {} from \"{}\"", removed, address);
		}
		return removed;
	}

	public @Nullable Node lookup(@NonNull Address address) {
		return nodesByAddress.get(address);
	}

	/**
	 * @throws NonexistentNodeException if no node is registered at <code>address</code>
	 * @throws IllegalArgumentException if the node there is not a <code>nodeClass</code>
	 */
	public <N extends Node> N get(@NonNull Address address, @NonNull Class<N> nodeClass) {
		Node node = nodesByAddress.get(address);
		if (node == null) {
			throw new NonexistentNodeException(address);
		} else if (!nodeClass.isInstance(node)) {
			throw new IllegalArgumentException("Node at \"" + address + "\" is " + node + ", not " + nodeClass.getSimpleName());
		}
		return nodeClass.cast(node);
	}

	/**
	 * @return the node registered at <code>address.{@link Address#parent() parent}()</code>,
	 * or <code>null</code> if there isn't one
	 */
	public @Nullable Node parentOf(@NonNull Address address) {
		Address parent = address.parent();
		return (parent == null) ? null : nodesByAddress.get(parent);
	}

	public boolean contains(@NonNull Address address) {
		return nodesByAddress.containsKey(address);
	}

	/**
	 * Adds the {@link RT} at <code>rtAddress</code> to the {@link AP} at <code>apAddress</code>.
	 *
	 * @see AP#addMember
	 */
	public void attach(Address apAddress, Address rtAddress) {
		AP ap = get(apAddress, AP.class);
		RT rt = get(rtAddress, RT.class);
		ap.addMember(rt);
	}

	/**
	 * @see AP#removeMember
	 */
	public void detach(Address apAddress, Address rtAddress) {
		AP ap = get(apAddress, AP.class);
		RT rt = get(rtAddress, RT.class);
		ap.removeMember(rt);
	}

	/**
	 * @see Node#heartbeatStats(boolean)
	 */
	public HeartbeatStats heartbeatStats(Address address, boolean reset) {
		Node node = get(address, Node.class);
		HeartbeatStats result = node.heartbeatStats(reset);
		if (reset) {
			LOGGER.info("Reset heartbeat statistics of {} at \"{}\" after {} local and {} child heartbeats",
				node, address, result.local().total(), result.children().total());
		}
		return result;
	}

	/**
	 * @return a read-only live view of the registered addresses, in registration order
	 */
	public Set<Address> addresses() {
		return unmodifiableSet(nodesByAddress.keySet());
	}

	public int size() {
		return nodesByAddress.size();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeRegistry.class);
}
