package io.vena.nodesim;

import io.vena.nodesim.junit.ParametersByName;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Properties shared by every kind of node, with the kind bound through the constructor.
 */
class NodeKindTest extends AbstractTopologyTest {
	final NodeKind kind;

	@ParametersByName
	NodeKindTest(NodeKind kind) {
		this.kind = kind;
	}

	@ParametersByName
	void idChange_keepsKind(int newId) {
		Node node = kind.withId.apply(1);
		node.id(newId);
		assertEquals(kind.kindName + "(" + newId + ")", node.describe());
	}

	@ParametersByName
	void idChange_keepsSetMembership(int newId) {
		Node node = kind.withGeneratedId.get();
		Set<Node> set = new HashSet<>();
		set.add(node);
		node.id(newId);
		assertTrue(set.contains(node));
	}

	@SuppressWarnings("unused")
	static Stream<Integer> newId() {
		return Stream.of(0, 7, -9, NodeIds.MAX_ID);
	}

}
