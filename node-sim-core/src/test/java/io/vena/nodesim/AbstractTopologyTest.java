package io.vena.nodesim;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.slf4j.LoggerFactory;

import static io.vena.nodesim.TopologySettings.ReparentingPolicy.STRICT;

public abstract class AbstractTopologyTest {
	protected static final TopologySettings STRICT_SETTINGS = TopologySettings.builder()
		.reparenting(STRICT)
		.build();

	private final Deque<Runnable> tearDownActions = new ArrayDeque<>();

	@AfterEach
	void runTearDown() {
		tearDownActions.forEach(Runnable::run);
		tearDownActions.clear();
	}

	/**
	 * One constructor pair per concrete node class, for tests that should hold for all of them.
	 */
	public enum NodeKind {
		PLAIN_NODE("Node", Node::new, Node::new),
		ACCESS_POINT("AP", AP::new, AP::new),
		REMOTE_TERMINAL("RT", RT::new, RT::new),
		;

		final String kindName;
		final Supplier<Node> withGeneratedId;
		final IntFunction<Node> withId;

		NodeKind(String kindName, Supplier<Node> withGeneratedId, IntFunction<Node> withId) {
			this.kindName = kindName;
			this.withGeneratedId = withGeneratedId;
			this.withId = withId;
		}
	}

	/**
	 * Values for test parameters named <code>kind</code>.
	 */
	@SuppressWarnings("unused")
	static Stream<NodeKind> kind() {
		return Stream.of(NodeKind.values());
	}

	protected static AP strictAp(int id) {
		return new AP(id, STRICT_SETTINGS);
	}

	/**
	 * Collects everything logged by <code>loggerClass</code> until the end of the current test.
	 */
	protected List<ILoggingEvent> captureLogging(Class<?> loggerClass) {
		Logger logger = (Logger) LoggerFactory.getLogger(loggerClass);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		tearDownActions.addFirst(() -> {
			logger.detachAppender(appender);
			appender.stop();
		});
		return appender.list;
	}
}
