package io.vena.nodesim;

import io.vena.nodesim.exceptions.MalformedAddressException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

import static java.lang.String.format;

/**
 * Location of a node in the network hierarchy: network, hub, access point, remote terminal.
 *
 * <p>
 * Each level is optional, but a level can only be present if the one above it is:
 * an <code>rt</code> needs an <code>ap</code>, which needs a <code>hub</code>,
 * which needs a <code>net</code>. The address with no levels at all is the {@link #root()}.
 *
 * <p>
 * The compact form returned by {@link #tag()} (and {@link #toString()}) looks like
 * <code>N01H02A0aR1f</code>, and {@link #parse} turns it back into an address.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Address {
	private final @Nullable Integer net;
	private final @Nullable Integer hub;
	private final @Nullable Integer ap;
	private final @Nullable Integer rt;

	private static final Address ROOT = new Address(null, null, null, null);

	private static final Pattern TAG_PATTERN = Pattern.compile(
		"(?:N([0-9a-f]{2,}))?(?:H([0-9a-f]{2,}))?(?:A([0-9a-f]{2,}))?(?:R([0-9a-f]{2,}))?");

	public static Address root() {
		return ROOT;
	}

	public static Address network(int net) {
		return of(net, null, null, null);
	}

	/**
	 * @throws MalformedAddressException if a level is present without the one above it,
	 * or if any level is negative
	 */
	public static Address of(@Nullable Integer net, @Nullable Integer hub, @Nullable Integer ap, @Nullable Integer rt) {
		if (rt != null && ap == null) {
			throw new MalformedAddressException("Address with an rt must also have an ap");
		} else if (ap != null && hub == null) {
			throw new MalformedAddressException("Address with an ap must also have a hub");
		} else if (hub != null && net == null) {
			throw new MalformedAddressException("Address with a hub must also have a net");
		}
		checkNonNegative("net", net);
		checkNonNegative("hub", hub);
		checkNonNegative("ap", ap);
		checkNonNegative("rt", rt);
		if (net == null) {
			return ROOT;
		}
		return new Address(net, hub, ap, rt);
	}

	public Address withHub(int hub) {
		return of(net, hub, ap, rt);
	}

	public Address withAp(int ap) {
		return of(net, hub, ap, rt);
	}

	public Address withRt(int rt) {
		return of(net, hub, ap, rt);
	}

	/**
	 * Inverse of {@link #tag()}. Only the canonical form is accepted: uppercase level
	 * markers in order, each followed by at least two lowercase hex digits, with no
	 * extra leading zeros.
	 *
	 * @throws MalformedAddressException if <code>tag</code> is not the tag of any address
	 */
	public static Address parse(String tag) {
		Matcher matcher = TAG_PATTERN.matcher(tag);
		if (!matcher.matches()) {
			throw new MalformedAddressException("Invalid address tag: \"" + tag + "\"");
		}
		Address result;
		try {
			result = of(
				parseLevel(matcher.group(1)),
				parseLevel(matcher.group(2)),
				parseLevel(matcher.group(3)),
				parseLevel(matcher.group(4)));
		} catch (NumberFormatException e) {
			throw new MalformedAddressException("Address tag component out of range: \"" + tag + "\"", e);
		} catch (MalformedAddressException e) {
			throw new MalformedAddressException("Invalid address tag \"" + tag + "\": " + e.getMessage(), e);
		}
		if (!result.tag().equals(tag)) {
			throw new MalformedAddressException("Address tag \"" + tag + "\" is not canonical; expected \"" + result.tag() + "\"");
		}
		return result;
	}

	public String tag() {
		StringBuilder sb = new StringBuilder();
		appendLevel(sb, 'N', net);
		appendLevel(sb, 'H', hub);
		appendLevel(sb, 'A', ap);
		appendLevel(sb, 'R', rt);
		return sb.toString();
	}

	/**
	 * @return this address with its most specific level removed,
	 * or <code>null</code> if this is the {@link #root()}
	 */
	public @Nullable Address parent() {
		if (rt != null) {
			return of(net, hub, ap, null);
		} else if (ap != null) {
			return of(net, hub, null, null);
		} else if (hub != null) {
			return of(net, null, null, null);
		} else if (net != null) {
			return ROOT;
		} else {
			return null;
		}
	}

	public int depth() {
		if (rt != null) {
			return 4;
		} else if (ap != null) {
			return 3;
		} else if (hub != null) {
			return 2;
		} else if (net != null) {
			return 1;
		} else {
			return 0;
		}
	}

	public boolean isRoot() {
		return net == null;
	}

	@Override
	public String toString() {
		return tag();
	}

	private static void checkNonNegative(String level, @Nullable Integer value) {
		if (value != null && value < 0) {
			throw new MalformedAddressException("Address " + level + " can't be negative: " + value);
		}
	}

	private static @Nullable Integer parseLevel(@Nullable String hexDigits) {
		return (hexDigits == null) ? null : Integer.parseInt(hexDigits, 16);
	}

	private static void appendLevel(StringBuilder sb, char marker, @Nullable Integer value) {
		if (value != null) {
			sb.append(marker).append(format("%02x", value));
		}
	}
}
