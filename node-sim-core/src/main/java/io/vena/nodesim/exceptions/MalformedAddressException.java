package io.vena.nodesim.exceptions;

/**
 * Thrown for addresses that skip a level of the hierarchy, have negative
 * components, or for tags that can't be parsed back into an address.
 */
@SuppressWarnings("serial")
public class MalformedAddressException extends IllegalArgumentException {
	public MalformedAddressException(String message) { super(message); }
	public MalformedAddressException(String message, Throwable cause) { super(message, cause); }
}
