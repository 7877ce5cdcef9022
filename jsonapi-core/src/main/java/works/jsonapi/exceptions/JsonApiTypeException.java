package works.jsonapi.exceptions;

import java.util.List;

/**
 * A value had a type other than the ones allowed in its position.
 */
public final class JsonApiTypeException extends JsonApiException {
	private final String actual;
	private final List<String> expected;

	public JsonApiTypeException(String actual, List<String> expected) {
		super("Got type \"" + actual + "\"; expected one of " + expected);
		this.actual = actual;
		this.expected = List.copyOf(expected);
	}

	public JsonApiTypeException(String actual, List<String> expected, Throwable cause) {
		super("Got type \"" + actual + "\"; expected one of " + expected, cause);
		this.actual = actual;
		this.expected = List.copyOf(expected);
	}

	public String actual() {
		return actual;
	}

	public List<String> expected() {
		return expected;
	}
}
