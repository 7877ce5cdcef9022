package works.jsonapi.exceptions;

public final class MalformedResourceException extends JsonApiException {
	public MalformedResourceException(String message) {
		super(message);
	}
}
