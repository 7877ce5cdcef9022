package works.jsonapi.exceptions;

public final class MissingLinkFieldsException extends JsonApiException {
	public MissingLinkFieldsException() {
		super("Link must have a non-empty self or related field");
	}
}
