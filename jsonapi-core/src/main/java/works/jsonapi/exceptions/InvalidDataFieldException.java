package works.jsonapi.exceptions;

/**
 * The {@code data} member is present but is an empty object,
 * which is neither a resource nor an explicit absence of one.
 */
public final class InvalidDataFieldException extends JsonApiException {
	public InvalidDataFieldException() {
		super("Primary data must be null, a resource object, or an array of resource objects; found {}");
	}
}
