package works.jsonapi.exceptions;

/**
 * Root of the failures raised while validating, encoding, decoding,
 * or verifying a JSON:API document.
 * <p>
 * None of these are transient: the input is wrong, and retrying won't help.
 */
public sealed abstract class JsonApiException extends RuntimeException permits
	InvalidDataFieldException,
	JsonApiTypeException,
	MalformedResourceException,
	MissingDataFieldException,
	MissingLinkFieldsException,
	PartialLinkageException
{
	protected JsonApiException(String message) {
		super(message);
	}

	protected JsonApiException(String message, Throwable cause) {
		super(message, cause);
	}
}
