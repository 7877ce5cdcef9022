package works.jsonapi.exceptions;

/**
 * The document has none of the top-level members that make it a document:
 * {@code data}, {@code errors}, {@code meta}, {@code jsonapi}, or {@code links}.
 */
public final class MissingDataFieldException extends JsonApiException {
	public MissingDataFieldException() {
		super("Document must contain at least one of data, errors, meta, jsonapi, or links");
	}
}
