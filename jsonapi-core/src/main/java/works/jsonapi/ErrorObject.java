package works.jsonapi;

import lombok.Builder;

/**
 * An error object, as found in the {@code errors} member of a document.
 * Every field is optional.
 *
 * @param status the HTTP status code, as a string
 * @param code an application-specific error code
 * @param source the part of the request document responsible for the error
 */
@Builder(toBuilder = true)
public record ErrorObject(
	String id,
	ErrorLinks links,
	String status,
	String code,
	String title,
	String detail,
	ErrorSource source,
	Object meta
) {
	/**
	 * Each value is a {@link String}, a {@link LinkObject}, or null.
	 */
	public record ErrorLinks(Object about, Object type) { }

	/**
	 * @param pointer a JSON Pointer into the request document
	 * @param parameter the query parameter that caused the error
	 * @param header the request header that caused the error
	 */
	public record ErrorSource(String pointer, String parameter, String header) { }
}
