/**
 * Failures reported by JSON:API document processing.
 * All are unchecked and extend {@link works.jsonapi.exceptions.JsonApiException}.
 */
package works.jsonapi.exceptions;
