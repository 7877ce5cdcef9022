/**
 * The JSON:API document model, independent of any JSON library.
 * <p>
 * Start with {@link works.jsonapi.Document}. Validation rules live in
 * {@link works.jsonapi.Validation}, primary data shape detection in
 * {@link works.jsonapi.DocumentShape}, and compound document checks in
 * {@link works.jsonapi.LinkageVerifier}.
 * Failures are reported with the exceptions in {@link works.jsonapi.exceptions}.
 */
module works.jsonapi.core {
	requires org.slf4j;

	requires static lombok;

	exports works.jsonapi;
	exports works.jsonapi.exceptions;
}
