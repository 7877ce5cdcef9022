/**
 * Reads and writes JSON:API documents using the Jackson library.
 * <p>
 * See {@link works.jsonapi.jackson.JsonApiCodec} for the main entry point.
 */
module works.jsonapi.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.jsonapi.core;

	requires static lombok;

	exports works.jsonapi.jackson;
}
