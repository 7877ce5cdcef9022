package works.jsonapi;

/**
 * The {@code jsonapi} member of a document, describing the server's implementation.
 */
public record JsonApiObject(String version, Object meta) {
	public static final String VERSION_1_0 = "1.0";
	public static final String VERSION_1_1 = "1.1";

	public static JsonApiObject version(String version) {
		return new JsonApiObject(version, null);
	}
}
