package works.jsonapi.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.jsonapi.LinkageVerifier;

@Value
@Builder(toBuilder = true)
public class JsonApiSettings {
	public static final JsonApiSettings DEFAULT = JsonApiSettings.builder().build();

	/**
	 * Pretty-print encoded documents.
	 */
	@Default boolean indentOutput = false;

	/**
	 * JSON:API reserves unrecognized members for future versions of the format,
	 * and most readers ignore them, which is the default.
	 * Set this to reject documents and resource objects containing members we don't recognize.
	 * Links objects may always contain additional members.
	 */
	@Default boolean failOnUnknownMembers = false;

	/**
	 * Whether {@link JsonApiCodec#decode} checks compound documents with {@link LinkageVerifier}.
	 * Default is {@link LinkageMode#NONE NONE}: callers that care run the check themselves.
	 */
	@Default LinkageMode linkage = LinkageMode.NONE;

	public enum LinkageMode {
		NONE,

		/**
		 * Fail decoding if any included resource is not reachable from primary data.
		 */
		VERIFY,

		/**
		 * Like {@link #VERIFY}, and also replace each relationship placeholder
		 * with the included resource it names.
		 */
		VERIFY_AND_ALIAS,
	}
}
