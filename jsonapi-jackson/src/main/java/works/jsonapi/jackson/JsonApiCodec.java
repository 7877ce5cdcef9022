package works.jsonapi.jackson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonapi.Document;
import works.jsonapi.LinkageVerifier;
import works.jsonapi.Validation;
import works.jsonapi.exceptions.JsonApiException;
import works.jsonapi.exceptions.MissingDataFieldException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static tools.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * Converts {@link Document documents} to and from JSON:API text.
 * <p>
 * Instances are immutable and can be shared between threads,
 * but the documents they operate on are not:
 * in particular, {@link JsonApiSettings.LinkageMode#VERIFY_AND_ALIAS aliasing}
 * modifies the decoded document.
 * <p>
 * Failures are reported with {@link JsonApiException} subclasses for
 * JSON:API rule violations, and with Jackson's own exceptions for
 * input that isn't JSON or doesn't have the right structure.
 */
public final class JsonApiCodec {
	private final JsonApiSettings settings;
	private final ObjectMapper mapper;

	private JsonApiCodec(JsonApiSettings settings) {
		this.settings = settings;
		this.mapper = JsonMapper.builder()
			.addModule(new JsonApiSerializer().moduleFor(settings))
			.configure(INDENT_OUTPUT, settings.isIndentOutput())
			.build();
	}

	public static JsonApiCodec create() {
		return create(JsonApiSettings.DEFAULT);
	}

	public static JsonApiCodec create(JsonApiSettings settings) {
		return new JsonApiCodec(settings);
	}

	public JsonApiSettings settings() {
		return settings;
	}

	/**
	 * The mapper we use, configured for JSON:API types.
	 * Useful for converting {@link Document#meta() meta} and
	 * {@link works.jsonapi.ResourceObject#attributes() attributes} to application types.
	 */
	public ObjectMapper mapper() {
		return mapper;
	}

	/**
	 * Validates {@code document}, normalizing its links as described by
	 * {@link works.jsonapi.Link#check()}, and then writes it.
	 * If validation fails, nothing is written.
	 */
	public byte[] encode(Document document) {
		Validation.prepareForEncoding(document);
		byte[] result = mapper.writeValueAsBytes(document);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Encoded {}:\n{}", document, new String(result, UTF_8));
		}
		return result;
	}

	public String encodeToString(Document document) {
		return new String(encode(document), UTF_8);
	}

	/**
	 * Reads a document, including the {@code data} member in whichever of its shapes appears.
	 * If {@link JsonApiSettings#getLinkage() linkage} verification is configured,
	 * the result must also be fully linked.
	 *
	 * @throws MissingDataFieldException if the JSON is {@code {}} or {@code null}
	 * @throws works.jsonapi.exceptions.InvalidDataFieldException if {@code data} is {@code {}}
	 * @throws works.jsonapi.exceptions.PartialLinkageException if linkage verification is on and fails
	 */
	public Document decode(byte[] json) {
		return verified(mapper.readValue(json, Document.class));
	}

	public Document decode(String json) {
		return verified(mapper.readValue(json, Document.class));
	}

	private Document verified(Document document) {
		if (document == null) {
			throw new MissingDataFieldException();
		}
		switch (settings.getLinkage()) {
			case VERIFY:
				LinkageVerifier.verify(document, false);
				break;
			case VERIFY_AND_ALIAS:
				LinkageVerifier.verify(document, true);
				break;
			case NONE:
				break;
		}
		return document;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonApiCodec.class);
}
