package works.jsonapi;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonapi.PrimaryData.Shape;
import works.jsonapi.exceptions.InvalidDataFieldException;
import works.jsonapi.exceptions.MissingDataFieldException;

/**
 * Determines the {@link Shape} of a document's primary data from a generic,
 * untyped rendition of the document, before committing to a typed decoding.
 * <p>
 * The generic form is what any JSON library produces when asked for plain
 * maps and lists: objects as {@link Map}, arrays as {@link List}, and JSON null as null.
 */
public final class DocumentShape {
	public static final String DATA = "data";

	private DocumentShape() { }

	/**
	 * <ul>
	 *     <li>{@code {}}: fails with {@link MissingDataFieldException}</li>
	 *     <li>no {@code data} member, or {@code "data": null}: {@link Shape#NONE NONE}</li>
	 *     <li>{@code "data": {}}: fails with {@link InvalidDataFieldException}</li>
	 *     <li>{@code "data": {...}}: {@link Shape#ONE ONE}</li>
	 *     <li>{@code "data": [...]}, even if empty: {@link Shape#MANY MANY}</li>
	 * </ul>
	 * Any other {@code data} value is reported as {@link Shape#ONE ONE},
	 * leaving the typed decoding to reject it.
	 */
	public static Shape sniff(Map<String, ?> genericDocument) {
		if (genericDocument.isEmpty()) {
			throw new MissingDataFieldException();
		}
		Shape result;
		if (!genericDocument.containsKey(DATA)) {
			result = Shape.NONE;
		} else {
			Object data = genericDocument.get(DATA);
			if (data == null) {
				result = Shape.NONE;
			} else if (data instanceof Map<?, ?> map) {
				if (map.isEmpty()) {
					throw new InvalidDataFieldException();
				}
				result = Shape.ONE;
			} else if (data instanceof List<?>) {
				result = Shape.MANY;
			} else {
				result = Shape.ONE;
			}
		}
		LOGGER.trace("Primary data shape is {}", result);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentShape.class);
}
