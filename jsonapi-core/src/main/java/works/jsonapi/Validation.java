package works.jsonapi;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.jsonapi.ErrorObject.ErrorLinks;
import works.jsonapi.exceptions.JsonApiTypeException;
import works.jsonapi.exceptions.MalformedResourceException;
import works.jsonapi.exceptions.MissingLinkFieldsException;

/**
 * Checks that must pass before a document can be written.
 */
public final class Validation {
	static final List<String> META_TYPES = List.of("struct", "map");
	static final List<String> LINK_VALUE_TYPES = List.of(LinkObject.class.getSimpleName(), String.class.getSimpleName());

	private Validation() { }

	/**
	 * A meta value must be absent, a {@link Map}, or an object with named fields (a "struct"),
	 * since it's written as a JSON object.
	 * An {@link Optional} is judged by its contents.
	 *
	 * @throws JsonApiTypeException if {@code meta} is a scalar, array, or collection
	 */
	public static void checkMeta(Object meta) {
		Object value = meta;
		while (value instanceof Optional<?> optional) {
			value = optional.orElse(null);
		}
		if (value == null || value instanceof Map<?, ?> || isStruct(value)) {
			return;
		}
		throw new JsonApiTypeException(typeName(value), META_TYPES);
	}

	private static boolean isStruct(Object value) {
		return !(value.getClass().isArray()
			|| value instanceof Enum<?>
			|| value instanceof CharSequence
			|| value instanceof Number
			|| value instanceof Boolean
			|| value instanceof Character
			|| value instanceof Iterable<?>);
	}

	/**
	 * @return true if {@code linkValue} counts as absent
	 * @throws JsonApiTypeException if {@code linkValue} is neither a {@link LinkObject} nor a {@link String},
	 * or is a {@link LinkObject} with bad {@link LinkObject#meta() meta}
	 */
	public static boolean checkLinkValue(Object linkValue) {
		if (linkValue == null) {
			return true;
		} else if (linkValue instanceof LinkObject lo) {
			checkMeta(lo.meta());
			return lo.isEmpty();
		} else if (linkValue instanceof String s) {
			return s.isEmpty();
		} else {
			throw new JsonApiTypeException(typeName(linkValue), LINK_VALUE_TYPES);
		}
	}

	/**
	 * Validates everything in {@code document} that will be written,
	 * normalizing {@link Link links} along the way as described by {@link Link#check()}.
	 * <p>
	 * A document with {@link Document#errors() errors} has no primary data written,
	 * so its {@link Document#data() data} isn't checked.
	 *
	 * @throws MissingLinkFieldsException if any links object has neither self nor related
	 * @throws JsonApiTypeException if any meta or link value has the wrong type
	 * @throws MalformedResourceException if any resource lacks a type
	 */
	public static void prepareForEncoding(Document document) {
		new Preparation().document(document);
	}

	private static final class Preparation {
		// A shared ResourceObject or Document only needs checking once
		final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());

		void document(Document document) {
			if (!seen.add(document)) {
				return;
			}
			checkMeta(document.meta());
			if (document.jsonapi() != null) {
				checkMeta(document.jsonapi().meta());
			}
			if (document.links() != null) {
				document.links().check();
			}
			for (ErrorObject error : document.errors()) {
				error(error);
			}
			if (document.errors().isEmpty()) {
				for (ResourceObject resource : document.data().resources()) {
					resource(resource);
				}
			}
			for (ResourceObject resource : document.included()) {
				resource(resource);
			}
		}

		void resource(ResourceObject resource) {
			if (!seen.add(resource)) {
				return;
			}
			if (resource.type() == null || resource.type().isEmpty()) {
				throw new MalformedResourceException("Resource object " + resource.identity() + " has no type");
			}
			checkMeta(resource.meta());
			if (resource.links() != null) {
				resource.links().check();
			}
			for (Map.Entry<String, Document> entry : resource.relationships().entrySet()) {
				if (entry.getValue() != null) {
					document(entry.getValue());
				}
			}
		}

		void error(ErrorObject error) {
			checkMeta(error.meta());
			ErrorLinks links = error.links();
			if (links != null) {
				checkLinkValue(links.about());
				checkLinkValue(links.type());
			}
		}
	}

	static String typeName(Object value) {
		Class<?> c = value.getClass();
		return c.getSimpleName().isEmpty() ? c.getName() : c.getSimpleName();
	}
}
