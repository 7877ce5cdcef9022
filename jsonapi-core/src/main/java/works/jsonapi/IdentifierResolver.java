package works.jsonapi;

import java.lang.reflect.InvocationTargetException;
import java.util.List;
import works.jsonapi.exceptions.JsonApiTypeException;

/**
 * Converts resource identifiers between their native type and their wire form,
 * which is always a string.
 * <p>
 * Identifiers need not be strings. Their types opt in to custom handling by
 * implementing {@link MarshalIdentifier} and {@link UnmarshalIdentifier}.
 */
public final class IdentifierResolver {
	static final List<String> MARSHAL_CAPABILITIES = List.of(
		MarshalIdentifier.class.getSimpleName(),
		String.class.getSimpleName(),
		"toString");
	static final List<String> UNMARSHAL_CAPABILITIES = List.of(
		UnmarshalIdentifier.class.getSimpleName(),
		String.class.getSimpleName());

	private IdentifierResolver() { }

	/**
	 * Uses the first of these that applies:
	 * <ol>
	 *     <li>{@link MarshalIdentifier#marshalId()}</li>
	 *     <li>the value itself, if it's a {@link String}</li>
	 *     <li>{@link Object#toString()}, if the value's class overrides it</li>
	 * </ol>
	 * A null value has no identifier, which is written as the empty string.
	 *
	 * @throws JsonApiTypeException if none apply
	 */
	public static String marshal(Object value) {
		if (value == null) {
			return "";
		} else if (value instanceof MarshalIdentifier mi) {
			return mi.marshalId();
		} else if (value instanceof String s) {
			return s;
		} else if (overridesToString(value.getClass())) {
			return value.toString();
		} else {
			throw new JsonApiTypeException(value.getClass().getName(), MARSHAL_CAPABILITIES);
		}
	}

	/**
	 * Populates an existing identifier object from {@code id}.
	 *
	 * @throws JsonApiTypeException if {@code target} is not an {@link UnmarshalIdentifier}
	 */
	public static void unmarshalInto(Object target, String id) {
		if (target instanceof UnmarshalIdentifier ui) {
			ui.unmarshalId(id);
		} else {
			String actual = target == null ? "null" : target.getClass().getName();
			throw new JsonApiTypeException(actual, UNMARSHAL_CAPABILITIES);
		}
	}

	/**
	 * Produces a value of {@code slotType} from {@code id}, using the first of these that applies:
	 * <ol>
	 *     <li>if {@code slotType} implements {@link UnmarshalIdentifier}, a new instance
	 *     created with its public no-argument constructor, populated by {@link UnmarshalIdentifier#unmarshalId}</li>
	 *     <li>if a {@link String} fits in {@code slotType}, such as {@link CharSequence} or {@link Object}, {@code id} itself</li>
	 * </ol>
	 *
	 * @throws JsonApiTypeException if neither applies, or the instance can't be created
	 */
	public static <T> T unmarshal(String id, Class<T> slotType) {
		if (UnmarshalIdentifier.class.isAssignableFrom(slotType)) {
			T result = newInstance(slotType);
			((UnmarshalIdentifier) result).unmarshalId(id);
			return result;
		} else if (slotType.isAssignableFrom(String.class)) {
			return slotType.cast(id);
		} else {
			throw new JsonApiTypeException(slotType.getName(), UNMARSHAL_CAPABILITIES);
		}
	}

	private static <T> T newInstance(Class<T> slotType) {
		try {
			return slotType.getConstructor().newInstance();
		} catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
			throw new JsonApiTypeException(slotType.getName(), UNMARSHAL_CAPABILITIES, e);
		} catch (InvocationTargetException e) {
			throw new JsonApiTypeException(slotType.getName(), UNMARSHAL_CAPABILITIES, e.getCause());
		}
	}

	private static boolean overridesToString(Class<?> c) {
		try {
			return c.getMethod("toString").getDeclaringClass() != Object.class;
		} catch (NoSuchMethodException e) {
			throw new AssertionError("Every class has toString", e);
		}
	}
}
