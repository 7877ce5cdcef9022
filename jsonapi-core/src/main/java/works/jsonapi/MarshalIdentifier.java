package works.jsonapi;

/**
 * Implemented by identifier types that choose their own wire form.
 *
 * @see IdentifierResolver#marshal
 */
public interface MarshalIdentifier {
	String marshalId();
}
