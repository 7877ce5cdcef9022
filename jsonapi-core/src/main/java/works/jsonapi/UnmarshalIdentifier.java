package works.jsonapi;

/**
 * Implemented by identifier types that can be populated from their wire form.
 *
 * @see IdentifierResolver#unmarshalInto
 */
public interface UnmarshalIdentifier {
	/**
	 * Any exception thrown from here propagates to the caller of the decoding operation unchanged.
	 */
	void unmarshalId(String id);
}
