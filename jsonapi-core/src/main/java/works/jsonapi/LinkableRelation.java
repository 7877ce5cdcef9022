package works.jsonapi;

/**
 * Implemented by model objects that supply the {@code links} member of their relationships.
 */
public interface LinkableRelation {
	/**
	 * @return the links for the named relationship, or null if it has none
	 */
	Link linkRelation(String relation);
}
