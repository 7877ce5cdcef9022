package works.jsonapi;

/**
 * Implemented by model objects that supply the {@code links} member of their resource object.
 */
public interface Linkable {
	Link link();
}
