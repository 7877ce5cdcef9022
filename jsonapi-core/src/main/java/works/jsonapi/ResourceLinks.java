package works.jsonapi;

import java.util.Optional;

/**
 * Looks up the links a model object offers through {@link Linkable} and {@link LinkableRelation}.
 */
public final class ResourceLinks {
	private ResourceLinks() { }

	public static Optional<Link> forResource(Object model) {
		if (model instanceof Linkable linkable) {
			return Optional.ofNullable(linkable.link());
		}
		return Optional.empty();
	}

	public static Optional<Link> forRelation(Object model, String relation) {
		if (model instanceof LinkableRelation linkable) {
			return Optional.ofNullable(linkable.linkRelation(relation));
		}
		return Optional.empty();
	}
}
