package works.jsonapi;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The {@code data} member of a {@link Document}: nothing, one resource, or many.
 * <p>
 * Decoding decides the case once, from the shape of the {@code data} member on the wire,
 * and encoding writes back the same shape.
 * In particular, {@link Many} with no resources is written as {@code []}, not {@code null}.
 */
public sealed interface PrimaryData permits PrimaryData.None, PrimaryData.One, PrimaryData.Many {

	enum Shape { NONE, ONE, MANY }

	Shape shape();

	/**
	 * @return the resources in this primary data, in order; empty for {@link None}
	 */
	List<ResourceObject> resources();

	default boolean isEmpty() {
		return resources().isEmpty();
	}

	static PrimaryData none() {
		return None.INSTANCE;
	}

	static PrimaryData one(ResourceObject resource) {
		return new One(resource);
	}

	static PrimaryData many(List<ResourceObject> resources) {
		return new Many(resources);
	}

	record None() implements PrimaryData {
		static final None INSTANCE = new None();

		@Override
		public Shape shape() {
			return Shape.NONE;
		}

		@Override
		public List<ResourceObject> resources() {
			return List.of();
		}
	}

	record One(ResourceObject resource) implements PrimaryData {
		public One {
			requireNonNull(resource);
		}

		@Override
		public Shape shape() {
			return Shape.ONE;
		}

		@Override
		public List<ResourceObject> resources() {
			return List.of(resource);
		}
	}

	record Many(List<ResourceObject> resources) implements PrimaryData {
		public Many {
			resources = List.copyOf(resources);
		}

		@Override
		public Shape shape() {
			return Shape.MANY;
		}
	}
}
