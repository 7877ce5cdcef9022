package works.jsonapi.exceptions;

import java.util.Set;

/**
 * A compound document includes resources that can't be reached
 * from its primary data by following relationships.
 * <p>
 * {@link #invalidResources()} has no meaningful order.
 */
public final class PartialLinkageException extends JsonApiException {
	private final Set<String> invalidResources;

	public PartialLinkageException(Set<String> invalidResources) {
		super("Included resources are not linked to primary data: " + invalidResources);
		this.invalidResources = Set.copyOf(invalidResources);
	}

	public Set<String> invalidResources() {
		return invalidResources;
	}
}
