package works.jsonapi;

/**
 * The object form of a link: an {@code href} with optional {@code meta}.
 *
 * @param href the link's URL; a link object with an empty href counts as absent
 * @param meta non-standard information about the link; must be map-like if present
 */
public record LinkObject(String href, Object meta) {
	public static LinkObject of(String href) {
		return new LinkObject(href, null);
	}

	public boolean isEmpty() {
		return href == null || href.isEmpty();
	}
}
