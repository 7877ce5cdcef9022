package works.jsonapi;

import java.util.Objects;
import works.jsonapi.exceptions.JsonApiTypeException;
import works.jsonapi.exceptions.MissingLinkFieldsException;

import static works.jsonapi.Validation.checkLinkValue;

/**
 * A links object, used at the top level of a document and on resource objects.
 * <p>
 * {@link #self()} and {@link #related()} each hold either a {@link String},
 * a {@link LinkObject}, or null.
 * The remaining fields are pagination links.
 */
public final class Link {
	private Object self;
	private Object related;

	private String first;
	private String last;
	private String next;
	private String previous;

	public Link() {
	}

	public Link(Object self, Object related) {
		this.self = self;
		this.related = related;
	}

	public static Link ofSelf(String href) {
		return new Link(href, null);
	}

	public static Link ofRelated(String href) {
		return new Link(null, href);
	}

	/**
	 * Ensures at least one of {@code self} and {@code related} is non-empty,
	 * and nulls out the other one if it's empty so it won't be written.
	 *
	 * @throws MissingLinkFieldsException if both are empty
	 * @throws JsonApiTypeException if either has a type other than {@link String} or {@link LinkObject}
	 */
	public void check() {
		boolean selfIsEmpty = checkLinkValue(self);
		boolean relatedIsEmpty = checkLinkValue(related);
		if (selfIsEmpty && relatedIsEmpty) {
			throw new MissingLinkFieldsException();
		} else if (selfIsEmpty) {
			self = null;
		} else if (relatedIsEmpty) {
			related = null;
		}
	}

	public Object self() {
		return self;
	}

	public Link self(Object self) {
		this.self = self;
		return this;
	}

	public Object related() {
		return related;
	}

	public Link related(Object related) {
		this.related = related;
		return this;
	}

	public String first() {
		return first;
	}

	public Link first(String first) {
		this.first = first;
		return this;
	}

	public String last() {
		return last;
	}

	public Link last(String last) {
		this.last = last;
		return this;
	}

	public String next() {
		return next;
	}

	public Link next(String next) {
		this.next = next;
		return this;
	}

	public String previous() {
		return previous;
	}

	public Link previous(String previous) {
		this.previous = previous;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Link that = (Link) o;
		return Objects.equals(self, that.self)
			&& Objects.equals(related, that.related)
			&& Objects.equals(first, that.first)
			&& Objects.equals(last, that.last)
			&& Objects.equals(next, that.next)
			&& Objects.equals(previous, that.previous);
	}

	@Override
	public int hashCode() {
		return Objects.hash(self, related, first, last, next, previous);
	}

	@Override
	public String toString() {
		return "Link(self=" + self + ", related=" + related
			+ ", first=" + first + ", last=" + last
			+ ", next=" + next + ", previous=" + previous + ")";
	}
}
