package works.jsonapi;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The addressable unit of a JSON:API document.
 * <p>
 * A relationship's value is itself a {@link Document} whose primary data holds
 * the related resources, usually with nothing but {@link #type()} and {@link #id()} set.
 * Those thin placeholders can be filled in from {@link Document#included() included}
 * resources by {@link LinkageVerifier}.
 */
public final class ResourceObject {
	private String type;
	private String id;
	private Map<String, Object> attributes = new LinkedHashMap<>();
	private Map<String, Document> relationships = new LinkedHashMap<>();
	private Object meta;
	private Link links;

	public ResourceObject() {
	}

	public ResourceObject(String type, String id) {
		this.type = type;
		this.id = id;
	}

	/**
	 * @return the {@code "{Type: T, ID: I}"} string identifying this resource within a document
	 */
	public String identity() {
		return identity(type, id);
	}

	public static String identity(String type, String id) {
		return "{Type: " + type + ", ID: " + (id == null ? "" : id) + "}";
	}

	/**
	 * Overwrites every field of this object with the corresponding field of {@code other}.
	 * The copy is shallow: afterward, both objects share the same attribute and relationship maps.
	 */
	public void copyFrom(ResourceObject other) {
		this.type = other.type;
		this.id = other.id;
		this.attributes = other.attributes;
		this.relationships = other.relationships;
		this.meta = other.meta;
		this.links = other.links;
	}

	public String type() {
		return type;
	}

	public ResourceObject type(String type) {
		this.type = type;
		return this;
	}

	public String id() {
		return id;
	}

	public ResourceObject id(String id) {
		this.id = id;
		return this;
	}

	public Map<String, Object> attributes() {
		return attributes;
	}

	public ResourceObject attribute(String name, Object value) {
		attributes.put(name, value);
		return this;
	}

	public ResourceObject attributes(Map<String, Object> attributes) {
		this.attributes = new LinkedHashMap<>(attributes);
		return this;
	}

	public Map<String, Document> relationships() {
		return relationships;
	}

	public ResourceObject relationship(String name, Document relationship) {
		relationships.put(name, relationship);
		return this;
	}

	public ResourceObject relationships(Map<String, Document> relationships) {
		this.relationships = new LinkedHashMap<>(relationships);
		return this;
	}

	public Object meta() {
		return meta;
	}

	public ResourceObject meta(Object meta) {
		this.meta = meta;
		return this;
	}

	public Link links() {
		return links;
	}

	public ResourceObject links(Link links) {
		this.links = links;
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		ResourceObject that = (ResourceObject) o;
		return Objects.equals(type, that.type)
			&& Objects.equals(id, that.id)
			&& Objects.equals(attributes, that.attributes)
			&& Objects.equals(relationships, that.relationships)
			&& Objects.equals(meta, that.meta)
			&& Objects.equals(links, that.links);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, id);
	}

	@Override
	public String toString() {
		return "ResourceObject" + identity();
	}
}
