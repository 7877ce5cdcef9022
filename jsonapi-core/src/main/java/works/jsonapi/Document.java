package works.jsonapi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A JSON:API document: the top-level envelope, and also the value of every relationship.
 * <p>
 * If {@link #errors()} is non-empty, the document is an error document
 * and its {@link #data() primary data} is not written.
 */
public final class Document {
	private PrimaryData data = PrimaryData.none();
	private Object meta;
	private JsonApiObject jsonapi;
	private List<ErrorObject> errors = new ArrayList<>();
	private Link links;
	private List<ResourceObject> included = new ArrayList<>();

	public Document() {
	}

	public Document(PrimaryData data) {
		this.data = requireNonNull(data);
	}

	public static Document one(ResourceObject resource) {
		return new Document(PrimaryData.one(resource));
	}

	public static Document many(List<ResourceObject> resources) {
		return new Document(PrimaryData.many(resources));
	}

	public static Document many(ResourceObject... resources) {
		return many(List.of(resources));
	}

	/**
	 * @return true if there is no primary data: either {@link PrimaryData.None none},
	 * or {@link PrimaryData.Many many} with no resources.
	 */
	public boolean isEmpty() {
		return data.isEmpty();
	}

	public boolean isCompound() {
		return !included.isEmpty();
	}

	public PrimaryData data() {
		return data;
	}

	public Document data(PrimaryData data) {
		this.data = requireNonNull(data);
		return this;
	}

	public Object meta() {
		return meta;
	}

	public Document meta(Object meta) {
		this.meta = meta;
		return this;
	}

	public JsonApiObject jsonapi() {
		return jsonapi;
	}

	public Document jsonapi(JsonApiObject jsonapi) {
		this.jsonapi = jsonapi;
		return this;
	}

	public List<ErrorObject> errors() {
		return errors;
	}

	public Document errors(List<ErrorObject> errors) {
		this.errors = new ArrayList<>(errors);
		return this;
	}

	public Link links() {
		return links;
	}

	public Document links(Link links) {
		this.links = links;
		return this;
	}

	public List<ResourceObject> included() {
		return included;
	}

	public Document included(List<ResourceObject> included) {
		this.included = new ArrayList<>(included);
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Document that = (Document) o;
		return Objects.equals(data, that.data)
			&& Objects.equals(meta, that.meta)
			&& Objects.equals(jsonapi, that.jsonapi)
			&& Objects.equals(errors, that.errors)
			&& Objects.equals(links, that.links)
			&& Objects.equals(included, that.included);
	}

	@Override
	public int hashCode() {
		return Objects.hash(data.shape(), meta, jsonapi);
	}

	@Override
	public String toString() {
		return "Document(data=" + data + ", errors=" + errors.size() + ", included=" + included.size() + ")";
	}
}
