package works.jsonapi.jackson;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonapi.Document;
import works.jsonapi.ErrorObject;
import works.jsonapi.ErrorObject.ErrorLinks;
import works.jsonapi.JsonApiObject;
import works.jsonapi.Link;
import works.jsonapi.LinkObject;
import works.jsonapi.ResourceObject;
import works.jsonapi.Validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonApiSerializerTest {
	private ObjectMapper jsonApiMapper;

	/**
	 * Not configured by JsonApiSerializer. Only for checking the properties of the generated JSON.
	 */
	private ObjectMapper plainMapper;

	@BeforeEach
	void setUpJackson() {
		jsonApiMapper = JsonMapper.builder()
			.addModule(new JsonApiSerializer().moduleFor(JsonApiSettings.DEFAULT))
			.build();
		plainMapper = JsonMapper.builder().build();
	}

	@Test
	void resourceObject_membersInOrder() {
		ResourceObject resource = new ResourceObject("articles", "1")
			.attribute("title", "Hello")
			.relationship("author", Document.one(new ResourceObject("people", "9")))
			.meta(Map.of("m", true))
			.links(Link.ofSelf("/articles/1"));

		JsonNode node = tree(Document.one(resource)).get("data");

		assertEquals(List.of("id", "type", "attributes", "relationships", "meta", "links"), names(node));
		assertEquals("Hello", node.get("attributes").get("title").asString());
		assertEquals("/articles/1", node.get("links").get("self").asString());
	}

	@Test
	void emptyIdAndEmptyMembers_omitted() {
		JsonNode node = tree(Document.one(new ResourceObject("articles", ""))).get("data");
		assertEquals(List.of("type"), names(node));
	}

	@Test
	void relationshipData_isWrittenInFull() {
		ResourceObject author = new ResourceObject("people", "9")
			.attribute("name", "Dan")
			.relationship("employer", Document.one(new ResourceObject("companies", "3")))
			.meta(Map.of("role", "lead"))
			.links(Link.ofSelf("/people/9"));
		ResourceObject article = new ResourceObject("articles", "1")
			.relationship("author", Document.one(author).links(Link.ofRelated("/articles/1/author")));

		JsonNode relationship = tree(Document.one(article)).get("data").get("relationships").get("author");

		assertEquals(List.of("id", "type", "attributes", "relationships", "meta", "links"), names(relationship.get("data")));
		assertEquals("/articles/1/author", relationship.get("links").get("related").asString());
	}

	@Test
	void resourceReachedThroughItself_isWrittenAsIdentifier() {
		ResourceObject node = new ResourceObject("nodes", "1")
			.attribute("label", "loop")
			.meta(Map.of("depth", 0));
		node.relationship("self", Document.one(node));

		JsonNode inner = tree(Document.one(node)).get("data").get("relationships").get("self").get("data");

		assertEquals(List.of("id", "type", "meta"), names(inner));
	}

	@Test
	void includedResources_areComplete() {
		ResourceObject author = new ResourceObject("people", "9").attribute("name", "Dan");
		Document document = Document.one(new ResourceObject("articles", "1")
				.relationship("author", Document.one(new ResourceObject("people", "9"))))
			.included(List.of(author));

		JsonNode included = tree(document).get("included");

		assertTrue(included.isArray());
		assertEquals("Dan", included.get(0).get("attributes").get("name").asString());
	}

	@Test
	void documentMembers() {
		Document document = Document.many(new ResourceObject("a", "1"))
			.meta(Map.of("total", 1))
			.jsonapi(JsonApiObject.version(JsonApiObject.VERSION_1_0))
			.links(Link.ofSelf("/a").first("/a?page=1").last("/a?page=3"));

		JsonNode node = tree(document);

		assertEquals(List.of("data", "meta", "jsonapi", "links"), names(node));
		assertTrue(node.get("data").isArray());
		assertEquals("1.0", node.get("jsonapi").get("version").asString());
		assertEquals(List.of("self", "first", "last"), names(node.get("links")));
	}

	@Test
	void linkObject() {
		Document document = new Document()
			.links(new Link(new LinkObject("/a", Map.of("count", 2)), LinkObject.of("/b")));

		JsonNode links = tree(document).get("links");

		assertEquals("/a", links.get("self").get("href").asString());
		assertEquals(2, links.get("self").get("meta").get("count").asInt());
		assertEquals(List.of("href"), names(links.get("related")));
	}

	@Test
	void errorObject() {
		Document document = new Document().errors(List.of(ErrorObject.builder()
			.id("e1")
			.links(new ErrorLinks("/errors/e1", null))
			.status("422")
			.code("invalid")
			.detail("Title is too long")
			.source(new ErrorObject.ErrorSource("/data/attributes/title", null, null))
			.build()));

		JsonNode node = tree(document);

		assertFalse(node.has("data"));
		JsonNode error = node.get("errors").get(0);
		assertEquals(List.of("id", "links", "status", "code", "detail", "source"), names(error));
		assertEquals(List.of("about"), names(error.get("links")));
		assertEquals(List.of("pointer"), names(error.get("source")));
	}

	@Test
	void deserialize_resourceObjectDirectly() {
		ResourceObject resource = jsonApiMapper.readValue("{\"type\":\"a\",\"id\":\"1\",\"attributes\":{\"x\":[1,2]}}", ResourceObject.class);
		assertEquals(new ResourceObject("a", "1").attribute("x", List.of(1, 2)), resource);
	}

	private JsonNode tree(Document document) {
		Validation.prepareForEncoding(document);
		return plainMapper.readTree(jsonApiMapper.writeValueAsString(document));
	}

	private static List<String> names(JsonNode node) {
		return node.properties().stream().map(Map.Entry::getKey).toList();
	}
}
