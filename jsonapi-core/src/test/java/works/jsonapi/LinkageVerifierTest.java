package works.jsonapi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.jsonapi.exceptions.PartialLinkageException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkageVerifierTest {

	@Test
	void noIncluded_isTriviallyLinked() {
		assertDoesNotThrow(() -> LinkageVerifier.verify(new Document(), true));
		assertDoesNotThrow(() -> LinkageVerifier.verify(Document.one(new ResourceObject("a", "1")), true));
	}

	@Test
	void directRelationship_isLinked() {
		Document document = Document.one(resource("a", "1", placeholder("b", "2")))
			.included(List.of(new ResourceObject("b", "2")));
		assertDoesNotThrow(() -> LinkageVerifier.verify(document, false));
	}

	@Test
	void unreferencedIncluded_isOrphaned() {
		Document document = Document.one(resource("a", "1", placeholder("b", "2")))
			.included(List.of(new ResourceObject("b", "2"), new ResourceObject("c", "3")));
		PartialLinkageException e = assertThrows(PartialLinkageException.class, () -> LinkageVerifier.verify(document, false));
		assertEquals(Set.of("{Type: c, ID: 3}"), e.invalidResources());
	}

	@Test
	void orphanReferencedOnlyByOrphan_isOrphaned() {
		Document document = Document.one(new ResourceObject("a", "1"))
			.included(List.of(
				resource("c", "3", placeholder("d", "4")),
				new ResourceObject("d", "4")));
		PartialLinkageException e = assertThrows(PartialLinkageException.class, () -> LinkageVerifier.verify(document, false));
		assertThat(e.invalidResources(), containsInAnyOrder("{Type: c, ID: 3}", "{Type: d, ID: 4}"));
	}

	@Test
	void transitiveRelationship_isLinked() {
		Document document = Document.one(resource("a", "1", placeholder("b", "2")))
			.included(List.of(
				new ResourceObject("c", "3"),
				resource("b", "2", placeholder("c", "3"))));
		assertDoesNotThrow(() -> LinkageVerifier.verify(document, false));
	}

	@Test
	void relationshipOutsideDocument_isNotAnError() {
		Document document = Document.one(resource("a", "1", placeholder("b", "2"), placeholder("x", "99")))
			.included(List.of(resource("b", "2", placeholder("y", "100"))));
		assertDoesNotThrow(() -> LinkageVerifier.verify(document, true));
	}

	@Test
	void emptyRelationships_contributeNoEdges() {
		ResourceObject primary = new ResourceObject("a", "1")
			.relationship("nothing", new Document())
			.relationship("none", Document.many());
		Document document = Document.one(primary)
			.included(List.of(new ResourceObject("b", "2")));
		PartialLinkageException e = assertThrows(PartialLinkageException.class, () -> LinkageVerifier.verify(document, false));
		assertEquals(Set.of("{Type: b, ID: 2}"), e.invalidResources());
	}

	@Test
	void manyPrimaryResources_allSeed() {
		Document document = Document.many(
				resource("a", "1", placeholder("b", "2")),
				resource("a", "2", placeholder("c", "3")))
			.included(List.of(new ResourceObject("b", "2"), new ResourceObject("c", "3")));
		assertDoesNotThrow(() -> LinkageVerifier.verify(document, false));
	}

	@Test
	void mutualReferences_terminateAndAlias() {
		ResourceObject fromPrimary = placeholder("a", "2");
		ResourceObject aToB = placeholder("b", "2");
		ResourceObject bToA = placeholder("a", "2");
		ResourceObject a = resource("a", "2", aToB).attribute("name", "A");
		ResourceObject b = resource("b", "2", bToA).attribute("name", "B");
		Document document = Document.one(resource("p", "1", fromPrimary))
			.included(List.of(a, b));

		LinkageVerifier.verify(document, true);

		assertEquals("A", fromPrimary.attributes().get("name"));
		assertEquals("B", aToB.attributes().get("name"));
		assertEquals("A", bToA.attributes().get("name"));
		assertSame(a.relationships(), fromPrimary.relationships());
		assertSame(b.relationships(), aToB.relationships());
		assertSame(a.relationships(), bToA.relationships());
	}

	@Test
	void selfReference_terminates() {
		ResourceObject selfPlaceholder = placeholder("a", "2");
		ResourceObject a = resource("a", "2", selfPlaceholder).attribute("name", "A");
		Document document = Document.one(resource("p", "1", placeholder("a", "2")))
			.included(List.of(a));

		LinkageVerifier.verify(document, true);

		assertEquals("A", selfPlaceholder.attributes().get("name"));
	}

	@Test
	void withoutAliasing_placeholdersUntouched() {
		ResourceObject placeholder = placeholder("b", "2");
		Document document = Document.one(resource("a", "1", placeholder))
			.included(List.of(new ResourceObject("b", "2").attribute("title", "full body").meta(Map.of("k", "v"))));

		LinkageVerifier.verify(document, false);

		assertTrue(placeholder.attributes().isEmpty());
		assertNull(placeholder.meta());
	}

	@Test
	void aliasing_copiesEveryField() {
		ResourceObject placeholder = placeholder("b", "2");
		Link links = Link.ofSelf("/b/2");
		ResourceObject included = new ResourceObject("b", "2")
			.attribute("title", "full body")
			.meta(Map.of("k", "v"))
			.links(links);
		Document document = Document.one(resource("a", "1", placeholder))
			.included(List.of(included));

		LinkageVerifier.verify(document, true);

		assertEquals(included, placeholder);
		assertSame(links, placeholder.links());
	}

	@Test
	void longChain_doesNotExhaustStack() {
		int length = 50_000;
		List<ResourceObject> included = new ArrayList<>();
		for (int i = 0; i < length; i++) {
			ResourceObject node = new ResourceObject("node", String.valueOf(i));
			if (i + 1 < length) {
				node.relationship("next", Document.one(placeholder("node", String.valueOf(i + 1))));
			}
			included.add(node);
		}
		Document document = Document.one(resource("head", "h", placeholder("node", "0")))
			.included(included);
		assertDoesNotThrow(() -> LinkageVerifier.verify(document, true));
	}

	/**
	 * The outcome can't depend on the order in which resources are listed.
	 */
	@ParameterizedTest
	@MethodSource("includedOrders")
	void result_isIndependentOfIncludedOrder(List<Integer> order) {
		List<ResourceObject> resources = List.of(
			resource("b", "1", placeholder("c", "1")),
			resource("c", "1", placeholder("b", "1"), placeholder("d", "1")),
			new ResourceObject("d", "1"),
			resource("e", "1", placeholder("b", "1")),
			new ResourceObject("f", "1"));
		List<ResourceObject> included = new ArrayList<>();
		order.forEach(i -> included.add(resources.get(i)));
		Document document = Document.one(resource("a", "1", placeholder("b", "1")))
			.included(included);

		PartialLinkageException e = assertThrows(PartialLinkageException.class, () -> LinkageVerifier.verify(document, false));
		assertEquals(Set.of("{Type: e, ID: 1}", "{Type: f, ID: 1}"), e.invalidResources());
	}

	static Stream<Arguments> includedOrders() {
		List<Integer> forward = List.of(0, 1, 2, 3, 4);
		List<Integer> backward = new ArrayList<>(forward);
		Collections.reverse(backward);
		return Stream.of(
			Arguments.of(forward),
			Arguments.of(backward),
			Arguments.of(List.of(2, 4, 0, 3, 1))
		);
	}

	private static ResourceObject placeholder(String type, String id) {
		return new ResourceObject(type, id);
	}

	/**
	 * A resource with a single to-many relationship called "related" holding the given placeholders.
	 */
	private static ResourceObject resource(String type, String id, ResourceObject... related) {
		return new ResourceObject(type, id).relationship("related", Document.many(related));
	}
}
