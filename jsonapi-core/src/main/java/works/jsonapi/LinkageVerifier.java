package works.jsonapi;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonapi.exceptions.PartialLinkageException;

/**
 * Checks that a compound document is fully linked: every {@link Document#included() included}
 * resource must be reachable from the primary data by following relationships,
 * possibly through other included resources.
 * <p>
 * Nodes of the graph are resource identities; edges are the relationships
 * declared by included resources. Relationships that point at resources
 * outside the document are fine; they just lead nowhere.
 * Cycles are fine too.
 */
public final class LinkageVerifier {
	private LinkageVerifier() { }

	/**
	 * @param aliasRelationships if true, every relationship placeholder that names an
	 * included resource is overwritten in place with that resource's fields
	 * (see {@link ResourceObject#copyFrom}). This is the only way this method modifies the document.
	 * @throws PartialLinkageException if some included resources are unreachable
	 */
	public static void verify(Document document, boolean aliasRelationships) {
		if (document.included().isEmpty()) {
			return;
		}

		Map<String, IncludeNode> includeGraph = new HashMap<>();
		for (ResourceObject included : document.included()) {
			includeGraph.put(included.identity(), new IncludeNode(included, relatedTo(included)));
		}

		Deque<ResourceObject> pending = new ArrayDeque<>();
		for (ResourceObject primary : document.data().resources()) {
			pushAll(pending, relatedTo(primary));
		}

		// Depth-first, in the same order a recursive walk would take
		while (!pending.isEmpty()) {
			ResourceObject placeholder = pending.pop();
			IncludeNode node = includeGraph.get(placeholder.identity());
			if (node == null) {
				continue;
			}
			if (aliasRelationships && placeholder != node.included) {
				placeholder.copyFrom(node.included);
			}
			if (!node.visited) {
				node.visited = true;
				pushAll(pending, node.relatedTo);
			}
		}

		Set<String> invalidResources = new LinkedHashSet<>();
		includeGraph.forEach((identity, node) -> {
			if (!node.visited) {
				invalidResources.add(identity);
			}
		});
		if (!invalidResources.isEmpty()) {
			LOGGER.debug("{} of {} included resources are unreachable from primary data", invalidResources.size(), includeGraph.size());
			throw new PartialLinkageException(invalidResources);
		}
		LOGGER.debug("All {} included resources are linked to primary data", includeGraph.size());
	}

	/**
	 * @return the primary data of all of {@code resource}'s relationships, flattened
	 */
	private static List<ResourceObject> relatedTo(ResourceObject resource) {
		List<ResourceObject> result = new ArrayList<>();
		for (Document relationship : resource.relationships().values()) {
			if (relationship != null) {
				result.addAll(relationship.data().resources());
			}
		}
		return result;
	}

	private static void pushAll(Deque<ResourceObject> stack, List<ResourceObject> resources) {
		ListIterator<ResourceObject> iter = resources.listIterator(resources.size());
		while (iter.hasPrevious()) {
			stack.push(iter.previous());
		}
	}

	private static final class IncludeNode {
		final ResourceObject included;
		final List<ResourceObject> relatedTo;
		boolean visited = false;

		IncludeNode(ResourceObject included, List<ResourceObject> relatedTo) {
			this.included = included;
			this.relatedTo = relatedTo;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LinkageVerifier.class);
}
