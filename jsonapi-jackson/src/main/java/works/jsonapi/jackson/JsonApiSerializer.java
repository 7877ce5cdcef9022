package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import tools.jackson.databind.type.TypeFactory;
import works.jsonapi.Document;
import works.jsonapi.DocumentShape;
import works.jsonapi.ErrorObject;
import works.jsonapi.ErrorObject.ErrorLinks;
import works.jsonapi.ErrorObject.ErrorSource;
import works.jsonapi.JsonApiObject;
import works.jsonapi.Link;
import works.jsonapi.LinkObject;
import works.jsonapi.PrimaryData;
import works.jsonapi.PrimaryData.Shape;
import works.jsonapi.ResourceObject;
import works.jsonapi.Validation;
import works.jsonapi.exceptions.MalformedResourceException;

import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Provides JSON:API serialization/deserialization of {@link Document} and its parts using Jackson.
 * <p>
 * The serializers write whatever they're given.
 * Call {@link Validation#prepareForEncoding} first, as {@link JsonApiCodec} does,
 * so that invalid documents are rejected before any output is produced
 * and links are normalized.
 */
public final class JsonApiSerializer {
	private static final TypeFactory typeFactory = TypeFactory.createDefaultInstance();

	public JsonApiSerializer() {
	}

	public JsonApiJacksonModule moduleFor(JsonApiSettings settings) {
		return new JsonApiJacksonModule() {
			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new JsonApiSerializers());
				context.addDeserializers(new JsonApiDeserializers(settings));
			}
		};
	}

	private static final class JsonApiSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (Document.class.isAssignableFrom(theClass)) {
				return documentSerializer();
			} else if (ResourceObject.class.isAssignableFrom(theClass)) {
				return resourceObjectSerializer();
			} else if (Link.class.isAssignableFrom(theClass)) {
				return linkSerializer();
			} else if (LinkObject.class.isAssignableFrom(theClass)) {
				return linkObjectSerializer();
			} else if (JsonApiObject.class.isAssignableFrom(theClass)) {
				return jsonApiObjectSerializer();
			} else if (ErrorObject.class.isAssignableFrom(theClass)) {
				return errorObjectSerializer();
			} else {
				return null;
			}
		}

		private ValueSerializer<Document> documentSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Document value, JsonGenerator gen, SerializationContext serializers) {
					writeDocument(value, newWritingSet(), gen, serializers);
				}
			};
		}

		private ValueSerializer<ResourceObject> resourceObjectSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(ResourceObject value, JsonGenerator gen, SerializationContext serializers) {
					writeResource(value, newWritingSet(), gen, serializers);
				}
			};
		}

		private ValueSerializer<Link> linkSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Link value, JsonGenerator gen, SerializationContext serializers) {
					writeLink(value, gen, serializers);
				}
			};
		}

		private ValueSerializer<LinkObject> linkObjectSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(LinkObject value, JsonGenerator gen, SerializationContext serializers) {
					writeLinkValue(value, gen, serializers);
				}
			};
		}

		private ValueSerializer<JsonApiObject> jsonApiObjectSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(JsonApiObject value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					gen.writeName("version");
					if (value.version() == null) {
						gen.writeNull();
					} else {
						gen.writeString(value.version());
					}
					writeIfPresent("meta", value.meta(), gen, serializers);
					gen.writeEndObject();
				}
			};
		}

		private ValueSerializer<ErrorObject> errorObjectSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(ErrorObject value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeStartObject();
					writeStringIfPresent("id", value.id(), gen);
					ErrorLinks links = value.links();
					if (links != null) {
						gen.writeName("links");
						gen.writeStartObject();
						writeLinkValueIfPresent("about", links.about(), gen, serializers);
						writeLinkValueIfPresent("type", links.type(), gen, serializers);
						gen.writeEndObject();
					}
					writeStringIfPresent("status", value.status(), gen);
					writeStringIfPresent("code", value.code(), gen);
					writeStringIfPresent("title", value.title(), gen);
					writeStringIfPresent("detail", value.detail(), gen);
					ErrorSource source = value.source();
					if (source != null) {
						gen.writeName("source");
						gen.writeStartObject();
						writeStringIfPresent("pointer", source.pointer(), gen);
						writeStringIfPresent("parameter", source.parameter(), gen);
						writeStringIfPresent("header", source.header(), gen);
						gen.writeEndObject();
					}
					writeIfPresent("meta", value.meta(), gen, serializers);
					gen.writeEndObject();
				}
			};
		}
	}

	/**
	 * @param writing the resources whose output is in progress.
	 * A resource reached again through its own relationships, as happens in an aliased graph
	 * with cycles, is written as a resource identifier object:
	 * just {@code type}, {@code id}, and {@code meta}.
	 */
	private static void writeDocument(Document document, Set<ResourceObject> writing, JsonGenerator gen, SerializationContext serializers) {
		gen.writeStartObject();

		// Errors and primary data are mutually exclusive
		if (document.errors().isEmpty()) {
			gen.writeName(DocumentShape.DATA);
			writePrimaryData(document.data(), writing, gen, serializers);
		}

		writeIfPresent("meta", document.meta(), gen, serializers);
		writeIfPresent("jsonapi", document.jsonapi(), gen, serializers);

		if (!document.errors().isEmpty()) {
			gen.writeName("errors");
			gen.writeStartArray();
			for (ErrorObject error : document.errors()) {
				writeValue(error, gen, serializers);
			}
			gen.writeEndArray();
		}

		if (document.links() != null) {
			gen.writeName("links");
			writeLink(document.links(), gen, serializers);
		}

		if (!document.included().isEmpty()) {
			gen.writeName("included");
			gen.writeStartArray();
			for (ResourceObject included : document.included()) {
				writeResource(included, writing, gen, serializers);
			}
			gen.writeEndArray();
		}

		gen.writeEndObject();
	}

	private static void writePrimaryData(PrimaryData data, Set<ResourceObject> writing, JsonGenerator gen, SerializationContext serializers) {
		switch (data.shape()) {
			case MANY:
				gen.writeStartArray();
				for (ResourceObject resource : data.resources()) {
					writeResource(resource, writing, gen, serializers);
				}
				gen.writeEndArray();
				break;
			case ONE:
				writeResource(((PrimaryData.One) data).resource(), writing, gen, serializers);
				break;
			case NONE:
				gen.writeNull();
				break;
		}
	}

	private static void writeResource(ResourceObject resource, Set<ResourceObject> writing, JsonGenerator gen, SerializationContext serializers) {
		boolean identifierOnly = !writing.add(resource);
		gen.writeStartObject();
		writeStringIfPresent("id", resource.id(), gen);
		gen.writeName("type");
		gen.writeString(resource.type());
		if (!identifierOnly) {
			if (!resource.attributes().isEmpty()) {
				gen.writeName("attributes");
				writeValue(resource.attributes(), gen, serializers);
			}
			if (!resource.relationships().isEmpty()) {
				gen.writeName("relationships");
				gen.writeStartObject();
				for (Entry<String, Document> entry : resource.relationships().entrySet()) {
					if (entry.getValue() != null) {
						gen.writeName(entry.getKey());
						writeDocument(entry.getValue(), writing, gen, serializers);
					}
				}
				gen.writeEndObject();
			}
		}
		writeIfPresent("meta", resource.meta(), gen, serializers);
		if (!identifierOnly && resource.links() != null) {
			gen.writeName("links");
			writeLink(resource.links(), gen, serializers);
		}
		gen.writeEndObject();
		if (!identifierOnly) {
			writing.remove(resource);
		}
	}

	private static Set<ResourceObject> newWritingSet() {
		return Collections.newSetFromMap(new IdentityHashMap<>());
	}

	private static void writeLink(Link link, JsonGenerator gen, SerializationContext serializers) {
		gen.writeStartObject();
		writeLinkValueIfPresent("self", link.self(), gen, serializers);
		writeLinkValueIfPresent("related", link.related(), gen, serializers);
		writeStringIfPresent("first", link.first(), gen);
		writeStringIfPresent("last", link.last(), gen);
		writeStringIfPresent("next", link.next(), gen);
		writeStringIfPresent("previous", link.previous(), gen);
		gen.writeEndObject();
	}

	private static void writeLinkValueIfPresent(String name, Object linkValue, JsonGenerator gen, SerializationContext serializers) {
		if (linkValue != null) {
			gen.writeName(name);
			writeLinkValue(linkValue, gen, serializers);
		}
	}

	private static void writeLinkValue(Object linkValue, JsonGenerator gen, SerializationContext serializers) {
		if (linkValue instanceof LinkObject lo) {
			gen.writeStartObject();
			writeStringIfPresent("href", lo.href(), gen);
			writeIfPresent("meta", lo.meta(), gen, serializers);
			gen.writeEndObject();
		} else {
			writeValue(linkValue, gen, serializers);
		}
	}

	private static void writeStringIfPresent(String name, String value, JsonGenerator gen) {
		if (value != null && !value.isEmpty()) {
			gen.writeName(name);
			gen.writeString(value);
		}
	}

	private static void writeIfPresent(String name, Object value, JsonGenerator gen, SerializationContext serializers) {
		if (value != null) {
			gen.writeName(name);
			writeValue(value, gen, serializers);
		}
	}

	private static void writeValue(Object value, JsonGenerator gen, SerializationContext serializers) {
		if (value == null) {
			gen.writeNull();
		} else {
			ValueSerializer<Object> valueSerializer = serializers.findValueSerializer(value.getClass());
			valueSerializer.serialize(value, gen, serializers);
		}
	}

	private static final class JsonApiDeserializers extends Deserializers.Base {
		private final JsonApiSettings settings;

		JsonApiDeserializers(JsonApiSettings settings) {
			this.settings = settings;
		}

		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			return getValueDeserializer(type.getRawClass());
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return null != getValueDeserializer(valueType);
		}

		private ValueDeserializer<?> getValueDeserializer(Class<?> theClass) {
			if (Document.class.isAssignableFrom(theClass)) {
				return documentDeserializer();
			} else if (ResourceObject.class.isAssignableFrom(theClass)) {
				return resourceObjectDeserializer();
			} else if (Link.class.isAssignableFrom(theClass)) {
				return linkDeserializer();
			} else if (LinkObject.class.isAssignableFrom(theClass)) {
				return linkObjectDeserializer();
			} else if (JsonApiObject.class.isAssignableFrom(theClass)) {
				return jsonApiObjectDeserializer();
			} else if (ErrorObject.class.isAssignableFrom(theClass)) {
				return errorObjectDeserializer();
			} else {
				return null;
			}
		}

		/**
		 * The type of the {@code data} member depends on its shape, which we can't know
		 * until we've seen it. So we read the document twice: first generically, to
		 * {@link DocumentShape#sniff sniff} the shape, then again with {@code data}
		 * decoded according to that shape.
		 */
		private ValueDeserializer<Document> documentDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public Document deserialize(JsonParser p, DeserializationContext ctxt) {
					JsonNode tree = ctxt.readTree(p);
					if (!tree.isObject()) {
						throw new StreamReadException(p, "Expected a JSON object for a document; found " + tree.getNodeType());
					}

					Map<String, Object> generic = ctxt.readTreeAsValue(tree, GENERIC_MAP_TYPE);
					Shape shape = DocumentShape.sniff(generic);
					LOGGER.debug("Decoding document with primary data shape {}", shape);

					Document result = new Document();
					for (Entry<String, JsonNode> member : tree.properties()) {
						JsonNode value = member.getValue();
						switch (member.getKey()) {
							case DocumentShape.DATA:
								result.data(readPrimaryData(value, shape, p, ctxt));
								break;
							case "meta":
								result.meta(ctxt.readTreeAsValue(value, Object.class));
								break;
							case "jsonapi":
								result.jsonapi(ctxt.readTreeAsValue(value, JsonApiObject.class));
								break;
							case "errors":
								result.errors(readArray(value, ErrorObject.class, "errors", p, ctxt));
								break;
							case "links":
								result.links(ctxt.readTreeAsValue(value, Link.class));
								break;
							case "included":
								result.included(readArray(value, ResourceObject.class, "included", p, ctxt));
								break;
							default:
								if (settings.isFailOnUnknownMembers()) {
									throw new StreamReadException(p, "Unrecognized member in document: " + member.getKey());
								}
						}
					}
					return result;
				}
			};
		}

		private PrimaryData readPrimaryData(JsonNode data, Shape shape, JsonParser p, DeserializationContext ctxt) {
			switch (shape) {
				case MANY:
					return PrimaryData.many(readArray(data, ResourceObject.class, DocumentShape.DATA, p, ctxt));
				case ONE:
					return PrimaryData.one(ctxt.readTreeAsValue(data, ResourceObject.class));
				default:
					return PrimaryData.none();
			}
		}

		private ValueDeserializer<ResourceObject> resourceObjectDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public ResourceObject deserialize(JsonParser p, DeserializationContext ctxt) {
					ResourceObject result = new ResourceObject();
					expect(START_OBJECT, p);
					while (p.nextToken() != END_OBJECT) {
						p.nextValue();
						switch (p.currentName()) {
							case "id":
								result.id(readString(p));
								break;
							case "type":
								result.type(readString(p));
								break;
							case "attributes":
								result.attributes(readGenericMap(p, ctxt));
								break;
							case "relationships":
								result.relationships(readRelationships(p, ctxt));
								break;
							case "meta":
								result.meta(ctxt.readValue(p, Object.class));
								break;
							case "links":
								result.links(p.currentToken() == VALUE_NULL ? null : ctxt.readValue(p, Link.class));
								break;
							default:
								skipUnknownMember("resource object", p);
						}
					}
					if (result.type() == null || result.type().isEmpty()) {
						throw new MalformedResourceException("Resource object " + result.identity() + " has no type");
					}
					return result;
				}
			};
		}

		private Map<String, Document> readRelationships(JsonParser p, DeserializationContext ctxt) {
			Map<String, Document> result = new LinkedHashMap<>();
			if (p.currentToken() == VALUE_NULL) {
				return result;
			}
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				String name = p.currentName();
				if (p.currentToken() != VALUE_NULL) {
					Document relationship = ctxt.readValue(p, Document.class);
					if (result.put(name, relationship) != null) {
						throw new StreamReadException(p, "Relationship appears twice: \"" + name + "\"");
					}
				}
			}
			return result;
		}

		private ValueDeserializer<Link> linkDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public Link deserialize(JsonParser p, DeserializationContext ctxt) {
					Link result = new Link();
					expect(START_OBJECT, p);
					while (p.nextToken() != END_OBJECT) {
						p.nextValue();
						switch (p.currentName()) {
							case "self":
								result.self(readLinkValue(p, ctxt));
								break;
							case "related":
								result.related(readLinkValue(p, ctxt));
								break;
							case "first":
								result.first(readString(p));
								break;
							case "last":
								result.last(readString(p));
								break;
							case "next":
								result.next(readString(p));
								break;
							case "prev":
							case "previous":
								result.previous(readString(p));
								break;
							default:
								// Links objects are open-ended
								p.skipChildren();
						}
					}
					return result;
				}
			};
		}

		private ValueDeserializer<LinkObject> linkObjectDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public LinkObject deserialize(JsonParser p, DeserializationContext ctxt) {
					return readLinkObject(p, ctxt);
				}
			};
		}

		/**
		 * @return a {@link String}, a {@link LinkObject}, or null
		 */
		private Object readLinkValue(JsonParser p, DeserializationContext ctxt) {
			JsonToken token = p.currentToken();
			if (token == VALUE_NULL) {
				return null;
			} else if (token == VALUE_STRING) {
				return p.getString();
			} else if (token == START_OBJECT) {
				return readLinkObject(p, ctxt);
			} else {
				throw new StreamReadException(p, "Expected link to be a string or object; found " + token);
			}
		}

		private LinkObject readLinkObject(JsonParser p, DeserializationContext ctxt) {
			String href = null;
			Object meta = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "href":
						href = readString(p);
						break;
					case "meta":
						meta = ctxt.readValue(p, Object.class);
						break;
					default:
						p.skipChildren();
				}
			}
			return new LinkObject(href, meta);
		}

		private ValueDeserializer<JsonApiObject> jsonApiObjectDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public JsonApiObject deserialize(JsonParser p, DeserializationContext ctxt) {
					String version = null;
					Object meta = null;
					expect(START_OBJECT, p);
					while (p.nextToken() != END_OBJECT) {
						p.nextValue();
						switch (p.currentName()) {
							case "version":
								version = readString(p);
								break;
							case "meta":
								meta = ctxt.readValue(p, Object.class);
								break;
							default:
								// ext and profile arrived in 1.1; we don't interpret them
								p.skipChildren();
						}
					}
					return new JsonApiObject(version, meta);
				}
			};
		}

		private ValueDeserializer<ErrorObject> errorObjectDeserializer() {
			return new JsonApiDeserializer<>() {
				@Override
				public ErrorObject deserialize(JsonParser p, DeserializationContext ctxt) {
					ErrorObject.ErrorObjectBuilder builder = ErrorObject.builder();
					expect(START_OBJECT, p);
					while (p.nextToken() != END_OBJECT) {
						p.nextValue();
						switch (p.currentName()) {
							case "id":
								builder.id(readString(p));
								break;
							case "links":
								builder.links(readErrorLinks(p, ctxt));
								break;
							case "status":
								builder.status(readString(p));
								break;
							case "code":
								builder.code(readString(p));
								break;
							case "title":
								builder.title(readString(p));
								break;
							case "detail":
								builder.detail(readString(p));
								break;
							case "source":
								builder.source(readErrorSource(p));
								break;
							case "meta":
								builder.meta(ctxt.readValue(p, Object.class));
								break;
							default:
								skipUnknownMember("error object", p);
						}
					}
					return builder.build();
				}
			};
		}

		private ErrorLinks readErrorLinks(JsonParser p, DeserializationContext ctxt) {
			if (p.currentToken() == VALUE_NULL) {
				return null;
			}
			Object about = null;
			Object type = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "about":
						about = readLinkValue(p, ctxt);
						break;
					case "type":
						type = readLinkValue(p, ctxt);
						break;
					default:
						p.skipChildren();
				}
			}
			return new ErrorLinks(about, type);
		}

		private ErrorSource readErrorSource(JsonParser p) {
			if (p.currentToken() == VALUE_NULL) {
				return null;
			}
			String pointer = null;
			String parameter = null;
			String header = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "pointer":
						pointer = readString(p);
						break;
					case "parameter":
						parameter = readString(p);
						break;
					case "header":
						header = readString(p);
						break;
					default:
						p.skipChildren();
				}
			}
			return new ErrorSource(pointer, parameter, header);
		}

		private void skipUnknownMember(String context, JsonParser p) {
			if (settings.isFailOnUnknownMembers()) {
				throw new StreamReadException(p, "Unrecognized member in " + context + ": " + p.currentName());
			}
			p.skipChildren();
		}
	}

	/**
	 * Common properties all our deserializers have.
	 */
	private abstract static class JsonApiDeserializer<T> extends ValueDeserializer<T> {
		@Override public boolean isCachable() { return true; }
	}

	private static String readString(JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == VALUE_NULL) {
			return null;
		} else if (token == VALUE_STRING) {
			return p.getString();
		} else {
			throw new StreamReadException(p, "Expected string value for \"" + p.currentName() + "\"; found " + token);
		}
	}

	private static Map<String, Object> readGenericMap(JsonParser p, DeserializationContext ctxt) {
		if (p.currentToken() == VALUE_NULL) {
			return new LinkedHashMap<>();
		}
		expect(START_OBJECT, p);
		return ctxt.readValue(p, GENERIC_MAP_TYPE);
	}

	/**
	 * Reads each element separately, rather than as a {@link List} in one go,
	 * so that our own exceptions reach the caller without being wrapped.
	 */
	private static <T> List<T> readArray(JsonNode array, Class<T> elementType, String memberName, JsonParser p, DeserializationContext ctxt) {
		List<T> result = new ArrayList<>();
		if (array.isNull()) {
			return result;
		} else if (!array.isArray()) {
			throw new StreamReadException(p, "Expected \"" + memberName + "\" to be an array; found " + array.getNodeType());
		}
		for (int i = 0; i < array.size(); i++) {
			JsonNode element = array.get(i);
			if (element.isNull()) {
				throw new StreamReadException(p, "Array \"" + memberName + "\" contains null at index " + i);
			}
			result.add(ctxt.readTreeAsValue(element, elementType));
		}
		return result;
	}

	private static final JavaType GENERIC_MAP_TYPE = typeFactory.constructType(new TypeReference<
		LinkedHashMap<String, Object>>() {});

	public static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonApiSerializer.class);
}
