package works.docsync.jackson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.docsync.Row;
import works.docsync.TypeDefinition;

/**
 * Turns JSON text or {@link JsonNode} trees into the in-memory document model
 * that {@link TypeDefinition#sync} accepts: {@link Map}, {@link List}, {@link String},
 * {@link Boolean}, null, and numbers as {@link Long} or {@link Double},
 * so that integers and floating-point values stay distinguishable for type inference.
 * Integers too large for a {@code long} are left as {@link BigInteger}s.
 */
public class JsonDocuments {
	private final ObjectMapper mapper;

	public JsonDocuments() {
		this(JsonMapper.builder().build());
	}

	public JsonDocuments(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * @throws JacksonException if <code>json</code> is not valid JSON
	 */
	public Object read(String json) {
		return normalize(mapper.readValue(json, Object.class));
	}

	public Object fromNode(JsonNode node) {
		return normalize(mapper.treeToValue(node, Object.class));
	}

	/**
	 * @throws IllegalArgumentException if <code>json</code> is not an object
	 */
	public Map<String, Object> readDocument(String json) {
		return asDocument(read(json));
	}

	/**
	 * Syncs a JSON object with {@link TypeDefinition#sync}, or a JSON array of objects
	 * with {@link TypeDefinition#bulkSync}.
	 *
	 * @return the stored rows: one for an object, one per element for an array
	 * @throws IllegalArgumentException if <code>json</code> is neither an object
	 * nor an array of objects
	 */
	public List<Row> sync(TypeDefinition type, String json, boolean partial) {
		Object value = read(json);
		if (value instanceof List) {
			List<Map<String, Object>> documents = new ArrayList<>();
			for (Object element: (List<?>) value) {
				documents.add(asDocument(element));
			}
			LOGGER.debug("Syncing array of {} {} document(s)", documents.size(), type.name());
			return type.bulkSync(documents, partial);
		} else {
			return List.of(type.sync(asDocument(value), partial));
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asDocument(Object value) {
		if (value instanceof Map) {
			return (Map<String, Object>) value;
		}
		throw new IllegalArgumentException("Expected a JSON object; got " + (value == null ? "null" : value.getClass().getSimpleName()));
	}

	/**
	 * Rewrites the output of Jackson's untyped deserialization into the document model.
	 */
	static Object normalize(Object value) {
		if (value instanceof Map) {
			Map<String, Object> result = new LinkedHashMap<>();
			((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), normalize(v)));
			return result;
		} else if (value instanceof List) {
			List<Object> result = new ArrayList<>();
			for (Object element: (List<?>) value) {
				result.add(normalize(element));
			}
			return result;
		} else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		} else if (value instanceof BigInteger) {
			BigInteger big = (BigInteger) value;
			return (big.bitLength() < 64) ? (Object) big.longValue() : big;
		} else if (value instanceof Float || value instanceof BigDecimal) {
			return ((Number) value).doubleValue();
		} else {
			return value;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocuments.class);
}
