package works.docsync.jackson;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.docsync.exceptions.StorageException;

/**
 * Encodes the values of {@code json} and {@code list:reference} columns as JSON text,
 * for storage engines that have no native type for them.
 */
public class StructuredValueCodec {
	private final ObjectMapper mapper;

	public StructuredValueCodec() {
		this(JsonMapper.builder().build());
	}

	public StructuredValueCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * @throws StorageException if <code>value</code> can't be represented as JSON
	 */
	public String encode(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JacksonException e) {
			throw new StorageException("Unable to encode structured value " + value, e);
		}
	}

	/**
	 * @return the value in the document model described by {@link JsonDocuments}
	 */
	public Object decode(String text) {
		try {
			return JsonDocuments.normalize(mapper.readValue(text, Object.class));
		} catch (JacksonException e) {
			throw new StorageException("Stored structured value is not valid JSON: " + text, e);
		}
	}

	/**
	 * Decodes a {@code list:reference} column value.
	 */
	public List<Long> decodeIdentifiers(String text) {
		Object decoded = decode(text);
		if (!(decoded instanceof List)) {
			throw new StorageException("Stored identifier list is not a JSON array: " + text);
		}
		List<Long> result = new ArrayList<>();
		for (Object element: (List<?>) decoded) {
			if (element == null || element instanceof Long) {
				result.add((Long) element);
			} else {
				throw new StorageException("Stored identifier list has a non-integer element: " + text);
			}
		}
		return result;
	}
}
