package works.docsync.jackson;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.docsync.FieldDescriptor;
import works.docsync.TypeDefinition;
import works.docsync.TypeRegistry;
import works.docsync.TypeSettings;
import works.docsync.exceptions.DefinitionException;

/**
 * Defines types in a {@link TypeRegistry} from a JSON configuration document:
 *
 * <pre>
 * {"types": [
 *   {"name": "Person",
 *    "options": {"table_name": "people", "remove_missing_fields": false},
 *    "fields": [
 *      {"fieldname": "name"},
 *      {"fieldname": "born", "type": "date", "date_format": "dd.MM.yyyy"},
 *      {"fieldname": "employer", "type": "reference Company", "column_name": "employer_id", "not_null": true}
 *    ]}
 * ]}
 * </pre>
 *
 * Only {@code name} and {@code fieldname} are required; a field's type defaults to {@code string}.
 * Unrecognized keys anywhere in the document are rejected.
 */
public class TypeDefinitionLoader {
	private final ObjectMapper mapper;

	public TypeDefinitionLoader() {
		this.mapper = JsonMapper.builder()
			.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();
	}

	/**
	 * @return the newly defined types, in the order they appear
	 * @throws DefinitionException if the document is malformed or any definition is invalid
	 */
	public List<TypeDefinition> load(TypeRegistry registry, String json) {
		return define(registry, read(() -> mapper.readValue(json, Config.class)));
	}

	public List<TypeDefinition> load(TypeRegistry registry, InputStream json) {
		return define(registry, read(() -> mapper.readValue(json, Config.class)));
	}

	private static Config read(ConfigReader reader) {
		try {
			return reader.read();
		} catch (JacksonException e) {
			throw new DefinitionException("Invalid type configuration: " + e.getOriginalMessage(), e);
		}
	}

	@FunctionalInterface
	private interface ConfigReader {
		Config read() throws JacksonException;
	}

	private List<TypeDefinition> define(TypeRegistry registry, Config config) {
		if (config == null || config.types() == null) {
			throw new DefinitionException("Type configuration has no \"types\" array");
		}
		List<TypeDefinition> result = new ArrayList<>();
		for (TypeConfig typeConfig: config.types()) {
			if (typeConfig.name() == null) {
				throw new DefinitionException("Type configuration is missing a name");
			}
			TypeSettings settings = (typeConfig.options() == null)
				? TypeSettings.defaults()
				: TypeSettings.fromOptions(typeConfig.options());
			List<FieldDescriptor> fields = new ArrayList<>();
			if (typeConfig.fields() != null) {
				for (FieldConfig fieldConfig: typeConfig.fields()) {
					fields.add(fieldConfig.toDescriptor(typeConfig.name()));
				}
			}
			LOGGER.debug("Loading type {} with {} field(s)", typeConfig.name(), fields.size());
			result.add(registry.defineType(typeConfig.name(), settings, fields));
		}
		return result;
	}

	record Config(List<TypeConfig> types) { }

	record TypeConfig(
		String name,
		Map<String, Object> options,
		List<FieldConfig> fields
	) { }

	record FieldConfig(
		String fieldname,
		String type,
		@JsonProperty("column_name") String columnName,
		@JsonProperty("date_format") String dateFormat,
		@JsonProperty("not_null") Boolean notNull
	) {
		FieldDescriptor toDescriptor(String typeName) {
			if (fieldname == null) {
				throw new DefinitionException("A field of type \"" + typeName + "\" is missing its fieldname");
			}
			FieldDescriptor.Builder builder = FieldDescriptor.builder(fieldname);
			if (type != null) {
				builder.type(type);
			}
			return builder
				.columnName(columnName)
				.dateFormat(dateFormat)
				.notNull(Boolean.TRUE.equals(notNull))
				.build();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeDefinitionLoader.class);
}
