package works.docsync;

import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import works.docsync.exceptions.DefinitionException;

@Value
@Builder(toBuilder = true)
public class TypeSettings {
	/**
	 * The storage table for the type's documents.
	 * When null, the table is named after the type.
	 */
	@Nullable String tableName;

	/**
	 * When true, an update of an existing row sets every stored column
	 * that the incoming row doesn't mention to null, so the document is taken
	 * as the complete state of the row.
	 * When false, unmentioned columns keep their stored values.
	 * <p>
	 * Partial syncs never clear columns, regardless of this setting.
	 */
	@Default boolean removeMissingFields = true;

	/**
	 * @see KeyStrategy#INTEGER_ID
	 */
	@Default KeyStrategy keyStrategy = KeyStrategy.INTEGER_ID;

	public static TypeSettings defaults() {
		return builder().build();
	}

	public static final String TABLE_NAME_OPTION = "table_name";
	public static final String REMOVE_MISSING_FIELDS_OPTION = "remove_missing_fields";

	/**
	 * Builds settings from loosely typed options, as found in a configuration document.
	 * Recognized keys are {@value #TABLE_NAME_OPTION} (a string)
	 * and {@value #REMOVE_MISSING_FIELDS_OPTION} (a boolean).
	 *
	 * @throws DefinitionException if a key is unrecognized or a value has the wrong type
	 */
	public static TypeSettings fromOptions(Map<String, ?> options) {
		TypeSettingsBuilder builder = builder();
		for (Map.Entry<String, ?> entry: options.entrySet()) {
			Object value = entry.getValue();
			switch (entry.getKey()) {
				case TABLE_NAME_OPTION:
					if (value != null && !(value instanceof String)) {
						throw new DefinitionException("Option " + TABLE_NAME_OPTION + " must be a string; got " + value);
					}
					builder.tableName((String) value);
					break;
				case REMOVE_MISSING_FIELDS_OPTION:
					if (!(value instanceof Boolean)) {
						throw new DefinitionException("Option " + REMOVE_MISSING_FIELDS_OPTION + " must be true or false; got " + value);
					}
					builder.removeMissingFields((Boolean) value);
					break;
				default:
					throw new DefinitionException("Unrecognized type option \"" + entry.getKey() + "\"");
			}
		}
		return builder.build();
	}
}
