package works.docsync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A fully resolved row ready for storage: column name to value, in insertion order,
 * with reference fields already replaced by identifiers.
 * <p>
 * Null values are meaningful: a column mapped to null is written as null,
 * while a column that is absent is left alone on update.
 */
public final class Row {
	private final LinkedHashMap<String, Object> values;

	public Row() {
		this.values = new LinkedHashMap<>();
	}

	public Row(Map<String, ?> values) {
		this.values = new LinkedHashMap<>(values);
	}

	public Object get(String column) {
		return values.get(column);
	}

	public boolean containsColumn(String column) {
		return values.containsKey(column);
	}

	public Row put(String column, Object value) {
		values.put(column, value);
		return this;
	}

	public Object remove(String column) {
		return values.remove(column);
	}

	public Set<String> columns() {
		return Collections.unmodifiableSet(values.keySet());
	}

	public int size() {
		return values.size();
	}

	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}

	public Row copy() {
		return new Row(values);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Row that = (Row) o;
		return Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(values);
	}

	@Override
	public String toString() {
		return "Row" + values;
	}
}
