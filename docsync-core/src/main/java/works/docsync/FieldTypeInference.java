package works.docsync;

import java.util.Set;

/**
 * Chooses the storage type for a newly discovered field from the
 * {@link ValueKind kinds} of value observed for it.
 * <p>
 * Only an unambiguous observation produces a specific type.
 * Mixed, missing or unmappable kinds fall back to {@link FieldType#STRING},
 * which can hold anything without loss.
 */
public final class FieldTypeInference {
	private FieldTypeInference() {}

	public static FieldType infer(Set<ValueKind> observedKinds) {
		if (observedKinds.size() != 1) {
			return FieldType.STRING;
		}
		switch (observedKinds.iterator().next()) {
			case INTEGER: return FieldType.INTEGER;
			case STRUCTURED: return FieldType.JSON;
			case BOOLEAN: return FieldType.BOOLEAN;
			case FLOATING: return FieldType.DOUBLE;
			default: return FieldType.STRING;
		}
	}
}
