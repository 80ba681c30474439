package works.docsync;

import java.math.BigInteger;
import org.jetbrains.annotations.Nullable;

/**
 * Determines how the rows of a type are identified: which column holds the key,
 * and which document values already are keys rather than nested documents.
 * <p>
 * Reference resolution uses the <em>referenced</em> type's strategy to decide
 * whether a value needs to be synced or can be stored as-is.
 */
public interface KeyStrategy {
	String keyColumn();

	boolean isIdentifier(@Nullable Object value);

	/**
	 * @throws IllegalArgumentException if <code>value</code> is not an {@link #isIdentifier identifier}
	 */
	long toIdentifier(Object value);

	/**
	 * @return the row's key, or null if it has none, in which case the row can only be inserted
	 */
	default @Nullable Long keyOf(Row row) {
		Object value = row.get(keyColumn());
		if (isIdentifier(value)) {
			return toIdentifier(value);
		} else {
			return null;
		}
	}

	/**
	 * A single integer column named {@code id}, holding any integral value.
	 */
	KeyStrategy INTEGER_ID = new KeyStrategy() {
		@Override
		public String keyColumn() {
			return "id";
		}

		@Override
		public boolean isIdentifier(@Nullable Object value) {
			return value != null && ValueKind.isIntegral(value);
		}

		@Override
		public long toIdentifier(Object value) {
			if (value instanceof BigInteger) {
				try {
					return ((BigInteger) value).longValueExact();
				} catch (ArithmeticException e) {
					throw new IllegalArgumentException("Not an integer identifier: " + value, e);
				}
			} else if (isIdentifier(value)) {
				return ((Number) value).longValue();
			}
			throw new IllegalArgumentException("Not an integer identifier: " + value);
		}

		@Override
		public String toString() {
			return "INTEGER_ID";
		}
	};
}
