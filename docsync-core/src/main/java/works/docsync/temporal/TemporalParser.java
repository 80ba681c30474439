package works.docsync.temporal;

import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Turns a temporal string from a document into a {@code java.time} value.
 * <p>
 * The result may be any of {@code ZonedDateTime}, {@code OffsetDateTime},
 * {@code LocalDateTime}, {@code LocalDate} or {@code LocalTime}, depending on
 * how much the text specifies; {@link TemporalValues#toFieldValue} then shapes it
 * for the field.
 */
@FunctionalInterface
public interface TemporalParser {
	TemporalAccessor parse(String text) throws DateTimeParseException;

	/**
	 * @param pattern a {@link java.time.format.DateTimeFormatter} pattern
	 * @throws IllegalArgumentException if the pattern is invalid
	 */
	static TemporalParser ofPattern(String pattern) {
		return new PatternTemporalParser(pattern);
	}

	static TemporalParser flexible(TemporalParseOptions options) {
		return new FlexibleTemporalParser(options);
	}
}
