package works.docsync.temporal;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

final class PatternTemporalParser implements TemporalParser {
	private final String pattern;
	private final DateTimeFormatter formatter;

	PatternTemporalParser(String pattern) {
		this.pattern = pattern;
		this.formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
	}

	@Override
	public TemporalAccessor parse(String text) {
		return formatter.parseBest(text,
			ZonedDateTime::from,
			OffsetDateTime::from,
			LocalDateTime::from,
			LocalDate::from,
			LocalTime::from);
	}

	@Override
	public String toString() {
		return "PatternTemporalParser{" + pattern + '}';
	}
}
