package works.docsync.temporal;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_TIME;
import static java.time.format.DateTimeFormatter.ISO_OFFSET_DATE_TIME;
import static java.time.format.DateTimeFormatter.ISO_ZONED_DATE_TIME;
import static java.time.format.DateTimeFormatter.RFC_1123_DATE_TIME;

/**
 * Accepts the formats commonly found in JSON payloads, tried in order:
 * ISO-8601 in its various shapes, the same with a space instead of {@code T},
 * RFC 1123, slash-separated numeric dates, and English month names.
 */
final class FlexibleTemporalParser implements TemporalParser {
	private final TemporalParseOptions options;
	private final List<DateTimeFormatter> formatters;

	FlexibleTemporalParser(TemporalParseOptions options) {
		this.options = options;
		List<DateTimeFormatter> list = new ArrayList<>();
		list.add(ISO_ZONED_DATE_TIME);
		list.add(ISO_OFFSET_DATE_TIME);
		list.add(ISO_LOCAL_DATE_TIME);
		list.add(new DateTimeFormatterBuilder()
			.append(ISO_LOCAL_DATE)
			.appendLiteral(' ')
			.appendPattern("HH:mm")
			.optionalStart()
				.appendLiteral(':')
				.appendPattern("ss")
				.optionalStart()
					.appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
				.optionalEnd()
			.optionalEnd()
			.optionalStart()
				.appendOffset("+HH:MM", "Z")
			.optionalEnd()
			.toFormatter(Locale.ENGLISH));
		list.add(ISO_LOCAL_DATE);
		list.add(ISO_LOCAL_TIME);
		list.add(RFC_1123_DATE_TIME);
		list.add(pattern("yyyy/MM/dd[ HH:mm[:ss]]"));
		if (options.dayFirst()) {
			list.add(pattern("d/M/yyyy[ H:mm[:ss]]"));
		} else {
			list.add(pattern("M/d/yyyy[ H:mm[:ss]]"));
		}
		list.add(pattern("d MMM yyyy[ H:mm[:ss]]"));
		list.add(pattern("MMM d, yyyy[ H:mm[:ss]]"));
		list.add(pattern("d MMMM yyyy[ H:mm[:ss]]"));
		list.add(pattern("MMMM d, yyyy[ H:mm[:ss]]"));
		this.formatters = List.copyOf(list);
	}

	@Override
	public TemporalAccessor parse(String text) {
		String trimmed = text.trim();
		DateTimeParseException firstFailure = null;
		for (DateTimeFormatter formatter: formatters) {
			try {
				return formatter.parseBest(trimmed,
					ZonedDateTime::from,
					OffsetDateTime::from,
					LocalDateTime::from,
					LocalDate::from,
					LocalTime::from);
			} catch (DateTimeParseException e) {
				if (firstFailure == null) {
					firstFailure = e;
				}
			}
		}
		throw new DateTimeParseException("No known date/time format matches", text, 0, firstFailure);
	}

	private static DateTimeFormatter pattern(String pattern) {
		return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
	}

	@Override
	public String toString() {
		return "FlexibleTemporalParser{" + options + '}';
	}
}
