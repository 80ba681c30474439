package works.docsync.temporal;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import works.docsync.FieldType;

public final class TemporalValues {
	private TemporalValues() {}

	/**
	 * Normalizes a parsed value into the local representation for a field:
	 * zoned values are shifted into <code>zone</code>, missing parts are filled
	 * (midnight for a bare date, today for a bare time), and the result is
	 * truncated to a {@link LocalDate}, {@link LocalTime} or {@link LocalDateTime}
	 * according to <code>kind</code>.
	 *
	 * @param kind one of {@link FieldType.Kind#DATE DATE}, {@link FieldType.Kind#TIME TIME},
	 *             {@link FieldType.Kind#DATETIME DATETIME}
	 */
	public static Object toFieldValue(TemporalAccessor parsed, FieldType.Kind kind, ZoneId zone) {
		if (kind == FieldType.Kind.DATE && parsed instanceof LocalDate) {
			return parsed;
		} else if (kind == FieldType.Kind.TIME && parsed instanceof LocalTime) {
			return parsed;
		}
		LocalDateTime local = toLocalDateTime(parsed, zone);
		switch (kind) {
			case DATE: return local.toLocalDate();
			case TIME: return local.toLocalTime();
			case DATETIME: return local;
			default: throw new IllegalArgumentException("Not a temporal kind: " + kind);
		}
	}

	static LocalDateTime toLocalDateTime(TemporalAccessor parsed, ZoneId zone) {
		if (parsed instanceof ZonedDateTime) {
			return ((ZonedDateTime) parsed).withZoneSameInstant(zone).toLocalDateTime();
		} else if (parsed instanceof OffsetDateTime) {
			return ((OffsetDateTime) parsed).atZoneSameInstant(zone).toLocalDateTime();
		} else if (parsed instanceof Instant) {
			return LocalDateTime.ofInstant((Instant) parsed, zone);
		} else if (parsed instanceof LocalDateTime) {
			return (LocalDateTime) parsed;
		} else if (parsed instanceof LocalDate) {
			return ((LocalDate) parsed).atStartOfDay();
		} else if (parsed instanceof LocalTime) {
			return LocalDate.now(zone).atTime((LocalTime) parsed);
		} else {
			return LocalDateTime.from(parsed);
		}
	}
}
