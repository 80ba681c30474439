package works.docsync.temporal;

import java.time.ZoneId;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TemporalParseOptions {
	/**
	 * When a numeric date like {@code 03/04/2024} is ambiguous,
	 * read the first number as the day rather than the month.
	 */
	@Default boolean dayFirst = false;

	/**
	 * Values that carry a zone or offset are converted to this zone,
	 * then the zone is dropped. Values without zone information are left as they are.
	 */
	@Default ZoneId zone = ZoneId.systemDefault();

	public static TemporalParseOptions defaults() {
		return builder().build();
	}
}
