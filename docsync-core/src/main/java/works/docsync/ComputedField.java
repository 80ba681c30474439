package works.docsync;

/**
 * Derives a field's value instead of reading it from the document.
 * <p>
 * Called with the row as built so far, which contains the passthrough columns
 * and every declared field preceding this one, and with the context of the
 * document being synced. Implementations that don't need the context can ignore it.
 */
@FunctionalInterface
public interface ComputedField {
	Object compute(Row rowSoFar, TraversalContext context);
}
