/**
 * Parsing of the string values of {@code date}, {@code time} and {@code datetime} fields.
 */
package works.docsync.temporal;
