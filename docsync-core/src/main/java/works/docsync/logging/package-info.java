/**
 * Logging support shared by the docsync modules.
 */
package works.docsync.logging;
