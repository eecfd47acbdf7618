/**
 * Built-in dialects and the {@link eventsourcing.jdbc.dialect.Dialects} registry.
 */
package eventsourcing.jdbc.dialect;
