/**
 * JDBC implementations of the recorder interfaces.
 */
package eventsourcing.jdbc.recorder;
