/**
 * Persistence core of an event-sourcing framework.
 *
 * <h2>Core Design</h2>
 * <p>Domain events are stored as immutable rows keyed by
 * {@code (originator_id, originator_version)}. The uniqueness of that key is the only
 * concurrency control: two writers proposing the same version cannot both commit, and
 * the loser receives {@link eventsourcing.InsertResult.Conflict}.
 *
 * <p>An {@linkplain eventsourcing.spi.ApplicationRecorder application recorder} additionally
 * stamps each event with a notification id, giving downstream consumers one ordered log to
 * follow. A {@linkplain eventsourcing.spi.ProcessRecorder process recorder} stores a
 * consumer's {@linkplain eventsourcing.model.Tracking checkpoint} in the same transaction as
 * the events it produced, so processing and checkpointing succeed or fail together.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventsourcing-core</b>: model, recorder interfaces, errors (zero external deps)</li>
 *   <li><b>eventsourcing-jdbc</b>: JDBC recorders, connection pool, transaction scope
 *       (PostgreSQL, H2)</li>
 *   <li><b>eventsourcing-micrometer</b>: optional Micrometer metrics</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (var factory = JdbcRecorderFactory.fromEnvironment("orders", System.getenv())) {
 *     ApplicationRecorder recorder = factory.applicationRecorder();
 *     recorder.insertEvents(List.of(event)).orElseThrow();
 *     List<Notification> page = recorder.selectNotifications(1, 100);
 * }
 * }</pre>
 *
 * @see eventsourcing.spi.AggregateRecorder
 * @see eventsourcing.InsertResult
 */
package eventsourcing;
