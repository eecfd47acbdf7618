/**
 * Transactions on pooled sessions.
 *
 * @see eventsourcing.jdbc.tx.TransactionScope
 */
package eventsourcing.jdbc.tx;
