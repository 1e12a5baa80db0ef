/**
 * Relational persistence for the event log and the metadata cache.
 *
 * <p>{@link com.caseflow.database.JdbcEventStore} implements compare-and-append as a conditional
 * update of the stream's version row plus the event inserts, in one transaction. Schema changes are
 * Flyway migrations under {@code db/migration/caseflow}.
 *
 * @see com.caseflow.database.config.DatabaseConfig
 */
package com.caseflow.database;
