package io.github.goodees.ledger.store.jdbc;

/*-
 * #%L
 * ledger
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */


import io.github.goodees.ledger.core.Event;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.UUID;

/**
 * Statements the JDBC event store issues. Subclass to adapt the store to different table layout or SQL dialect.
 * Statements are closed by the caller, result sets are positioned by the caller.
 *
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamId)
            throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    /**
     * Set parameters of insert statement created by {@link #insertEvent(Connection)}.
     */
    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, long sequence, Instant storedAt,
            int payloadVersion, String payload) throws SQLException;

    /**
     * Select all events of a stream in ascending sequence order.
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String streamId) throws SQLException;

    protected abstract long readEventSequence(ResultSet rs) throws SQLException;

    protected abstract UUID readEventId(ResultSet rs) throws SQLException;

    protected abstract String readEventKind(ResultSet rs) throws SQLException;

    protected abstract Instant readEventOccurredAt(ResultSet rs) throws SQLException;

    protected abstract Instant readEventStoredAt(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    /**
     * Select ids of streams containing at least one event.
     */
    protected abstract PreparedStatement selectStreams(Connection connection) throws SQLException;

    protected abstract String readStreamId(ResultSet rs) throws SQLException;

    /**
     * Determine whether an exception reports violation of unique constraint, i. e. another transaction stored
     * the same stream version or sequence concurrently.
     * @param e exception thrown by the driver
     * @return true for integrity constraint violations (SQL state class 23)
     */
    protected boolean isConstraintViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            for (Throwable t = current; t != null; t = t.getCause()) {
                if (t instanceof SQLIntegrityConstraintViolationException) {
                    return true;
                }
                if (t instanceof SQLException) {
                    String state = ((SQLException) t).getSQLState();
                    if (state != null && state.startsWith("23")) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
