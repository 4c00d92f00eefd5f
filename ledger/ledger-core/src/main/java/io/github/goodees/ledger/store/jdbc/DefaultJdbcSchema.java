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
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * JDBC schema for a pair of tables. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(STREAM_ID, SEQ_NO, EVENT_ID, KIND, OCCURRED_AT, STORED_AT, PAYLOAD_VERSION, PAYLOAD)
 * primary key (STREAM_ID, SEQ_NO)</li>
 * <li><em>streamTable</em>(STREAM_ID, VERSION) primary key (STREAM_ID)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String streamTable;

    public DefaultJdbcSchema(String eventTable, String streamTable) {
        this.eventTable = eventTable;
        this.streamTable = streamTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getStreamTable() {
        return streamTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getStreamTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getStreamTable()
                + " (STREAM_ID, VERSION) VALUES (?, ?)");
        st.setString(1, streamId);
        st.setLong(2, version);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long expectedVersion,
            long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getStreamTable()
                + " SET VERSION=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, streamId);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (STREAM_ID, SEQ_NO, EVENT_ID, KIND, OCCURRED_AT, STORED_AT, PAYLOAD_VERSION, PAYLOAD)"
                + " VALUES (?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, long sequence, Instant storedAt,
            int payloadVersion, String payload) throws SQLException {
        insertEvent.setString(1, event.streamId());
        insertEvent.setLong(2, sequence);
        insertEvent.setString(3, event.getId().toString());
        insertEvent.setString(4, event.getKind());
        insertEvent.setTimestamp(5, Timestamp.from(event.getOccurredAt()));
        insertEvent.setTimestamp(6, Timestamp.from(storedAt));
        insertEvent.setInt(7, payloadVersion);
        insertEvent.setString(8, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT SEQ_NO, EVENT_ID, KIND, OCCURRED_AT, STORED_AT, "
                + "PAYLOAD_VERSION, PAYLOAD FROM " + getEventTable() + " WHERE STREAM_ID=? ORDER BY SEQ_NO");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected long readEventSequence(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected UUID readEventId(ResultSet rs) throws SQLException {
        String id = rs.getString(2);
        return id == null ? null : UUID.fromString(id);
    }

    @Override
    protected String readEventKind(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected Instant readEventOccurredAt(ResultSet rs) throws SQLException {
        Timestamp ts = rs.getTimestamp(4);
        return ts == null ? null : ts.toInstant();
    }

    @Override
    protected Instant readEventStoredAt(ResultSet rs) throws SQLException {
        return rs.getTimestamp(5).toInstant();
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(6);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected PreparedStatement selectStreams(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT STREAM_ID FROM " + getStreamTable() + " WHERE VERSION >= 0");
    }

    @Override
    protected String readStreamId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }
}
