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
import io.github.goodees.ledger.core.StoredEvent;
import io.github.goodees.ledger.core.UnrecognizedEvent;
import io.github.goodees.ledger.core.store.ConcurrencyConflictException;
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.core.store.EventStoreException;
import io.github.goodees.ledger.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable event store backed by a relational database.
 *
 * <p>Events are rows of an event table with primary key (stream, sequence), current version of every stream is kept
 * in a stream table. An append runs in single transaction: the version is checked, events are inserted, and the
 * version row is updated only if it still holds the expected version. Concurrent writer is therefore detected either
 * by the conditional update or by the primary key, and all its changes are rolled back.</p>
 *
 * <p>When store is in strict mode, reading a stream fails when an event cannot be deserialized. This can usually
 * happen in two cases: Either there was an error in payload serialization, or an event belongs to a future version of
 * the system, code was rolled back and currently running code doesn't yet know such event. When {@code strict} is
 * false, such event is returned as {@link UnrecognizedEvent}, so that stream versions stay consistent with the
 * database.</p>
 *
 * @param <E> base type of events supported by the serialization
 */
public class JdbcEventStore<E extends Event> implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final TxHandler txHandler;
    private final Clock clock;
    private final boolean strict;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this(dataSource, schema, serialization, LOCAL_TRANSACTION, Clock.systemUTC(), false);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization,
            TxHandler handler, Clock clock, boolean strict) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
        this.clock = clock;
        this.strict = strict;
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true if unknown events fail the read
     */
    public boolean isStrict() {
        return strict;
    }

    protected int determinePayloadVersion(Event event) throws EventStoreException {
        return serialization.payloadVersion(serialization.toSerializable(event));
    }

    protected String serializePayload(Event event) throws EventStoreException {
        return serialization.serialize(serialization.toSerializable(event));
    }

    @Override
    public void append(String streamId, List<? extends Event> events, long expectedVersion)
            throws EventStoreException {
        PersistTemplate template = createTemplate(streamId, expectedVersion);
        for (Event event : events) {
            template.addEvent(event);
        }
        template.persist();
    }

    protected PersistTemplate createTemplate(String streamId, long expectedVersion) {
        return new PersistTemplate(streamId, expectedVersion);
    }

    @Override
    public List<StoredEvent> readStream(String streamId) throws EventStoreException {
        List<StoredEvent> result = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectEvents(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                long sequence = schema.readEventSequence(rs);
                result.add(new StoredEvent(readEvent(streamId, sequence, rs), sequence,
                        schema.readEventStoredAt(rs)));
            }
        } catch (SQLException e) {
            logger.error("Could not read stream {}", streamId, e);
            throw EventStoreException.readFailed(streamId, e);
        }
        return result;
    }

    private Event readEvent(String streamId, long sequence, ResultSet rs) throws SQLException, EventStoreException {
        String kind = schema.readEventKind(rs);
        int payloadVersion = schema.readEventPayloadVersion(rs);
        String payload = schema.readEventPayload(rs);
        E event = deserialize(streamId, sequence, kind, payloadVersion, payload);
        if (event != null) {
            return event;
        }
        if (isStrict()) {
            throw EventStoreException.undecodable(streamId, sequence, kind);
        }
        logger.warn("{} Could not deserialize event {} of kind {}, payload version {}", streamId, sequence, kind,
            payloadVersion);
        return new UnrecognizedEvent(schema.readEventId(rs), streamId, kind, schema.readEventOccurredAt(rs),
                payloadVersion, payload);
    }

    private E deserialize(String streamId, long sequence, String kind, int payloadVersion, String payload) {
        try {
            return serialization.deserialize(payloadVersion, payload, kind);
        } catch (RuntimeException e) {
            logger.error("{} Payload of event {} is corrupt", streamId, sequence, e);
            return null;
        }
    }

    @Override
    public long currentVersion(String streamId) throws EventStoreException {
        try (Connection connection = dataSource.getConnection()) {
            return readVersion(connection, streamId);
        } catch (SQLException e) {
            throw EventStoreException.readFailed(streamId, e);
        }
    }

    private long readVersion(Connection connection, String streamId) throws SQLException {
        try (PreparedStatement select = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = select.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : NO_STREAM;
        }
    }

    @Override
    public Set<String> listStreams() throws EventStoreException {
        Set<String> result = new HashSet<>();
        try (Connection connection = dataSource.getConnection();
                PreparedStatement select = schema.selectStreams(connection);
                ResultSet rs = select.executeQuery()) {
            while (rs.next()) {
                result.add(schema.readStreamId(rs));
            }
        } catch (SQLException e) {
            throw EventStoreException.readFailed("*", e);
        }
        return result;
    }

    protected class PersistTemplate {
        private final List<Event> events = new ArrayList<>();
        private final String streamId;
        private final long expectedVersion;

        protected PersistTemplate(String streamId, long expectedVersion) {
            this.streamId = streamId;
            this.expectedVersion = expectedVersion;
        }

        void addEvent(Event event) throws EventStoreException {
            if (!streamId.equals(event.streamId())) {
                throw EventStoreException.multipleStreams(streamId, event);
            }
            serialization.toSerializable(event);
            events.add(event);
        }

        public void persist() throws EventStoreException {
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    doPersist(connection);
                    txHandler.commit(connection);
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            } catch (SQLException ex) {
                if (schema.isConstraintViolation(ex)) {
                    logger.debug("Stream {} was appended concurrently", streamId, ex);
                    throw ConcurrencyConflictException.detectedBy(streamId, expectedVersion, actualVersion(), ex);
                }
                logger.error("Storing events of stream {} failed", streamId, ex);
                throw EventStoreException.storeFailed(streamId, ex);
            } catch (RuntimeException ex) {
                logger.error("Storing events of stream {} failed", streamId, ex);
                throw EventStoreException.storeFailed(streamId, ex);
            }
        }

        private void doPersist(Connection connection) throws SQLException, EventStoreException {
            long version = readVersion(connection, streamId);
            if (version != expectedVersion) {
                logger.debug("Stream {} conflict, expected version {}, actual {}", streamId, expectedVersion,
                    version);
                throw EventStoreException.concurrencyConflict(streamId, expectedVersion, version);
            }
            if (events.isEmpty()) {
                return;
            }
            if (version == NO_STREAM) {
                try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId, NO_STREAM)) {
                    createVersion.executeUpdate();
                }
            }
            long newVersion = storeEvents(connection);
            updateVersion(connection, newVersion);
        }

        private long storeEvents(Connection connection) throws SQLException, EventStoreException {
            Instant storedAt = clock.instant();
            long sequence = expectedVersion;
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                for (Event event : events) {
                    int payloadVersion;
                    String payload;
                    try {
                        payloadVersion = determinePayloadVersion(event);
                        payload = serializePayload(event);
                    } catch (RuntimeException e) {
                        logger.error("Event {} of stream {} could not be serialized", event.getId(), streamId, e);
                        throw EventStoreException.unserializable(streamId, e);
                    }
                    schema.prepareInsert(insertEvent, event, ++sequence, storedAt, payloadVersion, payload);
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
            return sequence;
        }

        private void updateVersion(Connection connection, long newVersion) throws SQLException, EventStoreException {
            try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId, expectedVersion,
                newVersion)) {
                int result = updateVersion.executeUpdate();
                if (result != 1) {
                    throw EventStoreException.concurrencyConflict(streamId, expectedVersion, actualVersion());
                }
            }
        }

        private void rollback(Connection connection, Exception cause) {
            try {
                txHandler.rollback(connection);
            } catch (SQLException e) {
                logger.error("Rollback of stream {} failed", streamId, e);
                cause.addSuppressed(e);
            }
        }

        private long actualVersion() {
            try {
                return currentVersion(streamId);
            } catch (EventStoreException e) {
                logger.warn("Could not determine version of stream {} after conflict", streamId, e);
                return ConcurrencyConflictException.UNKNOWN_VERSION;
            }
        }
    }

    /**
     * Transaction demarcation around an append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Append in local transaction of the connection.
     */
    public static final TxHandler LOCAL_TRANSACTION = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };

    /**
     * Transactions are managed by the container the DataSource belongs to.
     */
    public static final TxHandler CONTAINER_MANAGED = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };
}
