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
import io.github.goodees.ledger.core.TallyEvents;
import io.github.goodees.ledger.core.UnrecognizedEvent;
import io.github.goodees.ledger.core.store.ConcurrencyConflictException;
import io.github.goodees.ledger.core.store.EventStore;
import io.github.goodees.ledger.core.store.EventStoreException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTest {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStoreTest.class);
    @Rule
    public ErrorCollector collector = new ErrorCollector();

    private List<Event> events(int... payloads) {
        JdbcTestEvent[] result = new JdbcTestEvent[payloads.length];
        for (int i = 0; i < payloads.length; i++) {
            result[i] = new JdbcTestEvent(name(), payloads[i]);
        }
        return Arrays.asList(result);
    }

    @Test
    public void events_for_new_stream_are_persisted() throws EventStoreException {
        eventStore.append(name(), events(100, 200), EventStore.NO_STREAM);
        assertDb(2, "select count(*) from ledger_event where stream_id = ?", name());
        assertDb(1, "select version from ledger_stream where stream_id = ?", name());
        assertEquals(1, eventStore.currentVersion(name()));
    }

    @Test
    public void events_for_existing_stream_are_persisted() throws EventStoreException {
        eventStore.append(name(), events(100, 200), EventStore.NO_STREAM);
        eventStore.append(name(), events(300, 400), 1);
        assertDb(4, "select count(*) from ledger_event where stream_id = ?", name());
        assertDb(3, "select version from ledger_stream where stream_id = ?", name());
        assertDb(1, "select count(*) from ledger_event where stream_id = ? and seq_no = 3 and payload like '%|400'",
            name());
    }

    @Test
    public void stream_is_read_in_order() throws EventStoreException {
        List<Event> written = events(1, 2, 3);
        eventStore.append(name(), written, EventStore.NO_STREAM);
        List<StoredEvent> stream = eventStore.readStream(name());
        assertThat(stream, hasSize(3));
        for (int i = 0; i < 3; i++) {
            assertEquals(i, stream.get(i).getSequence());
            assertEquals(written.get(i), stream.get(i).getEvent());
        }
        assertThat(eventStore.read(name()), contains(written.toArray()));
    }

    @Test
    public void unknown_stream_is_empty() throws EventStoreException {
        assertThat(eventStore.readStream(name()), empty());
        assertEquals(EventStore.NO_STREAM, eventStore.currentVersion(name()));
        assertThat(eventStore.listStreams(), not(hasItem(name())));
    }

    @Test
    public void streams_are_listed() throws EventStoreException {
        eventStore.append(name(), events(1), EventStore.NO_STREAM);
        assertThat(eventStore.listStreams(), hasItem(name()));
    }

    @Test
    public void mixing_streams_fails() {
        try {
            eventStore.append(name(), Arrays.asList(new JdbcTestEvent(name(), 100),
                new JdbcTestEvent(name() + "!", 200)), EventStore.NO_STREAM);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from ledger_event where stream_id like 'mixing%'");
        }
    }

    @Test
    public void appending_unsupported_events_fails() {
        try {
            eventStore.append(name(), Collections.singletonList(new TallyEvents.AddedEvent(name(), Instant.now(), 1)),
                EventStore.NO_STREAM);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertDb(0, "select count(*) from ledger_stream where stream_id = ?", name());
        }
    }

    @Test
    public void appending_at_stale_version_throws_early() {
        try {
            template.update("insert into ledger_stream (stream_id, version) values (?, 10)", name());
            eventStore.append(name(), events(100, 200), 9);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
            assertEquals(10, ((ConcurrencyConflictException) e).getActualVersion());
            assertDb(0, "select count(*) from ledger_event where stream_id = ?", name());
            assertDb(10, "select version from ledger_stream where stream_id = ?", name());
        }
    }

    @Test
    public void creating_existing_stream_conflicts() throws EventStoreException {
        eventStore.append(name(), events(1), EventStore.NO_STREAM);
        try {
            eventStore.append(name(), events(2), EventStore.NO_STREAM);
            fail("should have failed");
        } catch (ConcurrencyConflictException e) {
            assertEquals(EventStore.NO_STREAM, e.getExpectedVersion());
            assertEquals(0, e.getActualVersion());
        }
        assertDb(1, "select count(*) from ledger_event where stream_id = ?", name());
    }

    @Test
    public void serialization_failure_is_programmatic_error() throws EventStoreException {
        TestEventSerialization failing = new TestEventSerialization() {
            @Override
            public String serialize(JdbcTestEvent object) {
                throw new IllegalStateException("Payload " + object.getPayload() + " is not writable");
            }
        };
        JdbcEventStore<JdbcTestEvent> store = new JdbcEventStore<>(ds, schema, failing);
        try {
            store.append(name(), events(1), EventStore.NO_STREAM);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
            assertFalse(e.isRetryable());
            assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        }
        assertEquals(EventStore.NO_STREAM, eventStore.currentVersion(name()));
        assertDb(0, "select count(*) from ledger_stream where stream_id = ?", name());
        assertDb(0, "select count(*) from ledger_event where stream_id = ?", name());
    }

    @Test
    public void failed_insert_is_storage_failure() throws EventStoreException {
        JdbcEventStore<JdbcTestEvent> store = new JdbcEventStore<>(ds,
                new DefaultJdbcSchema("ledger_event_missing", "ledger_stream"), serialization);
        try {
            store.append(name(), events(1, 2), EventStore.NO_STREAM);
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.STORAGE_FAILURE, e.getFault());
            assertFalse(e.isRetryable());
        }
        assertEquals(EventStore.NO_STREAM, eventStore.currentVersion(name()));
        assertThat(eventStore.listStreams(), not(hasItem(name())));
        assertDb(0, "select count(*) from ledger_stream where stream_id = ?", name());
    }

    @Test
    public void racing_creators_exactly_one_wins() throws InterruptedException {
        int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        String streamId = name();
        for (int i = 0; i < threads; i++) {
            JdbcTestEvent event = new JdbcTestEvent(streamId, i);
            new Thread(() -> {
                try {
                    start.await();
                    eventStore.append(streamId, Collections.singletonList(event), EventStore.NO_STREAM);
                    successes.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                } catch (Exception e) {
                    logger.error("Unexpected failure", e);
                    collector.addError(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        done.await();
        assertEquals(1, successes.get());
        assertEquals(threads - 1, conflicts.get());
        assertDb(1, "select count(*) from ledger_event where stream_id = ?", streamId);
        assertDb(0, "select version from ledger_stream where stream_id = ?", streamId);
    }

    @Test
    public void unknown_kind_is_returned_unrecognized() throws EventStoreException {
        eventStore.append(name(), events(1), EventStore.NO_STREAM);
        insertForeignEvent(1);

        List<StoredEvent> stream = eventStore.readStream(name());
        assertThat(stream, hasSize(2));
        assertThat(stream.get(1).getEvent(), instanceOf(UnrecognizedEvent.class));
        UnrecognizedEvent unknown = (UnrecognizedEvent) stream.get(1).getEvent();
        assertEquals("Teleported", unknown.getKind());
        assertEquals(2, unknown.getPayloadVersion());
        assertEquals("{\"to\":\"moon\"}", unknown.getPayload());
        assertEquals(1, eventStore.currentVersion(name()));
    }

    @Test
    public void unknown_kind_fails_strict_read() throws EventStoreException {
        eventStore.append(name(), events(1), EventStore.NO_STREAM);
        insertForeignEvent(1);
        JdbcEventStore<JdbcTestEvent> strict = new JdbcEventStore<>(ds, schema, serialization,
                JdbcEventStore.LOCAL_TRANSACTION, Clock.systemUTC(), true);
        try {
            strict.readStream(name());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, e.getFault());
        }
    }

    private void insertForeignEvent(long sequence) {
        Timestamp now = Timestamp.from(Instant.now());
        template.update("insert into ledger_event (stream_id, seq_no, event_id, kind, occurred_at, stored_at, "
                + "payload_version, payload) values (?,?,?,?,?,?,?,?)", name(), sequence, UUID.randomUUID().toString(),
            "Teleported", now, now, 2, "{\"to\":\"moon\"}");
        template.update("update ledger_stream set version = ? where stream_id = ?", sequence, name());
    }

    @Test
    public void concurrent_append_fails_with_conflict() throws InterruptedException {
        /*
            THREAD 1                 THREAD 2

            read stream version
            < release "T1 has version" >
                                     < wait for "T1 has version" >
                                     read stream version
            insert "10"              insert "20"
                                     < release "T2 has inserted events" >
            < wait for "T2 has inserted events">
            update version
            < release "T1 has updated version" >
                                     < wait for "T1 has updated version" >
                                     update version (blocks until T1 commits, then matches no row)

            Thread 1 wins, thread 2 is rolled back.
         */
        CountDownLatch thread1hasVersion = new CountDownLatch(1);
        CountDownLatch thread2hasInsertedEvents = new CountDownLatch(1);
        CountDownLatch thread1updatedVersion = new CountDownLatch(1);

        JdbcSchema race1 = new DefaultJdbcSchema("ledger_event_collision", "ledger_stream") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    return super.readStreamVersion(rs);
                } finally {
                    logger.info("Thread 1 has read stream version");
                    thread1hasVersion.countDown();
                }
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, String streamId,
                    long expectedVersion, long newVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, expectedVersion,
                    newVersion);
                return (PreparedStatement) Proxy.newProxyInstance(getClass().getClassLoader(),
                    new Class<?>[] { PreparedStatement.class }, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 2 to insert events");
                            thread2hasInsertedEvents.await();
                        }
                        Object result = m.invoke(delegate, a);
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Thread 1 updated stream version");
                            thread1updatedVersion.countDown();
                        }
                        return result;
                    });
            }
        };

        JdbcSchema race2 = new DefaultJdbcSchema("ledger_event_collision", "ledger_stream") {
            @Override
            protected long readStreamVersion(ResultSet rs) throws SQLException {
                try {
                    logger.info("Thread 2 waits for thread 1 to read stream version");
                    thread1hasVersion.await();
                } catch (InterruptedException e) {
                    collector.addError(e);
                }
                return super.readStreamVersion(rs);
            }

            @Override
            protected PreparedStatement insertEvent(Connection connection) throws SQLException {
                PreparedStatement delegate = super.insertEvent(connection);
                return (PreparedStatement) Proxy.newProxyInstance(getClass().getClassLoader(),
                    new Class<?>[] { PreparedStatement.class }, (p, m, a) -> {
                        try {
                            return m.invoke(delegate, a);
                        } finally {
                            if ("executeBatch".equals(m.getName())) {
                                logger.info("Thread 2 has inserted events");
                                thread2hasInsertedEvents.countDown();
                            }
                        }
                    });
            }

            @Override
            protected PreparedStatement updateStreamVersion(Connection connection, String streamId,
                    long expectedVersion, long newVersion) throws SQLException {
                PreparedStatement delegate = super.updateStreamVersion(connection, streamId, expectedVersion,
                    newVersion);
                return (PreparedStatement) Proxy.newProxyInstance(getClass().getClassLoader(),
                    new Class<?>[] { PreparedStatement.class }, (p, m, a) -> {
                        if ("executeUpdate".equals(m.getName())) {
                            logger.info("Waiting for thread 1 to update stream version");
                            thread1updatedVersion.await();
                        }
                        return m.invoke(delegate, a);
                    });
            }
        };

        JdbcEventStore<JdbcTestEvent> store1 = new JdbcEventStore<>(ds, race1, serialization);
        JdbcEventStore<JdbcTestEvent> store2 = new JdbcEventStore<>(ds, race2, serialization);

        String streamId = name();
        template.update("insert into ledger_stream (stream_id, version) values (?, 0)", streamId);
        Thread thread1 = new Thread(() -> {
            try {
                store1.append(streamId, Collections.singletonList(new JdbcTestEvent(streamId, 10)), 0);
            } catch (Exception e) {
                logger.error("Thread 1 failed", e);
                collector.addError(e);
            } finally {
                // release all latches in case we failed
                thread1hasVersion.countDown();
                thread1updatedVersion.countDown();
            }
        });
        thread1.setName("Thread 1");
        thread1.start();
        try {
            store2.append(streamId, Collections.singletonList(new JdbcTestEvent(streamId, 20)), 0);
            fail("Should have failed");
        } catch (EventStoreException e) {
            logger.info("Thread 2 got (expected) event store exception", e);
            assertEquals(EventStoreException.Fault.CONCURRENCY_CONFLICT, e.getFault());
        }
        thread1.join();
        assertDb(1, "select count(*) from ledger_event_collision where stream_id = ?", streamId);
        assertDb(1, "select version from ledger_stream where stream_id = ?", streamId);
        assertDb(1, "select count(*) from ledger_event_collision where stream_id = ? and payload like '%|10'",
            streamId);
        assertDb(0, "select count(*) from ledger_event_collision where stream_id = ? and payload like '%|20'",
            streamId);
    }
}
