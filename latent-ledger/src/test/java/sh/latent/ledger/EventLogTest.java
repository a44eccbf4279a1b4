// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mockStatic;

import java.util.ArrayList;
import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.slf4j.LoggerFactory;

import sh.latent.core.LatentDebug;
import sh.latent.core.error.EventEncodingException;
import sh.latent.core.event.BasePathSet;
import sh.latent.core.event.LedgerEvent;
import sh.latent.core.event.LedgerEventCodec;
import sh.latent.core.event.TokenMinted;
import sh.latent.core.types.Address;
import sh.latent.core.types.TokenId;

class EventLogTest {

    private static final Address OWNER = new Address("0x" + "1".repeat(40));

    private final Journal journal = new Journal();
    private final EventLog log = new EventLog(journal);
    private final List<LedgerEvent> received = new ArrayList<>();

    @AfterEach
    void detach() {
        LatentDebug.setEnabled(false);
        ((Logger) LoggerFactory.getLogger(EventLog.class)).detachAndStopAllAppenders();
    }

    @Test
    void appendOutsideUnitIsDeliveredImmediately() {
        log.addListener(received::add);

        log.append(new BasePathSet("ipfs://"));

        assertEquals(List.of(new BasePathSet("ipfs://")), received);
    }

    @Test
    void deliveryWaitsForCommit() {
        log.addListener(received::add);

        journal.atomically("op", () -> {
            log.append(new BasePathSet("a"));
            log.append(new BasePathSet("b"));
            assertTrue(received.isEmpty());
        });

        assertEquals(List.of(new BasePathSet("a"), new BasePathSet("b")), received);
    }

    @Test
    void abortedEventsAreRemovedAndNeverDelivered() {
        log.addListener(received::add);

        assertThrows(IllegalStateException.class, () -> journal.atomically("op", () -> {
            log.append(new BasePathSet("a"));
            throw new IllegalStateException();
        }));
        journal.atomically("next", () -> log.append(new BasePathSet("b")));

        assertEquals(List.of(new BasePathSet("b")), log.events());
        assertEquals(List.of(new BasePathSet("b")), received);
    }

    @Test
    void failingListenerIsLoggedAndOthersStillReceive() {
        Logger logger = (Logger) LoggerFactory.getLogger(EventLog.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        log.addListener(event -> {
            throw new IllegalStateException("listener down");
        });
        log.addListener(received::add);

        log.append(new BasePathSet("a"));

        assertEquals(1, received.size());
        assertEquals(1, appender.list.size());
        assertEquals(Level.ERROR, appender.list.get(0).getLevel());
    }

    @Test
    void removedListenerStopsReceiving() {
        EventListener listener = received::add;
        log.addListener(listener);
        log.append(new BasePathSet("a"));
        log.removeListener(listener);
        log.append(new BasePathSet("b"));

        assertEquals(1, received.size());
    }

    @Test
    void eventsAppendedByListenerReachEveryListenerInOrder() {
        List<String> seen = new ArrayList<>();
        log.addListener(event -> {
            seen.add("first " + ((BasePathSet) event).basePath());
            if (event.equals(new BasePathSet("a"))) {
                journal.atomically("nested", () -> log.append(new BasePathSet("b")));
            }
        });
        log.addListener(event -> seen.add("second " + ((BasePathSet) event).basePath()));

        log.append(new BasePathSet("a"));

        assertEquals(List.of("first a", "second a", "first b", "second b"), seen);
    }

    @Test
    void traceEncodingFailureDoesNotAbortTheOperation() {
        Logger logger = (Logger) LoggerFactory.getLogger(EventLog.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        LatentDebug.setEventLogging(true);
        log.addListener(received::add);

        try (MockedStatic<LedgerEventCodec> codec = mockStatic(LedgerEventCodec.class)) {
            codec.when(() -> LedgerEventCodec.toJson(any()))
                    .thenThrow(new EventEncodingException("cannot encode", new IllegalStateException()));

            journal.atomically("op", () -> log.append(new BasePathSet("a")));
        }

        assertEquals(List.of(new BasePathSet("a")), log.events());
        assertEquals(List.of(new BasePathSet("a")), received);
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
    }

    @Test
    void ofTypeFilters() {
        log.append(new BasePathSet("a"));
        log.append(new TokenMinted(TokenId.of(1), OWNER));

        assertEquals(List.of(new TokenMinted(TokenId.of(1), OWNER)), log.ofType(TokenMinted.class));
        assertEquals(2, log.size());
    }
}
