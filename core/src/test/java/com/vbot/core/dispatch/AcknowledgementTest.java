package com.vbot.core.dispatch;

import com.vbot.api.ChatMessage;
import com.vbot.api.MessageRef;
import com.vbot.api.TransportException;
import com.vbot.test.FakeTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AcknowledgementTest {
    private FakeTransport transport;
    private ScheduledThreadPoolExecutor scheduler;
    private final ChatMessage message = new ChatMessage(42, -100, 5, "#work", false, Instant.EPOCH);

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testPhasesAreEditedInOrder() throws Exception {
        Acknowledgement ack = Acknowledgement.start(transport, message, List.of("one", "two", "three"), 10, scheduler);

        assertEquals(List.of("one"), transport.replyTexts());
        assertEquals(42L, transport.replies.get(0).replyTo());

        long deadline = System.currentTimeMillis() + 5_000;
        while (transport.edits.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(2, transport.edits.size());
        assertEquals("two", transport.edits.get(0).text());
        assertEquals("three", transport.edits.get(1).text());
        assertEquals(ack.getPlaceholder(), transport.edits.get(0).target());
    }

    @Test
    void testCancelStopsPendingPhases() throws Exception {
        Acknowledgement ack = Acknowledgement.start(transport, message, List.of("one", "two", "three"), 60_000, scheduler);
        assertEquals(2, scheduler.getQueue().size());

        ack.cancel();
        ack.cancel();

        assertTrue(ack.isCancelled());
        assertTrue(scheduler.getQueue().isEmpty());
        assertTrue(transport.edits.isEmpty());
    }

    @Test
    void testCancelDoesNotWaitForSlowEdit() throws Exception {
        CountDownLatch editStarted = new CountDownLatch(1);
        CountDownLatch releaseEdit = new CountDownLatch(1);
        FakeTransport slow = new FakeTransport() {
            @Override
            public void editMessage(MessageRef target, String text) throws TransportException {
                editStarted.countDown();
                try {
                    releaseEdit.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.editMessage(target, text);
            }
        };
        Acknowledgement ack = Acknowledgement.start(slow, message, List.of("one", "two", "three"), 10, scheduler);
        assertTrue(editStarted.await(5, TimeUnit.SECONDS));

        assertTimeoutPreemptively(Duration.ofSeconds(2), ack::cancel, "cancel() must not block on the transport");
        assertTrue(ack.isCancelled());
        assertTrue(ack.hasEditInFlight());

        releaseEdit.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (ack.hasEditInFlight() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(ack.hasEditInFlight());
        assertEquals(1, slow.edits.size(), "Only the edit already in flight completes");
        assertEquals("two", slow.edits.get(0).text());
    }

    @Test
    void testContextHandsOutPlaceholderOnce() throws Exception {
        InvocationContext context = new InvocationContext(-100, 42, Instant.EPOCH);
        assertTrue(context.takeStatusMessage().isEmpty(), "No acknowledgement attached yet");

        Acknowledgement ack = Acknowledgement.start(transport, message, List.of("one", "two"), 60_000, scheduler);
        context.attachAcknowledgement(ack);

        MessageRef status = context.takeStatusMessage().orElseThrow();
        assertEquals(ack.getPlaceholder(), status);
        assertTrue(ack.isCancelled(), "Taking the status message stops the phases");
        assertTrue(context.isStatusTaken());
    }

    @Test
    void testContextKeyIncludesChat() {
        InvocationContext a = new InvocationContext(-100, 42, Instant.EPOCH);
        InvocationContext b = new InvocationContext(-200, 42, Instant.EPOCH);
        assertNotEquals(a.getKey(), b.getKey());
        assertEquals(new InvocationContext.Key(-100, 42), a.getKey());
    }
}
