package com.vbot.core.dispatch;

import com.vbot.api.ChatMessage;
import com.vbot.api.CommandRequest;
import com.vbot.api.MessageRef;
import com.vbot.common.privacy.PrivacyManager;
import com.vbot.core.auth.RoleResolver;
import com.vbot.core.config.Configuration;
import com.vbot.core.plugin.CommandRegistry;
import com.vbot.test.FakeTransport;
import com.vbot.test.MutableClock;
import com.vbot.test.RecordingOperationalLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DispatchPipelineTest {
    private static final long DEVELOPER = 2L;
    private static final long ADMIN = 3L;
    private static final long MEMBER = 5L;
    private static final long GROUP = -100L;

    private Configuration config;
    private FakeTransport transport;
    private RecordingOperationalLog log;
    private CommandRegistry registry;
    private ScheduledThreadPoolExecutor scheduler;
    private DispatchPipeline pipeline;
    private long nextMessageId = 1;

    @BeforeEach
    void setUp() {
        config = new Configuration();
        config.ownerId = 1L;
        config.developerIds = new ArrayList<>(List.of(DEVELOPER));
        config.acknowledgeCommands = false;
        transport = new FakeTransport().withAdmins(GROUP, ADMIN);
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        build();
    }

    private void build() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        log = new RecordingOperationalLog();
        registry = new CommandRegistry(List::of, config);
        pipeline = new DispatchPipeline(config, new RoleResolver(config, clock), registry, log,
                new PrivacyManager(config), scheduler, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ChatMessage group(long sender, String text) {
        return new ChatMessage(nextMessageId++, GROUP, sender, text, false, Instant.EPOCH);
    }

    @Test
    void testNonCommandsAreIgnored() {
        assertEquals(DispatchOutcome.IGNORED, pipeline.dispatch(transport, group(MEMBER, "hello")));
        assertEquals(DispatchOutcome.IGNORED, pipeline.dispatch(transport, group(MEMBER, "   ")));
        assertEquals(0, transport.outboundCount());
        assertTrue(log.commands.isEmpty());
    }

    @Test
    void testDeveloperPassesAdminCommandWithoutFetch() {
        List<String> handled = new ArrayList<>();
        registry.registerHandler(List.of("/lock"), r -> handled.add(r.command()));

        assertEquals(DispatchOutcome.COMPLETED, pipeline.dispatch(transport, group(DEVELOPER, "/lock")));

        assertEquals(List.of("/lock"), handled);
        assertEquals(0, transport.adminFetches.get(), "Developers never need the admin list");
        assertEquals(1, log.commands.size());
        assertTrue(log.commands.get(0).success());
    }

    @Test
    void testMemberDeniedAdminCommand() {
        List<String> handled = new ArrayList<>();
        registry.registerHandler(List.of("/lock"), r -> handled.add(r.command()));

        assertEquals(DispatchOutcome.DENIED, pipeline.dispatch(transport, group(MEMBER, "/lock")));

        assertTrue(handled.isEmpty(), "Handler must not run for denied commands");
        assertEquals(1, log.denials.size(), "Exactly one denial entry");
        assertEquals(MEMBER, log.denials.get(0).userId());
        assertTrue(log.commands.isEmpty());
        assertEquals(List.of("⛔ Access denied. Admin authorization required."), transport.replyTexts());
        assertEquals(0, pipeline.activeContextCount(), "Denied commands leave no context behind");
    }

    @Test
    void testChatAdminAllowedAdminCommand() {
        registry.registerHandler(List.of("/lock"), r -> r.reply("locked"));
        assertEquals(DispatchOutcome.COMPLETED, pipeline.dispatch(transport, group(ADMIN, "/lock")));
        assertEquals(List.of("locked"), transport.replyTexts());
    }

    @Test
    void testAdminFetchFailureDenies() {
        transport.setFailAdminFetch(true);
        registry.registerHandler(List.of("/lock"), r -> fail("must not run"));
        assertEquals(DispatchOutcome.DENIED, pipeline.dispatch(transport, group(ADMIN, "/lock")));
    }

    @Test
    void testChatAdminDeniedDeveloperCommand() {
        registry.registerHandler(List.of(".reload"), r -> fail("must not run"));
        assertEquals(DispatchOutcome.DENIED, pipeline.dispatch(transport, group(ADMIN, ".reload")));
        assertEquals(List.of("⛔ Access denied. Founder authorization required."), transport.replyTexts());
    }

    @Test
    void testPrivateCommandDenialGoesToSender() {
        ChatMessage message = group(MEMBER, ".stats");
        assertEquals(DispatchOutcome.DENIED, pipeline.dispatch(transport, message));

        assertTrue(transport.replies.isEmpty());
        assertEquals(1, transport.sent.size());
        assertEquals(MEMBER, transport.sent.get(0).chatId());
        assertEquals(List.of(new MessageRef(GROUP, message.messageId())), transport.deleted,
                "The group command is removed");
    }

    @Test
    void testUnknownCommand() {
        config.acknowledgeCommands = true;
        assertEquals(DispatchOutcome.UNKNOWN, pipeline.dispatch(transport, group(MEMBER, "#nope now")));
        assertEquals(List.of("❓ Unknown command: #nope"), transport.replyTexts(), "No acknowledgement for unknown commands");
        assertEquals(0, pipeline.activeContextCount());
    }

    @Test
    void testSuffixAndArguments() {
        AtomicReference<CommandRequest> seen = new AtomicReference<>();
        registry.registerHandler(List.of("/lock"), seen::set);

        pipeline.dispatch(transport, group(ADMIN, "  /Lock@VBot  10 minutes "));

        assertEquals("/lock", seen.get().command());
        assertEquals(List.of("10", "minutes"), seen.get().args());
        assertEquals("10 minutes", seen.get().argLine());
    }

    @Test
    void testBuiltinsTakePrecedence() {
        List<String> calls = new ArrayList<>();
        registry.registerHandler(List.of("#help"), r -> calls.add("extension"));
        pipeline.registerBuiltin("#HELP", r -> calls.add("builtin"));

        pipeline.dispatch(transport, group(MEMBER, "#help"));

        assertEquals(List.of("builtin"), calls);
    }

    @Test
    void testHandlerFaultWithoutAcknowledgement() {
        registry.registerHandler(List.of("#boom"), r -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(DispatchOutcome.FAILED, pipeline.dispatch(transport, group(MEMBER, "#boom")));

        assertEquals(List.of("❌ Error: boom"), transport.replyTexts());
        assertEquals(1, log.faults.size());
        assertEquals("command #boom in chat -100", log.faults.get(0).context());
        assertEquals(1, log.commands.size());
        assertFalse(log.commands.get(0).success());
        assertEquals("boom", log.commands.get(0).error());
        assertEquals(0, pipeline.activeContextCount());
    }

    @Test
    void testLinkageErrorIsAHandlerFault() {
        registry.registerHandler(List.of("#boom"), r -> {
            throw new NoClassDefFoundError("com/missing/Dep");
        });

        DispatchOutcome outcome = assertDoesNotThrow(() -> pipeline.dispatch(transport, group(MEMBER, "#boom")));

        assertEquals(DispatchOutcome.FAILED, outcome);
        assertEquals(List.of("❌ Error: com/missing/Dep"), transport.replyTexts());
        assertEquals(1, log.faults.size());
        assertInstanceOf(NoClassDefFoundError.class, log.faults.get(0).fault());
        assertEquals(1, log.commands.size());
        assertFalse(log.commands.get(0).success());
        assertEquals(0, pipeline.activeContextCount());
    }

    @Test
    void testHandlerFaultEditsPlaceholder() {
        config.acknowledgeCommands = true;
        config.acknowledgementIntervalMillis = 60_000;
        registry.registerHandler(List.of("#boom"), r -> {
            throw new UnsupportedOperationException();
        });

        assertEquals(DispatchOutcome.FAILED, pipeline.dispatch(transport, group(MEMBER, "#boom")));

        assertEquals(List.of("⏳ Processing..."), transport.replyTexts());
        assertEquals(1, transport.edits.size());
        assertEquals("❌ **Command failed:** `#boom`\n\nUnsupportedOperationException", transport.edits.get(0).text());
        assertTrue(scheduler.getQueue().isEmpty(), "Pending phases are cancelled");
    }

    @Test
    void testContextLivesForOneCycle() {
        AtomicReference<InvocationContext> during = new AtomicReference<>();
        ChatMessage message = group(MEMBER, "#scratch");
        registry.registerHandler(List.of("#scratch"), r -> {
            during.set(pipeline.getContext(GROUP, message.messageId()));
            assertSame(r.context(), during.get());
            assertEquals(DispatchOutcome.IGNORED, pipeline.dispatch(transport, message), "Duplicate delivery");
        });

        assertEquals(DispatchOutcome.COMPLETED, pipeline.dispatch(transport, message));

        assertNotNull(during.get());
        assertNull(pipeline.getContext(GROUP, message.messageId()));
        assertEquals(0, pipeline.activeContextCount());
    }

    @Test
    void testUntakenPlaceholderIsRemoved() {
        config.acknowledgeCommands = true;
        config.acknowledgementIntervalMillis = 60_000;
        registry.registerHandler(List.of("#work"), r -> r.reply("done"));

        pipeline.dispatch(transport, group(MEMBER, "#work"));

        assertEquals(List.of("⏳ Processing...", "done"), transport.replyTexts());
        FakeTransport.Outgoing placeholder = transport.replies.get(0);
        assertEquals(List.of(new MessageRef(GROUP, placeholder.messageId())), transport.deleted);
        assertTrue(scheduler.getQueue().isEmpty());
    }

    @Test
    void testTakenPlaceholderIsKept() throws Exception {
        config.acknowledgeCommands = true;
        config.acknowledgementIntervalMillis = 60_000;
        registry.registerHandler(List.of("#work"), r -> {
            Optional<MessageRef> status = r.context().takeStatusMessage();
            assertTrue(status.isPresent());
            r.transport().editMessage(status.get(), "done");
        });

        assertEquals(DispatchOutcome.COMPLETED, pipeline.dispatch(transport, group(MEMBER, "#work")));

        assertEquals(1, transport.edits.size());
        assertEquals("done", transport.edits.get(0).text());
        assertTrue(transport.deleted.isEmpty());
    }

    @Test
    void testAcknowledgementFailureDoesNotStopCommand() {
        config.acknowledgeCommands = true;
        List<String> handled = new ArrayList<>();
        registry.registerHandler(List.of("#work"), r -> handled.add("ran"));
        transport.setFailSends(true);

        assertEquals(DispatchOutcome.COMPLETED, pipeline.dispatch(transport, group(MEMBER, "#work")));
        assertEquals(List.of("ran"), handled);
    }

    @Test
    void testDescribe() {
        assertEquals("bad", DispatchPipeline.describe(new IllegalArgumentException("bad")));
        assertEquals("NullPointerException", DispatchPipeline.describe(new NullPointerException()));
    }
}
