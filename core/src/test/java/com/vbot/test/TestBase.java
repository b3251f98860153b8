package com.vbot.test;

import com.google.gson.Gson;
import com.vbot.api.BotExtension;
import com.vbot.core.Kernel;
import com.vbot.core.config.Configuration;
import com.vbot.core.plugin.ExtensionCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for tests that need a whole kernel.
 * Every test gets its own tools folder, written from {@link #configure(Configuration)}.
 */
public abstract class TestBase {
    protected static final Logger logger = LoggerFactory.getLogger(TestBase.class);

    protected static final long OWNER_ID = 1L;
    protected static final long DEVELOPER_ID = 2L;
    protected static final long ADMIN_ID = 3L;
    protected static final long MEMBER_ID = 5L;
    protected static final long GROUP_ID = -100L;

    @TempDir
    protected Path tempDir;

    protected Kernel kernel;
    protected FakeTransport transport;

    @BeforeEach
    void setUp(TestInfo testInfo) throws IOException {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());

        Configuration config = new Configuration();
        config.ownerId = OWNER_ID;
        config.developerIds = new ArrayList<>(List.of(DEVELOPER_ID));
        config.acknowledgeCommands = false;
        config.extensionNamespace = "com.vbot";
        configure(config);

        File toolsDir = tempDir.resolve("tools").toFile();
        Files.createDirectories(toolsDir.toPath());
        Files.writeString(new File(toolsDir, "config.json").toPath(), new Gson().toJson(config),
                StandardCharsets.UTF_8);

        List<BotExtension> extensions = extensions();
        ExtensionCatalog catalog = () -> extensions;
        kernel = new Kernel(toolsDir, catalog);
        transport = new FakeTransport().withAdmins(GROUP_ID, ADMIN_ID);
        kernel.registerTransport(transport);
    }

    @AfterEach
    void tearDown(TestInfo testInfo) {
        kernel.shutdown();
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }

    // Hook for per-class settings; the kernel reads them at construction
    protected void configure(Configuration config) {
    }

    protected List<BotExtension> extensions() {
        return List.of();
    }
}
