package com.vbot.core;

import com.vbot.api.ChatTransport;
import com.vbot.api.OperationalLog;
import com.vbot.common.privacy.PrivacyManager;
import com.vbot.core.auth.RoleResolver;
import com.vbot.core.config.ConfigManager;
import com.vbot.core.config.ConfigValidator;
import com.vbot.core.config.Configuration;
import com.vbot.core.dispatch.ChatDispatcher;
import com.vbot.core.dispatch.DispatchPipeline;
import com.vbot.core.plugin.CommandRegistry;
import com.vbot.core.plugin.ExtensionCatalog;
import com.vbot.core.plugin.LoadResult;
import com.vbot.core.plugin.ServiceLoaderCatalog;
import com.vbot.plugins.CoreCommands;
import com.vbot.services.logging.ChatOperationalLog;
import com.vbot.services.logging.CommandLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application handle shared with every extension. Owns the configuration, the role
 * resolver, the command registry and the dispatch pipeline.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final File toolsDir;
    private final ConfigManager configManager;
    private final Clock clock;
    private final ExtensionCatalog catalog;
    private final RoleResolver roleResolver;
    private final CommandRegistry commandRegistry;
    private final CommandLogStore commandLogStore;
    private final OperationalLog operationalLog;
    private final PrivacyManager privacyManager;
    private final ScheduledExecutorService scheduler;
    private final DispatchPipeline dispatchPipeline;
    private final ChatDispatcher chatDispatcher;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Instant startTime;
    private volatile ChatTransport transport;
    private volatile List<LoadResult> loadResults = List.of();

    public Kernel(File toolsDir) {
        this(toolsDir, null);
    }

    public Kernel(File toolsDir, ExtensionCatalog catalog) {
        this.toolsDir = toolsDir;
        if (!toolsDir.exists())
            toolsDir.mkdirs();

        this.clock = Clock.systemUTC();
        this.startTime = clock.instant();
        this.configManager = new ConfigManager(toolsDir);
        Configuration config = configManager.getConfig();

        this.catalog = catalog != null ? catalog : new ServiceLoaderCatalog(new File(config.pluginDirectory));
        this.roleResolver = new RoleResolver(config, clock);
        this.commandRegistry = new CommandRegistry(this.catalog, config);
        this.commandLogStore = CommandLogStore.file(new File(toolsDir, "command_log"));
        this.operationalLog = new ChatOperationalLog(commandLogStore, this::getTransport, config.logChatId);
        this.privacyManager = new PrivacyManager(config);
        AtomicInteger ackThreads = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, config.dispatchThreads), r -> {
            Thread t = new Thread(r, "acknowledgement-" + ackThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.dispatchPipeline = new DispatchPipeline(config, roleResolver, commandRegistry, operationalLog,
                privacyManager, scheduler, clock);
        this.chatDispatcher = new ChatDispatcher(config.dispatchThreads);

        new CoreCommands(this).register(dispatchPipeline);
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");

        if (!new ConfigValidator().validateAndLog(getConfig())) {
            logger.warn("Configuration has errors, see above. Continuing with what is available.");
        }

        // Extensions register their commands (and the transport) here
        this.loadResults = commandRegistry.loadAll(this);
        configManager.saveConfig();

        if (transport == null)
            logger.warn("No chat transport registered. Inbound messages will not be received.");
        logger.info("✅ Kernel active.");
    }

    public void shutdown() {
        if (!running.getAndSet(false))
            return;
        logger.info("🛑 Kernel stopping...");
        commandRegistry.disableAll();
        chatDispatcher.shutdown();
        scheduler.shutdownNow();
        if (catalog instanceof ServiceLoaderCatalog)
            ((ServiceLoaderCatalog) catalog).close();
        logger.info("👋 Kernel stopped.");
    }

    // --- Transport ---

    public void registerTransport(ChatTransport transport) {
        this.transport = transport;
        logger.info("Transport registered: {}", transport.getClass().getSimpleName());
    }

    public ChatTransport getTransport() {
        return transport;
    }

    // --- Getters ---

    public boolean isRunning() {
        return running.get();
    }

    public File getToolsDir() {
        return toolsDir;
    }

    public Configuration getConfig() {
        return configManager.getConfig();
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public Clock getClock() {
        return clock;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public RoleResolver getRoleResolver() {
        return roleResolver;
    }

    public CommandRegistry getCommandRegistry() {
        return commandRegistry;
    }

    public List<LoadResult> getLoadResults() {
        return loadResults;
    }

    public CommandLogStore getCommandLogStore() {
        return commandLogStore;
    }

    public OperationalLog getOperationalLog() {
        return operationalLog;
    }

    public PrivacyManager getPrivacyManager() {
        return privacyManager;
    }

    public DispatchPipeline getDispatchPipeline() {
        return dispatchPipeline;
    }

    public ChatDispatcher getChatDispatcher() {
        return chatDispatcher;
    }
}
