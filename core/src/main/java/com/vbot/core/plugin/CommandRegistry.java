package com.vbot.core.plugin;

import com.vbot.api.BotExtension;
import com.vbot.api.CommandHandler;
import com.vbot.api.CommandRequest;
import com.vbot.core.Kernel;
import com.vbot.core.config.Configuration;
import com.vbot.core.dispatch.CommandNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Discovers extensions, loads them one by one in isolation and owns the mapping from
 * normalized command name to handler.
 * <p>
 * The first registration of a name wins; later claims are rejected and logged. Names are
 * only added while extensions load and are never removed, so dispatch reads need no locking.
 */
public class CommandRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);
    private static final String PROGRAMMATIC_OWNER = "programmatic";

    private final ExtensionCatalog catalog;
    private final Configuration config;

    private final Map<String, CommandRoute> routes = new ConcurrentHashMap<>();
    private final Map<String, BotExtension> loaded = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Throwable> failed = new ConcurrentHashMap<>();

    public CommandRegistry(ExtensionCatalog catalog, Configuration config) {
        this.catalog = catalog;
        this.config = config;
    }

    static String normalizeId(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Ids of all extensions in the configured namespace, skipping private and internal ones.
     */
    public List<String> discover() {
        List<String> ids = new ArrayList<>();
        for (BotExtension extension : catalog.extensions()) {
            if (isDiscoverable(extension))
                ids.add(normalizeId(extension.getName()));
        }
        return ids;
    }

    private boolean isDiscoverable(BotExtension extension) {
        String name = extension.getName();
        if (name == null || name.isBlank() || name.startsWith("_")) {
            logger.debug("Skipping private extension {}", extension.getClass().getName());
            return false;
        }
        String className = extension.getClass().getName();
        String namespace = config.extensionNamespace;
        if (namespace != null && !namespace.isEmpty() && !className.startsWith(namespace + ".")) {
            logger.debug("Skipping extension {} outside namespace {}", className, namespace);
            return false;
        }
        if (className.contains(".internal.")) {
            logger.debug("Skipping internal extension {}", className);
            return false;
        }
        return true;
    }

    private BotExtension find(String id) {
        for (BotExtension extension : catalog.extensions()) {
            if (isDiscoverable(extension) && normalizeId(extension.getName()).equals(id))
                return extension;
        }
        return null;
    }

    /**
     * Loads every discovered extension that is enabled in the configuration. New extensions
     * are added to the plugins map as enabled.
     */
    public List<LoadResult> loadAll(Kernel kernel) {
        List<LoadResult> results = new ArrayList<>();
        for (String id : discover()) {
            BotExtension extension = find(id);
            String name = extension != null ? extension.getName() : id;

            if (!config.plugins.containsKey(name)) {
                logger.info("✨ New extension discovered: {}", name);
                config.plugins.put(name, true);
            }
            if (!Boolean.TRUE.equals(config.plugins.get(name))) {
                logger.info("Extension {} is disabled in config.", name);
                continue;
            }
            results.add(load(id, kernel));
        }

        long ok = results.stream().filter(LoadResult::isLoaded).count();
        logger.info("🔌 Extensions loaded: {} ok, {} failed, {} commands registered",
                ok, results.size() - ok, routes.size());
        return results;
    }

    /**
     * Initializes one extension and registers the commands it declares. A fault raised by the
     * extension is returned as {@link LoadResult#failed}, never thrown.
     */
    public LoadResult load(String extensionId, Kernel kernel) {
        String id = normalizeId(extensionId);
        if (loaded.containsKey(id)) {
            logger.debug("Extension {} already loaded", id);
            return LoadResult.loaded(id);
        }

        BotExtension extension = find(id);
        if (extension == null) {
            IllegalArgumentException fault = new IllegalArgumentException("Unknown extension: " + extensionId);
            failed.put(id, fault);
            logger.error("Cannot load extension {}: not found", extensionId);
            return LoadResult.failed(id, fault);
        }

        Collection<String> commands;
        try {
            logger.info("Loading extension: {} v{}", extension.getName(), extension.getVersion());
            extension.onEnable(kernel);
            commands = extension.getCommands();
        } catch (Exception | LinkageError e) {
            logger.error("Failed to enable extension: " + extension.getName(), e);
            failed.put(id, e);
            return LoadResult.failed(id, e);
        }

        if (commands != null) {
            for (String command : commands) {
                register(command, id, extension::handleCommand);
            }
        }
        loaded.put(id, extension);
        failed.remove(id);
        logger.info("✅ Extension loaded: {}", extension.getName());
        return LoadResult.loaded(id);
    }

    private boolean register(String name, String ownerId, CommandHandler handler) {
        String normalized = CommandNames.normalize(name);
        if (normalized.isEmpty()) {
            logger.warn("Ignoring empty command name from {}", ownerId);
            return false;
        }
        CommandRoute route = new CommandRoute(normalized, ownerId, handler);
        CommandRoute existing = routes.putIfAbsent(normalized, route);
        if (existing != null) {
            logger.warn("⚠️ Command {} already registered by {}; ignoring claim from {}",
                    normalized, existing.ownerId(), ownerId);
            return false;
        }
        logger.debug("Command {} registered by {}", normalized, ownerId);
        return true;
    }

    public boolean isHandled(String commandName) {
        return routes.containsKey(CommandNames.normalize(commandName));
    }

    /**
     * Registers a handler outside the declarative command list. Returns true only if every
     * name was registered; names already owned are skipped, the rest still go through.
     */
    public boolean registerHandler(String ownerId, Collection<String> names, CommandHandler handler) {
        boolean all = true;
        for (String name : names) {
            all &= register(name, ownerId, handler);
        }
        return all;
    }

    public boolean registerHandler(Collection<String> names, CommandHandler handler) {
        return registerHandler(PROGRAMMATIC_OWNER, names, handler);
    }

    /**
     * Invokes the handler registered for the command. Returns false if there is none; faults
     * raised by the handler propagate to the caller.
     */
    public boolean dispatch(String commandName, CommandRequest request) throws Exception {
        CommandRoute route = routes.get(CommandNames.normalize(commandName));
        if (route == null)
            return false;
        route.handler().handle(request);
        return true;
    }

    public void disableAll() {
        List<Map.Entry<String, BotExtension>> entries;
        synchronized (loaded) {
            entries = new ArrayList<>(loaded.entrySet());
        }
        for (Map.Entry<String, BotExtension> entry : entries) {
            try {
                logger.info("🔌 Disabling extension: {}", entry.getKey());
                entry.getValue().onDisable();
            } catch (Exception e) {
                logger.error("Error during onDisable for " + entry.getKey(), e);
            }
        }
    }

    public List<String> getLoaded() {
        synchronized (loaded) {
            return new ArrayList<>(loaded.keySet());
        }
    }

    public Map<String, Throwable> getFailed() {
        return new TreeMap<>(failed);
    }

    public Map<String, CommandRoute> getRoutes() {
        return new TreeMap<>(routes);
    }
}
