package com.vbot.core.plugin;

import com.vbot.api.BotExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Finds extensions on the application classpath and in the jars of the plugin directory.
 * Instances are created once and reused for every later lookup.
 */
public class ServiceLoaderCatalog implements ExtensionCatalog {
    private static final Logger logger = LoggerFactory.getLogger(ServiceLoaderCatalog.class);

    private final File pluginDir;
    private final List<URLClassLoader> jarLoaders = new ArrayList<>();
    private List<BotExtension> cached;

    public ServiceLoaderCatalog(File pluginDir) {
        this.pluginDir = pluginDir;
    }

    @Override
    public synchronized List<BotExtension> extensions() {
        if (cached == null) {
            List<BotExtension> found = new ArrayList<>();
            collect(ServiceLoader.load(BotExtension.class, getClass().getClassLoader()), "classpath", found);
            scanJars(found);
            found.sort(Comparator.comparing(BotExtension::getName, String.CASE_INSENSITIVE_ORDER));
            cached = List.copyOf(found);
        }
        return cached;
    }

    private void scanJars(List<BotExtension> found) {
        if (pluginDir == null || !pluginDir.isDirectory())
            return;

        File[] jars = pluginDir.listFiles((dir, name) -> name.endsWith(".jar"));
        if (jars == null || jars.length == 0)
            return;
        Arrays.sort(jars, Comparator.comparing(File::getName));

        for (File jar : jars) {
            try {
                URL[] urls = new URL[] { jar.toURI().toURL() };
                URLClassLoader ucl = new URLClassLoader(urls, getClass().getClassLoader());
                jarLoaders.add(ucl);
                collect(ServiceLoader.load(BotExtension.class, ucl), jar.getName(), found);
            } catch (Exception e) {
                logger.error("Failed to open plugin jar: " + jar.getName(), e);
            }
        }
    }

    private void collect(ServiceLoader<BotExtension> loader, String origin, List<BotExtension> found) {
        var iterator = loader.iterator();
        while (true) {
            try {
                if (!iterator.hasNext())
                    break;
                BotExtension extension = iterator.next();
                boolean duplicate = found.stream()
                        .anyMatch(e -> e.getClass().getName().equals(extension.getClass().getName()));
                if (duplicate) {
                    logger.debug("Extension class {} seen twice, keeping the first", extension.getClass().getName());
                    continue;
                }
                found.add(extension);
            } catch (ServiceConfigurationError e) {
                // A broken provider entry must not hide the others
                logger.error("Skipping unloadable extension from {}", origin, e);
            }
        }
    }

    public synchronized void close() {
        for (URLClassLoader ucl : jarLoaders) {
            try {
                ucl.close();
            } catch (Exception e) {
                logger.warn("Failed to close plugin ClassLoader", e);
            }
        }
        jarLoaders.clear();
    }
}
