package com.vbot.core.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServiceLoaderCatalogTest {
    @TempDir
    Path tempDir;

    @Test
    void testMissingPluginDirectoryIsEmpty() {
        ServiceLoaderCatalog catalog = new ServiceLoaderCatalog(new File(tempDir.toFile(), "absent"));
        assertTrue(catalog.extensions().isEmpty(), "Core ships no extension of its own");
        catalog.close();
    }

    @Test
    void testLookupIsCached() {
        ServiceLoaderCatalog catalog = new ServiceLoaderCatalog(tempDir.toFile());
        assertSame(catalog.extensions(), catalog.extensions());
        catalog.close();
    }
}
