package com.catalog.objcat.source;

import com.catalog.objcat.biblio.SourceDataException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class SourceTest {

    private SourceRegistry registry;

    @Before
    public void setUp() {
        registry = new SourceRegistry(locator -> "resolved:" + locator.strip());
    }

    @Test
    public void testInterning() {
        Source first = Source.of("source-test-interned");
        Source second = Source.of("source-test-interned");
        assertSame(first, second);
        assertTrue(Source.find("source-test-interned").isPresent());
        assertSame(first, Source.find("source-test-interned/anything").get());
    }

    @Test
    public void testPlainName() {
        Source plain = registry.source("Smith 2004");
        assertEquals("Smith 2004", plain.name());
        assertNull(plain.location());
        assertFalse(plain.hasLocation());
        assertEquals("Smith 2004", plain.spec());
        assertEquals("Source Smith 2004", plain.toString());
    }

    @Test
    public void testVerbatimCode() {
        Source coded = registry.source("Smith 2004//2004ApJ...600..100S");
        assertEquals("Smith 2004", coded.name());
        assertEquals("2004ApJ...600..100S", coded.location());
        assertEquals("Smith 2004//2004ApJ...600..100S", coded.spec());
        assertEquals("Source Smith 2004 @2004ApJ...600..100S", coded.toString());
    }

    @Test
    public void testLocatorGoesThroughResolver() {
        Source located = registry.source("Jones/arxiv:astro-ph/0601001");
        assertEquals("Jones", located.name());
        assertEquals("resolved:arxiv:astro-ph/0601001", located.location());

        Source other = registry.source("Brown", "doi:10.1086/420000");
        assertEquals("resolved:doi:10.1086/420000", other.location());
    }

    @Test
    public void testLocationOverwrite() {
        Source first = registry.source("Lee");
        assertSame(first, registry.source("Lee//2001AJ....121..100L"));
        assertEquals("2001AJ....121..100L", first.location());

        registry.source("Lee//2002AJ....122..200L");
        assertEquals("2002AJ....122..200L", first.location());

        registry.source("Lee");
        assertEquals("Bare name keeps the location", "2002AJ....122..200L", first.location());
    }

    @Test
    public void testFindDoesNotCreate() {
        assertFalse(registry.find("Nobody").isPresent());
        assertFalse(registry.contains("Nobody"));
        Source kept = registry.source("Nobody");
        assertTrue(registry.contains("Nobody"));
        assertEquals(1, registry.size());
        assertSame(kept, registry.find("Nobody").get());
    }

    @Test
    public void testBlankNameRejected() {
        for (String bad : new String[] { "", "   ", "/locator", "//code" }) {
            try {
                registry.source(bad);
                fail("Expected IllegalArgumentException for \"" + bad + "\"");
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test
    public void testRecordNeedsLocation() {
        Source plain = registry.source("Unlocated");
        try {
            plain.record(null);
            fail("Expected SourceDataException");
        } catch (SourceDataException e) {
            // expected
        }
    }

    @Test
    public void testVerbatimResolver() {
        assertNull(LocationResolver.VERBATIM.resolve("  "));
        assertEquals("2004ApJ", LocationResolver.VERBATIM.resolve(" 2004ApJ "));
        assertEquals("<default>", Source.DEFAULT.name());
    }
}
