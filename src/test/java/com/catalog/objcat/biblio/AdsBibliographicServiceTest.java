package com.catalog.objcat.biblio;

import com.catalog.objcat.source.Source;
import com.catalog.objcat.source.SourceRegistry;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class AdsBibliographicServiceTest {

    private static final String BASE = "http://ads.test";
    private static final String CODE = "2004ApJ...600..100S";

    private static final String RECORD_XML = "<?xml version=\"1.0\"?>\n"
            + "<records>\n"
            + "  <record>\n"
            + "    <bibcode>" + CODE + "</bibcode>\n"
            + "    <title>The Andromeda Halo</title>\n"
            + "    <author>Smith, J.</author>\n"
            + "    <author>Jones, K.</author>\n"
            + "    <pubdate>Mar 2004</pubdate>\n"
            + "    <abstract>We measure the halo.</abstract>\n"
            + "    <link type=\"ABSTRACT\"><url>http://ads.test/abs/" + CODE + "</url></link>\n"
            + "    <link type=\"DATA\"><url>http://data.test/1</url><url>http://data.test/2</url></link>\n"
            + "    <keywords type=\"AAS\"><keyword>galaxies: halos</keyword><keyword>galaxies: individual</keyword></keywords>\n"
            + "  </record>\n"
            + "</records>\n";

    private Map<String, PageFetcher.Page> pages;
    private List<String> requested;
    private AdsBibliographicService ads;

    @Before
    public void setUp() {
        pages = new HashMap<>();
        requested = new ArrayList<>();
        ads = new AdsBibliographicService(BASE + "/", uri -> {
            requested.add(uri.toString());
            return pages.getOrDefault(uri.toString(), new PageFetcher.Page(404, ""));
        });
    }

    private void page(String url, String body) {
        pages.put(url, new PageFetcher.Page(200, body));
    }

    @Test
    public void testLookupUris() {
        assertEquals(BASE + "/abs/arXiv:0901.1234?data_type=PLAINTEXT", ads.lookupUri("arXiv:0901.1234").toString());
        assertEquals(BASE + "/abs/arXiv:astro-ph/0601001?data_type=PLAINTEXT",
                ads.lookupUri("astro-ph/0601001").toString());
        assertEquals(BASE + "/doi/10.1086/420000?data_type=PLAINTEXT", ads.lookupUri("doi:10.1086/420000").toString());
        assertEquals("http://other.test/find?id=1&data_type=PLAINTEXT",
                ads.lookupUri("http://other.test/find?id=1").toString());
        assertEquals(BASE + "/abs/" + CODE + "?data_type=PLAINTEXT", ads.lookupUri(CODE).toString());
        assertEquals(BASE + "/abs/2004A%26A...400..100S?data_type=PLAINTEXT",
                ads.lookupUri("2004A&A...400..100S").toString());
    }

    @Test
    public void testResolveCode() {
        page(BASE + "/abs/arXiv:0901.1234?data_type=PLAINTEXT",
                "Title:                 The Andromeda Halo\nBibliographic Code:    " + CODE + "\n\nAbstract\n");
        assertEquals(CODE, ads.resolveCode("arXiv:0901.1234"));
    }

    @Test
    public void testResolveCodeWithoutMarker() {
        page(BASE + "/abs/arXiv:0901.1234?data_type=PLAINTEXT", "Nothing to see");
        try {
            ads.resolveCode("arXiv:0901.1234");
            fail("Expected SourceDataException");
        } catch (SourceDataException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("had no ADS code"));
        }
    }

    @Test
    public void testFetchRecord() {
        page(BASE + "/abs/" + CODE + "?data_type=XML", RECORD_XML);
        BibRecord record = ads.fetchRecord(CODE);
        assertEquals(CODE, record.code());
        assertEquals(List.of("Smith, J.", "Jones, K."), record.authors());
        assertEquals("The Andromeda Halo", record.title());
        assertEquals("We measure the halo.", record.abstractText());
        assertEquals("Mar 2004", record.date());
        assertEquals(List.of("http://data.test/1", "http://data.test/2"), record.links().get("DATA"));
        assertEquals("http://ads.test/abs/" + CODE, record.abstractUrl());
        assertEquals(List.of("galaxies: halos", "galaxies: individual"), record.keywords());
        assertEquals("AAS", record.keywordType());
    }

    @Test
    public void testRecordCountMustBeOne() {
        page(BASE + "/abs/" + CODE + "?data_type=XML", "<records></records>");
        try {
            ads.fetchRecord(CODE);
            fail("Expected NoSuchRecordException");
        } catch (NoSuchRecordException e) {
            // expected
        }

        page(BASE + "/abs/" + CODE + "?data_type=XML", "<records><record/><record/></records>");
        try {
            ads.fetchRecord(CODE);
            fail("Expected SourceDataException");
        } catch (SourceDataException e) {
            assertFalse(e instanceof NoSuchRecordException);
            assertTrue(e.getMessage(), e.getMessage().startsWith("Multiple matching ADS records"));
        }
    }

    @Test
    public void testMalformedXml() {
        page(BASE + "/abs/" + CODE + "?data_type=XML", "<records><record>");
        try {
            ads.fetchRecord(CODE);
            fail("Expected SourceDataException");
        } catch (SourceDataException e) {
            // expected
        }
    }

    @Test
    public void testHttpFailures() {
        try {
            ads.fetchBibtex(CODE);
            fail("Expected NoSuchRecordException");
        } catch (NoSuchRecordException e) {
            // expected
        }

        pages.put(BASE + "/abs/" + CODE + "?data_type=BIBTEX", new PageFetcher.Page(503, "busy"));
        try {
            ads.fetchBibtex(CODE);
            fail("Expected SourceTransportException");
        } catch (SourceTransportException e) {
            // expected
        }

        AdsBibliographicService offline = new AdsBibliographicService(BASE, uri -> {
            throw new IOException("network down");
        });
        try {
            offline.fetchRecord(CODE);
            fail("Expected SourceTransportException");
        } catch (SourceTransportException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test
    public void testFetchBibtex() {
        page(BASE + "/abs/" + CODE + "?data_type=BIBTEX", "@ARTICLE{" + CODE + ",}");
        assertEquals("@ARTICLE{" + CODE + ",}", ads.fetchBibtex(CODE));
    }

    @Test
    public void testResolvesSourceLocations() {
        page(BASE + "/abs/arXiv:0901.1234?data_type=PLAINTEXT", "Bibliographic Code: " + CODE);
        page(BASE + "/abs/" + CODE + "?data_type=XML", RECORD_XML);
        SourceRegistry registry = new SourceRegistry(ads.asLocationResolver());

        Source smith = registry.source("Smith 2004/arXiv:0901.1234");
        assertEquals(CODE, smith.location());
        assertEquals("The Andromeda Halo", smith.record(ads).title());

        Source verbatim = registry.source("Lee//2001AJ....121..100L");
        assertEquals("2001AJ....121..100L", verbatim.location());
        assertEquals("Verbatim codes are never looked up", 2, requested.size());
    }
}
