package com.catalog.objcat.biblio;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.catalog.objcat.config.CatalogSettings;

import lombok.extern.log4j.Log4j2;

/**
 * {@link BibliographicService} backed by the NASA Astrophysics Data System
 * abstract service.
 *
 * <p>
 * Codes are found by fetching the plaintext abstract page for the locator and
 * reading its {@code Bibliographic Code:} line. Records come from the XML
 * abstract page, which must hold exactly one {@code record} element.
 */
@Log4j2
public final class AdsBibliographicService implements BibliographicService {
    private static final String CODE_MARKER = "Bibliographic Code:";

    private final String baseUrl;
    private final PageFetcher fetcher;

    public AdsBibliographicService() {
        this(CatalogSettings.fromSystemProperties());
    }

    public AdsBibliographicService(CatalogSettings settings) {
        this(settings.getAdsBaseUrl(), new HttpPageFetcher(Duration.ofMillis(settings.getAdsTimeoutMillis())));
    }

    public AdsBibliographicService(String baseUrl, PageFetcher fetcher) {
        String base = Objects.requireNonNull(baseUrl, "baseUrl").strip();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** The plaintext abstract page URL a locator is looked up at. */
    public URI lookupUri(String locator) {
        String loc = locator.strip();
        String lower = loc.toLowerCase(Locale.ROOT);
        String url;
        if (lower.contains("arxiv")) {
            url = baseUrl + "/abs/arXiv:" + stripPrefix(loc, "arxiv");
        } else if (lower.contains("astro-ph")) {
            String id = stripPrefix(loc, "astro-ph");
            url = baseUrl + "/abs/arXiv:astro-ph/" + (id.startsWith("/") ? id.substring(1) : id);
        } else if (lower.startsWith("doi")) {
            url = baseUrl + "/doi/" + stripPrefix(loc, "doi");
        } else if (lower.startsWith("http")) {
            url = loc;
        } else {
            url = baseUrl + "/abs/" + encode(loc);
        }
        return URI.create(url + (url.contains("?") ? "&" : "?") + "data_type=PLAINTEXT");
    }

    @Override
    public String resolveCode(String locator) {
        URI uri = lookupUri(locator);
        String body = get(uri, "location " + locator);
        for (String line : body.split("\\R")) {
            int at = line.indexOf(CODE_MARKER);
            if (at >= 0) {
                String code = line.substring(at + CODE_MARKER.length()).strip();
                log.debug("Resolved location {} to code {}", locator, code);
                return code;
            }
        }
        throw new SourceDataException(
                "Bibliographic entry for the location " + locator + " had no ADS code, or parsing problem");
    }

    @Override
    public BibRecord fetchRecord(String code) {
        URI uri = URI.create(baseUrl + "/abs/" + encode(code) + "?data_type=XML");
        Document document = parse(get(uri, "code " + code), code);
        NodeList records = document.getElementsByTagName("record");
        if (records.getLength() == 0) {
            throw new NoSuchRecordException("No ADS record for code " + code);
        }
        if (records.getLength() > 1) {
            throw new SourceDataException("Multiple matching ADS records for code " + code);
        }
        return toRecord(code, (Element) records.item(0));
    }

    @Override
    public String fetchBibtex(String code) {
        return get(URI.create(baseUrl + "/abs/" + encode(code) + "?data_type=BIBTEX"), "code " + code);
    }

    private String get(URI uri, String what) {
        PageFetcher.Page page;
        try {
            page = fetcher.fetch(uri);
        } catch (IOException e) {
            throw new SourceTransportException("Could not fetch " + what + " from " + uri, e);
        }
        if (page.status() == 404) {
            throw new NoSuchRecordException("Requested " + what + " does not exist at url " + uri);
        }
        if (page.status() >= 400) {
            throw new SourceTransportException("HTTP " + page.status() + " fetching " + what + " from " + uri,
                    null);
        }
        return page.body() == null ? "" : page.body();
    }

    private static Document parse(String xml, String code) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new SourceDataException("Malformed ADS record for code " + code, e);
        }
    }

    private static BibRecord toRecord(String code, Element record) {
        List<String> authors = texts(record, "author");
        Map<String, List<String>> links = new LinkedHashMap<>();
        NodeList linkNodes = record.getElementsByTagName("link");
        for (int i = 0; i < linkNodes.getLength(); i++) {
            Element link = (Element) linkNodes.item(i);
            links.computeIfAbsent(link.getAttribute("type"), t -> new ArrayList<>()).addAll(texts(link, "url"));
        }
        List<String> keywords = List.of();
        String keywordType = null;
        NodeList keywordGroups = record.getElementsByTagName("keywords");
        if (keywordGroups.getLength() > 0) {
            Element group = (Element) keywordGroups.item(0);
            keywords = texts(group, "keyword");
            keywordType = group.hasAttribute("type") ? group.getAttribute("type") : null;
        }
        return new BibRecord(code, authors, single(record, "title"), single(record, "abstract"),
                single(record, "pubdate"), links, keywords, keywordType);
    }

    private static List<String> texts(Element parent, String tag) {
        NodeList nodes = parent.getElementsByTagName(tag);
        List<String> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add(nodes.item(i).getTextContent().strip());
        }
        return out;
    }

    private static String single(Element parent, String tag) {
        List<String> values = texts(parent, tag);
        return values.size() == 1 ? values.get(0) : null;
    }

    private static String stripPrefix(String locator, String prefix) {
        String rest = locator.substring(locator.toLowerCase(Locale.ROOT).indexOf(prefix) + prefix.length());
        return rest.startsWith(":") ? rest.substring(1).strip() : rest.strip();
    }

    private static String encode(String code) {
        return URLEncoder.encode(code, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
