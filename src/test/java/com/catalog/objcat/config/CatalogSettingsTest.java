package com.catalog.objcat.config;

import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.io.DerivedSnapshotPolicy;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class CatalogSettingsTest {

    @Test
    public void testDefaults() {
        CatalogSettings settings = CatalogSettings.defaults();
        assertEquals(FailurePolicy.RAISE, settings.getFailurePolicy());
        assertEquals(DerivedSnapshotPolicy.FAIL, settings.getSnapshotPolicy());
        assertEquals("http://adsabs.harvard.edu", settings.getAdsBaseUrl());
        assertEquals(10_000L, settings.getAdsTimeoutMillis());
    }

    @Test
    public void testOverrides() {
        Properties props = new Properties();
        props.setProperty(CatalogSettings.FAILURE_POLICY, " warn ");
        props.setProperty(CatalogSettings.SNAPSHOT_POLICY, "drop");
        props.setProperty(CatalogSettings.ADS_BASE_URL, "https://ui.adsabs.harvard.edu/");
        props.setProperty(CatalogSettings.ADS_TIMEOUT_MILLIS, "2500");

        CatalogSettings settings = CatalogSettings.from(props);
        assertEquals(FailurePolicy.WARN, settings.getFailurePolicy());
        assertEquals(DerivedSnapshotPolicy.DROP, settings.getSnapshotPolicy());
        assertEquals("https://ui.adsabs.harvard.edu", settings.getAdsBaseUrl());
        assertEquals(2500L, settings.getAdsTimeoutMillis());
    }

    @Test
    public void testMalformedValues() {
        String[][] cases = {
                { CatalogSettings.FAILURE_POLICY, "explode" },
                { CatalogSettings.SNAPSHOT_POLICY, "keep" },
                { CatalogSettings.ADS_TIMEOUT_MILLIS, "soon" },
                { CatalogSettings.ADS_TIMEOUT_MILLIS, "0" },
        };
        for (String[] c : cases) {
            Properties props = new Properties();
            props.setProperty(c[0], c[1]);
            try {
                CatalogSettings.from(props);
                fail("Expected IllegalArgumentException for " + c[0] + "=" + c[1]);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }
}
