package com.catalog.objcat.config;

import java.util.Properties;

import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.io.DerivedSnapshotPolicy;

import lombok.Getter;

/**
 * Process-wide defaults, read from system properties. Explicit arguments to
 * the catalog API always win over these.
 *
 * <ul>
 * <li>{@value #FAILURE_POLICY}: default {@link FailurePolicy} of new derived
 * values, {@code raise}</li>
 * <li>{@value #SNAPSHOT_POLICY}: default {@link DerivedSnapshotPolicy},
 * {@code fail}</li>
 * <li>{@value #ADS_BASE_URL}: bibliographic service root</li>
 * <li>{@value #ADS_TIMEOUT_MILLIS}: bibliographic request timeout</li>
 * </ul>
 */
@Getter
public final class CatalogSettings {
    public static final String FAILURE_POLICY = "objcat.derived.failurePolicy";
    public static final String SNAPSHOT_POLICY = "objcat.snapshot.derivedPolicy";
    public static final String ADS_BASE_URL = "objcat.ads.baseUrl";
    public static final String ADS_TIMEOUT_MILLIS = "objcat.ads.timeoutMillis";

    public static final String DEFAULT_ADS_BASE_URL = "http://adsabs.harvard.edu";
    public static final long DEFAULT_ADS_TIMEOUT_MILLIS = 10_000L;

    private final FailurePolicy failurePolicy;
    private final DerivedSnapshotPolicy snapshotPolicy;
    private final String adsBaseUrl;
    private final long adsTimeoutMillis;

    private CatalogSettings(FailurePolicy failurePolicy, DerivedSnapshotPolicy snapshotPolicy, String adsBaseUrl,
            long adsTimeoutMillis) {
        this.failurePolicy = failurePolicy;
        this.snapshotPolicy = snapshotPolicy;
        this.adsBaseUrl = adsBaseUrl;
        this.adsTimeoutMillis = adsTimeoutMillis;
    }

    public static CatalogSettings defaults() {
        return from(new Properties());
    }

    public static CatalogSettings fromSystemProperties() {
        return from(System.getProperties());
    }

    /**
     * @throws IllegalArgumentException if a property is present but malformed
     */
    public static CatalogSettings from(Properties props) {
        String policy = props.getProperty(FAILURE_POLICY);
        String snapshot = props.getProperty(SNAPSHOT_POLICY);
        String baseUrl = props.getProperty(ADS_BASE_URL, DEFAULT_ADS_BASE_URL).strip();
        String timeout = props.getProperty(ADS_TIMEOUT_MILLIS);
        long timeoutMillis;
        try {
            timeoutMillis = timeout == null ? DEFAULT_ADS_TIMEOUT_MILLIS : Long.parseLong(timeout.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed " + ADS_TIMEOUT_MILLIS + ": " + timeout, e);
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException(ADS_TIMEOUT_MILLIS + " must be positive: " + timeoutMillis);
        }
        return new CatalogSettings(
                policy == null ? FailurePolicy.RAISE : FailurePolicy.parse(policy),
                snapshot == null ? DerivedSnapshotPolicy.FAIL : DerivedSnapshotPolicy.parse(snapshot),
                baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl,
                timeoutMillis);
    }

    @Override
    public String toString() {
        return "CatalogSettings[failurePolicy=" + failurePolicy + ", snapshotPolicy=" + snapshotPolicy
                + ", adsBaseUrl=" + adsBaseUrl + ", adsTimeoutMillis=" + adsTimeoutMillis + "]";
    }
}
