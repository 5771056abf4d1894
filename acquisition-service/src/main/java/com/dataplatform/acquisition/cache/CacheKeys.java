package com.dataplatform.acquisition.cache;

import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.FilterCriteria;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Deterministic cache key of a request: {@code <dataType>:<sha-256 of the canonical form>}.
 *
 * <p>Entity keys are sorted so {@code [MSFT, AAPL]} and {@code [AAPL, MSFT]} share an entry.
 * Deadline, freshness requirement and trace id are not part of the key.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String of(DataRequest request) {
        FilterCriteria f = request.filterCriteria();
        StringBuilder canonical = new StringBuilder()
            .append(request.dataType()).append('|')
            .append(String.join(",", new TreeSet<>(request.entityKeys()))).append('|')
            .append(f.sector() == null ? "" : f.sector().trim().toLowerCase(Locale.ROOT)).append('|')
            .append(f.dateRange() == null ? "" : f.dateRange().toString()).append('|')
            .append(f.granularity()).append('|')
            .append(f.analysisType()).append('|')
            .append(f.realTime());
        return request.dataType().name().toLowerCase(Locale.ROOT) + ":" + sha256(canonical.toString());
    }

    /** Readable description for logs; never used as a key. */
    public static String describe(DataRequest request) {
        List<String> keys = request.entityKeys();
        String entities = keys.isEmpty() ? "-" : keys.size() <= 3 ? String.join(",", keys)
            : String.join(",", keys.subList(0, 3)) + ",+" + (keys.size() - 3);
        return request.dataType() + "[" + entities + "]";
    }

    private static String sha256(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
