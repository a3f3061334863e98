/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.weatheralerts.api.types.BoundsType;

/**
 * Derives the short place identifier that, together with the phenomenon, keys an aggregation bucket.
 *
 * <p>
 * The key string is {@code place_neLat_neLng_swLat_swLng}; its SHA-256 digest is hex encoded and truncated to
 * {@value #BUCKET_ID_LENGTH} characters. Equal inputs always produce the same id.
 *
 * <p>
 * Bounds come straight from the geocoder, so two reports from the same spot can yield slightly different coordinates
 * and therefore different bucket ids.
 */
@ApplicationScoped
public class BucketKeyDeriver {

    public static final int BUCKET_ID_LENGTH = 16;

    /**
     * Derives the bucket id for a geocoded place.
     *
     * @param placeName
     *            geocoded place name (neighbourhood or locality)
     * @param bounds
     *            geocoded bounding box
     * @return 16-character lowercase hex identifier
     */
    public String derive(String placeName, BoundsType bounds) {
        String keyString = placeName + "_" + bounds.northeast().lat() + "_" + bounds.northeast().lng() + "_"
                + bounds.southwest().lat() + "_" + bounds.southwest().lng();
        return sha256Hex(keyString).substring(0, BUCKET_ID_LENGTH);
    }

    private static String sha256Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(2 * hash.length);
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
