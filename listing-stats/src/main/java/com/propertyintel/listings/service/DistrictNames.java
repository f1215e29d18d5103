package com.propertyintel.listings.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * District name handling shared by the listing normaliser and the region lookup.
 */
public final class DistrictNames {

    /**
     * Portal spellings that differ from the administrative register.
     * Matched case-insensitively against the whole value. Extend by adding entries only.
     */
    private static final Map<String, String> EXCEPTIONS = new LinkedHashMap<>();

    static {
        EXCEPTIONS.put("Hlavní město Praha", "Praha");
        EXCEPTIONS.put("Ostrava", "Ostrava-město");
    }

    private static final Pattern SPACED_HYPHEN = Pattern.compile("\\s*-\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DistrictNames() {
    }

    public static String applyExceptions(String district) {
        if (district == null) return null;
        for (Map.Entry<String, String> e : EXCEPTIONS.entrySet()) {
            if (e.getKey().equalsIgnoreCase(district)) {
                return e.getValue();
            }
        }
        return district;
    }

    /**
     * Join key for a district: trimmed, no spaces around hyphens, single
     * spaces, lower case. "Ostrava - Město " and "ostrava-město" give the same key.
     *
     * @return the key, or null for a null or blank district
     */
    public static String normalizeKey(String district) {
        if (district == null || district.isBlank()) return null;
        String key = SPACED_HYPHEN.matcher(district.trim()).replaceAll("-");
        key = WHITESPACE.matcher(key).replaceAll(" ");
        return key.toLowerCase(Locale.ROOT);
    }
}
