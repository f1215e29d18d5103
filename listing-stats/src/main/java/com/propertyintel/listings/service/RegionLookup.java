package com.propertyintel.listings.service;

import com.propertyintel.listings.model.RegionReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable district → region index built once per run from the
 * administrative reference table.
 *
 * Keys go through {@link DistrictNames#normalizeKey}, the same function the
 * normaliser applies to listings, so a lookup is an exact map hit.
 */
@Slf4j
public final class RegionLookup {

    public record RegionEntry(String districtLabel, String regionLabel) {}

    private final Map<String, RegionEntry> byKey;

    private RegionLookup(Map<String, RegionEntry> byKey) {
        this.byKey = Collections.unmodifiableMap(byKey);
    }

    public static RegionLookup of(Iterable<RegionReference> references) {
        Map<String, RegionEntry> byKey = new HashMap<>();
        int skipped = 0;

        for (RegionReference ref : references) {
            String key = DistrictNames.normalizeKey(ref.district());
            if (key == null) {
                skipped++;
                continue;
            }
            RegionEntry entry = new RegionEntry(ref.district(), ref.region());
            RegionEntry existing = byKey.putIfAbsent(key, entry);
            if (existing != null && !sameRegion(existing, entry)) {
                log.warn("District '{}' maps to both '{}' and '{}', keeping '{}'",
                        key, existing.regionLabel(), entry.regionLabel(), existing.regionLabel());
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} region reference rows without a district", skipped);
        }
        return new RegionLookup(byKey);
    }

    private static boolean sameRegion(RegionEntry a, RegionEntry b) {
        return a.regionLabel() == null ? b.regionLabel() == null : a.regionLabel().equals(b.regionLabel());
    }

    public Optional<RegionEntry> find(String districtKey) {
        if (districtKey == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(districtKey));
    }

    public int size() {
        return byKey.size();
    }
}
