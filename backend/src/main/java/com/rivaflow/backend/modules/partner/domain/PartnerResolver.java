package com.rivaflow.backend.modules.partner.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges the instructor, manual contact and social friend lists into one partner directory.
 *
 * <p>Identity is the partner id. Lists are applied instructor first, then manual, then social;
 * the first record seen for an id is kept as is. Entries without an id are matched by
 * normalized name against what is already merged and dropped on a hit. Two records with
 * different ids are never merged, even with identical names. Name matching is a best-effort
 * fallback, not an identity guarantee.</p>
 */
public final class PartnerResolver {

    private static final Comparator<Partner> DISPLAY_ORDER = Comparator
            .comparing((Partner partner) -> normalizeName(partner.name()))
            .thenComparingInt(partner -> partner.source().getPriority())
            .thenComparing(Partner::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private PartnerResolver() {
    }

    public static List<Partner> merge(List<Partner> manual, List<Partner> instructors, List<Partner> social) {
        Map<String, Partner> byId = new LinkedHashMap<>();
        Set<String> mergedNames = new HashSet<>();
        List<Partner> merged = new ArrayList<>();

        for (List<Partner> source : List.of(nullSafe(instructors), nullSafe(manual), nullSafe(social))) {
            for (Partner partner : source) {
                if (partner == null || partner.name() == null || partner.name().isBlank()) {
                    continue;
                }
                String normalizedName = normalizeName(partner.name());
                if (partner.hasId()) {
                    if (byId.putIfAbsent(partner.id(), partner) == null) {
                        merged.add(partner);
                        mergedNames.add(normalizedName);
                    }
                } else if (mergedNames.add(normalizedName)) {
                    merged.add(partner);
                }
            }
        }

        merged.sort(DISPLAY_ORDER);
        return List.copyOf(merged);
    }

    public static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static List<Partner> nullSafe(List<Partner> partners) {
        return partners == null ? List.of() : partners;
    }
}
