package io.dataquest.normalize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical column name to the ordered source spellings accepted for it. Lookups ignore case; earlier
 * aliases win. Adding a spelling is a matter of adding it to the list.
 */
public final class AliasTable {
    private final Map<String, List<String>> aliases;

    private AliasTable(Map<String, List<String>> aliases) {
        this.aliases = aliases;
    }

    public static Builder builder() { return new Builder(); }

    public List<String> targets() { return List.copyOf(aliases.keySet()); }

    public List<String> aliasesFor(String target) {
        return aliases.getOrDefault(target, List.of());
    }

    /**
     * The first of {@code columns} that spells one of {@code target}'s aliases, trying aliases in order.
     * Columns in {@code unavailable} are never returned.
     */
    public Optional<String> resolve(String target, List<String> columns, Collection<String> unavailable) {
        Map<String, String> byLower = new HashMap<>();
        for (String c : columns) {
            if (!unavailable.contains(c)) byLower.putIfAbsent(c.toLowerCase(Locale.ROOT), c);
        }
        for (String alias : aliasesFor(target)) {
            String hit = byLower.get(alias.toLowerCase(Locale.ROOT));
            if (hit != null) return Optional.of(hit);
        }
        return Optional.empty();
    }

    @Override
    public String toString() { return "AliasTable" + aliases; }

    public static final class Builder {
        private final Map<String, List<String>> aliases = new LinkedHashMap<>();

        public Builder put(String target, String... spellings) {
            aliases.put(target, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(spellings))));
            return this;
        }

        public AliasTable build() {
            return new AliasTable(Collections.unmodifiableMap(new LinkedHashMap<>(aliases)));
        }
    }
}
