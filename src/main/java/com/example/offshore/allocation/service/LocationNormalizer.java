package com.example.offshore.allocation.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Maps free-text locations onto the closed set of known offshore facilities.
 * <p>
 * Names and aliases match by case-insensitive containment and the longest matching alias wins.
 * Rig codes of three characters or fewer only match a whole token of the input, so "TH" does not
 * fire inside "Smith". Unmatched input comes back trimmed.
 */
@Component
public class LocationNormalizer {

    private static final int CODE_MAX_LENGTH = 3;

    private final Map<String, String> rigCodes = new LinkedHashMap<>();
    private final List<Alias> aliases = new ArrayList<>();

    public LocationNormalizer() {
        facility("Thunder Horse PDQ", "TH", "Thunder Horse", "Thunderhorse", "TH");
        facility("Thunder Horse Drilling", "THD", "ThunderHorse Drilling", "Thunderhorse Drilling", "THD");
        facility("Thunder Horse Prod", "THP", "Thunder Horse Production", "THP");
        facility("Mad Dog", "MD", "MadDog", "Mad Dog Drilling", "Mad Dog Prod", "MD", "MDD", "MDP");
        facility("Atlantis PQ", "ATL", "Atlantis", "ATL", "AP");
        facility("Na Kika", "NK", "NaKika", "NK");
        facility("Argos", "ARG");
        facility("Shenzi", "SHE", "SHE");
        facility("Stena IceMAX", "IM", "IceMAX", "IM", "SI");
        facility("Ocean BlackLion", "OBL", "BlackLion", "Black Lion", "OBL");
        facility("Ocean Blackhornet", "OBH", "BlackHornet", "Black Hornet", "OBH");
        facility("Deepwater Invictus", "DVS", "Invictus", "DVS", "DI");
        facility("Island Venture", "IV", "IV");
        facility("Auriga", "AUR", "AUR");
        facility("C-Constructor", "CC", "C Constructor", "CC");
    }

    public String normalize(String location) {
        if (location == null) {
            return "";
        }
        String trimmed = location.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        Set<String> tokens = Arrays.stream(trimmed.toUpperCase(Locale.ROOT).split("[^A-Z0-9]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());

        Alias best = null;
        for (Alias alias : aliases) {
            boolean matches = alias.tokenOnly() ? tokens.contains(alias.upper()) : lower.contains(alias.lower());
            if (matches && (best == null || alias.lower().length() > best.lower().length())) {
                best = alias;
            }
        }
        return best != null ? best.canonical() : trimmed;
    }

    public boolean isKnown(String canonicalLocation) {
        return canonicalLocation != null && rigCodes.containsKey(canonicalLocation);
    }

    public Set<String> knownLocations() {
        return Collections.unmodifiableSet(rigCodes.keySet());
    }

    /**
     * Short code for a location: the facility's registered code, else the initials of up to three words.
     */
    public String rigCode(String location) {
        String canonical = normalize(location);
        if (canonical.isEmpty()) {
            return "UNK";
        }
        String known = rigCodes.get(canonical);
        if (known != null) {
            return known;
        }
        String[] words = canonical.split("\\s+");
        String code = words.length > 1
                ? Arrays.stream(words).map(word -> word.substring(0, 1)).collect(Collectors.joining())
                : canonical;
        code = code.toUpperCase(Locale.ROOT);
        return code.length() > CODE_MAX_LENGTH ? code.substring(0, CODE_MAX_LENGTH) : code;
    }

    private void facility(String canonical, String rigCode, String... extraAliases) {
        rigCodes.put(canonical, rigCode);
        Set<String> names = new LinkedHashSet<>();
        names.add(canonical);
        names.addAll(Arrays.asList(extraAliases));
        for (String name : names) {
            boolean tokenOnly = name.length() <= CODE_MAX_LENGTH;
            aliases.add(new Alias(name.toLowerCase(Locale.ROOT), name.toUpperCase(Locale.ROOT), canonical, tokenOnly));
        }
    }

    private record Alias(String lower, String upper, String canonical, boolean tokenOnly) {
    }
}
