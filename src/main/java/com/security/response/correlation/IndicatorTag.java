package com.security.response.correlation;

import java.util.Locale;
import java.util.Set;

/**
 * Technique tags recognised by the correlator. Sources label the same behaviour
 * differently ("c2_beacon", "command-and-control", "T1071.001"), so each indicator
 * matches a set of normalized names and MITRE ATT&CK technique prefixes.
 */
public enum IndicatorTag {

    LATERAL_MOVEMENT(Set.of("lateral_movement"), Set.of("t1021")),
    MALWARE_FAMILY(Set.of("malware", "confirmed_malware"), Set.of("malware_family")),
    COMMAND_AND_CONTROL(Set.of("c2", "c2_beacon", "c2_communication", "command_and_control"), Set.of("t1071")),
    RANSOMWARE(Set.of("ransomware", "ransomware_behavior"), Set.of("t1486")),
    GEO_ANOMALY(Set.of("geo_anomaly", "geographic_anomaly", "impossible_travel"), Set.of());

    private final Set<String> names;
    private final Set<String> prefixes;

    IndicatorTag(Set<String> names, Set<String> prefixes) {
        this.names = names;
        this.prefixes = prefixes;
    }

    public boolean matches(String rawTag) {
        String tag = normalize(rawTag);
        if (tag.isEmpty()) {
            return false;
        }
        if (names.contains(tag)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (tag.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Lower-case, trimmed, with '-' and spaces folded to '_'. */
    static String normalize(String rawTag) {
        if (rawTag == null) {
            return "";
        }
        return rawTag.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
