package com.security.response.correlation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndicatorTagTest {

    @Test
    void matchesVendorSpellingsAndTechniqueIds() {
        assertThat(IndicatorTag.COMMAND_AND_CONTROL.matches("Command-and-Control")).isTrue();
        assertThat(IndicatorTag.COMMAND_AND_CONTROL.matches("T1071.001")).isTrue();
        assertThat(IndicatorTag.RANSOMWARE.matches(" ransomware behavior ")).isTrue();
        assertThat(IndicatorTag.LATERAL_MOVEMENT.matches("t1021")).isTrue();
        assertThat(IndicatorTag.MALWARE_FAMILY.matches("malware_family:qakbot")).isTrue();
    }

    @Test
    void doesNotMatchUnrelatedOrBlankTags() {
        assertThat(IndicatorTag.RANSOMWARE.matches("port_scan")).isFalse();
        assertThat(IndicatorTag.GEO_ANOMALY.matches("")).isFalse();
        assertThat(IndicatorTag.GEO_ANOMALY.matches(null)).isFalse();
    }
}
