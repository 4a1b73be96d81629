package com.sentinelv.core.config;

import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.Urgency;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantumThreatTableTest {

    private final QuantumThreatTable t = QuantumThreatTable.defaults();

    @Test
    void break_years_by_family_and_key_size() {
        assertThat(t.breakYear(CryptoFamily.RSA, 2048, 2026)).isEqualTo(2030);
        assertThat(t.breakYear(CryptoFamily.RSA, 4096, 2026)).isEqualTo(2032);
        assertThat(t.breakYear(CryptoFamily.ECC, 256, 2026)).isEqualTo(2030);
        assertThat(t.breakYear(CryptoFamily.AES, 256, 2026)).isEqualTo(2040);
        assertThat(t.breakYear(CryptoFamily.PQC, 768, 2026)).isEqualTo(2076);
    }

    @Test
    void thresholds_are_inclusive_toward_more_urgent() {
        assertThat(t.urgencyFor(0)).isEqualTo(Urgency.IMMEDIATE);
        assertThat(t.urgencyFor(3)).isEqualTo(Urgency.IMMEDIATE);
        assertThat(t.urgencyFor(4)).isEqualTo(Urgency.URGENT);
        assertThat(t.urgencyFor(5)).isEqualTo(Urgency.URGENT);
        assertThat(t.urgencyFor(7)).isEqualTo(Urgency.HIGH);
        assertThat(t.urgencyFor(8)).isEqualTo(Urgency.MODERATE);
        assertThat(t.riskScore(Urgency.IMMEDIATE)).isEqualTo(95);
        assertThat(t.riskScore(Urgency.MODERATE)).isEqualTo(50);
    }

    @Test
    void builder_overrides_and_validates() {
        QuantumThreatTable custom = t.toBuilder().breakYear(CryptoFamily.RSA, 2035).build();
        assertThat(custom.breakYear(CryptoFamily.RSA, 2048, 2026)).isEqualTo(2035);
        assertThat(t.breakYear(CryptoFamily.RSA, 2048, 2026)).isEqualTo(2030);

        assertThatThrownBy(() -> QuantumThreatTable.builder().urgencyThresholds(5, 3, 7).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuantumThreatTable.builder().riskScore(Urgency.HIGH, 120).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
