package org.smileyface.linkarchive.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class LedgerStatusTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void coolingRequiresEndInstant() {
        assertThatThrownBy(() -> new LedgerStatus(LedgerStatus.Kind.COOLING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isCoolingAt_onlyBeforeTheEndInstant() {
        LedgerStatus s = LedgerStatus.cooling(T0);
        assertThat(s.isCoolingAt(T0.minusSeconds(1))).isTrue();
        assertThat(s.isCoolingAt(T0)).isFalse();
        assertThat(LedgerStatus.retryable().isCoolingAt(T0)).isFalse();
    }

    @Test
    void permanentIsPermanent() {
        assertThat(LedgerStatus.permanent().isPermanent()).isTrue();
        assertThat(LedgerStatus.neverFailed().isPermanent()).isFalse();
    }
}
