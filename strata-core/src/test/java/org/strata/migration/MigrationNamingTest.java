package org.strata.migration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationNamingTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-05T07:08:09Z"), ZoneOffset.UTC);

    @Test
    void initial() {
        assertThat(new MigrationNaming("m_", FIXED).initial()).isEqualTo("m_0001_initial");
    }

    @Test
    void next_incrementsNumberAndAddsUtcTimestamp() {
        MigrationNaming naming = new MigrationNaming("m_", FIXED);

        assertThat(naming.next("m_0001_initial")).isEqualTo("m_0002_auto_20240305_070809");
        assertThat(naming.next("m_0041_auto_20240101_000000")).isEqualTo("m_0042_auto_20240305_070809");
    }

    @Test
    @DisplayName("시스템 시간대와 관계없이 UTC로 기록한다")
    void next_ignoresClockZone() {
        Clock seoul = Clock.fixed(Instant.parse("2024-03-05T23:30:00Z"), ZoneId.of("Asia/Seoul"));

        assertThat(new MigrationNaming("m_", seoul).next("m_0001_initial"))
                .isEqualTo("m_0002_auto_20240305_233000");
    }

    @Test
    void numberGrowsBeyondFourDigits() {
        assertThat(new MigrationNaming("m_", FIXED).next("m_9999_auto_20240101_000000"))
                .startsWith("m_10000_auto_");
    }

    @Test
    void customPrefix() {
        MigrationNaming naming = new MigrationNaming("v_", FIXED);

        assertThat(naming.getPrefix()).isEqualTo("v_");
        assertThat(naming.initial()).isEqualTo("v_0001_initial");
        assertThat(naming.next("m_0003_auto_20240101_000000")).isEqualTo("v_0004_auto_20240305_070809");
    }

    @ParameterizedTest
    @ValueSource(strings = {"m", "m__", "_m", "1m_", "my_app_", ""})
    void invalidPrefix_isRejected(String prefix) {
        assertThatThrownBy(() -> new MigrationNaming(prefix, FIXED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"initial", "m_initial", "m_x001_auto", "m_-3_auto"})
    void unparsableIdentifier_isRejected(String identifier) {
        assertThatThrownBy(() -> MigrationNaming.sequenceNumber(identifier))
                .isInstanceOf(InvalidMigrationNameException.class)
                .isInstanceOf(MigrationPlanningException.class)
                .hasMessageContaining(identifier);
    }

    @Test
    void sequenceNumber() {
        assertThat(MigrationNaming.sequenceNumber("m_0007_auto_20240101_000000")).isEqualTo(7);
    }
}
