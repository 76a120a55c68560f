package com.collectiveip.core.support;

import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.LicenseOffer;
import com.collectiveip.core.domain.LicenseTerms;
import com.collectiveip.core.domain.LicenseType;
import com.collectiveip.core.domain.RoyaltySchedule;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampsTest {

    private static final long NOW = 1_767_225_600L;

    @Test
    void after_addsDuration() {
        assertThat(Timestamps.after(NOW, 0, "Duration")).isEqualTo(NOW);
        assertThat(Timestamps.after(NOW, 86_400, "Duration")).isEqualTo(NOW + 86_400);
        assertThat(Timestamps.after(NOW, Long.MAX_VALUE - NOW, "Duration")).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void after_rejectsOverflow() {
        assertThatThrownBy(() -> Timestamps.after(NOW, Long.MAX_VALUE - NOW + 1, "Suspension duration"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Suspension duration")
                .satisfies(e -> assertThat(((ValidationException) e).reason()).isEqualTo(ErrorReason.INVALID_DURATION));
        assertThatThrownBy(() -> Timestamps.after(NOW, Long.MAX_VALUE, "Voting duration"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void after_rejectsNegativeDuration() {
        assertThatThrownBy(() -> Timestamps.after(NOW, -1, "License duration"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void licenseWithHugeDuration_isNotCreatedExpired() {
        LicenseOffer offer = new LicenseOffer(1L, "0x00000000000000000000000000000000000000b1", LicenseType.NON_EXCLUSIVE,
                "USE", "GLOBAL", BigInteger.ZERO, 0, Long.MAX_VALUE, "0x00000000000000000000000000000000000000e1",
                LicenseTerms.unrestricted(), "ipfs://terms");

        assertThatThrownBy(() -> License.offer(1L, "0x00000000000000000000000000000000000000a1", offer, false, "0x", NOW))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void royaltySchedule_rejectsOverflowingInterval() {
        assertThatThrownBy(() -> RoyaltySchedule.start("0x00000000000000000000000000000000000000b1", Long.MAX_VALUE, NOW))
                .isInstanceOf(ValidationException.class);
    }
}
