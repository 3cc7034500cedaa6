package com.cleanwater.backend.modules.access.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AccessScopeTest {

    @Test
    void unrestrictedPermitsEverything() {
        AccessScope scope = AccessScope.unrestricted();

        assertThat(scope.isUnrestricted()).isTrue();
        assertThat(scope.permits(null, null)).isTrue();
        assertThat(scope.permits(7L, 70L)).isTrue();
    }

    @Test
    void regionScopeMatchesOnlyItsRegion() {
        AccessScope scope = AccessScope.region(5L);

        assertThat(scope.permits(5L, 50L)).isTrue();
        assertThat(scope.permits(5L, null)).isTrue();
        assertThat(scope.permits(7L, 50L)).isFalse();
        assertThat(scope.permits(null, 50L)).isFalse();
    }

    @Test
    void hospitalScopeMatchesOnlyItsHospital() {
        AccessScope scope = AccessScope.hospital(50L);

        assertThat(scope.permits(5L, 50L)).isTrue();
        assertThat(scope.permits(5L, 51L)).isFalse();
        assertThat(scope.permits(5L, null)).isFalse();
    }

    @Test
    void deniedPermitsNothing() {
        assertThat(AccessScope.denied().permits(5L, 50L)).isFalse();
    }

    @Test
    void scopedLevelsRequireTheirAnchor() {
        assertThatThrownBy(() -> new AccessScope(ScopeLevel.REGION, null, 50L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AccessScope(ScopeLevel.HOSPITAL, 5L, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
