package com.ryuqq.resea.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistryConfig 유닛 테스트.
 *
 * @author Resea Team
 * @since 1.0.0
 */
class RegistryConfigTest {

    @Test
    void 기본값() {
        RegistryConfig config = new RegistryConfig();

        assertThat(config.loadingSuffix()).isEqualTo("Loading");
        assertThat(config.trackAsyncLoading()).isTrue();
        assertThat(config.loadingKey("fetchUser")).isEqualTo("fetchUserLoading");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "Is Loading", "Loading\t"})
    void 유효하지_않은_접미사는_IllegalArgumentException(String suffix) {
        assertThatThrownBy(() -> new RegistryConfig(suffix, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("loadingSuffix");
    }

    @Test
    void with_메서드는_한_항목만_바꾼_새_인스턴스를_반환() {
        // given
        RegistryConfig base = new RegistryConfig();

        // when
        RegistryConfig pending = base.withLoadingSuffix("Pending");
        RegistryConfig untracked = base.withTrackAsyncLoading(false);

        // then
        assertThat(pending).isEqualTo(new RegistryConfig("Pending", true));
        assertThat(untracked).isEqualTo(new RegistryConfig("Loading", false));
        assertThat(base).isEqualTo(new RegistryConfig());
    }
}
