package com.ryuqq.resea.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PathObservation 유닛 테스트.
 *
 * @author Resea Team
 * @since 1.0.0
 */
class PathObservationTest {

    private final List<Map<String, Object>> received = new ArrayList<>();

    @Test
    void 관찰_경로의_값이_바뀌면_정규화_경로로_전달() {
        // given
        Map<String, Object> state = Map.of("items", List.of(Map.of("id", 1)));
        PathObservation observation = new PathObservation(List.of("items[0].id"), received::add, state);

        // when
        observation.onPatch(Map.of("items", List.of(Map.of("id", 2))));

        // then
        assertThat(observation.paths()).containsExactly("items.0.id");
        assertThat(received).containsExactly(Map.of("items.0.id", 2));
    }

    @Test
    void 같은_최상위_키라도_관찰_경로_값이_같으면_통지_없음() {
        // given
        Map<String, Object> state = Map.of("user", Map.of("name", "kim", "age", 30));
        PathObservation observation = new PathObservation(List.of("user.name"), received::add, state);

        // when
        observation.onPatch(Map.of("user", Map.of("name", "kim", "age", 31)));

        // then
        assertThat(received).isEmpty();
    }

    @Test
    void 관련_없는_키_변경은_무시() {
        // given
        PathObservation observation = new PathObservation(List.of("count"), received::add, Map.of("count", 0));

        // when
        observation.onPatch(Map.of("other", "x"));

        // then
        assertThat(received).isEmpty();
    }

    @Test
    void 마지막_전달값_기준으로_중복_통지를_억제() {
        // given
        PathObservation observation = new PathObservation(List.of("count", "label"), received::add,
            Map.of("count", 0, "label", "a"));

        // when
        observation.onPatch(Map.of("count", 1));
        observation.onPatch(Map.of("count", 1));
        observation.onPatch(Map.of("count", 2, "label", "b"));

        // then
        assertThat(received).containsExactly(
            Map.of("count", 1),
            Map.of("count", 2, "label", "b")
        );
    }

    @Test
    void 제거된_경로는_null로_전달() {
        // given
        PathObservation observation = new PathObservation(List.of("user.name"), received::add,
            Map.of("user", Map.of("name", "kim")));
        Map<String, Object> changed = new HashMap<>();
        changed.put("user", null);

        // when
        observation.onPatch(changed);

        // then
        assertThat(received).hasSize(1);
        assertThat(received.get(0)).containsEntry("user.name", null);
    }

    @Test
    void 빈_경로나_null_observer는_IllegalArgumentException() {
        assertThatThrownBy(() -> new PathObservation(List.of(), received::add, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PathObservation(List.of("count"), null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
