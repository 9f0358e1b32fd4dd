package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.registry.Registry;
import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.application.store.Subscription;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.state.Draft;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReactiveStore 유닛 테스트.
 *
 * <p>State 커밋 규칙을 검증합니다:</p>
 * <ul>
 *   <li>동일 값 setState는 no-op (version 유지, 통지 없음)</li>
 *   <li>patch 깊은 병합 / Draft patch 최소 diff</li>
 *   <li>reset 초기 스냅샷 복원 및 단일 통지</li>
 *   <li>재진입 가드</li>
 *   <li>구독자 예외 격리</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 */
class ReactiveStoreTest {

    private Registry registry;
    private Store store;

    @BeforeEach
    void setUp() {
        registry = Registries.createRegistry();
        store = registry.defineStore(StoreDefinition.of("profile", () -> Map.of(
            "count", 0,
            "user", Map.of("name", "kim", "age", 30),
            "tags", List.of("a", "b"),
            "settings", Map.of("theme", "light")
        )));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // ============================================================
    // 1. setState
    // ============================================================

    @Test
    void setState_모든_키가_같으면_version과_통지_없음() {
        // given
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        store.setState(Map.of("count", 0, "user", Map.of("name", "kim", "age", 30)));

        // then
        assertThat(store.version()).isZero();
        assertThat(notifications).hasValue(0);
    }

    @Test
    void setState_값이_바뀌면_version_1_증가_및_이전_새_State_전달() {
        // given
        List<Map<String, Object>> received = new ArrayList<>();
        store.subscribe((next, prev) -> {
            received.add(next);
            received.add(prev);
        });

        // when
        store.setState(Map.of("count", 1));

        // then
        assertThat(store.version()).isEqualTo(1);
        assertThat(store.<Integer>get("count")).isEqualTo(1);
        assertThat(received.get(0)).containsEntry("count", 1);
        assertThat(received.get(1)).containsEntry("count", 0);
    }

    @Test
    void setState_얕은_병합이라_중첩_객체는_통째로_교체됨() {
        // when
        store.setState(Map.of("user", Map.of("name", "lee")));

        // then
        assertThat(store.<Map<String, Object>>get("user")).containsOnlyKeys("name");
    }

    @Test
    void setState_함수형_updater는_이전_State를_받음() {
        // when
        store.setState(prev -> Map.of("count", (Integer) prev.get("count") + 5));

        // then
        assertThat(store.<Integer>get("count")).isEqualTo(5);
    }

    @Test
    void setState_null_partial이면_예외() {
        assertThatThrownBy(() -> store.setState((Map<String, ?>) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setState_새_키_추가도_변경으로_취급() {
        // given
        Map<String, Object> partial = new HashMap<>();
        partial.put("extra", null);

        // when
        store.setState(partial);

        // then
        assertThat(store.version()).isEqualTo(1);
        assertThat(store.getState()).containsKey("extra");
    }

    // ============================================================
    // 2. patch
    // ============================================================

    @Test
    void patch_Map은_중첩_객체를_병합하고_배열은_교체() {
        // when
        store.patch(Map.of("user", Map.of("age", 31), "tags", List.of("z")));

        // then
        assertThat(store.<String>get("user.name")).isEqualTo("kim");
        assertThat(store.<Integer>get("user.age")).isEqualTo(31);
        assertThat(store.<List<Object>>get("tags")).containsExactly("z");
    }

    @Test
    void patch_Map_변경이_없으면_no_op() {
        // when
        store.patch(Map.of("user", Map.of("name", "kim")));

        // then
        assertThat(store.version()).isZero();
    }

    @Test
    void patch_Draft로_중첩_필드_하나만_바꾸면_해당_최상위_키만_통지() {
        // given
        List<Map<String, Object>> patches = new ArrayList<>();
        store.onPatch(patches::add);

        // when
        store.patch(draft -> draft.set("user.name", "lee"));

        // then
        assertThat(patches).hasSize(1);
        assertThat(patches.get(0)).containsOnlyKeys("user");
        assertThat(store.<String>get("user.name")).isEqualTo("lee");
        assertThat(store.<Integer>get("user.age")).isEqualTo(30);
    }

    @Test
    void patch_Draft가_같은_값을_쓰면_통지와_version_변화_없음() {
        // given
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        store.patch(draft -> draft.set("user.name", "kim"));
        store.patch(draft -> { });

        // then
        assertThat(store.version()).isZero();
        assertThat(notifications).hasValue(0);
    }

    @Test
    void patch_Draft_append_remove_인덱스_경로() {
        // when
        store.patch(draft -> {
            draft.append("tags", "c");
            draft.set("tags[0]", "A");
            draft.remove("settings.theme");
        });

        // then
        assertThat(store.<List<Object>>get("tags")).containsExactly("A", "b", "c");
        assertThat(store.<Map<String, Object>>get("settings")).isEmpty();
        assertThat(store.version()).isEqualTo(1);
    }

    @Test
    void patch_null_recipe면_예외() {
        assertThatThrownBy(() -> store.patch((Consumer<Draft>) null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void set_배열_끝에서_너무_먼_인덱스는_거부하고_State_유지() {
        // given
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when & then
        assertThatThrownBy(() -> store.set("tags[1000000000]", "z"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.<List<Object>>get("tags")).containsExactly("a", "b");
        assertThat(store.version()).isZero();
        assertThat(notifications).hasValue(0);
    }

    @Test
    void set_중첩_경로_쓰기는_patch로_전달() {
        // given
        List<Map<String, Object>> patches = new ArrayList<>();
        store.onPatch(patches::add);

        // when
        store.set("settings.theme", "dark");

        // then
        assertThat(store.<String>get("settings.theme")).isEqualTo("dark");
        assertThat(patches).singleElement().satisfies(p -> assertThat(p).containsOnlyKeys("settings"));
    }

    // ============================================================
    // 3. reset / hydrate
    // ============================================================

    @Test
    void reset_초기_스냅샷으로_복원하고_통지는_한_번() {
        // given
        Map<String, Object> initial = store.getState();
        store.setState(Map.of("count", 9));
        store.set("user.name", "lee");
        store.setState(Map.of("added", true));
        AtomicInteger notifications = new AtomicInteger();
        List<Map<String, Object>> patches = new ArrayList<>();
        store.subscribe((next, prev) -> notifications.incrementAndGet());
        store.onPatch(patches::add);

        // when
        store.reset();

        // then
        assertThat(store.getState()).isEqualTo(initial);
        assertThat(notifications).hasValue(1);
        assertThat(patches.get(0)).containsKeys("count", "user", "added");
        assertThat(patches.get(0).get("added")).isNull();
    }

    @Test
    void reset_변경이_없으면_no_op() {
        // when
        store.reset();

        // then
        assertThat(store.version()).isZero();
    }

    @Test
    void hydrate_통지와_version_변화_없이_병합() {
        // given
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        store.hydrate(Map.of("count", 42));

        // then
        assertThat(store.<Integer>get("count")).isEqualTo(42);
        assertThat(store.version()).isZero();
        assertThat(notifications).hasValue(0);
    }

    // ============================================================
    // 4. 방어 복사 / 재진입 / 구독
    // ============================================================

    @Test
    void getState_반환값을_바꿔도_Store에_영향_없음() {
        // given
        Map<String, Object> copy = store.getState();

        // when
        copy.put("count", 100);

        // then
        assertThat(store.<Integer>get("count")).isZero();
        assertThatThrownBy(() -> store.<Map<String, Object>>get("user").put("name", "x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 구독자가_통지_중_setState를_호출하면_무시됨() {
        // given
        store.subscribe((next, prev) -> store.setState(Map.of("count", 100)));

        // when
        store.setState(Map.of("count", 1));

        // then
        assertThat(store.<Integer>get("count")).isEqualTo(1);
        assertThat(store.version()).isEqualTo(1);
        assertThat(store.isUpdating()).isFalse();
    }

    @Test
    void 구독자_예외는_격리되고_다음_구독자도_호출됨() {
        // given
        AtomicInteger reached = new AtomicInteger();
        store.subscribe((next, prev) -> {
            throw new IllegalStateException("boom");
        });
        store.subscribe((next, prev) -> reached.incrementAndGet());

        // when
        store.setState(Map.of("count", 1));

        // then
        assertThat(reached).hasValue(1);
        assertThat(store.<Integer>get("count")).isEqualTo(1);
    }

    @Test
    void 구독_해제는_멱등() {
        // given
        AtomicInteger notifications = new AtomicInteger();
        Subscription subscription = store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        subscription.unsubscribe();
        subscription.unsubscribe();
        store.setState(Map.of("count", 1));

        // then
        assertThat(notifications).hasValue(0);
    }

    @Test
    void 부분_변경_구독자가_전체_구독자보다_먼저_호출됨() {
        // given
        List<String> order = new ArrayList<>();
        store.subscribe((next, prev) -> order.add("state"));
        store.onPatch(changed -> order.add("patch"));

        // when
        store.setState(Map.of("count", 1));

        // then
        assertThat(order).containsExactly("patch", "state");
    }

    @Test
    void 경로_관찰은_관련_경로_값이_바뀔_때만_호출됨() {
        // given
        List<Map<String, Object>> observed = new ArrayList<>();
        store.observe(List.of("user.name", "settings.theme"), observed::add);

        // when
        store.set("user.age", 31);
        store.setState(Map.of("count", 3));
        store.set("user.name", "lee");

        // then
        assertThat(observed).hasSize(1);
        assertThat(observed.get(0)).containsExactly(Map.entry("user.name", "lee"));
    }

    @Test
    void 존재하지_않는_getter_읽기는_예외() {
        assertThatThrownBy(() -> store.getter("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }
}
