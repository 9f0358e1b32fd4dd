package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.registry.Plugin;
import com.ryuqq.resea.application.registry.Registry;
import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.ActionEvent;
import com.ryuqq.resea.core.model.StoreId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultRegistry 유닛 테스트.
 *
 * <p>Store 생성, Plugin 훅, Action 이벤트 버스, 배치를 검증합니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultRegistryTest {

    @Mock
    private Plugin plugin;

    private DefaultRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultRegistry();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private static StoreDefinition counter(String id) {
        return StoreDefinition.of(id, () -> Map.of("count", 0));
    }

    // ============================================================
    // 1. Store 생성 / 조회
    // ============================================================

    @Test
    void defineStore_같은_ID면_같은_인스턴스() {
        // when
        Store first = registry.defineStore(counter("counter"));
        first.setState(Map.of("count", 3));
        Store second = registry.defineStore(counter("counter"));

        // then
        assertThat(second).isSameAs(first);
        assertThat(second.<Integer>get("count")).isEqualTo(3);
        assertThat(registry.stores()).hasSize(1);
    }

    @Test
    void createStore_같은_ID면_IllegalStateException() {
        // given
        registry.createStore(counter("counter"));

        // when / then
        assertThatThrownBy(() -> registry.createStore(counter("counter")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("counter");
    }

    @Test
    void getStore_없는_ID면_empty() {
        // given
        Store store = registry.defineStore(counter("counter"));

        // then
        assertThat(registry.getStore("counter")).containsSame(store);
        assertThat(registry.getStore("missing")).isEmpty();
    }

    @Test
    void State_팩토리는_Store마다_한_번만_호출() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Supplier<Map<String, ?>> factory = () -> {
            calls.incrementAndGet();
            return Map.of("count", 0);
        };
        StoreDefinition definition = StoreDefinition.of("counter", factory);

        // when
        Store store = registry.defineStore(definition);
        store.setState(Map.of("count", 1));
        store.reset();
        registry.defineStore(definition);

        // then
        assertThat(calls).hasValue(1);
        assertThat(store.<Integer>get("count")).isZero();
    }

    // ============================================================
    // 2. Plugin
    // ============================================================

    @Test
    void use_install은_한_번만_호출되고_같은_이름은_무시() {
        // given
        when(plugin.name()).thenReturn("audit");

        // when
        registry.use(plugin);
        registry.use(plugin);

        // then
        verify(plugin, times(1)).install(registry);
        assertThat(registry.pluginNames()).containsExactly("audit");
    }

    @Test
    void storeCreated는_설치_이후_Store에만_호출_재생_없음() {
        // given
        when(plugin.name()).thenReturn("audit");
        when(plugin.properties(any())).thenReturn(Map.of());
        Store before = registry.defineStore(counter("before"));

        // when
        registry.use(plugin);
        Store after = registry.defineStore(counter("after"));

        // then
        verify(plugin, never()).storeCreated(before);
        verify(plugin).storeCreated(after);
    }

    @Test
    void Plugin_훅_예외는_격리되고_Store는_정상_생성() {
        // given
        when(plugin.name()).thenReturn("broken");
        doThrow(new IllegalStateException("install failure")).when(plugin).install(any());
        when(plugin.properties(any())).thenThrow(new IllegalStateException("properties failure"));
        doThrow(new IllegalStateException("hook failure")).when(plugin).storeCreated(any());

        // when
        registry.use(plugin);
        Store store = registry.defineStore(counter("counter"));

        // then
        assertThat(store.<Integer>get("count")).isZero();
        assertThat(registry.getStore("counter")).isPresent();
    }

    @Test
    void Plugin_속성은_Store_키로_읽을_수_있고_Getter와_겹치면_무시() {
        // given
        registry.use(new Plugin() {
            @Override
            public String name() {
                return "greeter";
            }

            @Override
            public Map<String, Object> properties(Store store) {
                return Map.of(
                    "greeting", "hello " + store.id().getValue(),
                    "doubled", "shadowed"
                );
            }
        });

        // when
        Store store = registry.defineStore(StoreDefinition.builder("counter")
            .state(() -> Map.of("count", 2))
            .getter("doubled", (state, getters) -> state.<Integer>get("count") * 2)
            .build());

        // then
        assertThat(store.<String>property("greeting")).isEqualTo("hello counter");
        assertThat(store.<String>get("greeting")).isEqualTo("hello counter");
        assertThat(store.<Integer>get("doubled")).isEqualTo(4);
        assertThat(store.<Object>property("doubled")).isNull();
    }

    @Test
    void use_null이나_이름_없는_Plugin은_IllegalArgumentException() {
        // given
        when(plugin.name()).thenReturn(" ");

        // when / then
        assertThatThrownBy(() -> registry.use(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.use(plugin)).isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. Action 이벤트 버스
    // ============================================================

    @Test
    void emitAction은_등록_순서대로_모든_리스너에게_전달하고_예외를_격리() {
        // given
        List<String> received = new ArrayList<>();
        registry.onAction(event -> received.add("first"));
        registry.onAction(event -> {
            throw new IllegalStateException("listener failure");
        });
        registry.onAction(event -> received.add("third"));
        ActionEvent event = ActionEvent.succeeded(StoreId.of("counter"), "increment", new Object[0], null, 1L, 2L);

        // when
        registry.emitAction(event);

        // then
        assertThat(received).containsExactly("first", "third");
    }

    @Test
    void Store_onAction은_자기_Store_이벤트만_받음() {
        // given
        Store a = registry.defineStore(StoreDefinition.builder("a")
            .action("ping", (ctx, args) -> "a")
            .build());
        Store b = registry.defineStore(StoreDefinition.builder("b")
            .action("ping", (ctx, args) -> "b")
            .build());
        List<ActionEvent> aEvents = new ArrayList<>();
        List<ActionEvent> all = new ArrayList<>();
        a.onAction(aEvents::add);
        registry.onAction(all::add);

        // when
        a.dispatch("ping");
        b.dispatch("ping");

        // then
        assertThat(aEvents).extracting(ActionEvent::result).containsExactly("a");
        assertThat(all).hasSize(2);
    }

    // ============================================================
    // 4. 배치
    // ============================================================

    @Test
    void batch_안의_여러_커밋은_Store마다_한_번만_통지() {
        // given
        Store store = registry.defineStore(StoreDefinition.of("form", () -> Map.of("a", 0, "b", 0, "c", 0)));
        List<Map<String, Object>> patches = new ArrayList<>();
        List<Map<String, Object>> previousStates = new ArrayList<>();
        store.onPatch(patches::add);
        store.subscribe((next, prev) -> previousStates.add(prev));

        // when
        registry.batch(() -> {
            store.setState(Map.of("a", 1));
            store.setState(Map.of("b", 1));
            store.setState(Map.of("c", 1));
            store.setState(Map.of("c", 0));
        });

        // then
        assertThat(store.version()).isEqualTo(4);
        assertThat(patches).singleElement().satisfies(p -> assertThat(p).containsOnlyKeys("a", "b"));
        assertThat(previousStates).singleElement().satisfies(prev -> assertThat(prev).containsEntry("a", 0));
    }

    @Test
    void batch_중첩되면_가장_바깥_범위가_끝날_때_통지() {
        // given
        Store store = registry.defineStore(counter("counter"));
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        registry.batch(() -> {
            registry.batch(() -> store.setState(Map.of("count", 1)));
            assertThat(notifications).hasValue(0);
            store.setState(Map.of("count", 2));
        });

        // then
        assertThat(notifications).hasValue(1);
    }

    @Test
    void batch_본문이_예외를_던져도_통지는_전달됨() {
        // given
        Store store = registry.defineStore(counter("counter"));
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        assertThatThrownBy(() -> registry.batch(() -> {
            store.setState(Map.of("count", 1));
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        // then
        assertThat(notifications).hasValue(1);
        assertThat(registry.isBatching()).isFalse();
    }

    @Test
    void batch_안에서_Getter는_즉시_새_값을_읽음() {
        // given
        Store store = registry.defineStore(StoreDefinition.builder("counter")
            .state(() -> Map.of("count", 1))
            .getter("doubled", (state, getters) -> state.<Integer>get("count") * 2)
            .build());
        List<Object> seen = new ArrayList<>();

        // when
        registry.batch(() -> {
            store.setState(Map.of("count", 5));
            seen.add(store.getter("doubled"));
        });

        // then
        assertThat(seen).containsExactly(10);
    }

    // ============================================================
    // 5. 종료
    // ============================================================

    @Test
    void close_모든_Store와_리스너를_제거하고_이후_사용은_IllegalStateException() {
        // given
        Store store = registry.defineStore(counter("counter"));
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe((next, prev) -> notifications.incrementAndGet());

        // when
        registry.close();
        store.setState(Map.of("count", 1));

        // then
        assertThat(registry.stores()).isEmpty();
        assertThat(registry.isClosed()).isTrue();
        assertThat(notifications).hasValue(0);
        assertThatThrownBy(() -> registry.defineStore(counter("other")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void Registries_팩토리는_독립된_Registry를_생성() {
        // given
        Registry first = Registries.createRegistry();
        Registry second = Registries.createRegistry(new RegistryConfig());

        // when
        first.defineStore(counter("shared"));

        // then
        assertThat(second.getStore("shared")).isEmpty();
        first.close();
        second.close();
    }
}
