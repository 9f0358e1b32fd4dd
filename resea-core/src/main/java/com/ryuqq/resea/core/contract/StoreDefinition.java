package com.ryuqq.resea.core.contract;

import com.ryuqq.resea.core.model.MemberKind;
import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.path.StateTrees;
import com.ryuqq.resea.core.spi.PersistOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store 정의.
 *
 * <p>State 팩토리, Getter, Action, 영속화 설정을 담는 불변 정의입니다.
 * Getter와 Action 이름은 정의 시점에 한 번 검증되어 멤버 테이블로 고정됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * StoreDefinition counter = StoreDefinition.builder("counter")
 *     .state(() -&gt; Map.of("count", 0))
 *     .getter("doubleCount", (state, getters) -&gt; state.&lt;Integer&gt;get("count") * 2)
 *     .action("increment", (ctx, args) -&gt; {
 *         ctx.set("count", ctx.&lt;Integer&gt;get("count") + 1);
 *         return null;
 *     })
 *     .build();
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class StoreDefinition {

    private final StoreId id;
    private final Supplier<? extends Map<String, ?>> stateFactory;
    private final Map<String, Getter> getters;
    private final Map<String, Action> actions;
    private final Map<String, AsyncAction> asyncActions;
    private final Map<String, MemberKind> members;
    private final PersistOptions persistOptions;

    private StoreDefinition(Builder builder) {
        this.id = builder.id;
        this.stateFactory = builder.stateFactory;
        this.getters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.getters));
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.actions));
        this.asyncActions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.asyncActions));
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(builder.members));
        this.persistOptions = builder.persistOptions;
    }

    /**
     * Builder 생성.
     *
     * @param id Store ID 문자열
     * @return Builder
     * @throws IllegalArgumentException id가 유효하지 않은 경우
     */
    public static Builder builder(String id) {
        return new Builder(StoreId.of(id));
    }

    /**
     * State만 있는 정의 생성.
     *
     * @param id Store ID 문자열
     * @param stateFactory 초기 State 팩토리
     * @return StoreDefinition
     */
    public static StoreDefinition of(String id, Supplier<? extends Map<String, ?>> stateFactory) {
        return builder(id).state(stateFactory).build();
    }

    public StoreId id() {
        return id;
    }

    /**
     * 초기 State 생성 (팩토리 호출 후 동결).
     *
     * @return 동결된 초기 State
     */
    public Map<String, Object> createInitialState() {
        return StateTrees.freezeRoot(stateFactory.get());
    }

    public Map<String, Getter> getters() {
        return getters;
    }

    public Map<String, Action> actions() {
        return actions;
    }

    public Map<String, AsyncAction> asyncActions() {
        return asyncActions;
    }

    /**
     * 정의 시점 멤버 테이블 (Getter, Action 이름 → 종류).
     *
     * @return 불변 멤버 테이블
     */
    public Map<String, MemberKind> members() {
        return members;
    }

    public Optional<PersistOptions> persistOptions() {
        return Optional.ofNullable(persistOptions);
    }

    @Override
    public String toString() {
        return "StoreDefinition{id=" + id.getValue()
            + ", getters=" + getters.keySet()
            + ", actions=" + actions.keySet()
            + ", asyncActions=" + asyncActions.keySet()
            + ", persist=" + (persistOptions != null) + '}';
    }

    /**
     * StoreDefinition Builder.
     */
    public static final class Builder {

        private final StoreId id;
        private Supplier<? extends Map<String, ?>> stateFactory = () -> Map.of();
        private final Map<String, Getter> getters = new LinkedHashMap<>();
        private final Map<String, Action> actions = new LinkedHashMap<>();
        private final Map<String, AsyncAction> asyncActions = new LinkedHashMap<>();
        private final Map<String, MemberKind> members = new LinkedHashMap<>();
        private PersistOptions persistOptions;

        private Builder(StoreId id) {
            this.id = id;
        }

        /**
         * 초기 State 팩토리 지정. Store 생성 시 한 번 호출됩니다.
         *
         * @param stateFactory 초기 State 팩토리
         * @return this
         */
        public Builder state(Supplier<? extends Map<String, ?>> stateFactory) {
            if (stateFactory == null) {
                throw new IllegalArgumentException("stateFactory cannot be null");
            }
            this.stateFactory = stateFactory;
            return this;
        }

        public Builder getter(String name, Getter getter) {
            if (getter == null) {
                throw new IllegalArgumentException("getter cannot be null: " + name);
            }
            register(name, MemberKind.GETTER);
            getters.put(name, getter);
            return this;
        }

        public Builder action(String name, Action action) {
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null: " + name);
            }
            register(name, MemberKind.ACTION);
            actions.put(name, action);
            return this;
        }

        public Builder asyncAction(String name, AsyncAction action) {
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null: " + name);
            }
            register(name, MemberKind.ASYNC_ACTION);
            asyncActions.put(name, action);
            return this;
        }

        /**
         * 기본 설정으로 영속화.
         *
         * @return this
         */
        public Builder persist() {
            return persist(PersistOptions.defaults());
        }

        public Builder persist(PersistOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options cannot be null");
            }
            this.persistOptions = options;
            return this;
        }

        public StoreDefinition build() {
            return new StoreDefinition(this);
        }

        private void register(String name, MemberKind kind) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(kind + " name cannot be null or blank");
            }
            MemberKind existing = members.putIfAbsent(name, kind);
            if (existing != null) {
                throw new IllegalArgumentException(
                    String.format("Duplicate member '%s' in store %s: already defined as %s", name, id.getValue(), existing)
                );
            }
        }
    }
}
