package com.metaextract.core.extractor;

import com.metaextract.core.api.Technique;
import com.metaextract.core.api.TechniqueFactory;
import com.metaextract.core.error.ConfigurationException;
import com.metaextract.core.technique.FacebookOpengraphTags;
import com.metaextract.core.technique.HeadTags;
import com.metaextract.core.technique.Html5SemanticTags;
import com.metaextract.core.technique.SemanticTags;
import com.metaextract.core.technique.TwitterSummaryCard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 기법 식별자 → 팩토리 레지스트리 (불변).
 * 리플렉션 대신 명시적 등록으로 "식별자 → 전략" 간접 참조를 유지한다.
 * 내장 기법의 식별자는 클래스의 FQCN.
 */
public final class TechniqueRegistry {

    private static final TechniqueRegistry BUILTINS = builder()
            .register(FacebookOpengraphTags.class, FacebookOpengraphTags::new)
            .register(TwitterSummaryCard.class, TwitterSummaryCard::new)
            .register(HeadTags.class, HeadTags::new)
            .register(Html5SemanticTags.class, Html5SemanticTags::new)
            .register(SemanticTags.class, SemanticTags::new)
            .build();

    private final Map<String, TechniqueFactory> factories;

    private TechniqueRegistry(Map<String, TechniqueFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /** 내장 기법 5종이 등록된 레지스트리 */
    public static TechniqueRegistry builtins() {
        return BUILTINS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 현재 등록분을 시작점으로 하는 빌더 (내장 + 커스텀 조합용) */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.factories.putAll(factories);
        return b;
    }

    public Optional<TechniqueFactory> lookup(String identifier) {
        return Optional.ofNullable(identifier == null ? null : factories.get(identifier));
    }

    /** 식별자 해석. 실패 시 ConfigurationException (식별자 포함) */
    public TechniqueFactory resolve(String identifier) {
        return lookup(identifier).orElseThrow(() -> ConfigurationException.unknownTechnique(identifier));
    }

    public boolean contains(String identifier) {
        return identifier != null && factories.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<String, TechniqueFactory> factories = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String identifier, TechniqueFactory factory) {
            if (identifier == null || identifier.isBlank()) {
                throw new ConfigurationException("technique identifier must not be blank");
            }
            Objects.requireNonNull(factory, "factory");
            if (factories.putIfAbsent(identifier, factory) != null) {
                throw new ConfigurationException("technique already registered: '" + identifier + "'");
            }
            return this;
        }

        /** 식별자 = type의 FQCN */
        public Builder register(Class<? extends Technique> type, TechniqueFactory factory) {
            Objects.requireNonNull(type, "type");
            return register(type.getName(), factory);
        }

        /** 기존 등록을 교체 (내장 기법을 하위 클래스로 바꿔 끼울 때) */
        public Builder replace(String identifier, TechniqueFactory factory) {
            if (!factories.containsKey(identifier)) {
                throw ConfigurationException.unknownTechnique(identifier);
            }
            factories.put(identifier, Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public TechniqueRegistry build() {
            return new TechniqueRegistry(factories);
        }
    }
}
