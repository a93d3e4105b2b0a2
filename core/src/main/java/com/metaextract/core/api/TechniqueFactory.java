package com.metaextract.core.api;

/** 식별자 → 기법 인스턴스. 추출 호출마다 새 인스턴스를 만들어야 한다. */
@FunctionalInterface
public interface TechniqueFactory {
    Technique create(TechniqueContext context);
}
