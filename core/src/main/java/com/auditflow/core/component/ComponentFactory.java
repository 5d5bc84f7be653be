package com.auditflow.core.component;

import java.util.Objects;
import java.util.function.Function;

/** 이름 붙은 컴포넌트 생성기. load() 시점에 ScanContext 를 받아 인스턴스를 만든다. */
public interface ComponentFactory<T> {

    ComponentInfo info();

    T create(ScanContext ctx);

    static <T> ComponentFactory<T> of(ComponentInfo info, Function<ScanContext, T> creator) {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(creator, "creator");
        return new ComponentFactory<>() {
            @Override public ComponentInfo info() { return info; }
            @Override public T create(ScanContext ctx) { return creator.apply(ctx); }
        };
    }
}
