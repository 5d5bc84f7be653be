package com.auditflow.core.component;

import java.util.List;

/**
 * ServiceLoader SPI. META-INF/services/com.auditflow.core.component.ComponentProvider 에 등록하면
 * discover() 시 자동으로 레지스트리에 올라간다.
 */
public interface ComponentProvider {

    default List<ComponentFactory<AuditModule>> modules() { return List.of(); }

    default List<ComponentFactory<Plugin>> plugins() { return List.of(); }

    default List<ComponentFactory<Report>> reports() { return List.of(); }
}
