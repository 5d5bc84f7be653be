package com.auditflow.core.component;

/** load() 에 등록되지 않은 이름이 들어왔을 때 */
public class ComponentNotFoundException extends IllegalArgumentException {
    private final String kind;
    private final String name;

    public ComponentNotFoundException(String kind, String name) {
        super("Unknown " + kind + ": " + name);
        this.kind = kind;
        this.name = name;
    }

    public String getKind() { return kind; }
    public String getName() { return name; }
}
