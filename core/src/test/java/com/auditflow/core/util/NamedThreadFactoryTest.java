package com.auditflow.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamedThreadFactoryTest {

    @Test
    void names_are_numbered_daemons() {
        NamedThreadFactory f = new NamedThreadFactory("af-plugin");
        Thread a = f.newThread(() -> {});
        Thread b = f.newThread(() -> {});

        assertThat(a.getName()).isEqualTo("af-plugin-1");
        assertThat(b.getName()).isEqualTo("af-plugin-2");
        assertThat(a.isDaemon()).isTrue();
        assertThat(a.getUncaughtExceptionHandler()).isNotInstanceOf(ThreadGroup.class);
        assertThat(f.created()).isEqualTo(2);
    }

    @Test
    void blank_group_rejected() {
        assertThatThrownBy(() -> new NamedThreadFactory(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
