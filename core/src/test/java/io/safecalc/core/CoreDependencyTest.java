package io.safecalc.core;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** The core module stays free of HTTP, YAML and JSON libraries. */
class CoreDependencyTest {

    @Test
    @DisplayName("Javalin is not on the core classpath")
    void noJavalin() {
        assertThatThrownBy(() -> Class.forName("io.javalin.Javalin")).isInstanceOf(ClassNotFoundException.class);
    }

    @Test
    @DisplayName("Jackson is not on the core classpath")
    void noJackson() {
        assertThatThrownBy(() -> Class.forName("com.fasterxml.jackson.databind.ObjectMapper"))
                .isInstanceOf(ClassNotFoundException.class);
    }
}
