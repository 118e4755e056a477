package me.golemcore.relay;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class RelayApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RelayApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RelayApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RelayApplication.class.getMethod("main", String[].class));
    }
}
