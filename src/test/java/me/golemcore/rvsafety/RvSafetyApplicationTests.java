package me.golemcore.rvsafety;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class RvSafetyApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RvSafetyApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RvSafetyApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RvSafetyApplication.class.getMethod("main", String[].class));
    }
}
