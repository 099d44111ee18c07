package me.golemcore.logai;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class LogAiApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(LogAiApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(LogAiApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(LogAiApplication.class.getMethod("main", String[].class));
    }
}
