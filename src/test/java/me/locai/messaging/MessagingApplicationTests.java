package me.locai.messaging;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class MessagingApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(MessagingApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(MessagingApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(MessagingApplication.class.getMethod("main", String[].class));
    }
}
