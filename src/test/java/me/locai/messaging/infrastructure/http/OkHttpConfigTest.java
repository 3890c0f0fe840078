package me.locai.messaging.infrastructure.http;

import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.testsupport.http.ScriptedHttpInterceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        MessagingProperties properties = new MessagingProperties();
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(3));
        properties.getHttp().setReadTimeout(Duration.ofSeconds(7));

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(3000, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
        assertTrue(client.interceptors().stream()
                .anyMatch(OkHttpConfig.CallTimingInterceptor.class::isInstance));
    }

    @Test
    void shouldPassResponsesAndFailuresThroughTimingInterceptor() throws IOException {
        ScriptedHttpInterceptor http = new ScriptedHttpInterceptor();
        OkHttpClient client = new OkHttpConfig(new MessagingProperties()).okHttpClient().newBuilder()
                .addInterceptor(http)
                .build();
        http.respond(200, "{}");
        http.failWith(new IOException("connection reset"));
        Request request = new Request.Builder().url("http://channel.test/api/v1/sessions/t1/status").build();

        try (Response response = client.newCall(request).execute()) {
            assertEquals(200, response.code());
        }
        IOException failure = assertThrows(IOException.class, () -> client.newCall(request).execute());
        assertEquals("connection reset", failure.getMessage());
        assertEquals(2, http.callCount());
    }
}
