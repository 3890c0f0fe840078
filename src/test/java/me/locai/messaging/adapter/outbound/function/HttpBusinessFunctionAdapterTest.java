package me.locai.messaging.adapter.outbound.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.locai.messaging.domain.model.FunctionResult;
import me.locai.messaging.infrastructure.config.AutoConfiguration;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.testsupport.http.ScriptedHttpInterceptor;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpBusinessFunctionAdapterTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MessagingProperties properties;
    private ScriptedHttpInterceptor http;
    private HttpBusinessFunctionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.getFunctions().setBaseUrl("http://platform.test");
        properties.getFunctions().setApiKey("functions-key");
        http = new ScriptedHttpInterceptor();
        adapter = new HttpBusinessFunctionAdapter(properties,
                new OkHttpClient.Builder().addInterceptor(http).build(), objectMapper);
    }

    @Test
    void shouldSupportOnlyConfiguredFunctions() {
        assertTrue(adapter.supports("search_properties"));
        assertFalse(adapter.supports("drop_database"));

        properties.getFunctions().setBaseUrl(null);
        assertFalse(adapter.supports("search_properties"));
    }

    @Test
    void shouldPostArgumentsWithTenant() throws Exception {
        http.respond(200, "{\"success\":true,\"message\":\"Found 2 properties\",\"data\":{\"count\":2}}");

        FunctionResult result = adapter.execute("tenant-a", "search_properties", Map.of("city", "recife")).join();

        assertTrue(result.success());
        assertEquals("Found 2 properties", result.message());
        assertEquals(Map.of("count", 2), result.data());

        ScriptedHttpInterceptor.RecordedCall request = http.nextCall();
        assertEquals("/api/ai/functions/search-properties", request.path());
        assertEquals("Bearer functions-key", request.header("Authorization"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("tenant-a", body.get("tenantId").asText());
        assertEquals("recife", body.get("city").asText());
    }

    @Test
    void shouldReturnFailureForErrorResponse() {
        http.respond(422, "{\"success\":false,\"error\":\"checkIn is required\"}");

        FunctionResult result = adapter.execute("tenant-a", "check_availability", Map.of()).join();

        assertFalse(result.success());
        assertEquals("checkIn is required", result.error());
    }

    @Test
    void shouldReturnFailureForNetworkError() {
        http.failWith(new IOException("connection refused"));

        FunctionResult result = adapter.execute("tenant-a", "search_properties", Map.of()).join();

        assertFalse(result.success());
        assertEquals("search_properties", result.name());
    }
}
