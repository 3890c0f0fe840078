package me.locai.messaging.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for all outbound adapters (channel microservice,
 * workflow engine, business functions).
 *
 * <p>
 * Adapters derive their own clients with {@link OkHttpClient#newBuilder()} and
 * set a call timeout matching their budget, so the connection pool and the
 * timing interceptor are shared.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final MessagingProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        MessagingProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS))
                .addInterceptor(new CallTimingInterceptor(http.getSlowCallThreshold()))
                .build();
    }

    /**
     * Logs method, host, status and elapsed time of each call. Paths are left out
     * because they carry tenant ids.
     */
    static final class CallTimingInterceptor implements Interceptor {

        private final Duration slowThreshold;

        CallTimingInterceptor(Duration slowThreshold) {
            this.slowThreshold = slowThreshold;
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long started = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                logCall(request, String.valueOf(response.code()), started);
                return response;
            } catch (IOException e) {
                logCall(request, e.getClass().getSimpleName(), started);
                throw e;
            }
        }

        private void logCall(Request request, String outcome, long started) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (elapsedMs >= slowThreshold.toMillis()) {
                log.info("[HTTP] Slow call {} {} -> {} in {}ms", request.method(), request.url().host(), outcome,
                        elapsedMs);
            } else {
                log.debug("[HTTP] {} {} -> {} in {}ms", request.method(), request.url().host(), outcome, elapsedMs);
            }
        }
    }
}
