package me.wargame.mcp.infrastructure.http;

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
import me.wargame.mcp.domain.service.CorrelationSupport;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the shared OkHttp client.
 *
 * <p>
 * The client is owned by the Spring context and handed to HTTP adapters
 * explicitly; adapters derive their own timeouts from it with
 * {@link OkHttpClient#newBuilder()}. Requests leaving without an
 * {@code X-Correlation-ID} header get the one bound to the calling thread's
 * MDC, if any.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final WargameProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        WargameProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .addInterceptor(new CorrelationInterceptor())
                .build();
    }

    static final class CorrelationInterceptor implements Interceptor {

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            String correlationId = MDC.get(CorrelationSupport.MDC_KEY);
            if (correlationId == null || "-".equals(correlationId) || request.header(CorrelationSupport.HEADER) != null) {
                return chain.proceed(request);
            }
            return chain.proceed(request.newBuilder()
                    .header(CorrelationSupport.HEADER, correlationId)
                    .build());
        }
    }
}
