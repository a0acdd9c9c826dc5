package com.github.ytdle.config;

import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    static final String USER_AGENT = "ytdle-engine/1.0";

    private final YtdleProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = Duration.ofSeconds(properties.getNetwork().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .addInterceptor(new UserAgentInterceptor())
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Identifies the engine on outgoing requests.
     */
    private static class UserAgentInterceptor implements Interceptor {

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request request = chain.request().newBuilder()
                    .header("User-Agent", USER_AGENT)
                    .build();
            return chain.proceed(request);
        }
    }
}
