package com.chicu.airetrain.config;

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HttpClientConfig {

    /**
     * 🌐 Общий OkHttpClient для ML sidecar и webhook алертов.
     * Sidecar на /train докручивает read-timeout под бюджет обучения через newBuilder(),
     * пул и интерцептор при этом общие.
     */
    @Bean
    public OkHttpClient okHttpClient(RetrainingProperties props) {
        RetrainingProperties.Http http = props.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(), http.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .addInterceptor(new OutboundCallInterceptor(http.getUserAgent(), http.getSlowCallThreshold()))
                .build();
    }
}
