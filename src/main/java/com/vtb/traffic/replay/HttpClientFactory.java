package com.vtb.traffic.replay;

import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * HTTP-клиент для исходящих запросов: все таймауты заданы, без редиректов и повторов
 */
public final class HttpClientFactory {

    private HttpClientFactory() {
    }

    public static OkHttpClient create(int timeoutSec) {
        if (timeoutSec <= 0) {
            throw new IllegalArgumentException("Таймаут должен быть положительным: " + timeoutSec);
        }
        return new OkHttpClient.Builder()
            .connectTimeout(timeoutSec, TimeUnit.SECONDS)
            .readTimeout(timeoutSec, TimeUnit.SECONDS)
            .writeTimeout(timeoutSec, TimeUnit.SECONDS)
            .callTimeout(timeoutSec, TimeUnit.SECONDS)
            .followRedirects(false)
            .followSslRedirects(false)
            .retryOnConnectionFailure(false)
            .build();
    }
}
