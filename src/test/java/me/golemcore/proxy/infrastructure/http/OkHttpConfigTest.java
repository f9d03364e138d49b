package me.golemcore.proxy.infrastructure.http;

import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        ProxyProperties properties = new ProxyProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertTrue(client.retryOnConnectionFailure());
    }

    @Test
    void shouldSendProxyUserAgent() throws IOException {
        ProxyProperties properties = new ProxyProperties();
        properties.setVersion("2.4.0");
        OkHttpMockEngine engine = new OkHttpMockEngine();
        engine.enqueueJson(200, "{}");

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient().newBuilder()
                .addInterceptor(engine)
                .build();
        try (Response response = client.newCall(new Request.Builder().url("https://upstream.test/ping").build())
                .execute()) {
            assertEquals(200, response.code());
        }

        assertEquals("GeminiForJanitors/2.4.0", engine.takeRequest().header("User-Agent"));
    }
}
