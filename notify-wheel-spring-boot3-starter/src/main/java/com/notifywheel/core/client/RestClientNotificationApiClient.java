package com.notifywheel.core.client;

import com.notifywheel.core.spi.NotificationApiClient;
import com.notifywheel.exception.NotificationFetchException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;

/**
 * 基于 Spring RestClient 的默认实现
 * 鉴权头在构造 RestClient 时已写入
 */
public class RestClientNotificationApiClient implements NotificationApiClient {

    private final RestClient restClient;

    public RestClientNotificationApiClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String request(String pathOrUrl) {
        try {
            RestClient.RequestHeadersSpec<?> spec = isAbsolute(pathOrUrl)
                    ? restClient.get().uri(URI.create(pathOrUrl))
                    : restClient.get().uri(pathOrUrl);
            return spec.retrieve().body(String.class);
        } catch (RestClientResponseException e) {
            throw new NotificationFetchException(
                    "GET " + pathOrUrl + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new NotificationFetchException("GET " + pathOrUrl + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean isAbsolute(String pathOrUrl) {
        return pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://");
    }
}
