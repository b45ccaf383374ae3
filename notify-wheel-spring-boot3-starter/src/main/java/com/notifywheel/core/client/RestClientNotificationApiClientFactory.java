package com.notifywheel.core.client;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.spi.NotificationApiClient;
import com.notifywheel.core.spi.NotificationApiClientFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * 每个 token 构造一个独立的 RestClient, 共享底层 HttpClient
 */
public class RestClientNotificationApiClientFactory implements NotificationApiClientFactory {

    private final NotifyWheelProperties.Api api;

    private final JdkClientHttpRequestFactory requestFactory;

    public RestClientNotificationApiClientFactory(NotifyWheelProperties.Api api) {
        this.api = api;
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(api.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestFactory = new JdkClientHttpRequestFactory(httpClient);
        this.requestFactory.setReadTimeout(api.getReadTimeout());
    }

    @Override
    public NotificationApiClient create(String token) {
        RestClient restClient = RestClient.builder()
                .baseUrl(api.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "token " + token)
                .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
        return new RestClientNotificationApiClient(restClient);
    }
}
