package com.notifywheel.core.spi;

/**
 * 已鉴权的远端 API 客户端, 每个流独占一个
 */
public interface NotificationApiClient {

    /**
     * GET 请求, 相对路径基于 base-url 解析, 绝对 URL 原样使用
     *
     * @return 响应体原文
     * @throws com.notifywheel.exception.NotificationFetchException 网络/鉴权/非 2xx
     */
    String request(String pathOrUrl);
}
