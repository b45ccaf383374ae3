package com.notifywheel.core.spi;

/**
 * 根据用户 token 构造客户端
 */
public interface NotificationApiClientFactory {

    NotificationApiClient create(String token);
}
