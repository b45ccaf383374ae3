package com.notifywheel.core.spi;

/**
 * 面向用户的房间提示通道
 */
public interface NoticeSender {

    void sendNotice(String roomId, String text, String msgtype);
}
