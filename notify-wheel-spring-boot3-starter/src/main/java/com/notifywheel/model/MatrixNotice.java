package com.notifywheel.model;

/**
 * 发往房间的纯文本提示
 */
public final class MatrixNotice {

    public static final String EVENT_NAME = "matrix.message";

    private final String roomId;

    private final String msgtype;

    private final String body;

    public MatrixNotice(String roomId, String msgtype, String body) {
        this.roomId = roomId;
        this.msgtype = msgtype;
        this.body = body;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getMsgtype() {
        return msgtype;
    }

    public String getBody() {
        return body;
    }
}
