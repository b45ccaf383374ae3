package com.notifywheel.core;

import com.notifywheel.model.StreamState;

/**
 * 只暴露轮询周期需要的注册表能力
 * 不暴露实现细节
 */
@FunctionalInterface
public interface StreamOps {

    /** 从注册表移除该流实例（若已被同 userId 的新流替换则不影响新流） */
    void deregister(StreamState stream);
}
