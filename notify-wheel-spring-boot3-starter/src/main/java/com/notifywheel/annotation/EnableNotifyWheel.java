package com.notifywheel.annotation;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableNotifyWheel {

    /**
     * 是否启动, 覆盖 notify-wheel.enabled
     */
    boolean value() default true;
}
