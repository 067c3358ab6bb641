package com.relay.common.util;

/**
 * 日志与展示用的文本工具。
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * 截断过长文本，超出部分以 "..." 代替。
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "...";
    }

    /**
     * 脱敏 API Key / 调用方标识，只保留前 8 位。
     */
    public static String mask(String key) {
        if (key == null || key.length() <= 8) return "***";
        return key.substring(0, 8) + "***";
    }

    /**
     * 异常的单行描述: "类名: 消息"。
     */
    public static String describe(Throwable error) {
        if (error == null) return "";
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
