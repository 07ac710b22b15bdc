package com.genji.queue.common.support;

import java.util.Map;

public final class HeaderUtils {

    private HeaderUtils() {}

    /**
     * true / "true" / 0이 아닌 숫자를 참으로 본다. 헤더가 없으면 false.
     */
    public static boolean isTruthy(Map<String, Object> headers, String key) {
        if (headers == null || key == null) {
            return false;
        }
        Object v = headers.get(key);
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof Number n) {
            return n.longValue() != 0;
        }
        if (v != null) {
            return Boolean.parseBoolean(v.toString().trim());
        }
        return false;
    }

    /**
     * DLQ 알림 여부는 정확히 true 인 경우만 인정한다.
     */
    public static boolean isExactlyTrue(Map<String, Object> headers, String key) {
        if (headers == null) {
            return false;
        }
        return Boolean.TRUE.equals(headers.get(key));
    }

    public static Long getLong(Map<String, Object> headers, String key) {
        if (headers == null) {
            return null;
        }
        Object v = headers.get(key);
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v != null) {
            try {
                return Long.parseLong(v.toString().trim());
            } catch (NumberFormatException ignore) {
                // 형식이 깨진 헤더는 없는 것으로 취급
            }
        }
        return null;
    }
}
