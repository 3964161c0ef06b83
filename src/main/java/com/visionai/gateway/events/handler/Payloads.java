package com.visionai.gateway.events.handler;

import java.util.Map;

final class Payloads {

    private Payloads() {
    }

    static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    /** Falsy values (null, false, zero, empty string) become {@code 0}. */
    static Object orZero(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return 0;
        }
        if (value instanceof Number n && n.doubleValue() == 0d) {
            return 0;
        }
        if (value instanceof String s && s.isEmpty()) {
            return 0;
        }
        return value;
    }
}
