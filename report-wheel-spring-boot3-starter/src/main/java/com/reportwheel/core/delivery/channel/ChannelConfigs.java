package com.reportwheel.core.delivery.channel;

import com.reportwheel.exception.ChannelConfigException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通道配置取值
 */
final class ChannelConfigs {

    private ChannelConfigs() {}

    static String str(Map<String, Object> config, String key) {
        Object v = config == null ? null : config.get(key);
        if (v == null) {
            return null;
        }
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? null : s;
    }

    static String required(Map<String, Object> config, String key) {
        String s = str(config, key);
        if (s == null) {
            throw new ChannelConfigException("'" + key + "' is required");
        }
        return s;
    }

    static boolean bool(Map<String, Object> config, String key, boolean def) {
        String s = str(config, key);
        return s == null ? def : Boolean.parseBoolean(s);
    }

    /**
     * 列表或逗号分隔字符串
     */
    static List<String> list(Map<String, Object> config, String key) {
        Object v = config == null ? null : config.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof Collection<?> c) {
            c.stream().filter(x -> x != null).map(x -> String.valueOf(x).trim()).filter(x -> !x.isEmpty()).forEach(out::add);
        } else if (v != null) {
            Arrays.stream(String.valueOf(v).split(",")).map(String::trim).filter(x -> !x.isEmpty()).forEach(out::add);
        }
        return out;
    }

    static Map<String, String> stringMap(Map<String, Object> config, String key) {
        Object v = config == null ? null : config.get(key);
        Map<String, String> out = new LinkedHashMap<>();
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, val) -> {
                if (k != null && val != null) {
                    out.put(String.valueOf(k), String.valueOf(val));
                }
            });
        } else if (v != null) {
            throw new ChannelConfigException("'" + key + "' must be an object");
        }
        return out;
    }
}
