package com.wangbin.sentinel.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串（格式化）
     */
    public static String toJsonStringPretty(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.PrettyFormat);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * JSON数组字符串转对象列表，非对象元素被跳过。
     * 无法解析时返回空列表。
     */
    public static List<JSONObject> parseObjectArray(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            JSONArray array = JSON.parseArray(json);
            if (array == null) {
                return Collections.emptyList();
            }
            List<JSONObject> result = new ArrayList<>(array.size());
            for (Object element : array) {
                if (element instanceof JSONObject object) {
                    result.add(object);
                }
            }
            return result;
        } catch (Exception e) {
            log.error("JSON字符串转List失败: {}", abbreviate(json), e);
            return Collections.emptyList();
        }
    }

    /**
     * 判断是否为JSON数组
     */
    public static boolean isJsonArray(String json) {
        try {
            Object obj = JSON.parse(json);
            return obj instanceof JSONArray;
        } catch (Exception e) {
            return false;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
