package com.wangbin.sentinel.core.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次分析中发现的问题。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Issue {

    private final IssueSeverity severity;
    private final IssueType type;
    private final String title;
    private final String description;
    private final String recommendation;

    private final Map<String, Object> details;

    @Builder
    public Issue(IssueSeverity severity,
                 IssueType type,
                 String title,
                 String description,
                 String recommendation,
                 Map<String, Object> details) {
        this.severity = severity;
        this.type = type;
        this.title = title;
        this.description = description;
        this.recommendation = recommendation;
        // 保留插入顺序，允许 null 值
        this.details = details == null || details.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * 跨周期比较用的签名：类型 + 级别 + 标题
     */
    public String signature() {
        return type.getCode() + "|" + severity.getCode() + "|" + title;
    }
}
