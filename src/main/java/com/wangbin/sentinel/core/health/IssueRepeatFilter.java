package com.wangbin.sentinel.core.health;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 按 {@link IssueRepeatPolicy} 处理跨周期重复的问题。
 * <p>
 * SUPPRESS 模式下，与上一周期签名相同的问题被去掉；去掉后为空时补一条 unchanged 信息，
 * 保证输出列表始终非空。healthy / unchanged 本身不参与抑制。
 */
@Slf4j
public class IssueRepeatFilter {

    @Getter
    private final IssueRepeatPolicy policy;

    private Set<String> previousSignatures = Collections.emptySet();

    public IssueRepeatFilter(IssueRepeatPolicy policy) {
        this.policy = policy != null ? policy : IssueRepeatPolicy.REPEAT;
    }

    /**
     * 调用方保证串行调用（分析周期单飞）
     */
    public List<Issue> apply(List<Issue> issues) {
        Set<String> current = issues.stream()
                .map(Issue::signature)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> previous = previousSignatures;
        previousSignatures = current;

        if (policy == IssueRepeatPolicy.REPEAT) {
            return issues;
        }

        List<Issue> fresh = issues.stream()
                .filter(issue -> isInformational(issue) || !previous.contains(issue.signature()))
                .collect(Collectors.toList());
        int suppressed = issues.size() - fresh.size();
        if (suppressed > 0) {
            log.debug("抑制 {} 条重复问题", suppressed);
        }
        if (fresh.isEmpty()) {
            return List.of(unchangedIssue(suppressed));
        }
        return Collections.unmodifiableList(fresh);
    }

    private static boolean isInformational(Issue issue) {
        return issue.getType() == IssueType.HEALTHY || issue.getType() == IssueType.UNCHANGED;
    }

    static Issue unchangedIssue(int suppressed) {
        return Issue.builder()
                .severity(IssueSeverity.INFO)
                .type(IssueType.UNCHANGED)
                .title("无新增问题")
                .description(suppressed + " 个问题与上一周期相同，已抑制")
                .recommendation("关注已有问题的处理进度")
                .build();
    }
}
