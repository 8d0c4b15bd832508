package com.wangbin.sentinel.core.health;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IssueRepeatFilterTest {

    private static final Issue LOSS = Issue.builder()
            .severity(IssueSeverity.CRITICAL)
            .type(IssueType.PACKET_LOSS)
            .title("丢包率过高: 6.0%")
            .build();

    private static final Issue LATENCY = Issue.builder()
            .severity(IssueSeverity.WARNING)
            .type(IssueType.LATENCY)
            .title("延迟偏高: 150.0ms")
            .build();

    @Test
    void repeatPolicyReturnsEveryIssue() {
        IssueRepeatFilter filter = new IssueRepeatFilter(IssueRepeatPolicy.REPEAT);

        assertEquals(List.of(LOSS), filter.apply(List.of(LOSS)));
        assertEquals(List.of(LOSS), filter.apply(List.of(LOSS)));
    }

    @Test
    void suppressDropsRepeatsButKeepsListNonEmpty() {
        IssueRepeatFilter filter = new IssueRepeatFilter(IssueRepeatPolicy.SUPPRESS);

        assertEquals(List.of(LOSS), filter.apply(List.of(LOSS)));

        List<Issue> second = filter.apply(List.of(LOSS));
        assertEquals(1, second.size());
        assertEquals(IssueType.UNCHANGED, second.get(0).getType());
        assertEquals(IssueSeverity.INFO, second.get(0).getSeverity());

        assertEquals(List.of(LATENCY), filter.apply(List.of(LOSS, LATENCY)));
    }

    @Test
    void suppressNeverDropsHealthy() {
        IssueRepeatFilter filter = new IssueRepeatFilter(IssueRepeatPolicy.SUPPRESS);
        Issue healthy = HealthMetricsAggregator.healthyIssue();

        filter.apply(List.of(healthy));

        assertEquals(List.of(healthy), filter.apply(List.of(healthy)));
    }

    @Test
    void nullPolicyMeansRepeat() {
        assertEquals(IssueRepeatPolicy.REPEAT, new IssueRepeatFilter(null).getPolicy());
    }
}
