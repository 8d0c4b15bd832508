package com.wangbin.sentinel.core.log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * 内存日志缓冲区。条数超过上限时一次性裁剪到保留条数，只保留最新的部分。
 */
public class LogBuffer {

    private final int maxSize;
    private final int retainOnTrim;
    private final ArrayDeque<LogEntry> entries = new ArrayDeque<>();

    public LogBuffer(int maxSize, int retainOnTrim) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("日志缓冲区上限必须大于 0: " + maxSize);
        }
        this.maxSize = maxSize;
        this.retainOnTrim = Math.max(0, Math.min(retainOnTrim, maxSize));
    }

    public void add(LogEntry entry) {
        if (entry == null) {
            return;
        }
        synchronized (entries) {
            entries.addLast(entry);
            if (entries.size() > maxSize) {
                while (entries.size() > retainOnTrim) {
                    entries.pollFirst();
                }
            }
        }
    }

    /**
     * 最近的日志，按时间从旧到新
     *
     * @param limit 最多返回条数
     * @param level 级别过滤（忽略大小写），为空时不过滤
     */
    public List<LogEntry> recent(int limit, String level) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        String wanted = level == null || level.isBlank() ? null : level.trim().toLowerCase(Locale.ROOT);
        List<LogEntry> result = new ArrayList<>();
        synchronized (entries) {
            Iterator<LogEntry> newestFirst = entries.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                LogEntry entry = newestFirst.next();
                if (wanted == null || (entry.getLevel() != null
                        && entry.getLevel().toLowerCase(Locale.ROOT).equals(wanted))) {
                    result.add(entry);
                }
            }
        }
        Collections.reverse(result);
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
