package com.reportwheel.core.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.reportwheel.exception.ScheduleValidationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 5 段 cron 表达式求值, 无状态
 *
 * 在目标时区的墙钟时间上匹配, 再映射回绝对时间:
 * 落在夏令时跳过的小时内 → 顺延到切换后的第一个有效时刻;
 * 落在重复的小时内 → 只在第一次出现时触发。
 */
public class CronEvaluator {

    /** 向后探测上限, 防止永不满足的表达式死循环 */
    private static final int MAX_PROBES = 64;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    /**
     * 校验表达式, 非法时抛出 ScheduleValidationException
     */
    public Cron validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleValidationException("INVALID_CRON", "Cron expression is required");
        }
        try {
            Cron cron = parser.parse(expression.trim());
            return cron.validate();
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("INVALID_CRON",
                    "Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public ZoneId validateZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new ScheduleValidationException("INVALID_TIMEZONE", "Timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleValidationException("INVALID_TIMEZONE", "Unknown timezone '" + timezone + "'", e);
        }
    }

    /**
     * 严格晚于 after 的下一次触发时间
     */
    public Instant nextFireTime(String expression, String timezone, Instant after) {
        ZoneId zone = validateZone(timezone);
        ExecutionTime executionTime = cache.computeIfAbsent(expression.trim(),
                k -> ExecutionTime.forCron(validate(k)));

        // 用 UTC 承载目标时区的墙钟时间, 避免 cron-utils 自行处理时区切换
        ZonedDateTime wall = LocalDateTime.ofInstant(after, zone)
                .truncatedTo(ChronoUnit.SECONDS)
                .atZone(ZoneOffset.UTC);
        for (int i = 0; i < MAX_PROBES; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(wall);
            if (next.isEmpty()) {
                break;
            }
            Instant candidate = resolve(next.get().toLocalDateTime(), zone);
            if (candidate.isAfter(after)) {
                return candidate;
            }
            // 重复小时的第二次出现, 继续向后找
            wall = next.get();
        }
        throw new ScheduleValidationException("CRON_NEVER_FIRES",
                "Cron expression '" + expression + "' has no upcoming fire time");
    }

    private static Instant resolve(LocalDateTime local, ZoneId zone) {
        ZoneOffsetTransition transition = zone.getRules().getTransition(local);
        if (transition != null && transition.isGap()) {
            return transition.getInstant();
        }
        // 重叠时 atZone 取较早的偏移
        return local.atZone(zone).toInstant();
    }
}
