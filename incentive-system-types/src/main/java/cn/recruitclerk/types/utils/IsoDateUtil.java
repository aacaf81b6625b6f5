package cn.recruitclerk.types.utils;

import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * @description ISO-8601 时间字符串与 Date 互转
 * @create 2026-10-17
 */
public class IsoDateUtil {

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    public static String format(Date date) {
        if (null == date) return null;
        return date.toInstant().toString();
    }

    public static Date parse(String text) {
        if (StringUtils.isBlank(text)) return null;
        try {
            return Date.from(Instant.parse(text));
        } catch (DateTimeParseException e) {
            throw new AppException(ResponseCode.E0107, "非法的ISO-8601时间: " + text, e);
        }
    }

    /**
     * 两个时间之间相差的天数（含小数）
     */
    public static double daysBetween(Date from, Date to) {
        return (double) (to.getTime() - from.getTime()) / MILLIS_PER_DAY;
    }

    /**
     * 两个时间之间相差的整天数（向下取整）
     */
    public static long wholeDaysBetween(Date from, Date to) {
        return Math.floorDiv(to.getTime() - from.getTime(), MILLIS_PER_DAY);
    }

    public static Date daysAgo(Date now, double days) {
        return new Date(now.getTime() - (long) (days * MILLIS_PER_DAY));
    }

}
