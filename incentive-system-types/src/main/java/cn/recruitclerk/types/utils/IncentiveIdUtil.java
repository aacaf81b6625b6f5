package cn.recruitclerk.types.utils;

import java.util.concurrent.ThreadLocalRandom;

/**
 * @description 激励ID生成工具类，格式：incentive_{毫秒时间戳36进制}_{9位36进制随机串}
 * @create 2026-10-17
 */
public class IncentiveIdUtil {

    /**
     * ID前缀
     */
    public static final String PREFIX = "incentive_";

    /**
     * 随机段长度
     */
    private static final int RANDOM_LENGTH = 9;

    /**
     * 36进制字符表
     */
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    /**
     * 产生下一个激励ID
     *
     * @return 激励ID
     */
    public static String nextId() {
        return nextId(getNewTimestamp());
    }

    /**
     * 按指定时间戳产生激励ID
     *
     * @param timestamp 毫秒时间戳
     * @return 激励ID
     */
    public static String nextId(long timestamp) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(PREFIX)
                .append(Long.toString(timestamp, 36))
                .append('_');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }

    /**
     * 返回以毫秒为单位的当前时间
     *
     * @return 当前时间(毫秒)
     */
    private static long getNewTimestamp() {
        return System.currentTimeMillis();
    }

}
