package cn.recruitclerk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Redis 连接配置属性
 */
@Data
@ConfigurationProperties(prefix = "redis.sdk.config", ignoreInvalidFields = true)
public class RedisClientConfigProperties {

    /** host:ip */
    private String host;
    /** 端口 */
    private int port;
    /** 账密 */
    private String password;
    /** 连接池的大小 */
    private int poolSize = 64;
    /** 连接池的最小空闲连接数 */
    private int minIdleSize = 10;
    /** 连接的最大空闲时间（单位：毫秒） */
    private int idleTimeout = 10000;
    /** 连接超时时间（单位：毫秒） */
    private int connectTimeout = 10000;
    /** 连接重试次数 */
    private int retryAttempts = 3;
    /** 连接重试的间隔时间（单位：毫秒） */
    private int retryInterval = 1000;
    /** 定期检查连接是否可用的时间间隔（单位：毫秒） */
    private int pingInterval = 0;
    /** 是否保持长连接 */
    private boolean keepAlive = true;

}
