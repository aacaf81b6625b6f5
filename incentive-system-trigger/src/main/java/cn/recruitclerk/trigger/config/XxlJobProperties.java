package cn.recruitclerk.trigger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * XXL-Job 执行器配置属性
 */
@Data
@ConfigurationProperties(prefix = "xxl.job")
public class XxlJobProperties {

    /** 是否启用执行器 */
    private boolean enabled = true;

    /** 调度中心地址，多个用逗号分隔 */
    private String adminAddresses;

    /** 执行器名称，需与调度中心注册的 AppName 一致 */
    private String appName = "incentive-system-job";

    /** 访问令牌 */
    private String accessToken;

    /** 执行器 IP，为空则自动获取 */
    private String ip;

    /** 执行器端口 */
    private int port = 9999;

    /** 任务日志路径 */
    private String logPath = "/data/applogs/incentive-system/xxl-job";

    /** 任务日志保留天数 */
    private int logRetentionDays = 30;
}
