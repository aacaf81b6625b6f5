package cn.recruitclerk.domain.incentive.adapter.port;

import java.util.Map;

/**
 * @description 审计日志端口，只记录不阻断
 * @create 2026-10-17
 */
public interface IAuditLogger {

    void logBusinessEvent(String eventName, Map<String, Object> data);

    void logSecurityEvent(String eventName, Map<String, Object> data);

    void logError(String eventName, Map<String, Object> data);

}
