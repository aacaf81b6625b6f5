package cn.recruitclerk.infrastructure.adapter.port;

import cn.recruitclerk.domain.incentive.adapter.port.IAuditLogger;
import com.alibaba.fastjson.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 审计日志，写入独立的 AUDIT 日志，由 logback 配置单独落盘
 */
@Component
public class AuditLogger implements IAuditLogger {

    public static final String AUDIT_LOGGER_NAME = "AUDIT";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    @Override
    public void logBusinessEvent(String eventName, Map<String, Object> data) {
        audit.info("[BUSINESS] {} {}", eventName, JSON.toJSONString(data));
    }

    @Override
    public void logSecurityEvent(String eventName, Map<String, Object> data) {
        audit.warn("[SECURITY] {} {}", eventName, JSON.toJSONString(data));
    }

    @Override
    public void logError(String eventName, Map<String, Object> data) {
        audit.error("[ERROR] {} {}", eventName, JSON.toJSONString(data));
    }

}
