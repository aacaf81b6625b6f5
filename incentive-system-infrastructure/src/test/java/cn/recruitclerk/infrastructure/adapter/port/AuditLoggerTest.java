package cn.recruitclerk.infrastructure.adapter.port;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class AuditLoggerTest {

    private final AuditLogger auditLogger = new AuditLogger();

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @Before
    public void init() {
        logger = (Logger) LoggerFactory.getLogger(AuditLogger.AUDIT_LOGGER_NAME);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @After
    public void destroy() {
        logger.detachAppender(appender);
    }

    @Test
    public void test_levels() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("incentiveId", "incentive_1");
        data.put("amount", 8);

        auditLogger.logBusinessEvent("INCENTIVE_PAID", data);
        auditLogger.logSecurityEvent("INCENTIVE_STATE_CONFLICT", data);
        auditLogger.logError("PROCESS_PAYMENT_ERROR", data);

        Assert.assertEquals(3, appender.list.size());
        Assert.assertEquals(Level.INFO, appender.list.get(0).getLevel());
        Assert.assertEquals("[BUSINESS] INCENTIVE_PAID {\"incentiveId\":\"incentive_1\",\"amount\":8}",
                appender.list.get(0).getFormattedMessage());
        Assert.assertEquals(Level.WARN, appender.list.get(1).getLevel());
        Assert.assertTrue(appender.list.get(1).getFormattedMessage().startsWith("[SECURITY] INCENTIVE_STATE_CONFLICT"));
        Assert.assertEquals(Level.ERROR, appender.list.get(2).getLevel());
        Assert.assertTrue(appender.list.get(2).getFormattedMessage().startsWith("[ERROR] PROCESS_PAYMENT_ERROR"));
    }

}
