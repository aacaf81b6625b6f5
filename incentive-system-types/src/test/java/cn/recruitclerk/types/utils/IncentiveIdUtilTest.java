package cn.recruitclerk.types.utils;

import lombok.extern.slf4j.Slf4j;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

@Slf4j
public class IncentiveIdUtilTest {

    @Test
    public void test_nextId_format() {
        String id = IncentiveIdUtil.nextId(1700000000000L);
        log.info("测试结果: {}", id);
        Assert.assertTrue(id.matches("^incentive_[0-9a-z]+_[0-9a-z]{9}$"));
        Assert.assertTrue(id.startsWith("incentive_" + Long.toString(1700000000000L, 36) + "_"));
    }

    @Test
    public void test_nextId_unique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(IncentiveIdUtil.nextId());
        }
        Assert.assertEquals(1000, ids.size());
    }

}
