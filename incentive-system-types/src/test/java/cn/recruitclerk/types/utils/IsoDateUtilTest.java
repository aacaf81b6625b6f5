package cn.recruitclerk.types.utils;

import cn.recruitclerk.types.exception.AppException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Date;

public class IsoDateUtilTest {

    @Test
    public void test_format_parse() {
        Date date = new Date(1700000000123L);
        String text = IsoDateUtil.format(date);
        Assert.assertEquals("2023-11-14T22:13:20.123Z", text);
        Assert.assertEquals(date, IsoDateUtil.parse(text));
        Assert.assertNull(IsoDateUtil.parse(null));
        Assert.assertNull(IsoDateUtil.format(null));
    }

    @Test(expected = AppException.class)
    public void test_parse_illegal() {
        IsoDateUtil.parse("yesterday");
    }

    @Test
    public void test_wholeDaysBetween() {
        Date now = new Date();
        Assert.assertEquals(2L, IsoDateUtil.wholeDaysBetween(IsoDateUtil.daysAgo(now, 2.5), now));
        Assert.assertEquals(0L, IsoDateUtil.wholeDaysBetween(now, now));
    }

}
