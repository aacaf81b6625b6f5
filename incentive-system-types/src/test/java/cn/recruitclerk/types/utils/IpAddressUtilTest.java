package cn.recruitclerk.types.utils;

import org.junit.Assert;
import org.junit.Test;

public class IpAddressUtilTest {

    @Test
    public void test_isValidIpAddress() {
        Assert.assertTrue(IpAddressUtil.isValidIpAddress("1.2.3.4"));
        Assert.assertTrue(IpAddressUtil.isValidIpAddress("255.255.255.255"));
        Assert.assertTrue(IpAddressUtil.isValidIpAddress("0.0.0.0"));

        Assert.assertFalse(IpAddressUtil.isValidIpAddress(null));
        Assert.assertFalse(IpAddressUtil.isValidIpAddress(""));
        Assert.assertFalse(IpAddressUtil.isValidIpAddress("256.1.1.1"));
        Assert.assertFalse(IpAddressUtil.isValidIpAddress("1.2.3"));
        Assert.assertFalse(IpAddressUtil.isValidIpAddress("1.2.3.4.5"));
        Assert.assertFalse(IpAddressUtil.isValidIpAddress("a.b.c.d"));
    }

}
