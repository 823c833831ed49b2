package io.hepplan.util;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.Properties;

public class PropertiesUtilsTest {

    @Test
    public void testLoadRs() throws IOException {
        Properties p = PropertiesUtils.loadRs("util_test.properties");
        Assert.assertNotNull(p);
        Assert.assertEquals(12, PropertiesUtils.getInt(p, "test.count", 0));
        Assert.assertEquals(3000000000L, PropertiesUtils.getLong(p, "test.size", 0));
        Assert.assertEquals(7, PropertiesUtils.getInt(p, "test.missing", 7));

        Assert.assertNull(PropertiesUtils.loadRs("not_exists.properties"));
    }

    @Test
    public void testBlankIsDefault() {
        Properties p = new Properties();
        p.setProperty("k", "  ");
        Assert.assertEquals(5L, PropertiesUtils.getLong(p, "k", 5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIllegal() throws IOException {
        Properties p = PropertiesUtils.loadRs("util_test.properties");
        PropertiesUtils.getLong(p, "test.name", 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIntOutOfRange() throws IOException {
        Properties p = PropertiesUtils.loadRs("util_test.properties");
        PropertiesUtils.getInt(p, "test.size", 0);
    }
}
