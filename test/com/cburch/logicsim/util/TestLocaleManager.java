package com.cburch.logicsim.util;

import org.junit.Assert;
import org.junit.Test;

public class TestLocaleManager {

    @Test
    public void loadsBundleAndFallsBackToKey() {
        LocaleManager m = new LocaleManager("logicsim", "parser");
        Assert.assertEquals("Parsing resumed on line %s.", m.get("parser.resumed"));
        Assert.assertEquals("no.such.key", m.get("no.such.key"));
    }
}
