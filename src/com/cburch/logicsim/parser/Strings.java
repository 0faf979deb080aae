package com.cburch.logicsim.parser;

import com.cburch.logicsim.util.LocaleManager;
import com.cburch.logicsim.util.StringUtil;

public class Strings {
    private static final LocaleManager source
        = new LocaleManager("logicsim", "parser");

    public static String get(String key) {
        return source.get(key);
    }
    public static String get(String key, String... args) {
        return StringUtil.format(source.get(key), args);
    }
    public static String get(String key, int n) {
        return StringUtil.format(source.get(key), String.valueOf(n));
    }
}
