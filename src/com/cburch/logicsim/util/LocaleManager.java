package com.cburch.logicsim.util;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Loads one resource bundle of message templates. A missing key is returned
 * as the key itself so that an incomplete translation never hides an error.
 */
public final class LocaleManager {
    private final String baseName;
    private ResourceBundle bundle;

    /**
     * @param dirName classpath directory of the bundle, e.g. "logicsim"
     * @param fileStart bundle file prefix, e.g. "parser"
     */
    public LocaleManager(String dirName, String fileStart) {
        this.baseName = dirName + "." + fileStart;
    }

    public String get(String key) {
        try {
            return bundle().getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
    }

    private ResourceBundle bundle() {
        if (bundle == null) {
            bundle = ResourceBundle.getBundle(baseName, Locale.getDefault());
        }
        return bundle;
    }
}
