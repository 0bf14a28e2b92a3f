package com.tio.pluginconfig;

import java.util.regex.Pattern;

/** Plugin names are word characters only ({@code [A-Za-z0-9_]}), non-empty, at most 100 chars. */
public final class PluginNameValidator {

    private static final Pattern NAME = Pattern.compile("^\\w+$");
    private static final int MAX_LENGTH = 100;

    private PluginNameValidator() {
    }

    public static boolean isValid(String name) {
        return name != null && name.length() <= MAX_LENGTH && NAME.matcher(name).matches();
    }

    /**
     * @throws IllegalArgumentException if the name is not valid
     */
    public static String validate(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid plugin name '" + name
                    + "': only [A-Za-z0-9_] characters, at most " + MAX_LENGTH);
        }
        return name;
    }
}
