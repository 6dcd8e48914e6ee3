package com.cluster.state.entity;

import java.util.regex.Pattern;

/**
 * Validation of entity names.
 */
public final class Names {

    private static final Pattern APPLICATION = Pattern.compile("^[a-z][a-z0-9]*(-[a-z0-9]*[a-z][a-z0-9]*)*$");
    private static final Pattern UNIT = Pattern.compile("^([a-z][a-z0-9]*(-[a-z0-9]*[a-z][a-z0-9]*)*)/(0|[1-9][0-9]*)$");
    private static final Pattern MACHINE = Pattern.compile("^(0|[1-9][0-9]*)(/[a-z]+/(0|[1-9][0-9]*))*$");

    private Names() {
    }

    public static boolean isValidApplication(String name) {
        return name != null && APPLICATION.matcher(name).matches();
    }

    public static boolean isValidUnit(String name) {
        return name != null && UNIT.matcher(name).matches();
    }

    public static boolean isValidMachine(String id) {
        return id != null && MACHINE.matcher(id).matches();
    }

    /**
     * Returns the application part of a unit name.
     */
    public static String applicationOf(String unitName) {
        int slash = unitName.indexOf('/');
        return slash > 0 ? unitName.substring(0, slash) : unitName;
    }

    /**
     * Returns the host of a container id, or empty for a top-level machine.
     */
    public static String parentOf(String machineId) {
        int slash = machineId.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        String withoutIndex = machineId.substring(0, slash);
        return withoutIndex.substring(0, withoutIndex.lastIndexOf('/'));
    }
}
