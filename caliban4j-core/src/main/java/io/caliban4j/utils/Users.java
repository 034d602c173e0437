package io.caliban4j.utils;

public final class Users {
    private Users() {
    }

    /**
     * OS user name, or "unknown" when the JVM does not expose one.
     */
    public static String current() {
        String user = System.getProperty("user.name");
        return user == null || user.isBlank() ? "unknown" : user;
    }
}
