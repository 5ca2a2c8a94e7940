package org.observatory.datapipeline.utils;

import java.nio.file.Path;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * Variables resolve against Java system properties first, then environment variables, so
 * {@code -Dobservatory.home=...} can override an exported {@code OBSERVATORY_HOME}.
 * <pre>
 * expandPath("${user.home}/worlds/ledger.jsonl")  → "/home/user/worlds/ledger.jsonl"
 * expandPath("/var/lib/observatory")              → "/var/lib/observatory"
 * </pre>
 */
public final class PathExpansion {

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param path the path potentially containing variables
     * @return the path with all variables expanded
     * @throws IllegalArgumentException if a referenced variable is undefined or a reference is unclosed
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < path.length()) {
            int startVar = path.indexOf("${", pos);
            if (startVar == -1) {
                result.append(path, pos, path.length());
                break;
            }
            result.append(path, pos, startVar);

            int endVar = path.indexOf('}', startVar + 2);
            if (endVar == -1) {
                throw new IllegalArgumentException("Unclosed variable in path: " + path);
            }
            String varName = path.substring(startVar + 2, endVar);
            String value = System.getProperty(varName);
            if (value == null) {
                value = System.getenv(varName);
            }
            if (value == null) {
                throw new IllegalArgumentException("Undefined variable '${" + varName + "}' in path: " + path);
            }
            result.append(value);
            pos = endVar + 1;
        }
        return result.toString();
    }

    /**
     * Expands and converts to an absolute, normalized path.
     */
    public static Path resolve(String path) {
        return Path.of(expandPath(path)).toAbsolutePath().normalize();
    }
}
