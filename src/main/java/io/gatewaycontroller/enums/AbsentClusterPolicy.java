package io.gatewaycontroller.enums;

/**
 * What happens to a cluster id that the active gateway no longer lists at all.
 */
public enum AbsentClusterPolicy {
    /** Keep whatever reachability value was last published. */
    RETAIN,
    /** Drop the cluster id from the table in the same publish. */
    PRUNE;

    /**
     * Parse a policy name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is not a known policy
     */
    public static AbsentClusterPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Absent cluster policy cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown absent cluster policy: " + value, e);
        }
    }
}
