package com.conveyor.orchestrator.platform;

/**
 * Answer of the registry or platform to a publish/apply request.
 *
 * @param accepted true when the request was taken
 * @param reason   why it was rejected; null when accepted
 */
public record Receipt(boolean accepted, String reason) {

    public static Receipt ok() {
        return new Receipt(true, null);
    }

    public static Receipt rejected(String reason) {
        return new Receipt(false, reason);
    }
}
