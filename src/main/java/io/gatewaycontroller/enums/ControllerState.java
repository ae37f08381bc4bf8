package io.gatewaycontroller.enums;

/**
 * Lifecycle of a {@link io.gatewaycontroller.GatewayStatusController}.
 * STOPPED is terminal.
 */
public enum ControllerState {
    CREATED,
    STARTED,
    RUNNING,
    STOPPED
}
