package com.vlrnotify.domain.model;

/**
 * Outcome of handing one notification to the delivery channel.
 */
public final class DeliveryResult {

    private static final DeliveryResult OK = new DeliveryResult(null);

    private final String error;

    private DeliveryResult(String error) {
        this.error = error;
    }

    public static DeliveryResult ok() {
        return OK;
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(reason != null ? reason : "unknown error");
    }

    public boolean isOk() {
        return error == null;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok" : "Err(" + error + ")";
    }
}
