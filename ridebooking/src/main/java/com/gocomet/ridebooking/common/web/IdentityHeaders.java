package com.gocomet.ridebooking.common.web;

/**
 * Headers carrying the caller identity established by the upstream auth gateway.
 */
public final class IdentityHeaders {

    public static final String RIDER_ID = "X-Rider-Id";
    public static final String DRIVER_ID = "X-Driver-Id";

    private IdentityHeaders() {
    }
}
