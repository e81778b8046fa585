package com.quorumbridge.bridge.controller;

public final class ApiHeaders {

    /** Chain address of the account making the request. */
    public static final String CALLER = "X-Caller-Address";

    private ApiHeaders() {
    }
}
