package org.nowstart.lending.controller;

public final class ApiHeaders {

    // account on whose behalf the request is made
    public static final String CALLER = "X-Caller";

    private ApiHeaders() {
    }
}
