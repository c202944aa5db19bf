package com.vaultledger.api.controller;

/**
 * Request header carrying the authenticated caller identity, set by the gateway in front of the API.
 */
final class CallerHeader {

    static final String NAME = "X-Caller-Id";

    private CallerHeader() {
    }
}
