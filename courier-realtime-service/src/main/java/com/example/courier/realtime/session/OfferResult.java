package com.example.courier.realtime.session;

public enum OfferResult {
    ACCEPTED,
    /** Outbound buffer full; the caller tears the connection down. */
    OVERFLOW,
    /** Connection is not open, or its outbound stream has already terminated. */
    CLOSED
}
