package com.meetpoll.domain.enums;

public enum Availability {
    AVAILABLE,
    MAYBE,
    UNAVAILABLE
}
