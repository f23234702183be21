package com.meetpoll.domain.enums;

public enum DeliveryStatus {
    DELIVERED,
    SIMULATED,
    FAILED
}
