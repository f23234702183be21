package com.meetpoll.domain.enums;

public enum GroupAccess {
    OWNED,
    SHARED
}
