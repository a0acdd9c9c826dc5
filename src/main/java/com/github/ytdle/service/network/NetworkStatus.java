package com.github.ytdle.service.network;

public enum NetworkStatus {
    ONLINE,
    OFFLINE,
    UNKNOWN
}
