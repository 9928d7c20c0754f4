package com.cloudmusic.resolver;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
