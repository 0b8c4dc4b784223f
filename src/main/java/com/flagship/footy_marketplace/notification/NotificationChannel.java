package com.flagship.footy_marketplace.notification;

public enum NotificationChannel {
    EMAIL,
    SMS
}
