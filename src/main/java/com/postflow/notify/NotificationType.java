package com.postflow.notify;

public enum NotificationType {
    JOB_STATE_CHANGED,
    QUEUE_PAUSED,
    QUEUE_RESUMED,
    QUEUE_CLEARED,
    BULK_COMPLETED
}
