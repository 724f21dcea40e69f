package com.threadline.notificationservice.dto;

import com.threadline.notificationservice.model.NotificationCategory;
import lombok.Data;

@Data
public class MarkAllReadRequest {
    private NotificationCategory category; // null = every category
}
