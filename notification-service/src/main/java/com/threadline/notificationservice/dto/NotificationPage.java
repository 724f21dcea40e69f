package com.threadline.notificationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class NotificationPage {
    private List<NotificationDto> items;
    private long totalCount;   // matches across all pages
    private int limit;
    private int offset;
}
