package com.aec.CalendarSrv.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LinkResultDto {
    private Long userId;
    private boolean linked;
    private String googleEmail;
}
