package com.aec.CalendarSrv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalendarStatusDto {
    private boolean configured;
    private boolean linked;
    private String googleEmail;
}
