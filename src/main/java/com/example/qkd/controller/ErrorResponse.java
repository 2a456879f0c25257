package com.example.qkd.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;

    /** EAVESDROPPER_DETECTED / INSUFFICIENT_KEY_MATERIAL，配置错误时为空 */
    private String reason;

    private Double qber;

    private String status;
}
