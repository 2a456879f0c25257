package com.example.qkd.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyRequest {

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("force_attack")
    private boolean forceAttack;

    /** 混合模式（BB84 + ML-KEM） */
    private boolean pqc;
}
