package com.example.qkd.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KeyResponse {

    @JsonProperty("key_hex")
    private String keyHex;

    private double qber;

    private String status;

    @JsonProperty("pqc_enabled")
    private boolean pqcEnabled;

    private boolean paired;
}
