package com.example.qkd.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * GET /link_status 的报文，服务端输出和执行端轮询解析共用。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkStatusResponse {

    private String status;

    private double qber;

    @JsonProperty("total_keys_issued")
    private long totalKeysIssued;

    @JsonProperty("attacks_detected")
    private long attacksDetected;

    @JsonProperty("active_sessions")
    private int activeSessions;

    @JsonProperty("attack_forced")
    private boolean attackForced;

    public static LinkStatusResponse of(LinkHealthSnapshot s) {
        LinkStatusResponse r = new LinkStatusResponse();
        r.setStatus(s.getStatus().name());
        r.setQber(s.getLastQber());
        r.setTotalKeysIssued(s.getKeysIssued());
        r.setAttacksDetected(s.getAttacksDetected());
        r.setActiveSessions(s.getActiveSessions());
        r.setAttackForced(s.isAttackForced());
        return r;
    }
}
