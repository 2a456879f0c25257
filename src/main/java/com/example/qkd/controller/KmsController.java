package com.example.qkd.controller;

import com.example.qkd.model.KeyIssuanceResult;
import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatusResponse;
import com.example.qkd.service.KeyManager;
import com.example.qkd.util.HexCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * KeyManager 的 HTTP 绑定，只做报文转换。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class KmsController {

    private final KeyManager keyManager;
    private final HexCodec hexCodec;

    @PostMapping("/get_session_key")
    public ResponseEntity<Object> getSessionKey(@RequestBody KeyRequest request) {
        KeyIssuanceResult result = keyManager.getFreshKey(
                request.getDeviceId(), request.isForceAttack(), request.isPqc());

        if (result instanceof KeyIssuanceResult.Success) {
            KeyIssuanceResult.Success ok = (KeyIssuanceResult.Success) result;
            return ResponseEntity.ok(new KeyResponse(
                    hexCodec.encodeHex(ok.getSessionKey()),
                    ok.getQber(),
                    ok.getStatus().name(),
                    ok.isHybrid(),
                    ok.isPaired()));
        }

        KeyIssuanceResult.Rejection rejected = (KeyIssuanceResult.Rejection) result;
        log.info("Key request blocked. deviceId={}, reason={}, qber={}",
                request.getDeviceId(), rejected.getReason(), rejected.getQber());
        return ResponseEntity.ok(new ErrorResponse(
                rejected.getMessage(),
                rejected.getReason().name(),
                rejected.getQber(),
                rejected.getStatus().name()));
    }

    @GetMapping("/link_status")
    public LinkStatusResponse linkStatus() {
        return LinkStatusResponse.of(keyManager.checkLinkHealth());
    }

    /**
     * 打开强制窃听开关。返回的状态还是开关前的链路状态，
     * 下一次 /get_session_key 跑出高 QBER 后才会变成 RED。
     */
    @PostMapping("/force_attack")
    public LinkStatusResponse forceAttack() {
        return LinkStatusResponse.of(keyManager.forceAttack());
    }

    @DeleteMapping("/force_attack")
    public LinkStatusResponse clearForcedAttack() {
        return LinkStatusResponse.of(keyManager.clearForcedAttack());
    }

    @DeleteMapping("/sessions/{deviceId}")
    public ResponseEntity<Map<String, Object>> invalidateSession(@PathVariable String deviceId) {
        boolean removed = keyManager.invalidateSession(deviceId);
        if (!removed) {
            return ResponseEntity.status(404).body(Map.of("status", 1, "msg", "session not found"));
        }
        return ResponseEntity.ok(Map.of("status", 0, "deviceId", deviceId, "msg", "invalidated"));
    }

    @PostMapping("/reset")
    public Map<String, Object> reset() {
        LinkHealthSnapshot s = keyManager.resetForDemo();
        return Map.of(
                "status", "reset_complete",
                "link_status", s.getStatus().name(),
                "message", "KMS state cleared");
    }
}
