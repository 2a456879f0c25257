package com.example.qkd.enforcement;

import com.example.qkd.exception.LinkHealthUnavailableException;
import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatus;
import com.example.qkd.model.LinkStatusResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * 通过 HTTP 轮询 KMS 的 GET /link_status。
 */
public class HttpLinkHealthSource implements LinkHealthSource {

    private final String url;
    private final ObjectMapper objectMapper;
    private final int timeoutMillis;

    public HttpLinkHealthSource(String url, ObjectMapper objectMapper, Duration timeout) {
        this.url = url;
        this.objectMapper = objectMapper;
        this.timeoutMillis = (int) timeout.toMillis();
    }

    @Override
    public LinkHealthSnapshot checkLinkHealth() {
        String body;
        int status;
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) new URL(url).openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            conn.setRequestProperty("Accept", "application/json");

            status = conn.getResponseCode();
            InputStream is = (status >= 200 && status < 300) ? conn.getInputStream() : conn.getErrorStream();
            if (is == null) {
                body = "";
            } else {
                try (InputStream in = is) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            throw new LinkHealthUnavailableException("KMS unreachable at " + url + ": " + e.getMessage(), e);
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }

        if (status < 200 || status >= 300) {
            throw new LinkHealthUnavailableException("HTTP " + status + " from " + url + ": " + body);
        }

        LinkStatusResponse resp;
        try {
            resp = objectMapper.readValue(body, LinkStatusResponse.class);
        } catch (IOException e) {
            throw new LinkHealthUnavailableException("Could not parse link status from " + url, e);
        }

        LinkStatus linkStatus = LinkStatus.fromName(resp.getStatus());
        if (linkStatus == null) {
            throw new LinkHealthUnavailableException("Unknown link status '" + resp.getStatus() + "' from " + url);
        }
        return new LinkHealthSnapshot(linkStatus, resp.getQber(), resp.getTotalKeysIssued(),
                resp.getAttacksDetected(), resp.getActiveSessions(), resp.isAttackForced());
    }
}
