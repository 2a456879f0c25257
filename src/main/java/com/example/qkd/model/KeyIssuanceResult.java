package com.example.qkd.model;

import lombok.Getter;

/**
 * 密钥请求的结果：要么 {@link Success}，要么 {@link Rejection}。
 */
@Getter
public abstract class KeyIssuanceResult {

    private final String deviceId;
    private final double qber;
    private final LinkStatus status;

    protected KeyIssuanceResult(String deviceId, double qber, LinkStatus status) {
        this.deviceId = deviceId;
        this.qber = qber;
        this.status = status;
    }

    public abstract boolean isAccepted();

    public static Success success(String deviceId, byte[] sessionKey, double qber, LinkStatus status,
                                  boolean hybrid, boolean paired) {
        return new Success(deviceId, sessionKey, qber, status, hybrid, paired);
    }

    public static Rejection rejection(String deviceId, RejectionReason reason, String message,
                                      double qber, LinkStatus status) {
        return new Rejection(deviceId, reason, message, qber, status);
    }

    @Getter
    public static final class Success extends KeyIssuanceResult {
        private final byte[] sessionKey;
        private final boolean hybrid;
        private final boolean paired;

        private Success(String deviceId, byte[] sessionKey, double qber, LinkStatus status,
                        boolean hybrid, boolean paired) {
            super(deviceId, qber, status);
            this.sessionKey = sessionKey.clone();
            this.hybrid = hybrid;
            this.paired = paired;
        }

        public byte[] getSessionKey() {
            return sessionKey.clone();
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public String toString() {
            return "Success(deviceId=" + getDeviceId() + ", qber=" + getQber() + ", status=" + getStatus()
                    + ", hybrid=" + hybrid + ", paired=" + paired + ")";
        }
    }

    @Getter
    public static final class Rejection extends KeyIssuanceResult {
        private final RejectionReason reason;
        private final String message;

        private Rejection(String deviceId, RejectionReason reason, String message, double qber, LinkStatus status) {
            super(deviceId, qber, status);
            this.reason = reason;
            this.message = message;
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public String toString() {
            return "Rejection(deviceId=" + getDeviceId() + ", reason=" + reason + ", qber=" + getQber()
                    + ", status=" + getStatus() + ")";
        }
    }
}
