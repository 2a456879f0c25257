package com.example.scene.qkdsystem;

import com.example.qkd.Application;
import com.example.qkd.config.QkdProperties;
import com.example.qkd.exception.QkdConfigurationException;
import com.example.qkd.model.KeyIssuanceResult;
import com.example.qkd.model.LinkHealthSnapshot;
import com.example.qkd.model.LinkStatus;
import com.example.qkd.model.RejectionReason;
import com.example.qkd.model.SessionRecord;
import com.example.qkd.service.KeyManager;
import com.example.qkd.service.RandomSourceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = Application.class)
class KeyManagerServiceTests {

    @Autowired
    private KeyManager keyManager;

    @BeforeEach
    void reset() {
        keyManager.resetForDemo();
    }

    @Test
    void scenarioA_defaultRequestIssuesKey() {
        KeyIssuanceResult result = keyManager.getFreshKey("Alpha");

        assertTrue(result.isAccepted());
        KeyIssuanceResult.Success ok = (KeyIssuanceResult.Success) result;
        assertEquals(32, ok.getSessionKey().length);
        assertTrue(ok.getQber() < 0.11);
        assertEquals(LinkStatus.GREEN, ok.getStatus());
        assertFalse(ok.isPaired());

        LinkHealthSnapshot health = keyManager.checkLinkHealth();
        assertEquals(1, health.getKeysIssued());
        assertEquals(1, health.getActiveSessions());
        assertEquals(LinkStatus.GREEN, health.getStatus());
    }

    @Test
    void scenarioB_forcedEavesdropperIsRejected() {
        KeyIssuanceResult result = keyManager.getFreshKey("Alpha", true);

        assertFalse(result.isAccepted());
        KeyIssuanceResult.Rejection rejected = (KeyIssuanceResult.Rejection) result;
        assertEquals(RejectionReason.EAVESDROPPER_DETECTED, rejected.getReason());
        assertEquals(LinkStatus.RED, rejected.getStatus());
        assertTrue(rejected.getQber() > 0.11);

        LinkHealthSnapshot health = keyManager.checkLinkHealth();
        assertEquals(LinkStatus.RED, health.getStatus());
        assertEquals(1, health.getAttacksDetected());
        assertEquals(0, health.getKeysIssued());
        assertTrue(keyManager.findSession("Alpha").isEmpty());
    }

    @Test
    void scenarioC_resetAfterAttackRestoresBaseline() {
        keyManager.getFreshKey("Alpha", true);
        keyManager.forceAttack();

        keyManager.resetForDemo();
        LinkHealthSnapshot health = keyManager.checkLinkHealth();

        assertEquals(LinkStatus.GREEN, health.getStatus());
        assertEquals(0.0, health.getLastQber());
        assertEquals(0, health.getKeysIssued());
        assertEquals(0, health.getAttacksDetected());
        assertEquals(0, health.getActiveSessions());
        assertFalse(health.isAttackForced());
    }

    @Test
    void redRecoversOnNextSafeIssuance() {
        keyManager.getFreshKey("Alpha", true);
        assertEquals(LinkStatus.RED, keyManager.checkLinkHealth().getStatus());

        KeyIssuanceResult result = keyManager.getFreshKey("Alpha");
        assertTrue(result.isAccepted());
        assertEquals(LinkStatus.GREEN, keyManager.checkLinkHealth().getStatus());
    }

    @Test
    void secondDevice_receivesPairedKey() {
        KeyIssuanceResult.Success alpha = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha");
        KeyIssuanceResult.Success bravo = (KeyIssuanceResult.Success) keyManager.getFreshKey("Bravo");

        assertArrayEquals(alpha.getSessionKey(), bravo.getSessionKey());
        assertTrue(bravo.isPaired());
        assertEquals(alpha.getQber(), bravo.getQber());

        LinkHealthSnapshot health = keyManager.checkLinkHealth();
        assertEquals(2, health.getKeysIssued());
        assertEquals(2, health.getActiveSessions());

        SessionRecord bravoSession = keyManager.findSession("Bravo").orElseThrow();
        assertTrue(bravoSession.isPaired());
        assertArrayEquals(alpha.getSessionKey(), bravoSession.getSessionKey());
    }

    @Test
    void thirdDevice_getsFreshKey() {
        KeyIssuanceResult.Success alpha = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha");
        keyManager.getFreshKey("Bravo");
        KeyIssuanceResult.Success charlie = (KeyIssuanceResult.Success) keyManager.getFreshKey("Charlie");

        assertFalse(charlie.isPaired());
        assertFalse(Arrays.equals(alpha.getSessionKey(), charlie.getSessionKey()));
    }

    @Test
    void sameDeviceAgain_supersedesItsSession() {
        KeyIssuanceResult.Success first = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha");
        KeyIssuanceResult.Success second = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha");

        assertFalse(second.isPaired());
        assertFalse(Arrays.equals(first.getSessionKey(), second.getSessionKey()));
        assertArrayEquals(second.getSessionKey(), keyManager.findSession("Alpha").orElseThrow().getSessionKey());
        assertEquals(1, keyManager.checkLinkHealth().getActiveSessions());
        assertEquals(2, keyManager.checkLinkHealth().getKeysIssued());
    }

    @Test
    void rejectionClosesPairingSlot() {
        KeyIssuanceResult.Success alpha = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha");
        keyManager.getFreshKey("Mallory", true);

        KeyIssuanceResult.Success bravo = (KeyIssuanceResult.Success) keyManager.getFreshKey("Bravo");
        assertFalse(bravo.isPaired());
        assertFalse(Arrays.equals(alpha.getSessionKey(), bravo.getSessionKey()));
    }

    @Test
    void forcedAttack_staysUntilCleared() {
        keyManager.forceAttack();
        assertTrue(keyManager.isAttackForced());

        assertFalse(keyManager.getFreshKey("Alpha").isAccepted());
        assertFalse(keyManager.getFreshKey("Bravo").isAccepted());
        assertEquals(2, keyManager.checkLinkHealth().getAttacksDetected());

        keyManager.clearForcedAttack();
        assertTrue(keyManager.getFreshKey("Alpha").isAccepted());
        assertEquals(LinkStatus.GREEN, keyManager.checkLinkHealth().getStatus());
    }

    @Test
    void hybridKey_differsAndPairsOnlyWithHybrid() {
        KeyIssuanceResult.Success plain = (KeyIssuanceResult.Success) keyManager.getFreshKey("Alpha", false, false);
        KeyIssuanceResult.Success hybrid = (KeyIssuanceResult.Success) keyManager.getFreshKey("Bravo", false, true);

        assertTrue(hybrid.isHybrid());
        assertFalse(hybrid.isPaired());
        assertFalse(Arrays.equals(plain.getSessionKey(), hybrid.getSessionKey()));

        KeyIssuanceResult.Success hybridPeer = (KeyIssuanceResult.Success) keyManager.getFreshKey("Charlie", false, true);
        assertTrue(hybridPeer.isPaired());
        assertArrayEquals(hybrid.getSessionKey(), hybridPeer.getSessionKey());
    }

    @Test
    void invalidateSession_updatesCountAndClosesSlot() {
        keyManager.getFreshKey("Alpha");
        assertTrue(keyManager.invalidateSession("Alpha"));
        assertFalse(keyManager.invalidateSession("Alpha"));
        assertEquals(0, keyManager.checkLinkHealth().getActiveSessions());

        KeyIssuanceResult.Success bravo = (KeyIssuanceResult.Success) keyManager.getFreshKey("Bravo");
        assertFalse(bravo.isPaired());
    }

    @Test
    void blankDeviceId_isAConfigurationError() {
        assertThrows(QkdConfigurationException.class, () -> keyManager.getFreshKey(" "));
        assertThrows(QkdConfigurationException.class, () -> keyManager.getFreshKey(null));
    }

    @Test
    void insufficientKeyMaterial_isRejectedWithoutTouchingLinkHealth() {
        // 604 位时保留长度落在 256 附近，约一半的运行材料不足；不重试
        QkdProperties props = new QkdProperties();
        props.getSimulation().setBitCount(604);
        props.getSimulation().setMaxAttempts(1);
        KeyManager tight = TestKeyManagers.create(props);

        int insufficient = 0;
        for (int i = 0; i < 200; i++) {
            LinkHealthSnapshot before = tight.checkLinkHealth();
            KeyIssuanceResult result = tight.getFreshKey("Alpha");
            LinkHealthSnapshot after = tight.checkLinkHealth();

            if (result.isAccepted()) {
                assertEquals(before.getKeysIssued() + 1, after.getKeysIssued());
                continue;
            }
            insufficient++;
            KeyIssuanceResult.Rejection rejected = (KeyIssuanceResult.Rejection) result;
            assertEquals(RejectionReason.INSUFFICIENT_KEY_MATERIAL, rejected.getReason());
            assertEquals(before.getStatus(), rejected.getStatus());
            assertEquals(before.getStatus(), after.getStatus());
            assertEquals(before.getLastQber(), after.getLastQber());
            assertEquals(before.getKeysIssued(), after.getKeysIssued());
        }

        assertTrue(insufficient > 0);
        assertEquals(0, tight.checkLinkHealth().getAttacksDetected());
        assertEquals(LinkStatus.GREEN, tight.checkLinkHealth().getStatus());
    }

    @Test
    void unknownRandomAlgorithm_isAConfigurationError() {
        QkdProperties props = new QkdProperties();
        props.getRandom().setAlgorithm("NO-SUCH-PRNG");

        assertThrows(QkdConfigurationException.class, () -> new RandomSourceProvider(props));
    }
}
