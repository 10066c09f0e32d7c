package com.appforge.sandbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class SandboxErrorClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {"401 Unauthorized", "Forbidden", "Status 404: No such image: sandbox:rust",
            "Invalid API key supplied", "quota exceeded for account"})
    void permanentMessages(String message) {
        assertTrue(SandboxErrorClassifier.isPermanent(new RuntimeException(message)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Read timed out", "503 Service Unavailable", "ECONNRESET",
            "Connection refused", "something odd happened"})
    void transientMessages(String message) {
        assertFalse(SandboxErrorClassifier.isPermanent(new RuntimeException(message)));
    }

    @Test
    void transientMarkerWinsOverPermanentOne() {
        assertFalse(SandboxErrorClassifier.isPermanent(new RuntimeException("404 page fetch timed out")));
    }

    @Test
    void causeChainIsInspected() {
        var wrapped = new RuntimeException("create failed", new IOException("401 unauthorized"));
        assertTrue(SandboxErrorClassifier.isPermanent(wrapped));
    }

    @Test
    void sandboxExceptionCarriesItsOwnClassification() {
        assertFalse(SandboxErrorClassifier.isPermanent(new SandboxException("401 but retry anyway", false)));
        assertTrue(SandboxErrorClassifier.isPermanent(new SandboxException("bad template", true)));
    }
}
