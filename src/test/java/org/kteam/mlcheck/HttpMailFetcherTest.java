package org.kteam.mlcheck;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class HttpMailFetcherTest {

    @Test
    void validateStatus_shouldAcceptSuccess() {
        assertDoesNotThrow(() -> HttpMailFetcher.validateStatus(200, "https://example.com/a"));
        assertDoesNotThrow(() -> HttpMailFetcher.validateStatus(204, "https://example.com/a"));
    }

    @Test
    void validateStatus_shouldRejectErrors() {
        IOException e = assertThrows(IOException.class,
                () -> HttpMailFetcher.validateStatus(503, "https://example.com/a"));
        assertTrue(e.getMessage().contains("503"));
        assertThrows(IOException.class, () -> HttpMailFetcher.validateStatus(301, "https://example.com/a"));
    }
}
