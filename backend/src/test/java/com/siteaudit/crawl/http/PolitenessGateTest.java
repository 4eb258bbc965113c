package com.siteaudit.crawl.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PolitenessGateTest {

    @Test
    void spacesRequestsToTheSameHost() throws Exception {
        PolitenessGate gate = new PolitenessGate(Duration.ofMillis(150));

        long started = System.nanoTime();
        gate.awaitTurn("example.com");
        gate.awaitTurn("example.com");
        gate.awaitTurn("Example.COM");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(elapsedMs).isGreaterThanOrEqualTo(280);
    }

    @Test
    void hostsDoNotWaitForEachOther() throws Exception {
        PolitenessGate gate = new PolitenessGate(Duration.ofSeconds(5));

        long started = System.nanoTime();
        gate.awaitTurn("a.example.com");
        gate.awaitTurn("b.example.com");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(elapsedMs).isLessThan(1000);
    }

    @Test
    void backoffOnlyMovesNextSlotForward() {
        PolitenessGate gate = new PolitenessGate(Duration.ZERO);

        gate.extendBackoff("example.com", Duration.ofSeconds(30));
        Instant afterLongBackoff = gate.nextAllowedAt("example.com");
        gate.extendBackoff("example.com", Duration.ofSeconds(1));

        assertThat(afterLongBackoff).isAfter(Instant.now().plusSeconds(25));
        assertThat(gate.nextAllowedAt("example.com")).isEqualTo(afterLongBackoff);
    }
}
