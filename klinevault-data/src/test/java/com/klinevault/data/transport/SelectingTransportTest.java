package com.klinevault.data.transport;

import com.klinevault.core.error.TransportException;
import com.klinevault.data.TestFixtures.FakeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.klinevault.data.TestFixtures.ok;
import static org.junit.jupiter.api.Assertions.*;

class SelectingTransportTest {

    private TransportRegistry registry;
    private FakeTransport alpha;
    private FakeTransport beta;

    @BeforeEach
    void setUp() {
        registry = new TransportRegistry(TransportSettings.defaults());
        alpha = new FakeTransport("alpha", request -> ok("alpha"));
        beta = new FakeTransport("beta", request -> ok("beta"));
        registry.register("alpha", alpha);
        registry.register("beta", beta);
    }

    private static TransportRequest request() {
        return TransportRequest.get("fake://klines");
    }

    @Nested
    @DisplayName("FAILOVER")
    class FailoverTests {

        @Test
        @DisplayName("Should stop at the first backend that answers")
        void firstAnswerWins() throws Exception {
            SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.FAILOVER, List.of("alpha", "beta"));

            assertEquals("alpha", selecting.request(request()).bodyAsString());
            assertTrue(beta.getRequests().isEmpty());
        }

        @Test
        @DisplayName("Should move to the next backend on a transport error")
        void movesOnAfterError() throws Exception {
            // Given
            alpha.setResponder(request -> {
                throw TransportException.timeout("alpha timed out");
            });
            SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.FAILOVER, List.of("alpha", "beta"));

            // When
            TransportResponse response = selecting.request(request());

            // Then
            assertEquals("beta", response.bodyAsString());
            assertEquals(1, alpha.getRequests().size());
        }

        @Test
        @DisplayName("Should propagate the last error when every backend fails")
        void propagatesLastError() {
            alpha.setResponder(request -> {
                throw TransportException.timeout("alpha");
            });
            beta.setResponder(request -> {
                throw new TransportException(TransportException.Kind.CONNECTION_FAILED, "beta");
            });
            SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.FAILOVER, List.of("alpha", "beta"));

            TransportException e = assertThrows(TransportException.class, () -> selecting.request(request()));
            assertEquals(TransportException.Kind.CONNECTION_FAILED, e.getKind());
            assertEquals("beta", e.getMessage());
        }
    }

    @Test
    @DisplayName("SINGLE always uses the first backend")
    void single() throws Exception {
        SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.SINGLE, List.of("beta", "alpha"));

        selecting.request(request());
        selecting.request(request());

        assertEquals(2, beta.getRequests().size());
        assertTrue(alpha.getRequests().isEmpty());
    }

    @Test
    @DisplayName("ROUND_ROBIN rotates one backend per call")
    void roundRobin() throws Exception {
        SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.ROUND_ROBIN, List.of("alpha", "beta"));

        assertEquals("alpha", selecting.request(request()).bodyAsString());
        assertEquals("beta", selecting.request(request()).bodyAsString());
        assertEquals("alpha", selecting.request(request()).bodyAsString());
    }

    @Test
    @DisplayName("RANDOM only picks listed backends")
    void random() throws Exception {
        SelectingTransport selecting = new SelectingTransport(
            registry, SelectionStrategy.RANDOM, List.of("alpha", "beta"), new Random(42));

        for (int i = 0; i < 20; i++) {
            selecting.request(request());
        }

        assertEquals(20, alpha.getRequests().size() + beta.getRequests().size());
    }

    @Test
    @DisplayName("Backends added later take part in failover")
    void addBackend() throws Exception {
        alpha.setResponder(request -> {
            throw TransportException.timeout("down");
        });
        SelectingTransport selecting = new SelectingTransport(registry, SelectionStrategy.FAILOVER, List.of("alpha"));

        selecting.addBackend("beta");

        assertEquals("beta", selecting.request(request()).bodyAsString());
        assertEquals(List.of("alpha", "beta"), selecting.getBackendIds());
    }

    @Test
    @DisplayName("Should parse strategies from configuration")
    void parsesStrategy() {
        assertEquals(SelectionStrategy.ROUND_ROBIN, SelectionStrategy.fromConfig("round-robin"));
        assertEquals(SelectionStrategy.FAILOVER, SelectionStrategy.fromConfig(null));
        assertThrows(IllegalArgumentException.class, () -> SelectionStrategy.fromConfig("fastest"));
    }
}
