package org.vellaric.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.vellaric.config.PortProperties;
import org.vellaric.exception.PortException;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class PortManagerServiceTest {

    private PortManagerService portManager;

    @BeforeEach
    void setUp() {
        portManager = new PortManagerService(new PortProperties());
    }

    @Test
    @DisplayName("concurrent allocations never return the same port")
    void concurrentAllocationsAreDistinct() throws Exception {
        int minPort = 42100;
        int maxPort = 42199;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                tasks.add(() -> portManager.allocate(minPort, maxPort));
            }
            Set<Integer> ports = new HashSet<>();
            for (Future<Integer> future : pool.invokeAll(tasks)) {
                int port = future.get();
                assertTrue(port >= minPort && port <= maxPort);
                assertTrue(ports.add(port), "port handed out twice: " + port);
            }
            assertEquals(40, portManager.getReservedPorts().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("a port bound by another process is skipped")
    void skipsBoundPort() throws Exception {
        try (ServerSocket occupied = new ServerSocket()) {
            occupied.bind(new InetSocketAddress(0));
            int busy = occupied.getLocalPort();

            int port = portManager.allocate(busy, Math.min(busy + 20, 65535));

            assertNotEquals(busy, port);
        }
    }

    @Test
    @DisplayName("released ports can be handed out again")
    void releaseMakesPortReusable() {
        PortManagerService stubbed = new PortManagerService(new PortProperties()) {
            @Override
            boolean isPortAvailable(int port) {
                return true;
            }
        };
        int first = stubbed.allocate(43000, 43000);
        stubbed.release(first);

        assertEquals(first, stubbed.allocate(43000, 43000));
    }

    @Test
    @DisplayName("an exhausted range fails with NO_AVAILABLE_PORT")
    void exhaustedRange() {
        PortManagerService stubbed = new PortManagerService(new PortProperties()) {
            @Override
            boolean isPortAvailable(int port) {
                return true;
            }
        };
        stubbed.allocate(43010, 43011);
        stubbed.allocate(43010, 43011);

        PortException e = assertThrows(PortException.class, () -> stubbed.allocate(43010, 43011));
        assertEquals(PortException.ERROR_CODE_NO_AVAILABLE_PORT, e.getErrorCode());
    }

    @Test
    void invalidRangeIsRejected() {
        PortException e = assertThrows(PortException.class, () -> portManager.allocate(5000, 4000));
        assertEquals(PortException.ERROR_CODE_INVALID_RANGE, e.getErrorCode());
    }

    @Test
    void releasingNullIsIgnored() {
        assertDoesNotThrow(() -> portManager.release(null));
    }
}
