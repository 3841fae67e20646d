package org.satmesh.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main Tests")
class MainTest {

    @Test
    @DisplayName("Default ring demo converges and prints every routing table")
    void testMainOutputsRoutingTables() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int status = Main.run(new String[0], new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(0, status);
        assertTrue(output.contains("ring of 5 nodes, k=3: converged"));
        assertTrue(output.contains("SAT-1" + System.lineSeparator()));
        assertTrue(output.contains("  -> SAT-3 via SAT-2 hops=2"));
        assertTrue(output.contains("  -> SAT-4 via SAT-5 hops=2"));
    }

    @Test
    @DisplayName("Horizon argument limits the printed routes")
    void testHorizonArgument() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int status = Main.run(new String[] {"4", "1"}, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(0, status);
        assertTrue(output.contains("ring of 4 nodes, k=1: converged"));
        assertFalse(output.contains("hops=2"));
    }

    @Test
    @DisplayName("Invalid arguments print usage")
    void testUsage() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        assertEquals(2, Main.run(new String[] {"many"}, out));
        assertEquals(2, Main.run(new String[] {"1"}, out));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("usage: Main"));
    }
}
