package club.ppmc.debugger.session;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.debugger.exception.DebugSessionException;
import club.ppmc.debugger.model.debug.MemoryBlock;
import org.junit.jupiter.api.Test;

class MemoryReaderTest {

    private final MemoryReader reader = new MemoryReader();

    @Test
    void onlyLatestRequestIsAccepted() {
        long first = reader.begin();
        long second = reader.begin();

        assertFalse(reader.accept(first, MemoryBlock.fromHex("0x10", "aa")));
        assertTrue(reader.accept(second, MemoryBlock.fromHex("0x20", "bb")));
        assertEquals("0x20", reader.lastBlock().orElseThrow().baseAddress());
    }

    @Test
    void invalidateExpiresInFlightRequest() {
        long request = reader.begin();
        reader.accept(request, MemoryBlock.fromHex("0x10", "aa"));
        long pending = reader.begin();

        reader.invalidate();

        assertFalse(reader.isCurrent(pending));
        assertTrue(reader.lastBlock().isEmpty());
    }

    @Test
    void validatesArguments() {
        assertDoesNotThrow(() -> MemoryReader.validate("&buf", 16, 64));
        assertThrows(DebugSessionException.class, () -> MemoryReader.validate(" ", 16, 64));
        assertThrows(DebugSessionException.class, () -> MemoryReader.validate("--help", 16, 64));
        assertThrows(DebugSessionException.class, () -> MemoryReader.validate("&buf", 0, 64));
        assertThrows(DebugSessionException.class, () -> MemoryReader.validate("&buf", 65, 64));
    }
}
