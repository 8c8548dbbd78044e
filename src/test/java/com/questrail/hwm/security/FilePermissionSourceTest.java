package com.questrail.hwm.security;

import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilePermissionSourceTest {

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(FilePermissionSourceTest.class.getClassLoader().getResource("permissions/" + name).toURI());
    }

    @Test
    void readsEveryRecordInTheFile() throws Exception {
        List<UserPermissions> records = new FilePermissionSource(resource("permissions_valid.json")).load("test_user");

        assertEquals(2, records.size());

        UserPermissions first = records.get(0);
        assertEquals("test_user", first.userId());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), first.generatedAt());
        assertTrue(first.ignoreSessionProtections());
        assertEquals(new PermittedCommand("station_time", null, "system"), first.permittedCommands().get(0));
        assertEquals(PermittedCommand.device("get_time", "test_device3"), first.permittedCommands().get(1));

        UserPermissions second = records.get(1);
        assertEquals(Instant.ofEpochMilli(1_700_000_000_500L), second.generatedAt());
        assertFalse(second.ignoreSessionProtections());
    }

    @Test
    void wrongShapeIsRejected() throws Exception {
        FilePermissionSource source = new FilePermissionSource(resource("permissions_invalid_schema.json"));
        assertThrows(PermissionsInvalidSchemaException.class, () -> source.load("test_user"));
    }

    @Test
    void invalidJsonIsRejected() throws Exception {
        FilePermissionSource source = new FilePermissionSource(resource("permissions_malformed.json"));

        PermissionsException e = assertThrows(PermissionsException.class, () -> source.load("test_user"));
        assertTrue(e.getMessage().contains("invalid JSON"));
    }

    @Test
    void missingFileIsRejected(@org.junit.jupiter.api.io.TempDir Path dir) {
        FilePermissionSource source = new FilePermissionSource(dir.resolve("missing.json"));

        PermissionsException e = assertThrows(PermissionsException.class, () -> source.load("test_user"));
        assertFalse(e instanceof PermissionsInvalidSchemaException);
    }
}
