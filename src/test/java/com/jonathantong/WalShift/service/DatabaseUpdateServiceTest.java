package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.TrackedTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DatabaseUpdateServiceTest {

    private static final TrackedTable DEVICES = new TrackedTable("public", "devices", "ome");

    @Mock
    private JdbcTemplate targetJdbcTemplate;

    @InjectMocks
    private DatabaseUpdateService databaseUpdateService;

    @Test
    void upsert_shouldOverwriteNonKeyColumnsOnConflict() {
        // Arrange
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 1);
        data.put("device_name", "r750.local");
        data.put("health_status", "OK");

        String expectedSql = "INSERT INTO \"public\".\"devices\" (\"id\", \"device_name\", \"health_status\") "
                + "VALUES (?, ?, ?) ON CONFLICT (\"id\") DO UPDATE SET "
                + "\"device_name\" = EXCLUDED.\"device_name\", \"health_status\" = EXCLUDED.\"health_status\"";

        // Act
        databaseUpdateService.upsert(DEVICES, data);

        // Assert
        verify(targetJdbcTemplate, times(1)).update(expectedSql, 1, "r750.local", "OK");
    }

    @Test
    void upsert_withOnlyPrimaryKey_shouldDoNothingOnConflict() {
        // Arrange
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 9);

        String expectedSql = "INSERT INTO \"public\".\"devices\" (\"id\") VALUES (?) ON CONFLICT (\"id\") DO NOTHING";

        // Act
        databaseUpdateService.upsert(DEVICES, data);

        // Assert
        verify(targetJdbcTemplate, times(1)).update(expectedSql, 9);
    }

    @Test
    void upsert_shouldPassNullColumnValuesThrough() {
        // Arrange
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 2);
        data.put("model", null);

        String expectedSql = "INSERT INTO \"public\".\"devices\" (\"id\", \"model\") VALUES (?, ?) "
                + "ON CONFLICT (\"id\") DO UPDATE SET \"model\" = EXCLUDED.\"model\"";

        // Act
        databaseUpdateService.upsert(DEVICES, data);

        // Assert
        verify(targetJdbcTemplate).update(expectedSql, 2, null);
    }

    @Test
    void upsert_shouldRejectEmptyData() {
        assertThrows(IllegalArgumentException.class,
                () -> databaseUpdateService.upsert(DEVICES, new LinkedHashMap<>()));
        verifyNoInteractions(targetJdbcTemplate);
    }

    @Test
    void upsert_shouldWrapDatabaseFailures() {
        // Arrange
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 3);
        data.put("device_type_id", 999);
        String sql = "INSERT INTO \"public\".\"devices\" (\"id\", \"device_type_id\") VALUES (?, ?) "
                + "ON CONFLICT (\"id\") DO UPDATE SET \"device_type_id\" = EXCLUDED.\"device_type_id\"";
        when(targetJdbcTemplate.update(sql, 3, 999)).thenThrow(new DataIntegrityViolationException("fk violation"));

        // Act / Assert
        ReplicaWriteException e = assertThrows(ReplicaWriteException.class,
                () -> databaseUpdateService.upsert(DEVICES, data));
        assertEquals("Upsert failed for table public.devices", e.getMessage());
    }

    @Test
    void delete_shouldExecuteDeleteByPrimaryKey() {
        // Arrange
        String expectedSql = "DELETE FROM \"public\".\"devices\" WHERE \"id\" = ?";
        when(targetJdbcTemplate.update(expectedSql, 100)).thenReturn(1);

        // Act
        int rows = databaseUpdateService.delete(DEVICES, 100);

        // Assert
        assertEquals(1, rows);
        verify(targetJdbcTemplate, times(1)).update(expectedSql, 100);
    }

    @Test
    void delete_ofMissingRow_isNotAnError() {
        // Arrange
        String expectedSql = "DELETE FROM \"public\".\"devices\" WHERE \"id\" = ?";
        when(targetJdbcTemplate.update(expectedSql, 100)).thenReturn(0);

        // Act
        int rows = databaseUpdateService.delete(DEVICES, 100);

        // Assert
        assertEquals(0, rows);
    }

    @Test
    void quote_shouldEscapeEmbeddedQuotes() {
        assertEquals("\"we\"\"ird\"", DatabaseUpdateService.quote("we\"ird"));
    }
}
