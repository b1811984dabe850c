package org.vellaric.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.vellaric.dto.DatabaseCredentials;
import org.vellaric.dto.DatabaseStats;
import org.vellaric.dto.enums.DatabaseStatus;
import org.vellaric.exception.DatabaseNotFoundException;
import org.vellaric.exception.DuplicateDatabaseException;
import org.vellaric.service.DatabaseManagerService;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DatabaseControllerTest {

    @Mock
    private DatabaseManagerService databaseManagerService;

    @InjectMocks
    private DatabaseController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void createReturnsCredentials() throws Exception {
        DatabaseCredentials credentials = new DatabaseCredentials();
        credentials.setId("db-1");
        credentials.setName("orders");
        credentials.setStatus(DatabaseStatus.ACTIVE);
        credentials.setPassword("Abc123Abc123Abc123Abc123");
        when(databaseManagerService.createInstance("orders", "staging")).thenReturn(credentials);

        mockMvc.perform(post("/api/databases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"orders\",\"environment\":\"staging\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.password").value("Abc123Abc123Abc123Abc123"))
            .andExpect(jsonPath("$.data.status").value("active"));
    }

    @Test
    void duplicateIsConflict() throws Exception {
        when(databaseManagerService.createInstance("orders", "production"))
            .thenThrow(new DuplicateDatabaseException("orders", "production"));

        mockMvc.perform(post("/api/databases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"orders\",\"environment\":\"production\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value(DuplicateDatabaseException.ERROR_CODE));
    }

    @Test
    void statsForUnknownDatabaseIsNotFound() throws Exception {
        when(databaseManagerService.stats("db-missing")).thenThrow(new DatabaseNotFoundException("db-missing"));

        mockMvc.perform(get("/api/databases/db-missing/stats"))
            .andExpect(status().isNotFound());
    }

    @Test
    void statsForStoppedDatabase() throws Exception {
        when(databaseManagerService.stats("db-1")).thenReturn(DatabaseStats.stopped());

        mockMvc.perform(get("/api/databases/db-1/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("stopped"));
    }

    @Test
    void deleteKeepsStorageByDefault() throws Exception {
        mockMvc.perform(delete("/api/databases/db-1"))
            .andExpect(status().isOk());

        verify(databaseManagerService).deleteDatabase("db-1", false);
    }

    @Test
    void deleteWithPurge() throws Exception {
        mockMvc.perform(delete("/api/databases/db-1").param("purgeStorage", "true"))
            .andExpect(status().isOk());

        verify(databaseManagerService).deleteDatabase("db-1", true);
    }
}
