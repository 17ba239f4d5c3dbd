package com.planforge.api.controller;

import com.planforge.api.config.GenerationExecutorConfig;
import com.planforge.api.config.SecurityConfig;
import com.planforge.api.stream.GenerationStreamExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class)
@Import({SecurityConfig.class, GenerationExecutorConfig.class})
@TestPropertySource(properties = "planforge.generation.max-concurrent-streams=4")
class HealthControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private GenerationStreamExecutor streams;

    @MockBean
    private DataSource dataSource;

    @Test
    void healthIsPublic() throws Exception {
        mvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.service").value("planforge"));

        mvc.perform(get("/api/v1/health/ping"))
            .andExpect(status().isOk())
            .andExpect(content().string("pong"));
    }

    @Test
    void detailedHealthReportsDatabaseAndStreamSlots() throws Exception {
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);

        streams.tryAcquire();
        try {
            mvc.perform(get("/api/v1/health/detailed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.activeStreams").value(1))
                .andExpect(jsonPath("$.maxStreams").value(4));
        } finally {
            streams.release();
        }
    }

    @Test
    void unreachableDatabaseDegradesStatus() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        mvc.perform(get("/api/v1/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.database").value("DOWN"));
    }
}
