package com.musicgroups.controller;

import com.musicgroups.service.SeedService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql(scripts = "/music-groups.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@Transactional
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@WithMockUser
class SeedApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SeedService seedService;

    @Test
    void reportsFixtureCounts() throws Exception {
        mockMvc.perform(get("/api/seed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nrSeededGroups").value(2))
            .andExpect(jsonPath("$.nrUnseededGroups").value(1));
    }

    @Test
    void replacesSeededGroups() throws Exception {
        mockMvc.perform(post("/api/seed").param("count", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nrSeededGroups").value(3))
            .andExpect(jsonPath("$.nrUnseededGroups").value(1));
    }

    @Test
    void negativeCountKeepsExistingSeeds() throws Exception {
        mockMvc.perform(post("/api/seed").param("count", "-1"))
            .andExpect(status().isBadRequest());

        assertThat(seedService.info().nrSeededGroups()).isEqualTo(2);
    }
}
