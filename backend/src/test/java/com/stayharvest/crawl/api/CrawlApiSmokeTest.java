package com.stayharvest.crawl.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void statsAndCursorAreReadable() throws Exception {
        mockMvc.perform(get("/api/crawl/cursor"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cursor").value(greaterThanOrEqualTo(0)));

        mockMvc.perform(get("/api/crawl/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stats.total").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.dataQuality.withPrice").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.runActive").value(false));
    }
}
