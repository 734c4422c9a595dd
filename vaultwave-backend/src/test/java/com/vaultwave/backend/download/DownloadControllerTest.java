package com.vaultwave.backend.download;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultwave.backend.auth.CustomUserDetails;
import com.vaultwave.backend.catalog.Product;
import com.vaultwave.backend.storage.FakeStorageService;
import com.vaultwave.backend.user.User;
import com.vaultwave.backend.util.TestDataFactory;
import com.vaultwave.backend.util.ZipUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class DownloadControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private TestDataFactory data;
    @Autowired private FakeStorageService storage;

    private User listener;

    @BeforeEach
    void setUp() {
        data.wipe();
        storage.clear();
        listener = data.user("listener@vaultwave.test");
    }

    private RequestPostProcessor as(User user) {
        CustomUserDetails principal = new CustomUserDetails(user);
        return SecurityMockMvcRequestPostProcessors.authentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }

    private MvcResult request(User user, Long releaseId, String format, int expectedStatus) throws Exception {
        return mockMvc.perform(post("/api/releases/" + releaseId + "/request-download").with(as(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"" + format + "\"}"))
                .andExpect(status().is(expectedStatus))
                .andReturn();
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode awaitTerminal(User user, long jobId) throws Exception {
        for (int i = 0; i < 100; i++) {
            JsonNode job = json(mockMvc.perform(get("/api/download-jobs/" + jobId).with(as(user)))
                    .andExpect(status().isOk())
                    .andReturn());
            String status = job.get("status").asText();
            if (!status.equals("PENDING") && !status.equals("PROCESSING")) {
                return job;
            }
            Thread.sleep(100);
        }
        fail("Download job " + jobId + " did not finish");
        return null;
    }

    @Test
    void paidReleaseThatIsNotOwnedIsForbidden() throws Exception {
        Product paid = data.paidProduct("Low Tide", "6.00", "USD");

        request(listener, paid.getRelease().getId(), "MP3_320", 403);
    }

    @Test
    void freeReleaseIsPackagedOnceAndServed() throws Exception {
        Product free = data.freeProduct("Field Notes");
        data.track(free.getRelease(), 1, "Morning", "tracks/morning.flac", "flac", null, true);
        data.track(free.getRelease(), 2, "Evening", "tracks/evening.mp3", "mp3", 128, false);
        storage.put("tracks/morning.flac", "flac-bytes".getBytes(StandardCharsets.UTF_8));
        storage.put("tracks/evening.mp3", "mp3-bytes".getBytes(StandardCharsets.UTF_8));
        Long releaseId = free.getRelease().getId();

        long jobId = json(request(listener, releaseId, "FLAC", 202)).get("id").asLong();
        long again = json(request(listener, releaseId, "FLAC", 200)).get("id").asLong();
        assertEquals(jobId, again);

        JsonNode done = awaitTerminal(listener, jobId);
        assertEquals("READY", done.get("status").asText());
        assertEquals(100, done.get("progressPercent").asInt());
        assertEquals("/api/download-jobs/" + jobId + "/artifact", done.get("artifactUrl").asText());

        MvcResult artifact = mockMvc.perform(get("/api/download-jobs/" + jobId + "/artifact").with(as(listener)))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/zip"))
                .andExpect(header().string("Content-Disposition", org.hamcrest.Matchers.containsString("Field_Notes_FLAC.zip")))
                .andReturn();
        List<String> entries = ZipUtils.listEntries(new ByteArrayInputStream(artifact.getResponse().getContentAsByteArray()));
        assertEquals(List.of("01_Morning.flac", "02_Evening.mp3"), entries);

        mockMvc.perform(get("/api/download-jobs").with(as(listener)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void releaseWithoutTracksEndsFailed() throws Exception {
        Product free = data.freeProduct("Silence");

        long jobId = json(request(listener, free.getRelease().getId(), "WAV", 202)).get("id").asLong();

        JsonNode done = awaitTerminal(listener, jobId);
        assertEquals("FAILED", done.get("status").asText());
        assertEquals(DownloadPackagingWorker.NO_TRACKS_REASON, done.get("failureReason").asText());

        mockMvc.perform(get("/api/download-jobs/" + jobId + "/artifact").with(as(listener)))
                .andExpect(status().isConflict());

        // a failed job does not block a fresh request
        long retry = json(request(listener, free.getRelease().getId(), "WAV", 202)).get("id").asLong();
        assertNotEquals(jobId, retry);
        awaitTerminal(listener, retry);
    }

    @Test
    void otherUsersCannotSeeAJob() throws Exception {
        Product free = data.freeProduct("Field Notes");
        User other = data.user("other@vaultwave.test");

        long jobId = json(request(listener, free.getRelease().getId(), "MP3_192", 202)).get("id").asLong();
        awaitTerminal(listener, jobId);

        mockMvc.perform(get("/api/download-jobs/" + jobId).with(as(other)))
                .andExpect(status().isForbidden());
    }

    @Test
    void unknownFormatIsABadRequest() throws Exception {
        Product free = data.freeProduct("Field Notes");

        request(listener, free.getRelease().getId(), "OGG", 400);
    }
}
