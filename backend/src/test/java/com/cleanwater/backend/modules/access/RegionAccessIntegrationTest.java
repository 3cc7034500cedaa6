package com.cleanwater.backend.modules.access;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.domain.Region;
import com.cleanwater.backend.support.AbstractPostgresIntegrationTest;
import com.cleanwater.backend.support.TestAccountFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class RegionAccessIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Passw0rdOk";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestAccountFactory testAccountFactory;

    private Region regionFive;
    private Hospital hospitalInFive;
    private Hospital hospitalInSeven;

    @BeforeEach
    void setUp() {
        regionFive = testAccountFactory.region("R5");
        Region regionSeven = testAccountFactory.region("R7");
        hospitalInFive = testAccountFactory.hospital("H50", regionFive);
        hospitalInSeven = testAccountFactory.hospital("H70", regionSeven);
        testAccountFactory.user("admin", PASSWORD, AccessRole.ADMIN, null, null);
    }

    @Test
    void regionAdminSeesOnlyOwnRegion() throws Exception {
        testAccountFactory.user("ra5", PASSWORD, AccessRole.REGION_ADMIN, regionFive, null);
        testAccountFactory.user("nurse5", PASSWORD, AccessRole.HOSPITAL_USER, null, hospitalInFive);
        testAccountFactory.user("nurse7", PASSWORD, AccessRole.HOSPITAL_USER, null, hospitalInSeven);
        String token = accessToken("ra5");

        mockMvc.perform(get("/api/region/users").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].username").value("ra5"))
                .andExpect(jsonPath("$[1].username").value("nurse5"));
        mockMvc.perform(get("/api/region/hospitals").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].code").value("H50"));
    }

    @Test
    void regionAdminCannotAssignUserFromAnotherRegion() throws Exception {
        testAccountFactory.user("ra5", PASSWORD, AccessRole.REGION_ADMIN, regionFive, null);
        long outsider = testAccountFactory.user("nurse7", PASSWORD, AccessRole.HOSPITAL_USER, null, hospitalInSeven).getId();

        mockMvc.perform(post("/api/region/users/{id}/assign-hospital", outsider)
                        .header("Authorization", "Bearer " + accessToken("ra5"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("hospitalId", hospitalInFive.getId()))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.user_outside_region"));
    }

    @Test
    void unassignedRegionAdminIsInvalidState() throws Exception {
        testAccountFactory.user("ra-none", PASSWORD, AccessRole.REGION_ADMIN, null, null);

        mockMvc.perform(get("/api/region/users").header("Authorization", "Bearer " + accessToken("ra-none")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("access.region_assignment_required"));
    }

    @Test
    void nonNumericIdentifiersAreMalformedRequests() throws Exception {
        String adminToken = accessToken("admin");

        mockMvc.perform(get("/api/admin/users").param("regionId", "x")
                        .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"));
        mockMvc.perform(put("/api/admin/users/{id}/role", "abc")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", 4))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_request"));
    }

    @Test
    void duplicateWhitelistEntryIsConflict() throws Exception {
        String adminToken = accessToken("admin");

        mockMvc.perform(post("/api/admin/allowed-emails")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "@hospital.org"))))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/admin/allowed-emails")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "@hospital.org"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("whitelist.duplicate_entry"));
    }

    private String accessToken(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", username, "password", PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .path("tokens").path("accessToken").asText();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
