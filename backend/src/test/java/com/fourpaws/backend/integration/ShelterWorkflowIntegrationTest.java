package com.fourpaws.backend.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fourpaws.backend.modules.animal.infrastructure.persistence.OutcomeRepository;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.domain.ShelterUser;
import com.fourpaws.backend.support.AbstractPostgresIntegrationTest;
import com.fourpaws.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ShelterWorkflowIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory userFactory;

    @Autowired
    private OutcomeRepository outcomeRepository;

    private ShelterUser admin;
    private String adminToken;

    @BeforeEach
    void setUp() {
        admin = userFactory.createUser("admin");
        adminToken = userFactory.bearer(admin);
    }

    @Test
    void adoptionRunsFromIntakeToOutcome() throws Exception {
        UUID orgId = createOrganization(adminToken, "paws-" + shortSuffix());

        UUID animalId = postForId(adminToken, "/organizations/" + orgId + "/animals", Map.of(
                "name", "Pepper",
                "species", "dog",
                "intakeType", "STRAY",
                "intakeDate", "2024-01-05"
        ));
        UUID personId = postForId(adminToken, "/organizations/" + orgId + "/people", Map.of(
                "type", "ADOPTER",
                "fullName", "Rowan Pike",
                "email", "rowan@example.org"
        ));
        UUID applicationId = postForId(adminToken, "/organizations/" + orgId + "/applications", Map.of(
                "animalId", animalId.toString(),
                "personId", personId.toString(),
                "kind", "ADOPTION",
                "form", Map.of("hasYard", true)
        ));

        String base = "/organizations/" + orgId + "/applications/" + applicationId;
        mockMvc.perform(post(base + "/review").header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REVIEW"));
        mockMvc.perform(post(base + "/approve").header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"notes\":\"home visit ok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));

        mockMvc.perform(post(base + "/adoption").header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("feeCents", 15000, "donationCents", 2500))))
                .andExpect(status().is2xxSuccessful());

        mockMvc.perform(get("/organizations/" + orgId + "/animals/" + animalId)
                        .header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ADOPTED"));
        mockMvc.perform(get(base).header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("COMPLETED"));
        mockMvc.perform(get("/organizations/" + orgId + "/audit-log")
                        .header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].action", hasItems(
                        "ANIMAL_STATUS_CHANGED", "OUTCOME_RECORDED", "ADOPTION_CREATED", "APPLICATION_FINALIZED")));

        assertThat(outcomeRepository.findByAnimal(animalId, orgId)).isPresent();

        mockMvc.perform(post(base + "/adoption").header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("feeCents", 15000))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_TERMINAL"));
    }

    @Test
    void animalOfAnotherOrganizationLooksMissing() throws Exception {
        UUID ownOrg = createOrganization(adminToken, "own-" + shortSuffix());
        ShelterUser other = userFactory.createUser("other-admin");
        String otherToken = userFactory.bearer(other);
        UUID otherOrg = createOrganization(otherToken, "other-" + shortSuffix());
        UUID foreignAnimal = postForId(otherToken, "/organizations/" + otherOrg + "/animals", Map.of(
                "name", "Mochi",
                "species", "cat",
                "intakeType", "OWNER_SURRENDER"
        ));

        mockMvc.perform(get("/organizations/" + ownOrg + "/animals/" + foreignAnimal)
                        .header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_ENTITY"));
    }

    @Test
    void nonMemberIsRejected() throws Exception {
        UUID orgId = createOrganization(adminToken, "closed-" + shortSuffix());
        ShelterUser outsider = userFactory.createUser("outsider");

        mockMvc.perform(get("/organizations/" + orgId + "/animals")
                        .header(HttpHeaders.AUTHORIZATION, userFactory.bearer(outsider)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));
    }

    @Test
    void volunteerCannotTransitionAnimals() throws Exception {
        UUID orgId = createOrganization(adminToken, "vol-" + shortSuffix());
        ShelterUser volunteer = userFactory.createUser("volunteer");
        userFactory.grant(volunteer, orgId, MembershipRole.VOLUNTEER);
        UUID animalId = postForId(adminToken, "/organizations/" + orgId + "/animals", Map.of(
                "name", "Tofu",
                "species", "rabbit",
                "intakeType", "STRAY"
        ));

        mockMvc.perform(post("/organizations/" + orgId + "/animals/" + animalId + "/transitions")
                        .header(HttpHeaders.AUTHORIZATION, userFactory.bearer(volunteer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"HOLD\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("PERMISSION_DENIED"));
    }

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/organizations/" + UUID.randomUUID() + "/animals"))
                .andExpect(status().isUnauthorized());
    }

    private UUID createOrganization(String token, String slug) throws Exception {
        MvcResult result = mockMvc.perform(post("/organizations")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Shelter " + slug, "slug", slug))))
                .andExpect(status().is2xxSuccessful())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("organizationId").asText());
    }

    private UUID postForId(String token, String path, Map<String, Object> payload) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(payload)))
                .andExpect(status().is2xxSuccessful())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    private String json(Object payload) throws Exception {
        return objectMapper.writeValueAsString(payload);
    }

    private static String shortSuffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
