package com.tenantguard.workspace.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenantguard.quota.audit.AuditRecord;
import com.tenantguard.quota.audit.InMemoryAuditSink;
import com.tenantguard.workspace.infrastructure.web.CallerIdentityExtractor;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Document API")
class DocumentApiTest {

    private static final String SUBJECT = CallerIdentityExtractor.SUBJECT_HEADER;

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private InMemoryAuditSink auditSink;

    private String createContract(String subject, String title) throws Exception {
        String body = mockMvc.perform(post("/api/v1/contracts")
                        .header(SUBJECT, subject)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"" + title + "\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.get("id").asText();
    }

    @Nested
    @DisplayName("within the caller's tenant")
    class SameTenant {

        @Test
        @DisplayName("create stamps the caller's tenant over any supplied one")
        void createStampsTenant() throws Exception {
            mockMvc.perform(post("/api/v1/vendors")
                            .header(SUBJECT, "sub-user-a")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Acme\",\"tenantId\":\"tenant-b\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.kind").value("vendors"))
                    .andExpect(jsonPath("$.fields.name").value("Acme"))
                    .andExpect(jsonPath("$.fields.tenantId").value("tenant-a"));
        }

        @Test
        @DisplayName("read, update and delete a document")
        void lifecycle() throws Exception {
            String id = createContract("sub-owner-a", "MSA");

            mockMvc.perform(get("/api/v1/contracts/" + id).header(SUBJECT, "sub-viewer-a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.fields.title").value("MSA"));

            mockMvc.perform(patch("/api/v1/contracts/" + id)
                            .header(SUBJECT, "sub-user-a")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"MSA v2\",\"tenantId\":\"tenant-b\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.fields.title").value("MSA v2"))
                    .andExpect(jsonPath("$.fields.tenantId").value("tenant-a"));

            mockMvc.perform(delete("/api/v1/contracts/" + id).header(SUBJECT, "sub-owner-a"))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/contracts/" + id).header(SUBJECT, "sub-owner-a"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.reason").value("not_found"));
        }

        @Test
        @DisplayName("list returns only the caller's tenant")
        void listIsTenantScoped() throws Exception {
            createContract("sub-user-b", "Tenant B only");
            createContract("sub-user-a", "Tenant A visible");

            String body = mockMvc.perform(get("/api/v1/contracts").header(SUBJECT, "sub-user-a"))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();

            JsonNode list = objectMapper.readTree(body);
            assertThat(list).isNotEmpty();
            list.forEach(doc -> assertThat(doc.get("fields").get("tenantId").asText()).isEqualTo("tenant-a"));
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("a request without a subject is 401")
        void anonymous() throws Exception {
            mockMvc.perform(get("/api/v1/contracts"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.reason").value("unauthenticated"));
        }

        @Test
        @DisplayName("an unknown subject is 401")
        void unknownSubject() throws Exception {
            mockMvc.perform(get("/api/v1/contracts").header(SUBJECT, "sub-nobody"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("an inactive account is 403")
        void inactiveAccount() throws Exception {
            mockMvc.perform(get("/api/v1/contracts").header(SUBJECT, "sub-retired-a"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.reason").value("account_inactive"));
        }

        @Test
        @DisplayName("a viewer cannot create")
        void viewerCannotCreate() throws Exception {
            mockMvc.perform(post("/api/v1/contracts")
                            .header(SUBJECT, "sub-viewer-a")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"nope\"}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.reason").value("permission_denied"));
        }

        @Test
        @DisplayName("another tenant's document looks like it does not exist, but is audited as cross-tenant")
        void crossTenantIsNotFound() throws Exception {
            String foreignId = createContract("sub-user-b", "Tenant B secret");

            mockMvc.perform(get("/api/v1/contracts/" + foreignId).header(SUBJECT, "sub-user-a"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.reason").value("not_found"))
                    .andExpect(jsonPath("$.correlationId").exists());

            assertThat(auditSink.recordsFor("query.get.contracts"))
                    .filteredOn(r -> "user:user-a".equals(r.identity()))
                    .extracting(AuditRecord::metadata)
                    .anySatisfy(metadata -> {
                        assertThat(metadata).containsEntry("reason", "cross_tenant_access");
                        assertThat(metadata).containsEntry("ownerTenantId", "tenant-b");
                    });

            mockMvc.perform(get("/api/v1/contracts/" + foreignId).header(SUBJECT, "sub-user-b"))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("another tenant's document gets the same response body as a missing one")
        void crossTenantBodyMatchesMissing() throws Exception {
            String foreignId = createContract("sub-user-b", "Tenant B contract");
            String missingId = UUID.randomUUID().toString();

            String foreign = mockMvc.perform(get("/api/v1/contracts/" + foreignId).header(SUBJECT, "sub-user-a"))
                    .andExpect(status().isNotFound())
                    .andReturn().getResponse().getContentAsString();
            String missing = mockMvc.perform(get("/api/v1/contracts/" + missingId).header(SUBJECT, "sub-user-a"))
                    .andExpect(status().isNotFound())
                    .andReturn().getResponse().getContentAsString();

            assertThat(comparable(foreign, foreignId)).isEqualTo(comparable(missing, missingId));
        }

        private JsonNode comparable(String body, String id) throws Exception {
            ObjectNode json = (ObjectNode) objectMapper.readTree(body.replace(id, "ID"));
            json.remove(List.of("timestamp", "correlationId", "instance"));
            return json;
        }

        @Test
        @DisplayName("an unknown resource kind is 404 after the guard has run")
        void unknownKind() throws Exception {
            mockMvc.perform(get("/api/v1/invoices").header(SUBJECT, "sub-owner-a"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.reason").value("not_found"));

            assertThat(auditSink.recordsFor("query.list.unknown"))
                    .filteredOn(r -> "user:owner-a".equals(r.identity()))
                    .extracting(AuditRecord::metadata)
                    .anySatisfy(metadata -> assertThat(metadata).containsEntry("outcome", "NOT_FOUND"));

            mockMvc.perform(get("/api/v1/invoices"))
                    .andExpect(status().isUnauthorized());
        }
    }
}
