package com.queryroute.controller;

import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.catalog.SourceNotFoundException;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.etl.InvalidInstructionException;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.EtlQueryType;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.RouteConstraints;
import com.queryroute.model.SourceDefinition;
import com.queryroute.model.TabularData;
import com.queryroute.service.EtlService;
import com.queryroute.service.MetadataDiscoveryService;
import com.queryroute.service.QueryRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.queryroute.model.TabularData.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryRouteController.class)
@DisplayName("QueryRouteController")
class QueryRouteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryRouter queryRouter;
    @MockBean
    private EtlService etlService;
    @MockBean
    private MetadataDiscoveryService discoveryService;
    @MockBean
    private SourceRegistry sourceRegistry;
    @MockBean
    private MetadataCatalog catalog;

    @Nested
    @DisplayName("POST /v1/route")
    class Route {

        @Test
        @DisplayName("passes the constraints through and returns the result")
        void routes() throws Exception {
            ExecutionResult result = ExecutionResult.success(
                    new TabularData(List.of("count"), List.of(row("count", 3))), "SELECT COUNT(*) FROM orders");
            when(queryRouter.route(eq("how many orders"), eq("shop"), any())).thenReturn(result);

            mockMvc.perform(post("/v1/route")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"request\":\"how many orders\",\"source_id\":\"shop\","
                                    + "\"explicit_tables\":[\"orders\"],\"max_tables\":2,\"allow_batching\":false}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.query_sql").value("SELECT COUNT(*) FROM orders"));

            ArgumentCaptor<RouteConstraints> constraints = ArgumentCaptor.forClass(RouteConstraints.class);
            verify(queryRouter).route(eq("how many orders"), eq("shop"), constraints.capture());
            assertThat(constraints.getValue().getExplicitTables()).containsExactly("orders");
            assertThat(constraints.getValue().getMaxTables()).isEqualTo(2);
            assertThat(constraints.getValue().isAllowBatching()).isFalse();
        }

        @Test
        @DisplayName("rejects a request without text")
        void validation() throws Exception {
            mockMvc.perform(post("/v1/route")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"source_id\":\"shop\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.details", containsString("request")));

            verifyNoInteractions(queryRouter);
        }

        @Test
        @DisplayName("maps an unknown source to 404")
        void unknownSource() throws Exception {
            when(queryRouter.route(anyString(), eq("nowhere"), any()))
                    .thenThrow(new SourceNotFoundException("nowhere"));

            mockMvc.perform(post("/v1/route")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"request\":\"list users\",\"source_id\":\"nowhere\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("SOURCE_NOT_FOUND"))
                    .andExpect(jsonPath("$.status").value(404))
                    .andExpect(jsonPath("$.message").value("Data source not found: nowhere"));
        }

        @Test
        @DisplayName("echoes the caller's request id")
        void traceId() throws Exception {
            when(queryRouter.route(anyString(), eq("nowhere"), any()))
                    .thenThrow(new SourceNotFoundException("nowhere"));

            mockMvc.perform(post("/v1/route")
                            .header("X-Request-Id", "req-42")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"request\":\"list users\",\"source_id\":\"nowhere\"}"))
                    .andExpect(header().string("X-Request-Id", "req-42"))
                    .andExpect(jsonPath("$.trace_id").value("req-42"));
        }
    }

    @Nested
    @DisplayName("ETL endpoints")
    class Etl {

        @Test
        @DisplayName("reports every problem of rejected instructions")
        void invalidInstructions() throws Exception {
            when(etlService.executeEtl(any(), eq("files"), isNull(), any()))
                    .thenThrow(new InvalidInstructionException("Invalid ETL instructions",
                            List.of("field 'price' not found in table sales")));

            mockMvc.perform(post("/v1/etl/execute")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"source_id\":\"files\",\"instructions\":{\"instruction_id\":\"statistic_1\","
                                    + "\"query_type\":\"aggregate\",\"table_name\":\"sales\",\"source_fields\":[\"price\"]}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_INSTRUCTIONS"))
                    .andExpect(jsonPath("$.status").value(400))
                    .andExpect(jsonPath("$.problems[0]").value("field 'price' not found in table sales"));
        }

        @Test
        @DisplayName("plans from the listed fields")
        void plan() throws Exception {
            EtlInstructions planned = EtlInstructions.builder()
                    .instructionId("statistic_1")
                    .queryType(EtlQueryType.AGGREGATE)
                    .tableName("sales")
                    .build();
            when(etlService.plan(any(), isNull(), eq(List.of("amount")), isNull())).thenReturn(List.of(planned));

            mockMvc.perform(post("/v1/etl/plan")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"requirements\":[{\"category\":\"statistic\",\"description\":\"total amount\"}],"
                                    + "\"available_fields\":[\"amount\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].instruction_id").value("statistic_1"))
                    .andExpect(jsonPath("$[0].query_type").value("aggregate"));
        }

        @Test
        @DisplayName("requires at least one requirement")
        void planNeedsRequirements() throws Exception {
            mockMvc.perform(post("/v1/etl/plan")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"requirements\":[],\"available_fields\":[\"amount\"]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        }
    }

    @Test
    @DisplayName("GET /v1/sources lists sources with their catalog size")
    void sources() throws Exception {
        SourceDefinition shop = new SourceDefinition();
        shop.setId("shop");
        shop.setType("postgres");
        shop.setDefaultTable("orders");
        shop.setPassword("secret");
        when(sourceRegistry.all()).thenReturn(List.of(shop));
        when(catalog.tables("shop")).thenReturn(List.of());

        mockMvc.perform(get("/v1/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("shop"))
                .andExpect(jsonPath("$[0].name").value("shop"))
                .andExpect(jsonPath("$[0].default_table").value("orders"))
                .andExpect(jsonPath("$[0].catalog_tables").value(0));
    }
}
