package io.hhplus.ticketing.presentation.api.ticket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.ticketing.application.ticket.dto.IssueTicketRequest;
import io.hhplus.ticketing.application.ticket.dto.RefundTicketRequest;
import io.hhplus.ticketing.domain.idempotency.IdempotencyCache;
import io.hhplus.ticketing.infrastructure.persistence.ticket.JpaTicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TicketControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JpaTicketRepository jpaTicketRepository;

    @Autowired
    private IdempotencyCache idempotencyCache;

    @BeforeEach
    void setUp() {
        jpaTicketRepository.deleteAll();
        idempotencyCache.clear();
    }

    private IssueTicketRequest issueRequest(int quantity) {
        return new IssueTicketRequest("CGV 강남", "user-1", "파묘", 15000, quantity, null);
    }

    private JsonNode issue(IssueTicketRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/tickets/issue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("발권(3장) → 각각 조회 → 일괄 환불 → 각각 재조회")
    void roundTrip() throws Exception {
        // 발권
        JsonNode issued = issue(new IssueTicketRequest("CGV", "user-1", "X", 15000, 3, null));
        List<String> ticketIds = new ArrayList<>();
        issued.get("ticketIds").forEach(id -> ticketIds.add(id.asText()));
        assertThat(issued.get("count").asInt()).isEqualTo(3);
        assertThat(ticketIds).hasSize(3).doesNotHaveDuplicates();
        assertThat(issued.get("summary").get("theaterName").asText()).isEqualTo("CGV");
        assertThat(issued.get("summary").get("movieTitle").asText()).isEqualTo("X");
        assertThat(issued.get("summary").get("priceKrw").asInt()).isEqualTo(15000);

        // 조회
        for (String ticketId : ticketIds) {
            mockMvc.perform(get("/tickets/{ticketId}", ticketId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(ticketId))
                    .andExpect(jsonPath("$.theaterName").value("CGV"))
                    .andExpect(jsonPath("$.movieTitle").value("X"))
                    .andExpect(jsonPath("$.priceKrw").value(15000))
                    .andExpect(jsonPath("$.status").value("issued"))
                    .andExpect(jsonPath("$.canceledAt").doesNotExist())
                    .andExpect(jsonPath("$.createdAt").exists());
        }

        // 환불
        mockMvc.perform(post("/tickets/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RefundTicketRequest(ticketIds, "일정 변경"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refunded", hasSize(3)))
                .andExpect(jsonPath("$.refunded[0]").value(ticketIds.get(0)))
                .andExpect(jsonPath("$.refunded[1]").value(ticketIds.get(1)))
                .andExpect(jsonPath("$.refunded[2]").value(ticketIds.get(2)))
                .andExpect(jsonPath("$.alreadyCanceled", hasSize(0)))
                .andExpect(jsonPath("$.notFound", hasSize(0)));

        // 재조회
        for (String ticketId : ticketIds) {
            mockMvc.perform(get("/tickets/{ticketId}", ticketId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("canceled"))
                    .andExpect(jsonPath("$.canceledAt").exists())
                    .andExpect(jsonPath("$.cancelReason").value("일정 변경"));
        }
    }

    @Test
    @DisplayName("멱등 재전송 - 첫 요청 201, 같은 키 재요청 200 + 같은 본문, 티켓 수 그대로")
    void idempotentReplay() throws Exception {
        // given
        String idempotencyKey = "issue-" + UUID.randomUUID();
        String body = objectMapper.writeValueAsString(issueRequest(2));

        // when
        String first = mockMvc.perform(post("/tickets/issue")
                        .header(TicketController.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(post("/tickets/issue")
                        .header(TicketController.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        // then
        assertThat(objectMapper.readTree(second)).isEqualTo(objectMapper.readTree(first));
        assertThat(jpaTicketRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("멱등 충돌 - 같은 키 + 다른 본문은 409 I001")
    void idempotencyConflict() throws Exception {
        // given
        String idempotencyKey = "issue-" + UUID.randomUUID();
        mockMvc.perform(post("/tickets/issue")
                        .header(TicketController.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(issueRequest(1))))
                .andExpect(status().isCreated());

        // when & then
        mockMvc.perform(post("/tickets/issue")
                        .header(TicketController.IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(issueRequest(3))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("I001"));

        assertThat(jpaTicketRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("경계값 위반 - 수량 11, 가격 0, 가격 1,000,001은 400이고 아무것도 저장되지 않는다")
    void boundaryRejections() throws Exception {
        List<IssueTicketRequest> invalidRequests = List.of(
                new IssueTicketRequest("CGV 강남", "user-1", "파묘", 15000, 11, null),
                new IssueTicketRequest("CGV 강남", "user-1", "파묘", 0, 1, null),
                new IssueTicketRequest("CGV 강남", "user-1", "파묘", 1_000_001, 1, null),
                new IssueTicketRequest(" ", "user-1", "파묘", 15000, 1, null)
        );

        for (IssueTicketRequest request : invalidRequests) {
            mockMvc.perform(post("/tickets/issue")
                            .header(TicketController.IDEMPOTENCY_KEY_HEADER, "boundary-key")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("COMMON002"));
        }

        assertThat(jpaTicketRepository.count()).isZero();
        assertThat(idempotencyCache.find("boundary-key")).isEmpty();
    }

    @Test
    @DisplayName("잘못된 JSON 본문 - 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/tickets/issue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"theaterName\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON002"));
    }

    @Test
    @DisplayName("환불 - 빈 ID 목록은 400")
    void refund_emptyIds() throws Exception {
        mockMvc.perform(post("/tickets/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ticketIds\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON002"));
    }

    @Test
    @DisplayName("환불 - 발권/취소/미존재/중복 ID 분류")
    void refund_classification() throws Exception {
        // given
        JsonNode issued = issue(issueRequest(2));
        String first = issued.get("ticketIds").get(0).asText();
        String second = issued.get("ticketIds").get(1).asText();
        mockMvc.perform(post("/tickets/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new RefundTicketRequest(List.of(second), null))))
                .andExpect(status().isOk());

        // when & then
        mockMvc.perform(post("/tickets/refund")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new RefundTicketRequest(List.of(first, second, "no-such-ticket", first), null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refunded", hasSize(1)))
                .andExpect(jsonPath("$.refunded[0]").value(first))
                .andExpect(jsonPath("$.alreadyCanceled", hasSize(2)))
                .andExpect(jsonPath("$.notFound[0]").value("no-such-ticket"));
    }

    @Test
    @DisplayName("단건 조회 - 없는 티켓은 404 T001")
    void getTicket_notFound() throws Exception {
        mockMvc.perform(get("/tickets/{ticketId}", UUID.randomUUID().toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("T001"));
    }

    @Test
    @DisplayName("목록 조회 - 15건을 10 + 5로 페이징하면 겹침 없음")
    void listTickets_pagination() throws Exception {
        // given
        for (int i = 0; i < 15; i++) {
            issue(new IssueTicketRequest("CGV 강남", "user-" + i, "파묘", 15000, 1, null));
        }

        // when
        JsonNode firstPage = objectMapper.readTree(mockMvc.perform(get("/tickets")
                        .param("limit", "10")
                        .param("offset", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(15))
                .andExpect(jsonPath("$.tickets", hasSize(10)))
                .andReturn().getResponse().getContentAsString());
        JsonNode secondPage = objectMapper.readTree(mockMvc.perform(get("/tickets")
                        .param("limit", "10")
                        .param("offset", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tickets", hasSize(5)))
                .andExpect(jsonPath("$.limit").value(10))
                .andExpect(jsonPath("$.offset").value(10))
                .andReturn().getResponse().getContentAsString());

        // then
        List<String> ids = new ArrayList<>();
        firstPage.get("tickets").forEach(ticket -> ids.add(ticket.get("id").asText()));
        secondPage.get("tickets").forEach(ticket -> ids.add(ticket.get("id").asText()));
        Set<String> unique = new HashSet<>(ids);
        assertThat(ids).hasSize(15);
        assertThat(unique).hasSize(15);
    }

    @Test
    @DisplayName("목록 조회 - 상태 필터, 잘못된 상태와 페이징 값은 400")
    void listTickets_filtersAndValidation() throws Exception {
        // given
        issue(issueRequest(3));

        // when & then
        mockMvc.perform(get("/tickets").param("status", "issued").param("userId", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.limit").value(100))
                .andExpect(jsonPath("$.offset").value(0));
        mockMvc.perform(get("/tickets").param("status", "canceled"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        mockMvc.perform(get("/tickets").param("status", "refunded"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON002"));
        mockMvc.perform(get("/tickets").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/tickets").param("limit", "1001"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/tickets").param("offset", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/tickets").param("limit", "ten"))
                .andExpect(status().isBadRequest());
    }
}
