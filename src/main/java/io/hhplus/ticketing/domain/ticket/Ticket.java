package io.hhplus.ticketing.domain.ticket;

import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;
import io.hhplus.ticketing.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
    name = "tickets",
    indexes = {
        @Index(name = "idx_ticket_issued_at", columnList = "issued_at"),
        @Index(name = "idx_ticket_theater_issued", columnList = "theater_name, issued_at"),
        @Index(name = "idx_ticket_user_issued", columnList = "user_id, issued_at"),
        @Index(name = "idx_ticket_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Ticket extends BaseTimeEntity {

    public static final int MAX_THEATER_NAME_LENGTH = 100;
    public static final int MAX_USER_ID_LENGTH = 100;
    public static final int MAX_MOVIE_TITLE_LENGTH = 200;
    public static final int MIN_PRICE_KRW = 1;
    public static final int MAX_PRICE_KRW = 1_000_000;
    public static final int MIN_QUANTITY = 1;
    public static final int MAX_QUANTITY = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;  // 랜덤 UUID 문자열

    @Column(name = "theater_name", nullable = false, length = MAX_THEATER_NAME_LENGTH)
    private String theaterName;

    @Column(name = "user_id", nullable = false, length = MAX_USER_ID_LENGTH)
    private String userId;

    @Column(name = "movie_title", nullable = false, length = MAX_MOVIE_TITLE_LENGTH)
    private String movieTitle;

    @Column(name = "price_krw", nullable = false)
    private Integer priceKrw;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketStatus status;

    @Column(columnDefinition = "TEXT")
    private String memo;

    @Column(name = "issued_at", nullable = false)
    private LocalDateTime issuedAt;

    @Column(name = "canceled_at")
    private LocalDateTime canceledAt;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    public static Ticket issue(String theaterName, String userId, String movieTitle,
                               Integer priceKrw, String memo, LocalDateTime issuedAt) {
        validateTicketFields(theaterName, userId, movieTitle, priceKrw);

        Ticket ticket = new Ticket();
        ticket.theaterName = theaterName;
        ticket.userId = userId;
        ticket.movieTitle = movieTitle;
        ticket.priceKrw = priceKrw;
        ticket.status = TicketStatus.ISSUED;
        ticket.memo = memo;
        ticket.issuedAt = issuedAt;
        ticket.canceledAt = null;  // 환불 시 설정
        return ticket;
    }

    /**
     * 환불 처리 (ISSUED → CANCELED)
     */
    public void cancel(LocalDateTime canceledAt, String reason) {
        if (this.status != TicketStatus.ISSUED) {
            throw new BusinessException(
                ErrorCode.INVALID_TICKET_STATUS,
                String.format("발권 상태인 티켓만 취소할 수 있습니다. ticketId: %s, 현재 상태: %s", id, status)
            );
        }

        this.status = TicketStatus.CANCELED;
        this.canceledAt = canceledAt;
        this.cancelReason = reason;
    }

    public boolean isIssued() {
        return this.status == TicketStatus.ISSUED;
    }

    public boolean isCanceled() {
        return this.status == TicketStatus.CANCELED;
    }

    // ====================================
    // Validation Methods
    // ====================================

    /**
     * 발권 요청 검증 (수량 포함). 티켓을 만들기 전에 호출한다.
     */
    public static void validateIssuable(String theaterName, String userId, String movieTitle,
                                        Integer priceKrw, Integer quantity) {
        validateTicketFields(theaterName, userId, movieTitle, priceKrw);
        validateQuantity(quantity);
    }

    private static void validateTicketFields(String theaterName, String userId,
                                             String movieTitle, Integer priceKrw) {
        validateText(theaterName, MAX_THEATER_NAME_LENGTH, "극장명");
        validateText(userId, MAX_USER_ID_LENGTH, "사용자 ID");
        validateText(movieTitle, MAX_MOVIE_TITLE_LENGTH, "영화명");
        validatePrice(priceKrw);
    }

    private static void validateText(String value, int maxLength, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                fieldName + "은(는) 필수입니다"
            );
        }
        if (value.length() > maxLength) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("%s은(는) %d자 이하여야 합니다", fieldName, maxLength)
            );
        }
    }

    private static void validatePrice(Integer priceKrw) {
        if (priceKrw == null || priceKrw < MIN_PRICE_KRW || priceKrw > MAX_PRICE_KRW) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("가격은 %d원 이상 %,d원 이하여야 합니다. 요청: %s", MIN_PRICE_KRW, MAX_PRICE_KRW, priceKrw)
            );
        }
    }

    private static void validateQuantity(Integer quantity) {
        if (quantity == null || quantity < MIN_QUANTITY || quantity > MAX_QUANTITY) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("수량은 %d개 이상 %d개 이하여야 합니다. 요청: %s", MIN_QUANTITY, MAX_QUANTITY, quantity)
            );
        }
    }
}
