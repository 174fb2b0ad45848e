package io.hhplus.ticketing.infrastructure.persistence.ticket;

import io.hhplus.ticketing.domain.ticket.Ticket;
import io.hhplus.ticketing.domain.ticket.TicketPage;
import io.hhplus.ticketing.domain.ticket.TicketRepository;
import io.hhplus.ticketing.domain.ticket.TicketSearchCondition;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemory Ticket Repository
 *
 * 트랜잭션이 없으므로 단위 테스트(@Profile("inmemory")) 전용이다.
 */
@Repository
@Profile("inmemory")
public class InMemoryTicketRepository implements TicketRepository {

    private static final Comparator<Ticket> ISSUED_AT_DESC =
            Comparator.comparing(Ticket::getIssuedAt).thenComparing(Ticket::getId).reversed();

    private final Map<String, Ticket> storage = new ConcurrentHashMap<>();

    @Override
    public Ticket save(Ticket ticket) {
        // ID가 없으면 새로 생성 (신규 저장)
        if (ticket.getId() == null) {
            // Reflection으로 ID 설정 (JPA Entity는 setter가 없음)
            try {
                var idField = Ticket.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(ticket, UUID.randomUUID().toString());
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }

        storage.put(ticket.getId(), ticket);
        return ticket;
    }

    @Override
    public Optional<Ticket> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Ticket> findAllByIdInWithLock(Collection<String> ids) {
        return ids.stream()
                .distinct()
                .map(storage::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public TicketPage search(TicketSearchCondition condition, int limit, int offset) {
        List<Ticket> matched = storage.values().stream()
                .filter(ticket -> condition.theaterName() == null || condition.theaterName().equals(ticket.getTheaterName()))
                .filter(ticket -> condition.userId() == null || condition.userId().equals(ticket.getUserId()))
                .filter(ticket -> condition.movieTitle() == null || condition.movieTitle().equals(ticket.getMovieTitle()))
                .filter(ticket -> condition.status() == null || condition.status() == ticket.getStatus())
                .sorted(ISSUED_AT_DESC)
                .toList();

        List<Ticket> page = matched.stream()
                .skip(offset)
                .limit(limit)
                .toList();
        return new TicketPage(page, matched.size());
    }

    @Override
    public long count() {
        return storage.size();
    }

    public void clear() {
        storage.clear();
    }
}
