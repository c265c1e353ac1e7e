package app.twodots.core.card.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.entity.CardEntity;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.card.domain.request.CardSortField;
import app.twodots.core.card.repository.CardRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the card store. Every result leaves here hydrated through
 * {@link PolymorphicCardLoader}, so callers never see a bare card row.
 */
@Service
public class CardQueryService {

    public static final int MAX_SEARCH_LIMIT = 100;
    public static final int MAX_RELATED_LIMIT = 50;

    private final CardRepository cardRepository;
    private final PolymorphicCardLoader cardLoader;

    public CardQueryService(CardRepository cardRepository, PolymorphicCardLoader cardLoader) {
        this.cardRepository = cardRepository;
        this.cardLoader = cardLoader;
    }

    @Transactional(readOnly = true)
    public Optional<CardData> findById(UUID userId, UUID cardId) {
        if (cardId == null) {
            return Optional.empty();
        }
        return cardRepository.findByCardIdAndUserId(cardId, userId)
                .map(card -> cardLoader.loadEntityDataBatch(List.of(card)).get(0));
    }

    /**
     * Cards in the order their ids were given. Unknown ids and cards owned by
     * someone else are skipped.
     */
    @Transactional(readOnly = true)
    public List<CardData> findManyByIds(UUID userId, Collection<UUID> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = cardIds.stream().filter(Objects::nonNull).distinct().toList();
        Map<UUID, CardEntity> byId = cardRepository.findAllById(ids).stream()
                .filter(card -> card.getUserId().equals(userId))
                .collect(Collectors.toMap(CardEntity::getCardId, Function.identity()));

        List<CardEntity> ordered = ids.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .toList();
        return cardLoader.loadEntityDataBatch(ordered);
    }

    @Transactional(readOnly = true)
    public List<CardData> search(UUID userId, String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int safeLimit = Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT));
        String pattern = "%" + escapeLike(query.trim()) + "%";
        return cardLoader.loadEntityDataBatch(cardRepository.searchActiveCards(userId, pattern, safeLimit));
    }

    @Transactional(readOnly = true)
    public CardPage list(UUID userId, CardListQuery query) {
        String cardType = query.cardType() == null ? null : query.cardType().name();
        long total = cardRepository.countUserCards(userId, cardType);
        if (total == 0) {
            return CardPage.empty();
        }

        List<CardEntity> rows = cardRepository.listUserCards(
                userId,
                cardType,
                sortKey(query.sortField(), query.sortOrder()),
                query.coverFirst(),
                query.limit(),
                query.offset()
        );
        List<CardData> cards = cardLoader.loadEntityDataBatch(rows);
        return new CardPage(cards, total, query.offset() + cards.size() < total);
    }

    /**
     * Other cards of the same owner built from the same kind of source entity,
     * most recently touched first.
     */
    @Transactional(readOnly = true)
    public List<CardData> findRelated(UUID userId, UUID cardId, int limit) {
        Optional<CardEntity> anchor = cardRepository.findByCardIdAndUserId(cardId, userId);
        if (anchor.isEmpty() || anchor.get().getSourceEntityType() == null) {
            return List.of();
        }
        int safeLimit = Math.max(1, Math.min(limit, MAX_RELATED_LIMIT));
        List<CardEntity> related = cardRepository.findByUserIdAndSourceEntityTypeAndCardIdNotOrderByUpdatedAtDesc(
                userId,
                anchor.get().getSourceEntityType(),
                cardId,
                PageRequest.of(0, safeLimit)
        );
        return cardLoader.loadEntityDataBatch(related);
    }

    @Transactional(readOnly = true)
    public List<UUID> getAllCardIds(UUID userId) {
        return cardRepository.findAllCardIds(userId);
    }

    static String sortKey(CardSortField field, Sort.Direction direction) {
        String prefix = field == CardSortField.TITLE ? "TITLE" : "CREATED_AT";
        return prefix + (direction == Sort.Direction.ASC ? "_ASC" : "_DESC");
    }

    static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
