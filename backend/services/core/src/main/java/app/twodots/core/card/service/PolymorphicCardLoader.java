package app.twodots.core.card.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.SourceEntityView;
import app.twodots.core.card.domain.entity.CardEntity;
import app.twodots.core.card.domain.type.SourceEntityType;
import app.twodots.core.card.gateway.SourceEntityGateway;
import app.twodots.core.card.repository.CardRepository;
import app.twodots.core.config.CardCoreProps;
import app.twodots.core.config.CardExecutorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Turns card rows into {@link CardData} by joining each card against the table
 * its source entity lives in. Lookups are grouped by entity type, so a batch
 * costs one round-trip per distinct type regardless of how many cards it holds.
 */
@Service
public class PolymorphicCardLoader {

    public static final String UNTITLED = "Untitled";

    private static final Logger log = LoggerFactory.getLogger(PolymorphicCardLoader.class);

    private final SourceEntityGateway sourceEntityGateway;
    private final CardRepository cardRepository;
    private final Executor executor;
    private final Duration groupTimeout;

    public PolymorphicCardLoader(SourceEntityGateway sourceEntityGateway,
                                 CardRepository cardRepository,
                                 @Qualifier(CardExecutorConfig.ENTITY_GROUP_EXECUTOR) Executor executor,
                                 CardCoreProps props) {
        this.sourceEntityGateway = sourceEntityGateway;
        this.cardRepository = cardRepository;
        this.executor = executor;
        this.groupTimeout = props.loader().groupTimeout();
    }

    public List<CardData> loadEntityDataBatch(List<CardEntity> cards) {
        if (cards == null || cards.isEmpty()) {
            return List.of();
        }

        Map<SourceEntityType, Set<UUID>> idsByType = new LinkedHashMap<>();
        for (CardEntity card : cards) {
            SourceEntityType type = card.getSourceEntityType();
            if (type == null) {
                log.warn("Card {} has an unknown source entity type, using fallback title", card.getCardId());
                continue;
            }
            if (card.getSourceEntityId() == null) {
                continue;
            }
            idsByType.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(card.getSourceEntityId());
        }

        // groups are independent, start them all before waiting on any
        Map<SourceEntityType, CompletableFuture<List<SourceEntityView>>> pending = new LinkedHashMap<>();
        idsByType.forEach((type, ids) -> pending.put(type, fetchGroup(type, ids)));

        Map<EntityKey, SourceEntityView> entities = new HashMap<>();
        pending.forEach((type, future) -> {
            for (SourceEntityView view : awaitGroup(type, idsByType.get(type).size(), future)) {
                entities.put(new EntityKey(type, view.entityId()), view);
            }
        });

        return cards.stream()
                .map(card -> toCardData(card, entities.get(new EntityKey(card.getSourceEntityType(), card.getSourceEntityId()))))
                .toList();
    }

    public Optional<SourceEntityView> loadEntityData(SourceEntityType type, UUID entityId) {
        if (type == null) {
            log.warn("Unknown source entity type for entity {}", entityId);
            return Optional.empty();
        }
        try {
            return sourceEntityGateway.getById(type, entityId);
        } catch (RuntimeException ex) {
            log.warn("Loading {} {} failed: {}", type.label(), entityId, ex.getMessage());
            return Optional.empty();
        }
    }

    public Optional<CardData> getCardWithEntityData(UUID cardId) {
        if (cardId == null) {
            return Optional.empty();
        }
        return cardRepository.findById(cardId)
                .map(card -> toCardData(card,
                        loadEntityData(card.getSourceEntityType(), card.getSourceEntityId()).orElse(null)));
    }

    public CardData toCardData(CardEntity card, SourceEntityView entity) {
        String title = firstNonBlank(card.getCustomTitle(), entity == null ? null : entity.title());
        String content = firstNonBlank(card.getCustomContent(), entity == null ? null : entity.content());
        return new CardData(
                card.getCardId(),
                card.getUserId(),
                card.getType(),
                card.getSourceEntityId(),
                card.getSourceEntityType(),
                card.getStatus(),
                card.isFavorited(),
                card.getBackgroundImageUrl(),
                card.getCustomTitle(),
                card.getCustomContent(),
                card.getDisplayOrder(),
                title == null ? UNTITLED : title,
                content == null ? "" : content,
                card.getCreatedAt(),
                card.getUpdatedAt()
        );
    }

    private CompletableFuture<List<SourceEntityView>> fetchGroup(SourceEntityType type, Set<UUID> ids) {
        List<UUID> idList = List.copyOf(ids);
        return CompletableFuture
                .supplyAsync(() -> sourceEntityGateway.getByIds(type, idList), executor)
                .orTimeout(groupTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private List<SourceEntityView> awaitGroup(SourceEntityType type,
                                              int requested,
                                              CompletableFuture<List<SourceEntityView>> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Batch load of {} entities failed, {} lookups fall back: {} {}",
                    type.label(), requested, cause.getClass().getSimpleName(), cause.getMessage());
            return List.of();
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return null;
    }

    private record EntityKey(SourceEntityType type, UUID entityId) {
    }
}
