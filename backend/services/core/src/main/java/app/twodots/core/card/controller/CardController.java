package app.twodots.core.card.controller;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.card.domain.request.CardSortField;
import app.twodots.core.card.domain.request.CardsByIdsRequest;
import app.twodots.core.card.domain.type.CardType;
import app.twodots.core.card.service.CardQueryService;
import app.twodots.core.security.CurrentUserProvider;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/cards")
public class CardController {

    private final CurrentUserProvider currentUserProvider;
    private final CardQueryService cardQueryService;

    public CardController(CurrentUserProvider currentUserProvider, CardQueryService cardQueryService) {
        this.currentUserProvider = currentUserProvider;
        this.cardQueryService = cardQueryService;
    }

    // GET /cards?type=CONCEPT&limit=200&offset=0&sort_by=created_at&sort_order=desc&cover_first=false
    @GetMapping
    public CardPage listCards(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "200") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "sort_order", defaultValue = "desc") String sortOrder,
            @RequestParam(name = "cover_first", defaultValue = "false") boolean coverFirst
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        var query = new CardListQuery(
                limit,
                offset,
                CardSortField.fromString(sortBy),
                Sort.Direction.fromString(sortOrder),
                coverFirst,
                type == null || type.isBlank() ? null : CardType.fromString(type)
        );
        return cardQueryService.list(userId, query);
    }

    // GET /cards/search?q=...&limit=10
    @GetMapping("/search")
    public List<CardData> searchCards(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "10") int limit
    ) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        var userId = currentUserProvider.getUserId(jwt);
        return cardQueryService.search(userId, query, limit);
    }

    // GET /cards/ids
    @GetMapping("/ids")
    public List<UUID> getAllCardIds(@AuthenticationPrincipal Jwt jwt) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardQueryService.getAllCardIds(userId);
    }

    // GET /cards/{cardId}
    @GetMapping("/{cardId}")
    public CardData getCard(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID cardId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardQueryService.findById(userId, cardId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found"));
    }

    // GET /cards/{cardId}/related?limit=5
    @GetMapping("/{cardId}/related")
    public List<CardData> getRelatedCards(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID cardId,
            @RequestParam(defaultValue = "5") int limit
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return cardQueryService.findRelated(userId, cardId, limit);
    }

    // POST /cards/by-ids
    @PostMapping("/by-ids")
    public List<CardData> getCardsByIds(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody CardsByIdsRequest request
    ) {
        if (request == null || request.cardIds() == null || request.cardIds().isEmpty()) {
            throw new IllegalArgumentException("cardIds must not be empty");
        }
        var userId = currentUserProvider.getUserId(jwt);
        return cardQueryService.findManyByIds(userId, request.cardIds());
    }
}
