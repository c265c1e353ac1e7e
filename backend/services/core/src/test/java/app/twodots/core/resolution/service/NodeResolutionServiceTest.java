package app.twodots.core.resolution.service;

import app.twodots.core.config.CardCoreProps;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.NodeReference;
import app.twodots.core.resolution.strategy.DirectIdMatchStrategy;
import app.twodots.core.resolution.strategy.TitleMatchStrategy;
import app.twodots.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static app.twodots.core.support.CardFixtures.cardData;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NodeResolutionServiceTest {

    @Mock
    CardLookupPort lookup;

    NodeResolutionService service;

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        CardCoreProps props = new CardCoreProps(null, null, null, null);
        service = new NodeResolutionService(
                List.of(new DirectIdMatchStrategy(lookup), new TitleMatchStrategy(lookup, props)),
                lookup,
                Runnable::run,
                props,
                clock
        );
    }

    @Test
    void cachesAreKeptPerUser() {
        UUID cardId = UUID.randomUUID();
        when(lookup.searchCards(alice, "Goals", 10)).thenReturn(List.of(cardData(cardId, "Goals", "")));

        assertThat(service.mapNode(alice, NodeReference.of("n1", "Goals", null))).isPresent();

        assertThat(service.cacheStats(alice).keys()).containsExactly("n1");
        assertThat(service.cacheStats(bob).size()).isZero();
    }

    @Test
    void clearCacheOnlyAffectsThatUser() {
        when(lookup.searchCards(alice, "Goals", 10)).thenReturn(List.of(cardData(UUID.randomUUID(), "Goals", "")));
        when(lookup.searchCards(bob, "Goals", 10)).thenReturn(List.of(cardData(UUID.randomUUID(), "Goals", "")));
        service.mapNode(alice, NodeReference.of("n1", "Goals", null));
        service.mapNode(bob, NodeReference.of("n1", "Goals", null));

        service.clearCache(alice);

        assertThat(service.cacheStats(alice).size()).isZero();
        assertThat(service.cacheStats(bob).size()).isEqualTo(1);
    }

    @Test
    void resolveNodeRethrowsResolutionFailureUnwrapped() {
        UUID cardId = UUID.randomUUID();
        when(lookup.findCard(alice, cardId)).thenThrow(new IllegalStateException("broken"));

        assertThatThrownBy(() -> service.resolveNode(alice, NodeReference.of(cardId.toString(), null, null)))
                .isInstanceOf(NodeResolutionException.class);
    }

    @Test
    void idleUsersAreDroppedWhileActiveOnesStay() {
        when(lookup.searchCards(alice, "Goals", 10)).thenReturn(List.of(cardData(UUID.randomUUID(), "Goals", "")));
        UUID carol = UUID.randomUUID();
        service.mapNode(alice, NodeReference.of("n1", "Goals", null));
        service.resolverFor(carol);

        clock.advance(Duration.ofMinutes(20));
        service.cacheStats(alice);
        clock.advance(Duration.ofMinutes(11));
        service.resolverFor(bob);

        // alice was used 11 minutes ago, carol 31
        assertThat(service.activeUsers()).isEqualTo(2);
        assertThat(service.cacheStats(carol).size()).isZero();
        assertThat(service.activeUsers()).isEqualTo(2);
    }

    @Test
    void unknownUserHasEmptyStats() {
        assertThat(service.cacheStats(UUID.randomUUID()).keys()).isEmpty();
        service.clearCache(UUID.randomUUID());
        assertThat(service.mapNode(bob, NodeReference.of("n9", null, null))).isEqualTo(Optional.empty());
    }
}
