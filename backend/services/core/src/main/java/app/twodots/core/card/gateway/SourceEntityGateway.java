package app.twodots.core.card.gateway;

import app.twodots.core.card.domain.dto.SourceEntityView;
import app.twodots.core.card.domain.entity.SourceEntity;
import app.twodots.core.card.domain.type.SourceEntityType;
import app.twodots.core.card.repository.CommunityRepository;
import app.twodots.core.card.repository.ConceptRepository;
import app.twodots.core.card.repository.DerivedArtifactRepository;
import app.twodots.core.card.repository.GrowthEventRepository;
import app.twodots.core.card.repository.MemoryUnitRepository;
import app.twodots.core.card.repository.ProactivePromptRepository;
import app.twodots.core.card.repository.UserProfileRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed read access to the tables a card can point at. Every call is a single
 * repository round-trip against the table that owns {@code type}.
 */
@Component
public class SourceEntityGateway {

    private final MemoryUnitRepository memoryUnitRepository;
    private final ConceptRepository conceptRepository;
    private final DerivedArtifactRepository derivedArtifactRepository;
    private final ProactivePromptRepository proactivePromptRepository;
    private final CommunityRepository communityRepository;
    private final GrowthEventRepository growthEventRepository;
    private final UserProfileRepository userProfileRepository;

    public SourceEntityGateway(MemoryUnitRepository memoryUnitRepository,
                               ConceptRepository conceptRepository,
                               DerivedArtifactRepository derivedArtifactRepository,
                               ProactivePromptRepository proactivePromptRepository,
                               CommunityRepository communityRepository,
                               GrowthEventRepository growthEventRepository,
                               UserProfileRepository userProfileRepository) {
        this.memoryUnitRepository = memoryUnitRepository;
        this.conceptRepository = conceptRepository;
        this.derivedArtifactRepository = derivedArtifactRepository;
        this.proactivePromptRepository = proactivePromptRepository;
        this.communityRepository = communityRepository;
        this.growthEventRepository = growthEventRepository;
        this.userProfileRepository = userProfileRepository;
    }

    public Optional<SourceEntityView> getById(SourceEntityType type, UUID entityId) {
        Objects.requireNonNull(type, "type");
        if (entityId == null) {
            return Optional.empty();
        }
        Optional<? extends SourceEntity> entity = switch (type) {
            case MEMORY_UNIT -> memoryUnitRepository.findById(entityId);
            case CONCEPT -> conceptRepository.findById(entityId);
            case DERIVED_ARTIFACT -> derivedArtifactRepository.findById(entityId);
            case PROACTIVE_PROMPT -> proactivePromptRepository.findById(entityId);
            case COMMUNITY -> communityRepository.findById(entityId);
            case GROWTH_EVENT -> growthEventRepository.findById(entityId);
            case USER -> userProfileRepository.findById(entityId);
        };
        return entity.map(e -> toView(type, e));
    }

    public List<SourceEntityView> getByIds(SourceEntityType type, Collection<UUID> entityIds) {
        Objects.requireNonNull(type, "type");
        if (entityIds == null || entityIds.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = entityIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return List.of();
        }

        List<? extends SourceEntity> entities = switch (type) {
            case MEMORY_UNIT -> memoryUnitRepository.findAllById(ids);
            case CONCEPT -> conceptRepository.findAllById(ids);
            case DERIVED_ARTIFACT -> derivedArtifactRepository.findAllById(ids);
            case PROACTIVE_PROMPT -> proactivePromptRepository.findAllById(ids);
            case COMMUNITY -> communityRepository.findAllById(ids);
            case GROWTH_EVENT -> growthEventRepository.findAllById(ids);
            case USER -> userProfileRepository.findAllById(ids);
        };
        return entities.stream()
                .map(e -> toView(type, e))
                .toList();
    }

    private static SourceEntityView toView(SourceEntityType type, SourceEntity entity) {
        return new SourceEntityView(type, entity.getEntityId(), entity.getTitle(), entity.getContent());
    }
}
