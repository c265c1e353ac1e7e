package app.twodots.core.card.repository;

import app.twodots.core.card.domain.entity.CardEntity;
import app.twodots.core.card.domain.type.SourceEntityType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    // Each card joins at most one source table, selected by its stored type label.
    String SOURCE_JOINS = """
            from app_core.cards c
            left join app_core.memory_units mu
                on c.source_entity_type = 'MemoryUnit' and mu.entity_id = c.source_entity_id
            left join app_core.concepts co
                on c.source_entity_type = 'Concept' and co.entity_id = c.source_entity_id
            left join app_core.derived_artifacts da
                on c.source_entity_type = 'DerivedArtifact' and da.entity_id = c.source_entity_id
            left join app_core.proactive_prompts pp
                on c.source_entity_type = 'ProactivePrompt' and pp.entity_id = c.source_entity_id
            left join app_core.communities cm
                on c.source_entity_type = 'Community' and cm.entity_id = c.source_entity_id
            left join app_core.growth_events ge
                on c.source_entity_type = 'GrowthEvent' and ge.entity_id = c.source_entity_id
            left join app_core.users u
                on c.source_entity_type = 'User' and u.user_id = c.source_entity_id
            """;

    String RESOLVED_TITLE = """
            coalesce(nullif(btrim(c.custom_title), ''),
                     nullif(btrim(mu.title), ''), nullif(btrim(co.title), ''), nullif(btrim(da.title), ''),
                     nullif(btrim(pp.title), ''), nullif(btrim(cm.title), ''), nullif(btrim(ge.title), ''),
                     nullif(btrim(u.name), ''), nullif(btrim(u.email), ''), 'Untitled')""";

    String RESOLVED_CONTENT = """
            coalesce(nullif(btrim(c.custom_content), ''),
                     nullif(btrim(mu.content), ''), nullif(btrim(co.content), ''), nullif(btrim(da.content), ''),
                     nullif(btrim(pp.content), ''), nullif(btrim(cm.content), ''), nullif(btrim(ge.content), ''),
                     nullif(btrim(u.profile_summary), ''), '')""";

    // Cards whose source entity was archived drop out of search; orphans stay findable by their overrides.
    String SOURCE_ACTIVE = """
            coalesce(mu.status, co.status, da.status, pp.status, cm.status, ge.status,
                     u.account_status, 'active') = 'active'""";

    String TYPE_FILTER = """
            where c.user_id = :userId
              and (cast(:cardType as text) is null or c.card_type = cast(:cardType as text))
            """;

    Optional<CardEntity> findByCardIdAndUserId(UUID cardId, UUID userId);

    List<CardEntity> findByUserIdAndSourceEntityTypeAndCardIdNotOrderByUpdatedAtDesc(
            UUID userId,
            SourceEntityType sourceEntityType,
            UUID cardId,
            Pageable pageable
    );

    @Query("select c.cardId from CardEntity c where c.userId = :userId order by c.createdAt desc")
    List<UUID> findAllCardIds(@Param("userId") UUID userId);

    /**
     * One page of a user's cards ordered by {@code sortKey}, one of
     * {@code CREATED_AT_ASC}, {@code CREATED_AT_DESC}, {@code TITLE_ASC}, {@code TITLE_DESC}.
     * Title ordering uses the resolved title, so custom overrides and entity titles sort together.
     */
    @Query(value = "select c.* " + SOURCE_JOINS + TYPE_FILTER + """
            order by
                case when :coverFirst = true and c.background_image_url is not null then 0 else 1 end,
                case when :sortKey = 'TITLE_ASC' then lower(""" + RESOLVED_TITLE + """
            ) end asc,
                case when :sortKey = 'TITLE_DESC' then lower(""" + RESOLVED_TITLE + """
            ) end desc,
                case when :sortKey = 'CREATED_AT_ASC' then c.created_at end asc,
                case when :sortKey = 'CREATED_AT_DESC' then c.created_at end desc,
                c.card_id asc
            limit :limit offset :offset
            """, nativeQuery = true)
    List<CardEntity> listUserCards(@Param("userId") UUID userId,
                                   @Param("cardType") String cardType,
                                   @Param("sortKey") String sortKey,
                                   @Param("coverFirst") boolean coverFirst,
                                   @Param("limit") int limit,
                                   @Param("offset") int offset);

    @Query(value = "select count(*) from app_core.cards c " + TYPE_FILTER, nativeQuery = true)
    long countUserCards(@Param("userId") UUID userId, @Param("cardType") String cardType);

    /**
     * Active canvas cards whose resolved title or content matches {@code pattern}
     * (an ILIKE pattern) and whose source entity, if any, is still active.
     * Title hits rank first, then newest.
     */
    @Query(value = "select c.* " + SOURCE_JOINS + """
            where c.user_id = :userId
              and c.status = 'ACTIVE_CANVAS'
              and """ + SOURCE_ACTIVE + """
              and (""" + RESOLVED_TITLE + " ilike :pattern or " + RESOLVED_CONTENT + """
             ilike :pattern)
            order by
                case when """ + RESOLVED_TITLE + """
             ilike :pattern then 1 else 2 end,
                c.created_at desc,
                c.card_id asc
            limit :limit
            """, nativeQuery = true)
    List<CardEntity> searchActiveCards(@Param("userId") UUID userId,
                                       @Param("pattern") String pattern,
                                       @Param("limit") int limit);
}
