package app.twodots.core.card.domain.entity;

import java.util.UUID;

/**
 * Common read surface of every table a card can point at.
 */
public interface SourceEntity {

    UUID getEntityId();

    String getTitle();

    String getContent();
}
