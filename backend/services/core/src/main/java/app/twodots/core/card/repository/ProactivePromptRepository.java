package app.twodots.core.card.repository;

import app.twodots.core.card.domain.entity.ProactivePromptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ProactivePromptRepository extends JpaRepository<ProactivePromptEntity, UUID> {
}
