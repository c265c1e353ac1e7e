package app.twodots.core.card.repository;

import app.twodots.core.card.domain.entity.DerivedArtifactEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DerivedArtifactRepository extends JpaRepository<DerivedArtifactEntity, UUID> {
}
