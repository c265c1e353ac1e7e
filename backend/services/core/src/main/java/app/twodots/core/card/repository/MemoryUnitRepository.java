package app.twodots.core.card.repository;

import app.twodots.core.card.domain.entity.MemoryUnitEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MemoryUnitRepository extends JpaRepository<MemoryUnitEntity, UUID> {
}
