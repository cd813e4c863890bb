package dev.enricher.repository;

import dev.enricher.entity.MetadataFieldPriority;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MetadataFieldPriorityRepository extends JpaRepository<MetadataFieldPriority, Long> {

    Optional<MetadataFieldPriority> findByFieldName(String fieldName);
}
