package dev.enricher.repository;

import dev.enricher.entity.AssetTypePriority;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AssetTypePriorityRepository extends JpaRepository<AssetTypePriority, Long> {

    Optional<AssetTypePriority> findByAssetType(String assetType);
}
