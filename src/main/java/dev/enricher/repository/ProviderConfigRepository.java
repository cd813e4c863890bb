package dev.enricher.repository;

import dev.enricher.entity.ProviderConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProviderConfigRepository extends JpaRepository<ProviderConfig, Long> {

    Optional<ProviderConfig> findByProviderName(String providerName);

    List<ProviderConfig> findByEnabledTrue();
}
