package dev.enricher.service;

import dev.enricher.config.ProvidersConfig;
import dev.enricher.entity.AssetTypePriority;
import dev.enricher.entity.MetadataFieldPriority;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.EntityType;
import dev.enricher.provider.ProviderCapabilities;
import dev.enricher.provider.ProviderRegistry;
import dev.enricher.repository.AssetTypePriorityRepository;
import dev.enricher.repository.MetadataFieldPriorityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Provider order per metadata field and per asset type. Without a user setting, the default
 * order applies, followed by any other capable provider in name order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldPriorityService {

    private final MetadataFieldPriorityRepository fieldRepository;
    private final AssetTypePriorityRepository assetTypeRepository;
    private final ProviderRegistry registry;
    private final ProvidersConfig providersConfig;
    private final Clock clock;

    public List<String> getMetadataFieldOrder(EntityType entityType, String field) {
        List<String> capable = registry.getProvidersForMetadataField(entityType, field);
        return fieldRepository.findByFieldName(field)
                .map(priority -> retain(priority.getProviderOrder(), capable))
                .orElseGet(() -> withDefaults(capable));
    }

    public List<String> getAssetTypeOrder(EntityType entityType, String assetType) {
        List<String> capable = registry.getProvidersForAssetType(entityType, assetType);
        return assetTypeRepository.findByAssetType(assetType)
                .map(priority -> retain(priority.getProviderOrder(), capable))
                .orElseGet(() -> withDefaults(capable));
    }

    @Transactional
    public MetadataFieldPriority setMetadataFieldOrder(String field, List<String> providerOrder) {
        validate(providerOrder, "field " + field, c -> c.metadataFields().values().stream()
                .anyMatch(fields -> fields.contains(field)));
        MetadataFieldPriority priority = fieldRepository.findByFieldName(field)
                .orElseGet(() -> MetadataFieldPriority.builder().fieldName(field).build());
        priority.setProviderOrder(new ArrayList<>(providerOrder));
        priority.setUpdatedAt(clock.instant());
        log.info("Provider order for field {}: {}", field, providerOrder);
        return fieldRepository.save(priority);
    }

    @Transactional
    public AssetTypePriority setAssetTypeOrder(String assetType, List<String> providerOrder) {
        validate(providerOrder, "asset type " + assetType, c -> c.supportsAssetType(assetType));
        AssetTypePriority priority = assetTypeRepository.findByAssetType(assetType)
                .orElseGet(() -> AssetTypePriority.builder().assetType(assetType).build());
        priority.setProviderOrder(new ArrayList<>(providerOrder));
        priority.setUpdatedAt(clock.instant());
        log.info("Provider order for asset type {}: {}", assetType, providerOrder);
        return assetTypeRepository.save(priority);
    }

    private void validate(List<String> providerOrder, String target, Predicate<ProviderCapabilities> capable) {
        if (providerOrder == null || providerOrder.isEmpty()) {
            throw new ValidationException("Provider order for " + target + " must not be empty");
        }
        if (new LinkedHashSet<>(providerOrder).size() != providerOrder.size()) {
            throw new ValidationException("Provider order for " + target + " contains duplicates");
        }
        for (String name : providerOrder) {
            ProviderCapabilities capabilities = registry.getCapabilities(name)
                    .orElseThrow(() -> new ValidationException("Unknown provider: " + name));
            if (!capable.test(capabilities)) {
                throw new ValidationException(name + " cannot supply " + target);
            }
        }
    }

    private List<String> withDefaults(List<String> capable) {
        Set<String> ordered = new LinkedHashSet<>(retain(providersConfig.getDefaultOrder(), capable));
        ordered.addAll(capable);
        return List.copyOf(ordered);
    }

    private static List<String> retain(List<String> order, List<String> capable) {
        return order.stream().filter(capable::contains).toList();
    }
}
