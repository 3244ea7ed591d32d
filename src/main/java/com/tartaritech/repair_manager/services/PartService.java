package com.tartaritech.repair_manager.services;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.PartDTO;
import com.tartaritech.repair_manager.entities.Part;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

@Service
public class PartService {

    private final PartRepository partRepository;
    private final RecordValidator recordValidator;
    private final Logger logger = LoggerFactory.getLogger(PartService.class);

    public PartService(PartRepository partRepository, RecordValidator recordValidator) {
        this.partRepository = partRepository;
        this.recordValidator = recordValidator;
    }

    @Transactional
    public Long createPart(PartDTO dto) {
        recordValidator.validate(dto);
        String sku = dto.getSku().trim();
        logger.info("Creating part: {}", sku);

        if (partRepository.existsBySku(sku)) {
            throw new ValidationException("SKU already exists: " + sku);
        }

        Part entity = new Part();
        copyToEntity(dto, entity);

        Part saved = partRepository.save(entity);
        logger.info("Part created successfully: {} with {} on hand", saved.getSku(), saved.getQuantity());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public PartDTO getPart(Long id) {
        if (id == null) {
            throw new ValidationException("part id is required");
        }
        return partRepository.findById(id)
                .map(PartDTO::new)
                .orElseThrow(() -> new ResourceNotFoundException("Part", id));
    }

    @Transactional(readOnly = true)
    public List<PartDTO> listParts() {
        return partRepository.findAllByOrderBySkuAsc().stream()
                .map(PartDTO::new)
                .collect(Collectors.toList());
    }

    static void copyToEntity(PartDTO dto, Part entity) {
        copyDetailsToEntity(dto, entity);
        entity.setQuantity(dto.getQuantity());
    }

    /**
     * Copies everything except the on-hand quantity, which only the inventory ledger changes once a part exists.
     */
    static void copyDetailsToEntity(PartDTO dto, Part entity) {
        entity.setSku(dto.getSku().trim());
        entity.setDescription(dto.getDescription());
        entity.setUnitCost(dto.getUnitCost());
    }
}
