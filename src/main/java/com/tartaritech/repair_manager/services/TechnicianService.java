package com.tartaritech.repair_manager.services;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.TechnicianDTO;
import com.tartaritech.repair_manager.entities.Technician;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.repositories.TechnicianRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

@Service
public class TechnicianService {

    private final TechnicianRepository technicianRepository;
    private final RecordValidator recordValidator;
    private final Logger logger = LoggerFactory.getLogger(TechnicianService.class);

    public TechnicianService(TechnicianRepository technicianRepository, RecordValidator recordValidator) {
        this.technicianRepository = technicianRepository;
        this.recordValidator = recordValidator;
    }

    @Transactional
    public Long createTechnician(TechnicianDTO dto) {
        recordValidator.validate(dto);

        Technician entity = new Technician();
        entity.setName(dto.getName().trim());

        Technician saved = technicianRepository.save(entity);
        logger.info("Technician created successfully: {} ({})", saved.getName(), saved.getId());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public TechnicianDTO getTechnician(Long id) {
        return technicianRepository.findById(id)
                .map(TechnicianDTO::new)
                .orElseThrow(() -> new ResourceNotFoundException("Technician", id));
    }

    @Transactional(readOnly = true)
    public List<TechnicianDTO> listTechnicians() {
        return technicianRepository.findAllByOrderByNameAsc().stream()
                .map(TechnicianDTO::new)
                .collect(Collectors.toList());
    }
}
