package com.tartaritech.repair_manager.services;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.EquipmentDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.Equipment;
import com.tartaritech.repair_manager.exceptions.ReferenceException;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.EquipmentRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

@Service
public class EquipmentService {

    private final EquipmentRepository equipmentRepository;
    private final CustomerRepository customerRepository;
    private final RecordValidator recordValidator;
    private final Logger logger = LoggerFactory.getLogger(EquipmentService.class);

    public EquipmentService(EquipmentRepository equipmentRepository, CustomerRepository customerRepository,
            RecordValidator recordValidator) {
        this.equipmentRepository = equipmentRepository;
        this.customerRepository = customerRepository;
        this.recordValidator = recordValidator;
    }

    @Transactional
    public Long createEquipment(EquipmentDTO dto) {
        recordValidator.validate(dto);
        logger.info("Creating equipment for customer {}: {} {}", dto.getCustomerId(), dto.getMake(), dto.getModel());

        Customer customer = customerRepository.findById(dto.getCustomerId())
                .orElseThrow(() -> new ReferenceException("equipment", "customer", dto.getCustomerId()));

        Equipment entity = new Equipment();
        entity.setCustomer(customer);
        entity.setMake(dto.getMake());
        entity.setModel(dto.getModel());
        entity.setCpu(dto.getCpu());
        entity.setRam(dto.getRam());
        entity.setStorage(dto.getStorage());
        entity.setOs(dto.getOs());
        entity.setSerialNumber(dto.getSerialNumber());
        entity.setNotes(dto.getNotes());

        Equipment saved = equipmentRepository.save(entity);
        logger.info("Equipment created successfully: {}", saved.getId());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public EquipmentDTO getEquipment(Long id) {
        return equipmentRepository.findById(id)
                .map(EquipmentDTO::new)
                .orElseThrow(() -> new ResourceNotFoundException("Equipment", id));
    }

    /**
     * All equipment, or only the equipment of one customer when {@code customerId} is given.
     */
    @Transactional(readOnly = true)
    public List<EquipmentDTO> listEquipment(Long customerId) {
        List<Equipment> equipment = customerId == null
                ? equipmentRepository.findAllByOrderByIdAsc()
                : equipmentRepository.findByCustomerIdOrderByIdAsc(customerId);
        return equipment.stream()
                .map(EquipmentDTO::new)
                .collect(Collectors.toList());
    }
}
