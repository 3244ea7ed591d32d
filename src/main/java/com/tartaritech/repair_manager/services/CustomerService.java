package com.tartaritech.repair_manager.services;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

@Service
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final RecordValidator recordValidator;
    private final Logger logger = LoggerFactory.getLogger(CustomerService.class);

    public CustomerService(CustomerRepository customerRepository, RecordValidator recordValidator) {
        this.customerRepository = customerRepository;
        this.recordValidator = recordValidator;
    }

    @Transactional
    public Long createCustomer(CustomerDTO dto) {
        recordValidator.validate(dto);
        logger.info("Creating customer: {} {}", dto.getFirstName(), dto.getLastName());

        Customer entity = new Customer();
        copyToEntity(dto, entity);

        Customer saved = customerRepository.save(entity);
        logger.info("Customer created successfully: {}", saved.getId());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public CustomerDTO getCustomer(Long id) {
        if (id == null) {
            throw new ValidationException("customer id is required");
        }
        return customerRepository.findById(id)
                .map(CustomerDTO::new)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", id));
    }

    /**
     * Customers ordered by last name, then first name.
     */
    @Transactional(readOnly = true)
    public List<CustomerDTO> listCustomers() {
        logger.info("Fetching all customers");
        return customerRepository.findAllByOrderByLastNameAscFirstNameAsc().stream()
                .map(CustomerDTO::new)
                .collect(Collectors.toList());
    }

    static void copyToEntity(CustomerDTO dto, Customer entity) {
        entity.setFirstName(dto.getFirstName().trim());
        entity.setLastName(dto.getLastName().trim());
        entity.setPhone(dto.getPhone());
        entity.setEmail(dto.getEmail());
        entity.setAddress(dto.getAddress());
        entity.setNotes(dto.getNotes());
    }
}
