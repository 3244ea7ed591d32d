package com.tartaritech.repair_manager.services;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tartaritech.repair_manager.dtos.EquipmentDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.Equipment;
import com.tartaritech.repair_manager.exceptions.ReferenceException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.EquipmentRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
public class EquipmentServiceTest {

    @Mock
    private EquipmentRepository equipmentRepository;

    @Mock
    private CustomerRepository customerRepository;

    @Spy
    private RecordValidator recordValidator = new RecordValidator(Validation.buildDefaultValidatorFactory().getValidator());

    @InjectMocks
    private EquipmentService equipmentService;

    private EquipmentDTO laptop(Long customerId) {
        EquipmentDTO dto = new EquipmentDTO();
        dto.setCustomerId(customerId);
        dto.setMake("Dell");
        dto.setModel("XPS");
        dto.setSerialNumber("SN123");
        return dto;
    }

    @Test
    public void createEquipmentShouldLinkToCustomer() {
        Customer jane = new Customer(1L, "Jane", "Doe", null, null, null, null);
        when(customerRepository.findById(1L)).thenReturn(Optional.of(jane));
        when(equipmentRepository.save(any(Equipment.class))).thenAnswer(inv -> {
            Equipment e = inv.getArgument(0);
            e.setId(10L);
            return e;
        });

        assertEquals(10L, equipmentService.createEquipment(laptop(1L)));
        verify(equipmentRepository).save(argThat(e -> e.getCustomer() == jane && "SN123".equals(e.getSerialNumber())));
    }

    @Test
    public void createEquipmentShouldRejectUnknownCustomer() {
        when(customerRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(ReferenceException.class, () -> equipmentService.createEquipment(laptop(5L)));
        verify(equipmentRepository, never()).save(any());
    }

    @Test
    public void createEquipmentShouldRequireCustomerId() {
        assertThrows(ValidationException.class, () -> equipmentService.createEquipment(laptop(null)));
        verifyNoInteractions(customerRepository);
    }

    @Test
    public void listEquipmentShouldFilterByCustomerWhenGiven() {
        when(equipmentRepository.findByCustomerIdOrderByIdAsc(1L)).thenReturn(List.of());

        assertTrue(equipmentService.listEquipment(1L).isEmpty());
        verify(equipmentRepository, never()).findAllByOrderByIdAsc();
    }
}
