package com.tartaritech.repair_manager.services;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
public class CustomerServiceTest {

    @Mock
    private CustomerRepository customerRepository;

    @Spy
    private RecordValidator recordValidator = new RecordValidator(Validation.buildDefaultValidatorFactory().getValidator());

    @InjectMocks
    private CustomerService customerService;

    @Test
    public void createCustomerShouldTrimNamesAndReturnId() {
        when(customerRepository.save(any(Customer.class))).thenAnswer(inv -> {
            Customer c = inv.getArgument(0);
            c.setId(1L);
            return c;
        });

        Long id = customerService.createCustomer(
                new CustomerDTO(null, " Jane ", "Doe", "555-0100", "jane@example.com", "1 Main St", null));

        assertEquals(1L, id);
        ArgumentCaptor<Customer> captor = ArgumentCaptor.forClass(Customer.class);
        verify(customerRepository).save(captor.capture());
        assertEquals("Jane", captor.getValue().getFirstName());
        assertEquals("Jane Doe", captor.getValue().getFullName());
        assertEquals("555-0100", captor.getValue().getPhone());
    }

    @Test
    public void createCustomerShouldRejectMissingNames() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> customerService.createCustomer(new CustomerDTO(null, "", null, null, null, null, null)));

        assertTrue(ex.getMessage().contains("first name is required"));
        assertTrue(ex.getMessage().contains("last name is required"));
        verify(customerRepository, never()).save(any());
    }

    @Test
    public void getCustomerShouldThrowWhenMissing() {
        when(customerRepository.findById(9L)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> customerService.getCustomer(9L));
        assertEquals("Customer", ex.getEntity());
        assertEquals(9L, ex.getId());
    }

    @Test
    public void getCustomerShouldRejectNullId() {
        assertThrows(ValidationException.class, () -> customerService.getCustomer(null));
        verifyNoInteractions(customerRepository);
    }

    @Test
    public void listCustomersShouldMapInRepositoryOrder() {
        when(customerRepository.findAllByOrderByLastNameAscFirstNameAsc()).thenReturn(List.of(
                new Customer(2L, "Ann", "Adams", null, null, null, null),
                new Customer(1L, "Jane", "Doe", null, null, null, null)));

        List<CustomerDTO> customers = customerService.listCustomers();

        assertEquals(2, customers.size());
        assertEquals("Adams", customers.get(0).getLastName());
        assertEquals("Doe", customers.get(1).getLastName());
    }
}
