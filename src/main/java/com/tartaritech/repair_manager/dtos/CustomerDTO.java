package com.tartaritech.repair_manager.dtos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.Customer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "id", "firstName", "lastName", "phone", "email", "address", "notes" })
public class CustomerDTO {

    private Long id;

    @NotBlank(message = "first name is required")
    @Size(max = 255, message = "first name must be at most 255 characters")
    private String firstName;

    @NotBlank(message = "last name is required")
    @Size(max = 255, message = "last name must be at most 255 characters")
    private String lastName;

    private String phone;
    private String email;
    private String address;
    private String notes;

    public CustomerDTO(Customer entity) {
        this.id = entity.getId();
        this.firstName = entity.getFirstName();
        this.lastName = entity.getLastName();
        this.phone = entity.getPhone();
        this.email = entity.getEmail();
        this.address = entity.getAddress();
        this.notes = entity.getNotes();
    }
}
