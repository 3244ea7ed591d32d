package com.tartaritech.repair_manager.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Entity
@Table(name = "tb_equipment")
public class Equipment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    private String make;
    private String model;
    private String cpu;
    private String ram;
    private String storage;
    private String os;
    private String serialNumber;

    @Column(length = 2000)
    private String notes;

    public String getDisplayName() {
        String name = ((make == null ? "" : make) + " " + (model == null ? "" : model)).trim();
        return name.isEmpty() ? "Equipment #" + id : name;
    }
}
