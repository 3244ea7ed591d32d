package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tartaritech.repair_manager.entities.Equipment;

public interface EquipmentRepository extends JpaRepository<Equipment, Long> {

    List<Equipment> findByCustomerIdOrderByIdAsc(Long customerId);

    List<Equipment> findAllByOrderByIdAsc();
}
