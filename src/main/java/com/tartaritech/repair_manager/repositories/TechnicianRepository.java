package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tartaritech.repair_manager.entities.Technician;

public interface TechnicianRepository extends JpaRepository<Technician, Long> {

    List<Technician> findAllByOrderByNameAsc();
}
