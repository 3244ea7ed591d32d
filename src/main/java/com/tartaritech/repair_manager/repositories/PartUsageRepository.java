package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tartaritech.repair_manager.entities.PartUsage;

public interface PartUsageRepository extends JpaRepository<PartUsage, Long> {

    List<PartUsage> findByWorkOrderIdOrderByIdAsc(Long workOrderId);
}
