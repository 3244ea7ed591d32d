package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tartaritech.repair_manager.entities.WorkDetail;

public interface WorkDetailRepository extends JpaRepository<WorkDetail, Long> {

    List<WorkDetail> findByWorkOrderIdOrderByDateAscIdAsc(Long workOrderId);
}
