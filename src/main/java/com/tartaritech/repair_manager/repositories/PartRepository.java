package com.tartaritech.repair_manager.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tartaritech.repair_manager.entities.Part;

public interface PartRepository extends JpaRepository<Part, Long> {

    List<Part> findAllByOrderBySkuAsc();

    Optional<Part> findBySku(String sku);

    boolean existsBySku(String sku);
}
