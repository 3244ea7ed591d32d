package com.tartaritech.repair_manager.repositories;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.tartaritech.repair_manager.entities.Invoice;
import com.tartaritech.repair_manager.enums.InvoiceStatus;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    List<Invoice> findAllByOrderByIssuedOnDescIdDesc();

    List<Invoice> findByStatusOrderByIssuedOnDescIdDesc(InvoiceStatus status);

    long countByStatus(InvoiceStatus status);

    @Query("SELECT COALESCE(SUM(i.amount), CAST(0 AS BigDecimal)) FROM Invoice i")
    BigDecimal sumAmounts();

    @Query("SELECT COALESCE(SUM(i.amount), CAST(0 AS BigDecimal)) FROM Invoice i WHERE i.status = :status")
    BigDecimal sumAmountsByStatus(@Param("status") InvoiceStatus status);
}
