package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.enums.WorkOrderStatus;

public interface WorkOrderRepository extends JpaRepository<WorkOrder, Long> {

    List<WorkOrder> findByStatusOrderByDateOpenedAscIdAsc(WorkOrderStatus status);

    /**
     * Work orders of every piece of equipment the customer owns, newest first.
     */
    @Query("""
        SELECT w FROM WorkOrder w
        WHERE w.equipment.customer.id = :customerId
        ORDER BY w.dateOpened DESC, w.id DESC
    """)
    List<WorkOrder> findHistoryByCustomerId(@Param("customerId") Long customerId);

    @Query("""
        SELECT w FROM WorkOrder w
        WHERE LOWER(w.description) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
           OR LOWER(w.equipment.serialNumber) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
           OR w.id = :id
        ORDER BY w.id ASC
    """)
    List<WorkOrder> search(@Param("term") String term, @Param("id") Long id);

    @Query("""
        SELECT w FROM WorkOrder w
        WHERE w.status = :status AND w.dueDate IS NOT NULL
        ORDER BY w.dueDate ASC, w.id ASC
    """)
    List<WorkOrder> findUpcomingDeadlines(@Param("status") WorkOrderStatus status, Pageable pageable);

    long countByStatus(WorkOrderStatus status);
}
