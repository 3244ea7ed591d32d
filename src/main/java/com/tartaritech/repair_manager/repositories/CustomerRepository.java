package com.tartaritech.repair_manager.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.tartaritech.repair_manager.entities.Customer;

public interface CustomerRepository extends JpaRepository<Customer, Long> {

    List<Customer> findAllByOrderByLastNameAscFirstNameAsc();

    @Query("""
        SELECT c FROM Customer c
        WHERE LOWER(c.firstName) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
           OR LOWER(c.lastName) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
           OR LOWER(c.phone) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
           OR LOWER(c.email) LIKE LOWER(CONCAT('%', :term, '%')) ESCAPE '!'
        ORDER BY c.lastName ASC, c.firstName ASC
    """)
    List<Customer> search(@Param("term") String term);
}
