package com.tartaritech.repair_manager.entities;

import java.math.BigDecimal;

import com.tartaritech.repair_manager.exceptions.ValidationException;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
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
@Entity
@Table(name = "tb_part")
public class Part {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String sku;

    private String description;

    @Column(nullable = false)
    private Integer quantity;

    @Column(precision = 12, scale = 2)
    private BigDecimal unitCost;

    /**
     * Applies a consumption to the on-hand count. Callers decide whether a negative result is acceptable.
     *
     * @throws ValidationException if the new count does not fit in an int
     */
    public int consume(int amount) {
        try {
            this.quantity = Math.subtractExact(this.quantity, amount);
        } catch (ArithmeticException e) {
            throw new ValidationException("stock of " + sku + " cannot go below " + Integer.MIN_VALUE);
        }
        return this.quantity;
    }
}
