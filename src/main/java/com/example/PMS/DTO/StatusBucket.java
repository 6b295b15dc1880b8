package com.example.PMS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

/**
 * One row of the group-by-status aggregation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusBucket {
    @Id
    private String status;
    private long count;
    private double revenue;
}
