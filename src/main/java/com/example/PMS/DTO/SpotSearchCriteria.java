package com.example.PMS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conjunction of optional listing filters. Blank values are treated as absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpotSearchCriteria {
    private String status;
    private String spotType;
    private String search; // substring of spot number or vehicle license, case-insensitive
}
