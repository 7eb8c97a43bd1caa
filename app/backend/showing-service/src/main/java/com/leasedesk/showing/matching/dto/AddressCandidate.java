package com.leasedesk.showing.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Property offered by an earlier search step, shown to the matcher by its street address
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressCandidate {

    private String address1;

    private String propertyId;
}
