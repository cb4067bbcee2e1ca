package com.mikov.emailvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for batch email validation
 *
 * @author zahari.mikov
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchValidationRequest {

    private List<String> emails;
    private ValidationOptionsRequest options;
}
