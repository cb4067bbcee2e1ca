package com.mikov.emailvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailValidationRequest {

    private String email;
    private ValidationOptionsRequest options;
}
