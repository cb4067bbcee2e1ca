package com.mikov.emailvalidator.validation;

import com.mikov.emailvalidator.model.ValidationCode;
import com.mikov.emailvalidator.model.ValidationIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the {@link SyntaxAnalyzer} learned about an address, including the errors
 * and warnings its rules produced.
 */
@Value
@Builder
public class SyntaxAnalysis {

    String email;
    String localPart;
    String domain;
    LocalPartFacts localPartFacts;
    DomainFacts domainFacts;

    @Builder.Default
    List<ValidationIssue> errors = List.of();

    @Builder.Default
    List<ValidationIssue> warnings = List.of();

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isRoleBased() {
        return localPartFacts != null && localPartFacts.roleBased();
    }

    public boolean isDisposable() {
        return domainFacts != null && domainFacts.disposable();
    }

    static SyntaxAnalysis formatFailure(final String email) {
        return SyntaxAnalysis.builder()
                .email(email)
                .errors(List.of(new ValidationIssue(ValidationCode.FORMAT, "Invalid email format")))
                .build();
    }
}
