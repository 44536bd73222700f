package com.pareview.app.integration.collaborator;

import com.pareview.app.integration.enumerations.CodeSystem;
import com.pareview.app.integration.models.verification.CodeValidationReport;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Validates diagnosis and procedure codes against a reference code set.
 *
 * <p>The report carries one entry per requested code, in request order.</p>
 */
public interface ICodeValidationClient {

    Mono<CodeValidationReport> validate(CodeSystem codeSystem, List<String> codes);
}
