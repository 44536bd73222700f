package com.pareview.app.integration.collaborator;

import com.pareview.app.integration.models.verification.ProviderVerificationResult;
import reactor.core.publisher.Mono;

/**
 * Looks a provider up in a provider registry.
 *
 * <p>An unknown identifier resolves to {@link ProviderVerificationResult#notFound(String)}.
 * An unreachable registry signals
 * {@link com.pareview.app.integration.exception.CollaboratorUnavailableException}.</p>
 */
public interface IProviderVerificationClient {

    Mono<ProviderVerificationResult> verify(String npi);
}
