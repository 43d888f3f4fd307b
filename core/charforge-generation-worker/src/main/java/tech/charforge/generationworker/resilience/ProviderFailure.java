package tech.charforge.generationworker.resilience;

/**
 * Implemented by exceptions that already carry classification fields.
 */
public interface ProviderFailure {

    ProviderError toProviderError();
}
