package com.planforge.llm.provider;

public class ProviderTimeoutException extends ProviderClient.ProviderException {

    public ProviderTimeoutException(String message, LlmProvider provider, Throwable cause) {
        super(message, provider, NO_STATUS, false, cause);
    }
}
