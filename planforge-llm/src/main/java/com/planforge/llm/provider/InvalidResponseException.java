package com.planforge.llm.provider;

/**
 * The backend answered, but the response envelope carried no usable content
 * (blocked candidate, missing choices, unexpected shape).
 */
public class InvalidResponseException extends ProviderClient.ProviderException {

    public InvalidResponseException(String message, LlmProvider provider) {
        super(message, provider, NO_STATUS, false);
    }

    public InvalidResponseException(String message, LlmProvider provider, Throwable cause) {
        super(message, provider, NO_STATUS, false, cause);
    }
}
