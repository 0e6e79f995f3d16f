package com.cpp2c.transformer;

/**
 * The front end handed over input that breaks its contract (for example a site whose
 * macro is missing from the macro table). The pass aborts; nothing is transformed
 * on a best-effort basis.
 */
public class TransformerContractException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TransformerContractException(String message) {
        super(message);
    }

    public TransformerContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
