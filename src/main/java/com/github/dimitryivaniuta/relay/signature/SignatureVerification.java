package com.github.dimitryivaniuta.relay.signature;

public record SignatureVerification(boolean valid, String error) {

    private static final SignatureVerification OK = new SignatureVerification(true, null);

    public static SignatureVerification ok() {
        return OK;
    }

    public static SignatureVerification failed(String error) {
        return new SignatureVerification(false, error);
    }
}
