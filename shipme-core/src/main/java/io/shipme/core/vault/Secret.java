package io.shipme.core.vault;

record Secret(String key, byte[] initializationVector, byte[] ciphertext) {
}
