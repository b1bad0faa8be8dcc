package io.shipme.core.vault;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * In-memory encrypted secret storage for one provisioning run.
 *
 * <p>Values are sealed with AES-256/GCM under a random key that exists only in this instance. Every
 * {@link #store(String, String)} uses a fresh initialization vector. {@link #destroy()} zeroes the key
 * and makes every later store, retrieve, resolve or listing fail with {@link VaultDestroyedException}.
 *
 * <p>All operations hold the read lock and check the state first; {@link #destroy()} takes the write lock,
 * so no operation can observe partially erased key material.
 */
public final class SecretVault implements AutoCloseable {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final Pattern REFERENCE = Pattern.compile("\\{\\{secrets\\.([^}]+)\\}\\}");
    private static final Pattern NAME = Pattern.compile("\\w+");

    private final Map<String, Secret> secrets = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final SecureRandom random;
    private final byte[] key;
    private volatile VaultState state = VaultState.ACTIVE;

    public SecretVault() {
        this(new SecureRandom());
    }

    SecretVault(SecureRandom random) {
        this.random = random;
        this.key = new byte[KEY_BYTES];
        random.nextBytes(key);
    }

    public void store(String name, String value) {
        requireName(name);
        if (value == null) {
            throw new IllegalArgumentException("Secret value must not be null");
        }
        withReadLock(() -> {
            ensureActive();
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            byte[] ciphertext = crypt(Cipher.ENCRYPT_MODE, name, iv, value.getBytes(StandardCharsets.UTF_8));
            secrets.put(name, new Secret(name, iv, ciphertext));
            return null;
        });
    }

    public Optional<String> retrieve(String name) {
        return withReadLock(() -> {
            ensureActive();
            Secret secret = name == null ? null : secrets.get(name);
            if (secret == null) {
                return Optional.empty();
            }
            byte[] plaintext = crypt(Cipher.DECRYPT_MODE, name, secret.initializationVector(), secret.ciphertext());
            try {
                return Optional.of(new String(plaintext, StandardCharsets.UTF_8));
            } finally {
                Arrays.fill(plaintext, (byte) 0);
            }
        });
    }

    /**
     * Substitutes a {@code {{secrets.<name>}}} placeholder with the stored value. Text without a placeholder
     * is returned unchanged.
     *
     * @throws SecretNotFoundException when the referenced name is not a valid secret name or was never stored
     */
    public String resolve(String reference) {
        return withReadLock(() -> {
            ensureActive();
            if (reference == null) {
                return null;
            }
            Matcher matcher = REFERENCE.matcher(reference);
            if (!matcher.find()) {
                return reference;
            }
            String name = matcher.group(1);
            if (!NAME.matcher(name).matches()) {
                throw new SecretNotFoundException(name);
            }
            String value = retrieve(name).orElseThrow(() -> new SecretNotFoundException(name));
            return reference.substring(0, matcher.start()) + value + reference.substring(matcher.end());
        });
    }

    public static boolean isReference(String value) {
        return value != null && REFERENCE.matcher(value).find();
    }

    public static String reference(String name) {
        requireName(name);
        return "{{secrets." + name + "}}";
    }

    public boolean has(String name) {
        return withReadLock(() -> state == VaultState.ACTIVE && name != null && secrets.containsKey(name));
    }

    public boolean delete(String name) {
        return withReadLock(() -> state == VaultState.ACTIVE && name != null && secrets.remove(name) != null);
    }

    public List<String> listKeys() {
        return withReadLock(() -> {
            ensureActive();
            return secrets.keySet().stream().sorted().toList();
        });
    }

    public VaultStatus status() {
        return withReadLock(() -> new VaultStatus(secrets.size(), state == VaultState.DESTROYED));
    }

    public VaultState state() {
        return state;
    }

    public void destroy() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (state == VaultState.DESTROYED) {
                return;
            }
            for (Secret secret : secrets.values()) {
                Arrays.fill(secret.ciphertext(), (byte) 0);
                Arrays.fill(secret.initializationVector(), (byte) 0);
            }
            secrets.clear();
            Arrays.fill(key, (byte) 0);
            state = VaultState.DESTROYED;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        destroy();
    }

    Optional<Secret> sealed(String name) {
        return Optional.ofNullable(secrets.get(name));
    }

    private byte[] crypt(int mode, String name, byte[] iv, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(name.getBytes(StandardCharsets.UTF_8));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            String action = mode == Cipher.ENCRYPT_MODE ? "encrypt" : "decrypt";
            throw new IllegalStateException("Failed to " + action + " secret '" + name + "'", e);
        }
    }

    private void ensureActive() {
        if (state == VaultState.DESTROYED) {
            throw new VaultDestroyedException();
        }
    }

    private <T> T withReadLock(Supplier<T> action) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Secret name must not be blank");
        }
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Secret name must contain only letters, digits and underscores: " + name);
        }
    }
}
