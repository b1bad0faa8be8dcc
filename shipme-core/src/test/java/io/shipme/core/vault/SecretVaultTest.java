package io.shipme.core.vault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SecretVaultTest {

    @Test
    void shouldRoundTripStoredValues() {
        SecretVault vault = new SecretVault();

        vault.store("k", "v");
        vault.store("unicode", "pässwörd ✓");

        assertThat(vault.retrieve("k")).contains("v");
        assertThat(vault.retrieve("unicode")).contains("pässwörd ✓");
        assertThat(vault.retrieve("never-stored")).isEmpty();
    }

    @Test
    void shouldUseFreshIvForEveryStore() {
        SecretVault vault = new SecretVault();

        vault.store("a", "v");
        Secret first = vault.sealed("a").orElseThrow();
        vault.store("a", "v");
        Secret second = vault.sealed("a").orElseThrow();

        assertThat(second.initializationVector()).isNotEqualTo(first.initializationVector());
        assertThat(second.ciphertext()).isNotEqualTo(first.ciphertext());
        assertThat(vault.retrieve("a")).contains("v");
    }

    @Test
    void shouldOverwriteExistingSecret() {
        SecretVault vault = new SecretVault();

        vault.store("token", "old");
        vault.store("token", "new");

        assertThat(vault.retrieve("token")).contains("new");
        assertThat(vault.status()).isEqualTo(new VaultStatus(1, false));
    }

    @Test
    void shouldResolveReferences() {
        SecretVault vault = new SecretVault();
        vault.store("service_key", "s3cr3t");

        assertThat(vault.resolve("plain text")).isEqualTo("plain text");
        assertThat(vault.resolve("{{secrets.service_key}}")).isEqualTo("s3cr3t");
        assertThat(vault.resolve("Bearer {{secrets.service_key}}")).isEqualTo("Bearer s3cr3t");
        assertThatThrownBy(() -> vault.resolve("{{secrets.missing}}"))
            .isInstanceOf(SecretNotFoundException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void shouldRejectNamesThatCannotBeReferenced() {
        SecretVault vault = new SecretVault();

        assertThatThrownBy(() -> vault.store("db-password", "s3cret"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("letters, digits and underscores");
        assertThatThrownBy(() -> SecretVault.reference("db.password")).isInstanceOf(IllegalArgumentException.class);
        assertThat(vault.has("db-password")).isFalse();
    }

    @Test
    void shouldFailOnPlaceholderWithInvalidOrAbsentName() {
        SecretVault vault = new SecretVault();
        vault.store("db_password", "s3cret");

        assertThatThrownBy(() -> vault.resolve("{{secrets.not-there}}"))
            .isInstanceOf(SecretNotFoundException.class)
            .hasMessageContaining("not-there");
        assertThatThrownBy(() -> vault.resolve("pw={{secrets.db password}}"))
            .isInstanceOf(SecretNotFoundException.class);
        assertThat(SecretVault.isReference("{{secrets.not-there}}")).isTrue();
        assertThat(vault.resolve("{{secrets.db_password}}")).isEqualTo("s3cret");
    }

    @Test
    void shouldFailEveryOperationAfterDestroy() {
        SecretVault vault = new SecretVault();
        vault.store("k", "v");

        vault.destroy();

        assertThatThrownBy(() -> vault.store("k", "v")).isInstanceOf(VaultDestroyedException.class);
        assertThatThrownBy(() -> vault.retrieve("k")).isInstanceOf(VaultDestroyedException.class);
        assertThatThrownBy(() -> vault.resolve("plain text")).isInstanceOf(VaultDestroyedException.class);
        assertThatThrownBy(vault::listKeys).isInstanceOf(VaultDestroyedException.class);
        assertThat(vault.has("k")).isFalse();
        assertThat(vault.delete("k")).isFalse();
        assertThat(vault.status()).isEqualTo(new VaultStatus(0, true));
        assertThat(vault.state()).isEqualTo(VaultState.DESTROYED);
    }

    @Test
    void shouldSupportIntrospection() {
        SecretVault vault = new SecretVault();
        vault.store("b", "2");
        vault.store("a", "1");

        assertThat(vault.listKeys()).containsExactly("a", "b");
        assertThat(vault.has("a")).isTrue();
        assertThat(vault.delete("a")).isTrue();
        assertThat(vault.delete("a")).isFalse();
        assertThat(vault.has("a")).isFalse();
        assertThat(vault.status().secretCount()).isEqualTo(1);
    }

    @Test
    void shouldNeverReadAfterConcurrentDestroy() throws Exception {
        SecretVault vault = new SecretVault();
        vault.store("k", "v");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> readers = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    String last = "";
                    for (int n = 0; n < 500; n++) {
                        try {
                            last = vault.retrieve("k").orElse("");
                            assertThat(last).isEqualTo("v");
                        } catch (VaultDestroyedException e) {
                            return "destroyed";
                        }
                    }
                    return last;
                }));
            }
            start.countDown();
            vault.destroy();
            for (Future<String> reader : readers) {
                assertThat(reader.get(10, TimeUnit.SECONDS)).isIn("v", "destroyed");
            }
            assertThatThrownBy(() -> vault.retrieve("k")).isInstanceOf(VaultDestroyedException.class);
        } finally {
            pool.shutdownNow();
        }
    }
}
