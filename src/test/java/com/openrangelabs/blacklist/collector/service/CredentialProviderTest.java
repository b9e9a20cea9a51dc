package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.entity.CollectionCredential;
import com.openrangelabs.blacklist.collector.exception.CollectionException;
import com.openrangelabs.blacklist.collector.exception.CredentialNotFoundException;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.repository.CollectionCredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialProviderTest {

    @Mock
    private CollectionCredentialRepository repository;

    @Mock
    private TextEncryptor encryptor;

    private CredentialProvider credentialProvider;
    private CollectionCredential storedCredential;
    private final AtomicInteger lookups = new AtomicInteger();

    @BeforeEach
    void setUp() {
        credentialProvider = new CredentialProvider(repository, encryptor, new CollectorProperties());

        storedCredential = new CollectionCredential("REGTECH", "analyst", "cipher-text");
        storedCredential.setEncrypted(true);
        storedCredential.setIsActive(true);
    }

    @Test
    void resolve_DecryptsStoredPassword() {
        // Arrange
        stubLookup(storedCredential);
        when(encryptor.decrypt("cipher-text")).thenReturn("s3cret");

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .assertNext(credential -> {
                    assertThat(credential.getSourceName()).isEqualTo("REGTECH");
                    assertThat(credential.getUsername()).isEqualTo("analyst");
                    assertThat(credential.getSecret()).isEqualTo("s3cret");
                    assertThat(credential.isEnabled()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void resolve_PlainTextPasswordIsUsedAsIs() {
        // Arrange
        storedCredential.setEncrypted(false);
        storedCredential.setPassword("plain");
        stubLookup(storedCredential);

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("regtech"))
                .assertNext(credential -> assertThat(credential.getSecret()).isEqualTo("plain"))
                .verifyComplete();
        verifyNoInteractions(encryptor);
    }

    @Test
    void resolve_CachesWithinTtl() {
        // Arrange
        stubLookup(storedCredential);
        when(encryptor.decrypt("cipher-text")).thenReturn("s3cret");

        // Act
        credentialProvider.resolve("REGTECH").block();
        credentialProvider.resolve("REGTECH").block();

        // Assert
        assertThat(lookups).hasValue(1);
    }

    @Test
    void resolveForRun_BypassesCache() {
        // Arrange
        stubLookup(storedCredential);
        when(encryptor.decrypt("cipher-text")).thenReturn("s3cret");

        // Act
        credentialProvider.resolve("REGTECH").block();
        credentialProvider.resolveForRun("REGTECH").block();

        // Assert
        assertThat(lookups).hasValue(2);
    }

    @Test
    void resolve_MissingRowIsNotFound() {
        // Arrange
        when(repository.findByServiceName("REGTECH")).thenReturn(Mono.empty());

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(CredentialNotFoundException.class);
                    assertThat(((CollectionException) error).getErrorKind()).isEqualTo(ErrorKind.CREDENTIAL_NOT_FOUND);
                })
                .verify();
    }

    @Test
    void resolve_BlankPasswordIsNotFound() {
        // Arrange
        storedCredential.setPassword(" ");
        stubLookup(storedCredential);

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .expectError(CredentialNotFoundException.class)
                .verify();
    }

    @Test
    void resolve_InactiveRowIsDisabled() {
        // Arrange
        storedCredential.setIsActive(false);
        stubLookup(storedCredential);

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .expectErrorSatisfies(error -> assertThat(((CollectionException) error).getErrorKind())
                        .isEqualTo(ErrorKind.CREDENTIAL_DISABLED))
                .verify();
        verifyNoInteractions(encryptor);
    }

    @Test
    void resolve_FailuresAreNotCached() {
        // Arrange
        when(repository.findByServiceName("REGTECH")).thenReturn(Mono.defer(() ->
                lookups.incrementAndGet() == 1 ? Mono.empty() : Mono.just(storedCredential)));
        when(encryptor.decrypt("cipher-text")).thenReturn("s3cret");

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .expectError(CredentialNotFoundException.class)
                .verify();
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .assertNext(credential -> assertThat(credential.getSecret()).isEqualTo("s3cret"))
                .verifyComplete();
    }

    @Test
    void resolve_UndecryptableSecretIsInternalError() {
        // Arrange
        stubLookup(storedCredential);
        when(encryptor.decrypt("cipher-text")).thenThrow(new IllegalStateException("Unable to decrypt"));

        // Act & Assert
        StepVerifier.create(credentialProvider.resolve("REGTECH"))
                .expectErrorSatisfies(error -> {
                    assertThat(((CollectionException) error).getErrorKind()).isEqualTo(ErrorKind.INTERNAL);
                    assertThat(error.getMessage()).doesNotContain("cipher-text");
                })
                .verify();
    }

    private void stubLookup(CollectionCredential row) {
        when(repository.findByServiceName("REGTECH")).thenReturn(Mono.defer(() -> {
            lookups.incrementAndGet();
            return Mono.just(row);
        }));
    }
}
