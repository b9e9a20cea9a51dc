package com.openrangelabs.blacklist.collector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.util.StringUtils;

/**
 * Decryption capability for stored source credentials.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@Configuration
public class EncryptionConfig {

    @Value("${open-range-labs.blacklist.encryption.secret-key:}")
    private String secretKey;

    @Value("${open-range-labs.blacklist.encryption.salt:}")
    private String salt;

    /**
     * AES-GCM encryptor when a key and hex salt are configured, otherwise a pass-through.
     *
     * @return the credential text encryptor
     */
    @Bean
    public TextEncryptor credentialEncryptor() {
        if (StringUtils.hasText(secretKey) && StringUtils.hasText(salt)) {
            return Encryptors.delux(secretKey, salt);
        }
        log.warn("No credential encryption key configured, stored credentials are read as plain text");
        return Encryptors.noOpText();
    }
}
