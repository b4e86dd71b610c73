package com.phillippitts.dictavault.config;

import com.phillippitts.dictavault.config.properties.VaultProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Beans backing the password vault.
 */
@Configuration
public class VaultConfig {

    /**
     * Salted one-way hash for the vault password. Only the hash is ever persisted.
     */
    @Bean
    public PasswordEncoder vaultPasswordEncoder(VaultProperties props) {
        return new BCryptPasswordEncoder(props.getBcryptStrength());
    }

    @Bean
    public Clock vaultClock() {
        return Clock.systemUTC();
    }
}
