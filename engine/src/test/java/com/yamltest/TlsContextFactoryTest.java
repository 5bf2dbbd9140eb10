package com.yamltest;

import com.yamltest.domain.HttpRequestSpec;
import com.yamltest.infra.ConfigurationException;
import com.yamltest.service.http.TlsContextFactory;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
class TlsContextFactoryTest {

    @Inject TlsContextFactory factory;

    @TempDir
    Path dir;

    private static HttpRequestSpec https(boolean skipVerification, String cert, String key, String ca) {
        return new HttpRequestSpec("https://localhost:8443", "GET", "/", Map.of(), Map.of(), null,
            skipVerification, cert, key, ca, 0, null, "https");
    }

    @Test
    void create_noTlsSettings_usesJdkDefaults() {
        assertThat(factory.create(https(false, null, null, null))).isNull();
    }

    @Test
    void create_skipVerification_buildsContext() {
        assertThat(factory.create(https(true, null, null, null))).isNotNull();
    }

    @Test
    void create_certWithoutKey_isConfigurationError() throws Exception {
        Path cert = Files.writeString(dir.resolve("client.pem"), "unused");

        assertThatThrownBy(() -> factory.create(https(false, cert.toString(), null, null)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Both cert and key are required for client certificate authentication");
    }

    @Test
    void create_missingCaFile_isConfigurationError() {
        String ca = dir.resolve("missing-ca.pem").toString();

        assertThatThrownBy(() -> factory.create(https(false, null, null, ca)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Failed to read CA certificate file: " + ca);
    }

    @Test
    void create_missingClientCertificate_isConfigurationError() throws Exception {
        Path key = Files.writeString(dir.resolve("client.key"), "unused");
        String cert = dir.resolve("client.pem").toString();

        assertThatThrownBy(() -> factory.create(https(false, cert, key.toString(), null)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Failed to read certificate file: " + cert);
    }
}
