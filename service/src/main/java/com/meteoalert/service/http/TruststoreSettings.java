package com.meteoalert.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Custom truststore for talking to a delivery system behind a private CA.
 */
public record TruststoreSettings(Path path, String password) {

    public static Optional<TruststoreSettings> fromEnvironment(Map<String, String> env) {
        String truststorePath = env.get("TRUSTSTORE_PATH");
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }
        String truststorePassword = env.get("TRUSTSTORE_PASSWORD");
        if (truststorePassword == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }
        return Optional.of(new TruststoreSettings(Path.of(truststorePath), truststorePassword));
    }

    public String type() {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }

    SSLContext sslContext() {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type());
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }
}
