package com.bko.sheetmirror.transport;

import com.bko.sheetmirror.shared.AppSettings;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class ServiceAccountTokenSource implements AccessTokenSource {
    private static final Logger logger = LoggerFactory.getLogger(ServiceAccountTokenSource.class);

    private final AppSettings settings;
    private GoogleCredentials credentials;

    public ServiceAccountTokenSource(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public synchronized String accessToken() throws IOException {
        GoogleCredentials current = getCredentials();
        current.refreshIfExpired();
        AccessToken token = current.getAccessToken();
        if (token == null) {
            current.refresh();
            token = current.getAccessToken();
        }
        if (token == null) {
            throw new IOException("Service account did not yield an access token.");
        }
        return token.getTokenValue();
    }

    private GoogleCredentials getCredentials() throws IOException {
        if (credentials == null) {
            if (!settings.isGoogleConfigured()) {
                throw new IllegalStateException("Missing Google configuration. Check GOOGLE_SERVICE_ACCOUNT_KEY_PATH.");
            }
            try (InputStream serviceAccountStream = openServiceAccountStream()) {
                credentials = GoogleCredentials.fromStream(serviceAccountStream)
                        .createScoped(settings.google().scopes());
            }
            logger.info("Loaded service account credentials with scopes {}", settings.google().scopes());
        }
        return credentials;
    }

    private InputStream openServiceAccountStream() throws IOException {
        String path = settings.google().serviceAccountKeyPath();

        if (path.startsWith("classpath:")) {
            return openClasspathResource(path.substring("classpath:".length()));
        }

        Path filePath = Path.of(path);
        if (Files.exists(filePath)) {
            return new FileInputStream(filePath.toFile());
        }

        InputStream resourceStream = tryClasspathResource(path);
        if (resourceStream != null) {
            return resourceStream;
        }
        throw new IOException("Service account key not found at path: " + path);
    }

    private InputStream openClasspathResource(String resourcePath) throws IOException {
        InputStream stream = tryClasspathResource(resourcePath);
        if (stream == null) {
            throw new IOException("Service account resource not found: " + resourcePath);
        }
        return stream;
    }

    private InputStream tryClasspathResource(String resourcePath) {
        String normalized = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
        return ServiceAccountTokenSource.class.getResourceAsStream(normalized);
    }
}
