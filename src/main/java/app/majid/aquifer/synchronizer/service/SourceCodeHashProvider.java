package app.majid.aquifer.synchronizer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;

/**
 * Identifies the engine build that produced a log entry: the MD5 of the application archive,
 * or of the implementation version when running from exploded classes.
 */
@Component
public class SourceCodeHashProvider {

    private static final Logger logger = LoggerFactory.getLogger(SourceCodeHashProvider.class);

    private final String hash;

    public SourceCodeHashProvider(@Value("${aquifer.source-code-hash:}") String configuredHash) {
        this.hash = configuredHash != null && !configuredHash.isBlank()
                ? configuredHash.trim()
                : computeHash();
        logger.info("Sync log entries will carry source code hash {}", hash);
    }

    public String getHash() {
        return hash;
    }

    private static String computeHash() {
        CodeSource codeSource = SourceCodeHashProvider.class.getProtectionDomain().getCodeSource();
        if (codeSource != null && codeSource.getLocation() != null) {
            try {
                Path location = Path.of(codeSource.getLocation().toURI());
                if (Files.isRegularFile(location)) {
                    try (InputStream in = Files.newInputStream(location)) {
                        return DigestUtils.md5DigestAsHex(in);
                    }
                }
            } catch (IOException | URISyntaxException | IllegalArgumentException e) {
                logger.debug("Cannot hash code source {}: {}", codeSource.getLocation(), e.getMessage());
            }
        }

        String version = SourceCodeHashProvider.class.getPackage().getImplementationVersion();
        String fallback = version != null ? version : "development";
        return DigestUtils.md5DigestAsHex(fallback.getBytes(StandardCharsets.UTF_8));
    }
}
