package app.majid.aquifer.synchronizer.service;

import app.majid.aquifer.synchronizer.model.SchemaObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static app.majid.aquifer.common.constants.SyncConstants.SYNC_LOG_LABEL;
import static app.majid.aquifer.common.constants.SyncConstants.SYNC_LOG_NAME;

/**
 * Excludes objects from synchronization using glob patterns matched against {@code kind/name},
 * e.g. {@code table/tmp_*}. The sync log itself is always excluded.
 */
@Service
public class SynchronizerIgnoreService {

    private static final Logger logger = LoggerFactory.getLogger(SynchronizerIgnoreService.class);

    private final List<PathMatcher> ignoreMatchers = new ArrayList<>();

    public SynchronizerIgnoreService(@Value("${aquifer.sync-ignore-file:}") String ignoreFilePath)
            throws IOException {

        List<String> ignorePatterns = Collections.emptyList();
        if (ignoreFilePath != null && !ignoreFilePath.isBlank()) {
            ignorePatterns = Files.readAllLines(Paths.get(ignoreFilePath));
        } else {
            var resource = new ClassPathResource(".syncignore");
            if (resource.exists()) {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
                    ignorePatterns = reader.lines().toList();
                }
            }
        }

        loadIgnorePatterns(ignorePatterns);
        logger.debug("Loaded {} ignore patterns", ignoreMatchers.size());
    }

    private void loadIgnorePatterns(List<String> ignorePatterns) {
        for (String ignorePattern : ignorePatterns) {
            String trimmed = ignorePattern.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                ignoreMatchers.add(FileSystems.getDefault()
                        .getPathMatcher("glob:" + trimmed));
            }
        }
    }

    public boolean shouldProcess(SchemaObjectRef ref) {
        if (isSyncLog(ref.name())) {
            return false;
        }
        return ignoreMatchers.stream()
                .noneMatch(matcher ->
                        matcher.matches(FileSystems.getDefault().getPath(ref.key())));
    }

    private static boolean isSyncLog(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals(SYNC_LOG_NAME) || lower.equals(SYNC_LOG_LABEL.toLowerCase(Locale.ROOT));
    }
}
