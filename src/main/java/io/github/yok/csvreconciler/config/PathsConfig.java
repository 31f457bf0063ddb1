package io.github.yok.csvreconciler.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property and resolves the CSV extract of
 * each entity.
 *
 * <p>
 * The {@code data-path} must point to the directory where the external export process drops one
 * CSV file per entity.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Directory that holds the incoming CSV extracts
    private String dataPath = "source-data";

    /**
     * Resolves the path of a source file inside the data directory.
     *
     * @param fileName file name relative to {@code data-path}
     * @return the resolved path
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public Path resolveSource(String fileName) {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return Paths.get(dataPath).resolve(fileName);
    }
}
