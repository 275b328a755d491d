package io.memento.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Job storage for the maintenance schedule. The JobRunr starter builds its StorageProvider from this
 * DataSource, so recurring decay and daily jobs survive restarts.
 *
 * <p>The job file lives at {@code memento.jobs.database-url}, outside {@code memento.data-path}. Every
 * {@code *.db} file directly under the data path is enumerated as a workspace, so a job file placed
 * there would be swept by maintenance as if it held memories. Startup fails in that case.</p>
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSource jobStorageDataSource(
            @Value("${memento.jobs.database-url:jdbc:sqlite:./data/jobrunr.db}") String url,
            MementoProperties properties
    ) {
        requireOutsideWorkspaces(url, Path.of(properties.dataPath()));
        var ds = new SQLiteDataSource();
        ds.setUrl(url);
        log.info("Maintenance job storage: {} (workspaces in {})", url, properties.dataPath());
        return ds;
    }

    static void requireOutsideWorkspaces(String url, Path dataPath) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String file = url.substring(SQLITE_PREFIX.length());
        int query = file.indexOf('?');
        if (query >= 0) {
            file = file.substring(0, query);
        }
        if (file.isBlank() || file.startsWith(":memory:") || file.startsWith("file:")) {
            return;
        }
        Path jobFile = Path.of(file).toAbsolutePath().normalize();
        Path workspaces = dataPath.toAbsolutePath().normalize();
        if (workspaces.equals(jobFile.getParent()) && jobFile.getFileName().toString().endsWith(".db")) {
            throw new IllegalStateException("Job storage " + jobFile
                    + " would be listed as a workspace; move memento.jobs.database-url out of " + workspaces);
        }
    }
}
