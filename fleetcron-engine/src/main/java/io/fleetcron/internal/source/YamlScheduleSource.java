package io.fleetcron.internal.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleetcron.core.ConfigException;
import io.fleetcron.core.JobSpec;
import io.fleetcron.internal.ObjectMappers;
import io.fleetcron.spi.ScheduleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads job definitions from the {@code schedule:} map of a YAML file.
 *
 * <pre>
 * schedule:
 *   highstate:
 *     function: state.apply
 *     minutes: 60
 *     splay: 30
 *   nightly-report:
 *     function: report.send
 *     cron: "0 3 * * *"
 *     timezone: Europe/Berlin
 * </pre>
 */
public class YamlScheduleSource implements ScheduleSource {
    private static final Logger log = LoggerFactory.getLogger(YamlScheduleSource.class);

    private final Path file;
    private final ObjectMapper yamlMapper;

    public YamlScheduleSource(Path file) {
        this(file, ObjectMappers.yaml());
    }

    public YamlScheduleSource(Path file, ObjectMapper yamlMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper must not be null");
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, JobSpec> load() {
        if (!Files.isRegularFile(file)) {
            log.info("Schedule source not found path={}, no jobs loaded", file);
            return Map.of();
        }
        Map<String, Object> document;
        try {
            document = yamlMapper.readValue(file.toFile(), new TypeReference<>() {});
        } catch (IOException ex) {
            throw new ConfigException(null, "Failed to read schedule file " + file + ": " + ex.getMessage(), ex);
        }
        if (document == null || document.get("schedule") == null) {
            return Map.of();
        }
        if (!(document.get("schedule") instanceof Map<?, ?> schedule)) {
            throw new ConfigException(null, "'schedule' in " + file + " must be a mapping");
        }

        Map<String, JobSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : schedule.entrySet()) {
            String name = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Map<?, ?> item)) {
                throw new ConfigException(name, "scheduled job must be a mapping");
            }
            specs.put(name, JobSpecParser.parse(name, (Map<String, Object>) item));
        }
        log.debug("Schedule source parsed path={} jobs={}", file, specs.size());
        return specs;
    }
}
