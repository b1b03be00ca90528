package stitcher.taskcenter.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stitcher.taskcenter.model.SettingKey;
import stitcher.taskcenter.model.TaskCenterSettings;
import stitcher.taskcenter.model.ValidationException;
import stitcher.taskcenter.repository.SettingsRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of SettingsRepository. Values are stored as JSON text.
 */
public class JdbcSettingsRepository implements SettingsRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSettingsRepository.class);

    private static final String UPSERT = """
                MERGE INTO config (config_key, config_value, updated_at) KEY (config_key)
                VALUES (?, ?, ?)
            """;

    private static final String INSERT = "INSERT INTO config (config_key, config_value, updated_at) VALUES (?, ?, ?)";

    private final Database db;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcSettingsRepository(Database db, ObjectMapper mapper) {
        this(db, mapper, Clock.systemUTC());
    }

    public JdbcSettingsRepository(Database db, ObjectMapper mapper, Clock clock) {
        this.db = db;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public TaskCenterSettings load() {
        Map<String, String> stored = readAll();
        Map<SettingKey, Object> values = new EnumMap<>(SettingKey.class);

        for (SettingKey key : SettingKey.values()) {
            String json = stored.get(key.key());
            if (json == null) {
                continue;
            }
            try {
                values.put(key, key.validate(mapper.readValue(json, Object.class)));
            } catch (JsonProcessingException | ValidationException e) {
                log.warn("Ignoring unreadable config value {}={}, using default {}: {}",
                        key.key(), json, key.defaultValue(), e.getMessage());
            }
        }
        return TaskCenterSettings.from(values);
    }

    @Override
    public Optional<Object> get(String key) {
        String json = readAll().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable config value {}={}: {}", key, json, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(SettingKey key, Object value) {
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key.key(), key.validate(value));
        setMany(single);
    }

    @Override
    public void setMany(Map<String, Object> values) {
        if (values.isEmpty()) {
            return;
        }
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(UPSERT)) {
                Timestamp now = Timestamp.from(clock.instant());
                for (Map.Entry<String, Object> entry : values.entrySet()) {
                    ps.setString(1, entry.getKey());
                    ps.setString(2, toJson(entry.getValue()));
                    ps.setTimestamp(3, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.info("Config updated: {}", values);
        } catch (SQLException e) {
            throw new StoreException("Failed to write config keys " + values.keySet(), e);
        }
    }

    @Override
    public int seedDefaults() {
        int seeded = 0;
        try (Connection conn = db.getConnection()) {
            try (PreparedStatement select = conn.prepareStatement("SELECT config_key FROM config FOR UPDATE");
                    PreparedStatement insert = conn.prepareStatement(INSERT)) {
                Set<String> present = new HashSet<>();
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        present.add(rs.getString(1));
                    }
                }
                Timestamp now = Timestamp.from(clock.instant());
                for (SettingKey key : SettingKey.values()) {
                    if (present.contains(key.key())) {
                        continue;
                    }
                    insert.setString(1, key.key());
                    insert.setString(2, toJson(key.defaultValue()));
                    insert.setTimestamp(3, now);
                    seeded += insert.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to seed default config", e);
        }
        if (seeded > 0) {
            log.info("Seeded {} default config values", seeded);
        }
        return seeded;
    }

    @Override
    public void resetToDefault() {
        setMany(TaskCenterSettings.defaults().asMap());
    }

    private Map<String, String> readAll() {
        String sql = "SELECT config_key, config_value FROM config";
        Map<String, String> stored = new LinkedHashMap<>();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    stored.put(rs.getString("config_key"), rs.getString("config_value"));
                }
            }
            conn.commit();
            return stored;
        } catch (SQLException e) {
            throw new StoreException("Failed to read config", e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize config value " + value, e);
        }
    }
}
